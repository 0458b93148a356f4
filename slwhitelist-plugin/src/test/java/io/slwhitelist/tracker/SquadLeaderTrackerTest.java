package io.slwhitelist.tracker;

import io.slwhitelist.WhitelistTimingConstants;
import io.slwhitelist.config.WhitelistConfig;
import io.slwhitelist.core.db.DatabaseManager;
import io.slwhitelist.data.ProgressStore;
import io.slwhitelist.data.ProgressUpdate;
import io.slwhitelist.notify.WhitelistMessages;
import io.slwhitelist.testing.FixedRoster;
import io.slwhitelist.testing.H2Databases;
import io.slwhitelist.testing.MutableClock;
import io.slwhitelist.testing.RecordingSink;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static io.slwhitelist.testing.FixedRoster.snapshotOf;
import static io.slwhitelist.testing.FixedRoster.squad;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SquadLeaderTrackerTest {

    private static final WhitelistConfig CONFIG = WhitelistConfig.builder()
            .threshold(100)
            .progressPerHour(50)
            .minSquadMembers(4)
            .onlyOpenSquads(true)
            .build();

    private DatabaseManager databaseManager;
    private ProgressStore store;
    private FixedRoster roster;
    private RecordingSink sink;
    private MutableClock clock;

    @BeforeEach
    void setUp() throws SQLException {
        databaseManager = H2Databases.freshManager();
        store = H2Databases.freshStore(databaseManager);
        roster = new FixedRoster();
        sink = new RecordingSink();
        clock = new MutableClock(1_700_000_000_000L);
    }

    @AfterEach
    void tearDown() {
        databaseManager.shutdown();
    }

    @Test
    void oneSampleCreditsHalfAMinuteOfHourlyRate() throws SQLException {
        roster.set(snapshotOf(squad("1", false, "sl-1", 4)));
        SquadLeaderTracker tracker = new SquadLeaderTracker(roster, store, sink, CONFIG, clock);

        assertEquals(1, tracker.tick());

        assertEquals(50.0 * 30 / 3600, tracker.getDeltaPerSample(), 1e-12);
        assertEquals(0.4167, store.find("sl-1").getScore(), 1e-4);
        assertEquals(clock.millis(), store.find("sl-1").getLastProgressedAtMs());
        assertTrue(sink.sent().isEmpty());
    }

    @Test
    void onlyEligibleLeadersAreCredited() throws SQLException {
        roster.set(snapshotOf(
                squad("1", false, "open", 4),
                squad("2", true, "locked", 4),
                squad("3", false, "small", 3)));
        SquadLeaderTracker tracker = new SquadLeaderTracker(roster, store, sink, CONFIG, clock);

        assertEquals(1, tracker.tick());

        assertNotNull(store.find("open"));
        assertNull(store.find("locked"));
        assertNull(store.find("small"));
        assertNull(store.find("open-m1"));
    }

    @Test
    void twoHoursOfLeadingReachesThresholdAndAnnouncesItOnce() throws SQLException {
        roster.set(snapshotOf(squad("1", false, "sl-1", 4)));
        SquadLeaderTracker tracker = new SquadLeaderTracker(roster, store, sink, CONFIG, clock);

        for (int i = 0; i < 240; i++) {
            tracker.tick();
            clock.advance(Duration.ofSeconds(WhitelistTimingConstants.SAMPLE_INTERVAL_SECONDS));
        }
        assertEquals(100.0, store.find("sl-1").getScore(), 1e-6);

        // Keep leading well past the threshold; nothing more should be said.
        for (int i = 0; i < 60; i++) {
            tracker.tick();
        }

        List<RecordingSink.Sent> messages = sink.sentTo("sl-1");
        long whitelisted = messages.stream()
                .filter(sent -> sent.message().equals(WhitelistMessages.nowWhitelisted()))
                .count();
        long progress = messages.stream()
                .filter(sent -> sent.message().contains("Progress Update:"))
                .count();
        assertEquals(1, whitelisted);
        assertEquals(9, progress);
        assertEquals(10, messages.size());
        assertTrue(messages.get(0).message().contains("Progress Update: 10%"));
        assertTrue(messages.get(0).message().startsWith(WhitelistMessages.HEADER));
    }

    @Test
    void alreadyWhitelistedLeaderIsSilentButStillAccrues() throws SQLException {
        H2Databases.putRecord(databaseManager, "veteran", 119.9, 0L);
        roster.set(snapshotOf(squad("1", false, "veteran", 4)));
        SquadLeaderTracker tracker = new SquadLeaderTracker(roster, store, sink, CONFIG, clock);

        tracker.tick();

        assertTrue(store.find("veteran").getScore() > 120.0);
        assertTrue(sink.sent().isEmpty());
    }

    @Test
    void failedWriteForOneLeaderDoesNotStopTheOthers() throws SQLException {
        ProgressStore flaky = new ProgressStore(databaseManager) {
            @Override
            public ProgressUpdate addProgress(String playerId, double delta, long nowMs) throws SQLException {
                if (playerId.equals("sl-broken")) {
                    throw new SQLException("connection reset");
                }
                return super.addProgress(playerId, delta, nowMs);
            }
        };
        roster.set(snapshotOf(
                squad("1", false, "sl-a", 4),
                squad("2", false, "sl-broken", 4),
                squad("3", false, "sl-b", 4)));
        SquadLeaderTracker tracker = new SquadLeaderTracker(roster, flaky, sink, CONFIG, clock);

        assertEquals(2, tracker.tick());

        assertNotNull(store.find("sl-a"));
        assertNull(store.find("sl-broken"));
        assertNotNull(store.find("sl-b"));
    }

    @Test
    void failingNotificationSinkDoesNotLoseProgress() throws SQLException {
        H2Databases.putRecord(databaseManager, "sl-1", 9.9, 0L);
        roster.set(snapshotOf(squad("1", false, "sl-1", 4)));
        SquadLeaderTracker tracker = new SquadLeaderTracker(roster, store,
                (playerId, message) -> {
                    throw new IllegalStateException("rcon down");
                }, CONFIG, clock);

        assertEquals(1, tracker.tick());
        assertTrue(store.find("sl-1").getScore() > 10.0);
    }

    @Test
    void stopDuringSampleStartsNoFurtherWrites() throws SQLException {
        H2Databases.putRecord(databaseManager, "sl-a", 9.9, 0L);
        roster.set(snapshotOf(
                squad("1", false, "sl-a", 4),
                squad("2", false, "sl-b", 4),
                squad("3", false, "sl-c", 4)));
        AtomicBoolean running = new AtomicBoolean(true);
        SquadLeaderTracker tracker = new SquadLeaderTracker(roster, store,
                (playerId, message) -> running.set(false), CONFIG, clock, running::get);

        assertEquals(1, tracker.tick());

        assertFalse(running.get());
        assertTrue(store.find("sl-a").getScore() > 10.0);
        assertNull(store.find("sl-b"));
        assertNull(store.find("sl-c"));
    }

    @Test
    void stoppedTrackerWritesNothing() throws SQLException {
        roster.set(snapshotOf(squad("1", false, "sl-1", 4)));
        SquadLeaderTracker tracker = new SquadLeaderTracker(roster, store, sink, CONFIG, clock, () -> false);

        assertEquals(0, tracker.tick());
        assertNull(store.find("sl-1"));
    }

    @Test
    void emptyRosterIsSkipped() {
        SquadLeaderTracker tracker = new SquadLeaderTracker(roster, store, sink, CONFIG, clock);

        assertEquals(0, tracker.tick());
    }

    @Test
    void zeroRateAwardsNothing() throws SQLException {
        WhitelistConfig noRate = WhitelistConfig.builder().progressPerHour(0).build();
        roster.set(snapshotOf(squad("1", false, "sl-1", 4)));
        SquadLeaderTracker tracker = new SquadLeaderTracker(roster, store, sink, noRate, clock);

        assertEquals(0, tracker.tick());
        assertNull(store.find("sl-1"));
    }
}
