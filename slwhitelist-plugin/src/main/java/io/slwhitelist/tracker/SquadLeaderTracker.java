package io.slwhitelist.tracker;

import com.google.common.flogger.FluentLogger;
import io.slwhitelist.WhitelistTimingConstants;
import io.slwhitelist.common.util.AsyncExecutionHelper;
import io.slwhitelist.common.util.FormatUtils;
import io.slwhitelist.config.WhitelistConfig;
import io.slwhitelist.data.ProgressStore;
import io.slwhitelist.data.ProgressUpdate;
import io.slwhitelist.notify.NotificationSink;
import io.slwhitelist.notify.WhitelistMessages;
import io.slwhitelist.roster.RosterEntry;
import io.slwhitelist.roster.RosterSnapshot;
import io.slwhitelist.roster.RosterSource;

import java.sql.SQLException;
import java.time.Clock;
import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.logging.Level;

/**
 * Samples the roster and awards hour-normalized progress to eligible squad leaders.
 * Each sample credits exactly one interval's worth; time between samples is never backfilled.
 */
public class SquadLeaderTracker {

    private static final FluentLogger LOGGER = FluentLogger.forEnclosingClass();

    private final RosterSource rosterSource;
    private final EligibilityFilter eligibilityFilter;
    private final ProgressStore progressStore;
    private final NotificationSink notificationSink;
    private final Clock clock;
    private final int threshold;
    private final double deltaPerSample;
    private final Level detailLevel;
    private final BooleanSupplier active;

    public SquadLeaderTracker(RosterSource rosterSource, ProgressStore progressStore,
                              NotificationSink notificationSink, WhitelistConfig config, Clock clock) {
        this(rosterSource, progressStore, notificationSink, config, clock, () -> true);
    }

    /**
     * @param active checked before each leader's write; once it reports false the rest of the
     *               sample is dropped
     */
    public SquadLeaderTracker(RosterSource rosterSource, ProgressStore progressStore,
                              NotificationSink notificationSink, WhitelistConfig config, Clock clock,
                              BooleanSupplier active) {
        this.active = active;
        this.rosterSource = rosterSource;
        this.eligibilityFilter = new EligibilityFilter(config.getMinSquadMembers(), config.isOnlyOpenSquads());
        this.progressStore = progressStore;
        this.notificationSink = notificationSink;
        this.clock = clock;
        this.threshold = config.getThreshold();
        this.deltaPerSample = deltaPerSample(config.getProgressPerHour(), WhitelistTimingConstants.SAMPLE_INTERVAL_SECONDS);
        this.detailLevel = config.isDebugLogs() ? Level.INFO : Level.FINE;
    }

    public static double deltaPerSample(double progressPerHour, long sampleSeconds) {
        return progressPerHour * (sampleSeconds / 3600.0);
    }

    /**
     * One sampling tick: pull the roster, filter leaders, credit each one.
     *
     * @return number of leaders whose progress was committed
     */
    public int tick() {
        RosterSnapshot snapshot = rosterSource.currentRoster();
        if (snapshot == null || snapshot.isEmpty()) {
            LOGGER.at(detailLevel).log("No player data available, skipping progress sample");
            return 0;
        }
        List<RosterEntry> leaders = eligibilityFilter.eligibleLeaders(snapshot);
        LOGGER.at(detailLevel).log("Found " + leaders.size() + " eligible squad leaders out of "
                + snapshot.size() + " players");
        return awardProgress(leaders);
    }

    /**
     * Credits every leader independently; one failed write only drops that leader's sample.
     */
    public int awardProgress(List<RosterEntry> leaders) {
        if (deltaPerSample <= 0.0) {
            return 0;
        }
        long now = clock.millis();
        int awarded = 0;
        for (RosterEntry leader : leaders) {
            if (!active.getAsBoolean()) {
                LOGGER.atInfo().log("Shutting down, dropping the rest of this progress sample");
                break;
            }
            ProgressUpdate update;
            try {
                update = progressStore.addProgress(leader.getPlayerId(), deltaPerSample, now);
            } catch (SQLException | RuntimeException e) {
                AsyncExecutionHelper.logThrottledWarning("accrual:" + leader.getPlayerId(),
                        "Progress award", leader.toString(), e);
                continue;
            }
            awarded++;
            LOGGER.at(detailLevel).log("Awarded progress to " + leader + ": "
                    + FormatUtils.formatScore(update.oldScore()) + " -> " + FormatUtils.formatScore(update.newScore()));
            notifyMilestone(leader, update);
        }
        return awarded;
    }

    private void notifyMilestone(RosterEntry leader, ProgressUpdate update) {
        String message = switch (MilestoneRule.evaluate(update.oldScore(), update.newScore(), threshold)) {
            case WHITELISTED -> WhitelistMessages.nowWhitelisted();
            case PROGRESS -> WhitelistMessages.progressUpdate(update.newScore(), threshold);
            case NONE -> null;
        };
        if (message == null) {
            return;
        }
        try {
            notificationSink.warn(leader.getPlayerId(), message);
        } catch (RuntimeException e) {
            LOGGER.atWarning().withCause(e).log("Failed to send progress message to " + leader);
        }
    }

    public double getDeltaPerSample() {
        return deltaPerSample;
    }
}
