package io.slwhitelist.tracker;

import io.slwhitelist.roster.RosterEntry;
import io.slwhitelist.roster.RosterSnapshot;
import io.slwhitelist.roster.SquadRef;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static io.slwhitelist.testing.FixedRoster.snapshotOf;
import static io.slwhitelist.testing.FixedRoster.squad;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EligibilityFilterTest {

    @Test
    void openSquadLeaderWithEnoughMembersIsEligible() {
        EligibilityFilter filter = new EligibilityFilter(4, true);

        List<RosterEntry> eligible = filter.eligibleLeaders(snapshotOf(squad("1", false, "sl-1", 4)));

        assertEquals(1, eligible.size());
        assertEquals("sl-1", eligible.get(0).getPlayerId());
    }

    @Test
    void nonLeadersAreNeverEligible() {
        EligibilityFilter filter = new EligibilityFilter(1, false);

        List<RosterEntry> eligible = filter.eligibleLeaders(snapshotOf(squad("1", false, "sl-1", 6)));

        assertEquals(1, eligible.size());
        assertTrue(eligible.stream().allMatch(RosterEntry::isLeader));
    }

    @Test
    void undersizedSquadIsNotEligible() {
        EligibilityFilter filter = new EligibilityFilter(4, false);

        assertTrue(filter.eligibleLeaders(snapshotOf(squad("1", false, "sl-1", 3))).isEmpty());
    }

    @Test
    void lockedSquadOnlyMattersWhenOnlyOpenSquadsIsSet() {
        RosterSnapshot snapshot = snapshotOf(squad("1", true, "sl-locked", 5), squad("2", false, "sl-open", 5));

        List<RosterEntry> openOnly = new EligibilityFilter(4, true).eligibleLeaders(snapshot);
        List<RosterEntry> any = new EligibilityFilter(4, false).eligibleLeaders(snapshot);

        assertEquals(List.of("sl-open"), ids(openOnly));
        assertEquals(List.of("sl-locked", "sl-open"), ids(any));
    }

    @Test
    void membersAreCountedPerSquadIdAcrossTheSnapshot() {
        SquadRef squad = new SquadRef("7", "SPLIT", false);
        List<RosterEntry> entries = new ArrayList<>();
        entries.add(new RosterEntry("a", "a", squad, false));
        entries.add(new RosterEntry("sl", "sl", squad, true));
        entries.add(new RosterEntry("loner", "loner", null, false));
        entries.add(new RosterEntry("b", "b", squad, false));

        List<RosterEntry> eligible = new EligibilityFilter(3, true).eligibleLeaders(new RosterSnapshot(entries));

        assertEquals(List.of("sl"), ids(eligible));
    }

    @Test
    void leaderWithoutSquadIsExcluded() {
        RosterSnapshot snapshot = new RosterSnapshot(List.of(new RosterEntry("sl", "sl", null, true)));

        assertTrue(new EligibilityFilter(0, false).eligibleLeaders(snapshot).isEmpty());
    }

    @Test
    void emptyOrMissingSnapshotYieldsNobody() {
        EligibilityFilter filter = new EligibilityFilter(1, false);

        assertTrue(filter.eligibleLeaders(RosterSnapshot.empty()).isEmpty());
        assertTrue(filter.eligibleLeaders(null).isEmpty());
    }

    private static List<String> ids(List<RosterEntry> entries) {
        List<String> ids = new ArrayList<>();
        for (RosterEntry entry : entries) {
            ids.add(entry.getPlayerId());
        }
        return ids;
    }
}
