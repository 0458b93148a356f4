package io.slwhitelist.tracker;

import io.slwhitelist.roster.RosterEntry;
import io.slwhitelist.roster.RosterSnapshot;
import io.slwhitelist.roster.SquadRef;

import java.util.ArrayList;
import java.util.List;

/**
 * Picks the squad leaders that earn whitelist credit from a roster snapshot.
 * A leader qualifies when their squad has at least {@code minSquadMembers} members in the same
 * snapshot and, with {@code onlyOpenSquads}, the squad is unlocked. Pure and thread-safe.
 */
public final class EligibilityFilter {

    private final int minSquadMembers;
    private final boolean onlyOpenSquads;

    public EligibilityFilter(int minSquadMembers, boolean onlyOpenSquads) {
        this.minSquadMembers = minSquadMembers;
        this.onlyOpenSquads = onlyOpenSquads;
    }

    /** Eligible leaders, in snapshot order. */
    public List<RosterEntry> eligibleLeaders(RosterSnapshot snapshot) {
        List<RosterEntry> eligible = new ArrayList<>();
        if (snapshot == null || snapshot.isEmpty()) {
            return eligible;
        }
        for (RosterEntry entry : snapshot.getEntries()) {
            if (isEligible(entry, snapshot)) {
                eligible.add(entry);
            }
        }
        return eligible;
    }

    boolean isEligible(RosterEntry entry, RosterSnapshot snapshot) {
        if (entry == null || !entry.isLeader()) {
            return false;
        }
        SquadRef squad = entry.getSquad();
        if (squad == null) {
            return false;
        }
        if (snapshot.countMembers(squad.getSquadId()) < minSquadMembers) {
            return false;
        }
        return !onlyOpenSquads || !squad.isLocked();
    }

    public int getMinSquadMembers() {
        return minSquadMembers;
    }

    public boolean isOnlyOpenSquads() {
        return onlyOpenSquads;
    }
}
