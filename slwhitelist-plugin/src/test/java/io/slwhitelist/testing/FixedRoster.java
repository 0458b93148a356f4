package io.slwhitelist.testing;

import io.slwhitelist.roster.RosterEntry;
import io.slwhitelist.roster.RosterSnapshot;
import io.slwhitelist.roster.RosterSource;
import io.slwhitelist.roster.SquadRef;

import java.util.ArrayList;
import java.util.List;

/** Mutable roster for tests, with an optional live count that differs from the roster size. */
public final class FixedRoster implements RosterSource {

    private volatile RosterSnapshot snapshot = RosterSnapshot.empty();
    private volatile Integer livePlayers;

    @Override
    public RosterSnapshot currentRoster() {
        return snapshot;
    }

    @Override
    public int livePlayerCount() {
        Integer override = livePlayers;
        return override != null ? override : snapshot.size();
    }

    public FixedRoster set(RosterSnapshot snapshot) {
        this.snapshot = snapshot;
        return this;
    }

    public FixedRoster livePlayers(int count) {
        this.livePlayers = count;
        return this;
    }

    /** A leader plus {@code members - 1} followers in one squad. */
    public static List<RosterEntry> squad(String squadId, boolean locked, String leaderId, int members) {
        SquadRef squad = new SquadRef(squadId, "Squad " + squadId, locked);
        List<RosterEntry> entries = new ArrayList<>();
        entries.add(new RosterEntry(leaderId, "Leader " + leaderId, squad, true));
        for (int i = 1; i < members; i++) {
            entries.add(new RosterEntry(leaderId + "-m" + i, "Member " + i, squad, false));
        }
        return entries;
    }

    @SafeVarargs
    public static RosterSnapshot snapshotOf(List<RosterEntry>... groups) {
        List<RosterEntry> entries = new ArrayList<>();
        for (List<RosterEntry> group : groups) {
            entries.addAll(group);
        }
        return new RosterSnapshot(entries);
    }
}
