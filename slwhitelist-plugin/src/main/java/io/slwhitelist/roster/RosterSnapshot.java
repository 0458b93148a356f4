package io.slwhitelist.roster;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** Ordered, immutable view of the players online at the moment the host was polled. */
public final class RosterSnapshot {

    private static final RosterSnapshot EMPTY = new RosterSnapshot(List.of());

    private final List<RosterEntry> entries;

    public RosterSnapshot(List<RosterEntry> entries) {
        List<RosterEntry> copy = new ArrayList<>(entries.size());
        for (RosterEntry entry : entries) {
            if (entry != null) {
                copy.add(entry);
            }
        }
        this.entries = Collections.unmodifiableList(copy);
    }

    public static RosterSnapshot empty() {
        return EMPTY;
    }

    public List<RosterEntry> getEntries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Number of entries that report membership of {@code squadId}. */
    public int countMembers(String squadId) {
        if (squadId == null) {
            return 0;
        }
        int count = 0;
        for (RosterEntry entry : entries) {
            SquadRef squad = entry.getSquad();
            if (squad != null && squadId.equals(squad.getSquadId())) {
                count++;
            }
        }
        return count;
    }
}
