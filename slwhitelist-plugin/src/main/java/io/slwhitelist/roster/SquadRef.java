package io.slwhitelist.roster;

import java.util.Objects;

/**
 * Squad membership as reported in a roster entry. The lock flag is already normalized;
 * see {@link LockFlag#parse(Object)}.
 */
public final class SquadRef {

    private final String squadId;
    private final String squadName;
    private final boolean locked;

    public SquadRef(String squadId, String squadName, boolean locked) {
        this.squadId = Objects.requireNonNull(squadId, "squadId");
        this.squadName = squadName;
        this.locked = locked;
    }

    public String getSquadId() {
        return squadId;
    }

    public boolean isLocked() {
        return locked;
    }

    @Override
    public String toString() {
        return "SquadRef{" + squadId + (squadName != null ? " '" + squadName + "'" : "")
                + (locked ? ", locked" : "") + "}";
    }
}
