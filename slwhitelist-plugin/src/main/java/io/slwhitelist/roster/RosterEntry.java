package io.slwhitelist.roster;

import javax.annotation.Nullable;
import java.util.Objects;

/** One player in a roster snapshot. */
public final class RosterEntry {

    private final String playerId;
    private final String name;
    @Nullable
    private final SquadRef squad;
    private final boolean leader;

    public RosterEntry(String playerId, String name, @Nullable SquadRef squad, boolean leader) {
        this.playerId = Objects.requireNonNull(playerId, "playerId");
        this.name = name != null ? name : playerId;
        this.squad = squad;
        this.leader = leader;
    }

    public String getPlayerId() {
        return playerId;
    }

    public String getName() {
        return name;
    }

    @Nullable
    public SquadRef getSquad() {
        return squad;
    }

    public boolean isLeader() {
        return leader;
    }

    @Override
    public String toString() {
        return name + " (" + playerId + ")";
    }
}
