package io.slwhitelist.roster;

/**
 * Pull access to the host's live player list. Implementations must be safe to call from
 * scheduler threads.
 */
public interface RosterSource {

    /**
     * @return the current roster, or an empty snapshot when the host has no player data yet
     */
    RosterSnapshot currentRoster();

    /** Live player count used to gate decay. Defaults to the roster size. */
    default int livePlayerCount() {
        RosterSnapshot snapshot = currentRoster();
        return snapshot != null ? snapshot.size() : 0;
    }
}
