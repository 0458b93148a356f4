package io.slwhitelist.command;

/**
 * Answer to a player's progress query. {@code rank} and {@code total} are only meaningful when
 * {@link Kind#WHITELISTED}.
 */
public record WhitelistStatus(Kind kind, long percent, int rank, int total) {

    public enum Kind {
        NO_PROGRESS,
        IN_PROGRESS,
        WHITELISTED
    }

    public static WhitelistStatus noProgress() {
        return new WhitelistStatus(Kind.NO_PROGRESS, 0L, 0, 0);
    }

    public static WhitelistStatus inProgress(long percent) {
        return new WhitelistStatus(Kind.IN_PROGRESS, percent, 0, 0);
    }

    public static WhitelistStatus whitelisted(long percent, int rank, int total) {
        return new WhitelistStatus(Kind.WHITELISTED, percent, rank, total);
    }
}
