package io.slwhitelist.data;

/** Immutable copy of one row of {@code sl_whitelist_progress}. */
public final class ProgressRecord {

    private final String playerId;
    private final double score;
    private final long lastProgressedAtMs;

    public ProgressRecord(String playerId, double score, long lastProgressedAtMs) {
        this.playerId = playerId;
        this.score = score;
        this.lastProgressedAtMs = lastProgressedAtMs;
    }

    public String getPlayerId() {
        return playerId;
    }

    public double getScore() {
        return score;
    }

    public long getLastProgressedAtMs() {
        return lastProgressedAtMs;
    }

    public boolean isWhitelisted(int threshold) {
        return score >= threshold;
    }

    @Override
    public String toString() {
        return "ProgressRecord{" + playerId + ", score=" + score + ", lastProgressedAt=" + lastProgressedAtMs + "}";
    }
}
