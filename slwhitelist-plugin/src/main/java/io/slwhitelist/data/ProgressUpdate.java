package io.slwhitelist.data;

/**
 * Outcome of one accrual write: the score seen under the row lock and the score committed.
 */
public record ProgressUpdate(String playerId, double oldScore, double newScore, boolean created) {
}
