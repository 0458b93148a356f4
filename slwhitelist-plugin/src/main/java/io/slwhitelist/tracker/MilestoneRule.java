package io.slwhitelist.tracker;

/**
 * Decides which notification, if any, an accrual step earns. Bands are ten score points wide
 * regardless of the threshold, and a player who already held the threshold hears nothing.
 */
public final class MilestoneRule {

    public static final double BAND_WIDTH = 10.0;

    private MilestoneRule() {
    }

    public enum Notice {
        NONE,
        PROGRESS,
        WHITELISTED
    }

    public static Notice evaluate(double oldScore, double newScore, int threshold) {
        if (oldScore >= threshold) {
            return Notice.NONE;
        }
        if (band(newScore) == band(oldScore)) {
            return Notice.NONE;
        }
        return newScore >= threshold ? Notice.WHITELISTED : Notice.PROGRESS;
    }

    static long band(double score) {
        return (long) Math.floor(score / BAND_WIDTH);
    }
}
