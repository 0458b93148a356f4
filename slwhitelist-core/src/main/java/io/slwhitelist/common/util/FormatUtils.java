package io.slwhitelist.common.util;

import java.util.Locale;

public final class FormatUtils {

    private FormatUtils() {
    }

    /** Two-decimal rendering used for fractional scores in logs. */
    public static String formatScore(double score) {
        return String.format(Locale.ROOT, "%.2f", score);
    }

    /**
     * Whole-number percentage of {@code value} against {@code target}, rounded half up.
     * Not capped: a score above the target reports more than 100.
     */
    public static long percentOf(double value, double target) {
        if (target <= 0.0) {
            return 0L;
        }
        return Math.round(value / target * 100.0);
    }

    public static String formatDuration(long durationMs) {
        long totalSeconds = Math.max(0L, durationMs / 1000L);
        long hours = totalSeconds / 3600L;
        long minutes = (totalSeconds % 3600L) / 60L;
        long seconds = totalSeconds % 60L;
        if (hours > 0) {
            return String.format(Locale.ROOT, "%dh %dm %ds", hours, minutes, seconds);
        }
        if (minutes > 0) {
            return String.format(Locale.ROOT, "%dm %ds", minutes, seconds);
        }
        return String.format(Locale.ROOT, "%ds", seconds);
    }
}
