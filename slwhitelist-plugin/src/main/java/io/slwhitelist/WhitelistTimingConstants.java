package io.slwhitelist;

/**
 * Fixed cadences of the whitelist plugin. The configurable ones (decay, file refresh) live in
 * {@link io.slwhitelist.config.WhitelistConfig}.
 */
public final class WhitelistTimingConstants {

    private WhitelistTimingConstants() {
    }

    /**
     * Interval between roster samples in seconds. Accrual per sample is
     * {@code progressPerHour * SAMPLE_INTERVAL_SECONDS / 3600}; a missed sample is not made up.
     */
    public static final long SAMPLE_INTERVAL_SECONDS = 30L;

    /** Delay before the first decay tick, so a restart does not decay immediately. */
    public static final long DECAY_INITIAL_DELAY_SECONDS = 60L;

    /** Upper bound on waiting for in-flight ticks during shutdown. */
    public static final long SHUTDOWN_DRAIN_SECONDS = 10L;

    /** Worker threads: one per periodic task, so the three tasks never queue behind each other. */
    public static final int SCHEDULER_THREADS = 3;

    public static final long MILLIS_PER_HOUR = 3_600_000L;
}
