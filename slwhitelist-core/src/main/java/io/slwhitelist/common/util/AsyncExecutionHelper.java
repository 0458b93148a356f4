package io.slwhitelist.common.util;

import com.google.common.flogger.FluentLogger;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Fire-and-forget submission for host hooks, and per-key throttling for warnings that would
 * otherwise repeat on every tick (a database outage hits every 30-second sample).
 */
public final class AsyncExecutionHelper {

    private static final FluentLogger LOGGER = FluentLogger.forEnclosingClass();
    private static final long THROTTLE_WINDOW_MS = 5_000L;
    private static final int MAX_TRACKED_KEYS = 1_024;
    private static final ConcurrentMap<String, Long> lastWarnedAt = new ConcurrentHashMap<>();

    private AsyncExecutionHelper() {
    }

    /**
     * Submits {@code action} without waiting for it. Failures, including a rejected submission
     * after shutdown, are logged and never reach the caller.
     *
     * @return true if the action was handed to the executor
     */
    public static boolean runBestEffort(Executor executor, Runnable action, String actionName, String context) {
        if (executor == null || action == null) {
            return false;
        }
        Runnable guarded = () -> {
            try {
                action.run();
            } catch (Throwable error) {
                logThrottledWarning(actionName, actionName, context, error);
            }
        };
        try {
            executor.execute(guarded);
            return true;
        } catch (RejectedExecutionException e) {
            logThrottledWarning(actionName, actionName, context, e);
            return false;
        }
    }

    /**
     * Logs a warning unless one with the same key was logged within the last five seconds.
     *
     * @return true if the warning was written
     */
    public static boolean logThrottledWarning(String warningKey, String actionName, String context,
                                              Throwable throwable) {
        String key = warningKey != null && !warningKey.isBlank() ? warningKey : String.valueOf(actionName);
        if (!claim(key, System.currentTimeMillis())) {
            return false;
        }
        String message = context == null || context.isBlank()
                ? actionName + " failed"
                : actionName + " failed [" + context + "]";
        Throwable cause = unwrap(throwable);
        if (cause != null) {
            LOGGER.atWarning().withCause(cause).log(message);
        } else {
            LOGGER.atWarning().log(message);
        }
        return true;
    }

    static void resetThrottle() {
        lastWarnedAt.clear();
    }

    static Throwable unwrap(Throwable throwable) {
        Throwable current = throwable;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static boolean claim(String key, long now) {
        if (lastWarnedAt.size() > MAX_TRACKED_KEYS) {
            lastWarnedAt.values().removeIf(at -> now - at >= THROTTLE_WINDOW_MS);
        }
        boolean[] claimed = new boolean[1];
        lastWarnedAt.compute(key, (k, previous) -> {
            if (previous == null || now - previous >= THROTTLE_WINDOW_MS) {
                claimed[0] = true;
                return now;
            }
            return previous;
        });
        return claimed[0];
    }
}
