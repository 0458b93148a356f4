package io.slwhitelist.core.db;

import com.google.common.flogger.FluentLogger;

import java.sql.SQLException;
import java.util.logging.Level;

/**
 * Retries one-off database operations (schema setup) with exponential backoff.
 * Scheduled ticks never go through here: a failed tick is simply retried by the next one.
 */
public final class DatabaseRetry {

    private static final FluentLogger LOGGER = FluentLogger.forEnclosingClass();

    public static final Policy SCHEMA_POLICY = new Policy(3, 100L, 5000L);

    private DatabaseRetry() {
    }

    public static <T> T executeWithRetry(SqlCallable<T> operation, String operationName) throws SQLException {
        return executeWithRetry(operation, operationName, SCHEMA_POLICY);
    }

    /**
     * @param operation the statement(s) to run
     * @param operationName human-readable name for logging
     * @param policy attempt count and backoff bounds
     * @return the operation's result
     * @throws SQLException the last failure once every attempt is used up
     */
    public static <T> T executeWithRetry(SqlCallable<T> operation, String operationName,
                                         Policy policy) throws SQLException {
        SQLException lastException = null;
        long delay = policy.initialDelayMs();

        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            try {
                return operation.call();
            } catch (SQLException e) {
                lastException = e;
                if (attempt == policy.maxAttempts()) {
                    break;
                }
                LOGGER.at(Level.WARNING).log(operationName + " failed (attempt " + attempt
                        + "/" + policy.maxAttempts() + "), retrying in " + delay + "ms: " + e.getMessage());
                sleep(delay);
                delay = Math.min(delay * 2, policy.maxDelayMs());
            } catch (RuntimeException e) {
                throw new SQLException("Unexpected error during " + operationName, e);
            }
        }

        LOGGER.at(Level.SEVERE).log(operationName + " failed after " + policy.maxAttempts() + " attempts");
        throw lastException;
    }

    public static void executeWithRetryVoid(SqlRunnable operation, String operationName) throws SQLException {
        executeWithRetry(() -> {
            operation.run();
            return null;
        }, operationName);
    }

    private static void sleep(long delayMs) throws SQLException {
        if (delayMs <= 0L) {
            return;
        }
        try {
            Thread.sleep(delayMs);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new SQLException("Retry interrupted", ie);
        }
    }

    public record Policy(int maxAttempts, long initialDelayMs, long maxDelayMs) {
        public Policy {
            if (maxAttempts < 1) {
                throw new IllegalArgumentException("maxAttempts must be at least 1");
            }
        }
    }

    @FunctionalInterface
    public interface SqlCallable<T> {
        T call() throws SQLException;
    }

    @FunctionalInterface
    public interface SqlRunnable {
        void run() throws SQLException;
    }
}
