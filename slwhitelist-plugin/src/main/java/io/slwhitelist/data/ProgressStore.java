package io.slwhitelist.data;

import com.google.common.flogger.FluentLogger;
import io.slwhitelist.core.db.DatabaseManager;
import io.slwhitelist.core.db.DatabaseRetry;

import javax.annotation.Nullable;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLTransactionRollbackException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * JDBC storage for per-player whitelist progress.
 * <p>
 * Every mutation is a single atomic read-modify-write on one row: accrual locks the row
 * ({@code SELECT ... FOR UPDATE}) inside a transaction, decay is one conditional
 * {@code UPDATE}. Rows are never deleted. Reads return rows in ascending id order.
 */
public class ProgressStore {

    private static final FluentLogger LOGGER = FluentLogger.forEnclosingClass();
    public static final String TABLE = "sl_whitelist_progress";
    public static final int MAX_PLAYER_ID_LENGTH = 64;
    private static final int MAX_CONFLICT_ATTEMPTS = 3;

    private static final String CREATE_SQL = """
            CREATE TABLE IF NOT EXISTS sl_whitelist_progress (
              player_id VARCHAR(64) NOT NULL PRIMARY KEY,
              score DOUBLE NOT NULL DEFAULT 0,
              last_progressed_at BIGINT NOT NULL,
              created_at BIGINT NOT NULL
            )
            """;
    private static final String LOCK_SQL =
            "SELECT score FROM sl_whitelist_progress WHERE player_id = ? FOR UPDATE";
    private static final String INSERT_SQL =
            "INSERT INTO sl_whitelist_progress (player_id, score, last_progressed_at, created_at) VALUES (?, ?, ?, ?)";
    private static final String ACCRUE_SQL = "UPDATE sl_whitelist_progress SET score = ?, "
            + "last_progressed_at = GREATEST(last_progressed_at, ?) WHERE player_id = ?";
    private static final String DECAY_SQL = "UPDATE sl_whitelist_progress SET score = GREATEST(0, score - ?) "
            + "WHERE score > 0 AND last_progressed_at < ?";
    private static final String SELECT_ONE_SQL =
            "SELECT player_id, score, last_progressed_at FROM sl_whitelist_progress WHERE player_id = ?";
    private static final String SELECT_QUALIFIED_SQL =
            "SELECT player_id, score, last_progressed_at FROM sl_whitelist_progress WHERE score >= ? ORDER BY player_id";
    private static final String SELECT_ALL_SQL =
            "SELECT player_id, score, last_progressed_at FROM sl_whitelist_progress ORDER BY player_id";

    private final DatabaseManager databaseManager;

    public ProgressStore(DatabaseManager databaseManager) {
        this.databaseManager = databaseManager;
    }

    /**
     * Creates the progress table if needed. Retried with backoff; a final failure is fatal for
     * the caller.
     */
    public void initialize() throws SQLException {
        if (!databaseManager.isInitialized()) {
            throw new SQLException("Database not initialized");
        }
        DatabaseRetry.executeWithRetryVoid(() -> {
            try (Connection conn = databaseManager.getConnection();
                 Statement stmt = conn.createStatement()) {
                stmt.setQueryTimeout(DatabaseManager.QUERY_TIMEOUT_SECONDS);
                stmt.executeUpdate(CREATE_SQL);
            }
        }, "create " + TABLE);
        LOGGER.atInfo().log("ProgressStore initialized (" + TABLE + " table ensured)");
    }

    /**
     * Adds {@code delta} to a player's score, creating the row at zero first if it does not exist,
     * and moves {@code last_progressed_at} forward to {@code nowMs}.
     */
    public ProgressUpdate addProgress(String playerId, double delta, long nowMs) throws SQLException {
        validatePlayerId(playerId);
        if (delta < 0.0 || Double.isNaN(delta)) {
            throw new IllegalArgumentException("Accrual delta must be non-negative: " + delta);
        }
        for (int attempt = 1; ; attempt++) {
            try {
                return addProgressOnce(playerId, delta, nowMs);
            } catch (SQLException e) {
                // A concurrent first accrual inserted the row first; the next attempt finds and locks it.
                if (attempt >= MAX_CONFLICT_ATTEMPTS || !isWriteConflict(e)) {
                    throw e;
                }
                LOGGER.atFine().log("Write conflict on accrual for " + playerId + ", retrying");
            }
        }
    }

    static boolean isWriteConflict(SQLException e) {
        if (e instanceof SQLIntegrityConstraintViolationException || e instanceof SQLTransactionRollbackException) {
            return true;
        }
        String state = e.getSQLState();
        return state != null && (state.startsWith("23") || state.startsWith("40"));
    }

    private ProgressUpdate addProgressOnce(String playerId, double delta, long nowMs) throws SQLException {
        try (Connection conn = databaseManager.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                ProgressUpdate update = applyAccrual(conn, playerId, delta, nowMs);
                conn.commit();
                return update;
            } catch (SQLException | RuntimeException e) {
                rollbackQuietly(conn, e);
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        }
    }

    private ProgressUpdate applyAccrual(Connection conn, String playerId, double delta, long nowMs)
            throws SQLException {
        Double current = null;
        try (PreparedStatement stmt = conn.prepareStatement(LOCK_SQL)) {
            DatabaseManager.applyQueryTimeout(stmt);
            stmt.setString(1, playerId);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    current = rs.getDouble("score");
                }
            }
        }

        if (current == null) {
            try (PreparedStatement stmt = conn.prepareStatement(INSERT_SQL)) {
                DatabaseManager.applyQueryTimeout(stmt);
                stmt.setString(1, playerId);
                stmt.setDouble(2, delta);
                stmt.setLong(3, nowMs);
                stmt.setLong(4, nowMs);
                stmt.executeUpdate();
            }
            return new ProgressUpdate(playerId, 0.0, delta, true);
        }

        double newScore = current + delta;
        try (PreparedStatement stmt = conn.prepareStatement(ACCRUE_SQL)) {
            DatabaseManager.applyQueryTimeout(stmt);
            stmt.setDouble(1, newScore);
            stmt.setLong(2, nowMs);
            stmt.setString(3, playerId);
            stmt.executeUpdate();
        }
        return new ProgressUpdate(playerId, current, newScore, false);
    }

    /**
     * Lowers every positive score whose last accrual is strictly before {@code idleCutoffMs},
     * clamping at zero. Timestamps are left alone.
     *
     * @return number of rows changed
     */
    public int decayIdle(double amount, long idleCutoffMs) throws SQLException {
        if (amount <= 0.0 || Double.isNaN(amount)) {
            return 0;
        }
        try (Connection conn = databaseManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(DECAY_SQL)) {
            DatabaseManager.applyQueryTimeout(stmt);
            stmt.setDouble(1, amount);
            stmt.setLong(2, idleCutoffMs);
            return stmt.executeUpdate();
        }
    }

    @Nullable
    public ProgressRecord find(String playerId) throws SQLException {
        if (playerId == null || playerId.isBlank()) {
            return null;
        }
        try (Connection conn = databaseManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ONE_SQL)) {
            DatabaseManager.applyQueryTimeout(stmt);
            stmt.setString(1, playerId);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? readRecord(rs) : null;
            }
        }
    }

    /** Records with {@code score >= threshold}, in store order. */
    public List<ProgressRecord> findQualified(double threshold) throws SQLException {
        try (Connection conn = databaseManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_QUALIFIED_SQL)) {
            DatabaseManager.applyQueryTimeout(stmt);
            stmt.setDouble(1, threshold);
            return readRecords(stmt);
        }
    }

    public List<ProgressRecord> findAll() throws SQLException {
        try (Connection conn = databaseManager.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_ALL_SQL)) {
            DatabaseManager.applyQueryTimeout(stmt);
            return readRecords(stmt);
        }
    }

    private static List<ProgressRecord> readRecords(PreparedStatement stmt) throws SQLException {
        List<ProgressRecord> records = new ArrayList<>();
        try (ResultSet rs = stmt.executeQuery()) {
            while (rs.next()) {
                records.add(readRecord(rs));
            }
        }
        return records;
    }

    private static ProgressRecord readRecord(ResultSet rs) throws SQLException {
        String playerId = rs.getString("player_id");
        double score = rs.getDouble("score");
        if (score < 0.0) {
            LOGGER.atWarning().log("Negative score " + score + " stored for " + playerId);
        }
        return new ProgressRecord(playerId, score, rs.getLong("last_progressed_at"));
    }

    private static void validatePlayerId(String playerId) {
        if (playerId == null || playerId.isBlank()) {
            throw new IllegalArgumentException("Player id is required");
        }
        if (playerId.length() > MAX_PLAYER_ID_LENGTH) {
            throw new IllegalArgumentException("Player id longer than " + MAX_PLAYER_ID_LENGTH + " chars: " + playerId);
        }
    }

    private static void rollbackQuietly(Connection conn, Exception cause) {
        try {
            conn.rollback();
        } catch (SQLException rollbackError) {
            cause.addSuppressed(rollbackError);
        }
    }
}
