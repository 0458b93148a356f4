package io.slwhitelist.core.db;

import com.google.common.flogger.FluentLogger;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Locale;
import java.util.logging.Level;

/** Owns the JDBC connection pool shared by every progress store. */
public class DatabaseManager {

    private static final FluentLogger LOGGER = FluentLogger.forEnclosingClass();
    public static final int QUERY_TIMEOUT_SECONDS = 10;
    private static final String MYSQL_DRIVER = "com.mysql.cj.jdbc.Driver";

    private final Object initLock = new Object();
    private volatile HikariDataSource dataSource;

    public void initialize(DatabaseConfig config) {
        synchronized (initLock) {
            // Close existing dataSource if present before reinitializing
            if (dataSource != null && !dataSource.isClosed()) {
                LOGGER.atInfo().log("Closing existing database connection pool before reinitializing");
                dataSource.close();
            }

            HikariConfig hikari = new HikariConfig();
            hikari.setPoolName("slwhitelist");
            hikari.setJdbcUrl(config.resolveJdbcUrl());
            hikari.setUsername(config.getUser());
            hikari.setPassword(config.getPassword());
            if (!config.hasJdbcUrlOverride()) {
                hikari.setDriverClassName(MYSQL_DRIVER);
                hikari.addDataSourceProperty("cachePrepStmts", "true");
                hikari.addDataSourceProperty("prepStmtCacheSize", "64");
                hikari.addDataSourceProperty("useServerPrepStmts", "true");
            }

            hikari.setMaximumPoolSize(config.getMaximumPoolSize());
            hikari.setMinimumIdle(1);
            hikari.setIdleTimeout(300000);       // 5 minutes
            hikari.setConnectionTimeout(10000);  // 10 seconds
            hikari.setMaxLifetime(1800000);      // 30 minutes

            try {
                dataSource = new HikariDataSource(hikari);
                LOGGER.atInfo().log("Database connection pool initialized for " + describe(config));
            } catch (Exception e) {
                LOGGER.at(Level.SEVERE).withCause(e).log("Failed to initialize database connection pool");
                throw new IllegalStateException("Database initialization failed", e);
            }
        }
    }

    public Connection getConnection() throws SQLException {
        HikariDataSource current = dataSource;
        if (current == null || current.isClosed()) {
            throw new SQLException("Database not initialized");
        }
        return current.getConnection();
    }

    public void shutdown() {
        synchronized (initLock) {
            if (dataSource != null && !dataSource.isClosed()) {
                dataSource.close();
                LOGGER.atInfo().log("Database connection pool closed");
            }
        }
    }

    public boolean isInitialized() {
        HikariDataSource current = dataSource;
        return current != null && !current.isClosed();
    }

    /**
     * Runs a trivial query and checks that the given tables exist.
     * @return TestResult with success status and message
     */
    public TestResult testConnection(String... requiredTables) {
        if (!isInitialized()) {
            return new TestResult(false, "Database not initialized");
        }

        try (Connection conn = getConnection()) {
            if (!conn.isValid(5)) {
                return new TestResult(false, "Connection is not valid");
            }

            try (PreparedStatement stmt = conn.prepareStatement("SELECT 1")) {
                applyQueryTimeout(stmt);
                try (ResultSet rs = stmt.executeQuery()) {
                    if (!rs.next()) {
                        return new TestResult(false, "SELECT 1 returned no results");
                    }
                }
            }

            StringBuilder missingTables = new StringBuilder();
            for (String table : requiredTables) {
                if (!tableExists(conn, table)) {
                    if (missingTables.length() > 0) {
                        missingTables.append(", ");
                    }
                    missingTables.append(table);
                }
            }
            if (missingTables.length() > 0) {
                return new TestResult(false, "Missing tables: " + missingTables);
            }
            return new TestResult(true, "Connection successful, " + requiredTables.length + " table(s) present");
        } catch (SQLException e) {
            return new TestResult(false, "SQL error: " + e.getMessage(), e);
        }
    }

    public static boolean tableExists(Connection conn, String tableName) throws SQLException {
        DatabaseMetaData metaData = conn.getMetaData();
        // Identifier case differs between MySQL and H2, so try both forms.
        for (String candidate : new String[]{tableName, tableName.toUpperCase(Locale.ROOT)}) {
            try (ResultSet rs = metaData.getTables(conn.getCatalog(), null, candidate, new String[]{"TABLE"})) {
                if (rs.next()) {
                    return true;
                }
            }
        }
        return false;
    }

    public static void applyQueryTimeout(PreparedStatement stmt) throws SQLException {
        if (stmt != null) {
            stmt.setQueryTimeout(QUERY_TIMEOUT_SECONDS);
        }
    }

    private static String describe(DatabaseConfig config) {
        if (config.hasJdbcUrlOverride()) {
            String url = config.resolveJdbcUrl();
            int params = url.indexOf(';');
            return params > 0 ? url.substring(0, params) : url;
        }
        return config.getHost() + ":" + config.getPort() + "/" + config.getDatabase();
    }

    public record TestResult(boolean success, String message, Throwable cause) {
        public TestResult(boolean success, String message) {
            this(success, message, null);
        }
    }
}
