package io.slwhitelist.core.db;

import com.google.common.flogger.FluentLogger;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Connection settings for the progress database, stored as JSON next to the plugin config.
 * An explicit {@code jdbcUrl} wins over the MySQL host/port/database triple.
 */
public class DatabaseConfig {

    private static final FluentLogger LOGGER = FluentLogger.forEnclosingClass();
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();
    public static final String PASSWORD_ENV = "SLWL_DB_PASSWORD";

    private String jdbcUrl;
    private String host = "localhost";
    private int port = 3306;
    private String database = "squadjs";
    private String user = "root";
    private String password = "";
    private int maximumPoolSize = 4;

    public static DatabaseConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            DatabaseConfig defaultConfig = new DatabaseConfig();
            defaultConfig.save(configPath);
            LOGGER.atInfo().log("Created default database config at " + configPath);
            return defaultConfig;
        }

        try {
            String json = Files.readString(configPath);
            DatabaseConfig config = GSON.fromJson(json, DatabaseConfig.class);
            if (config == null) {
                LOGGER.atWarning().log("Database config " + configPath + " is empty, using defaults");
                return new DatabaseConfig();
            }
            LOGGER.atInfo().log("Loaded database config from " + configPath);
            return config;
        } catch (IOException | JsonParseException e) {
            LOGGER.atSevere().log("Failed to load database config: " + e.getMessage());
            return new DatabaseConfig();
        }
    }

    public static DatabaseConfig forJdbcUrl(String jdbcUrl, String user, String password) {
        DatabaseConfig config = new DatabaseConfig();
        config.jdbcUrl = jdbcUrl;
        config.user = user;
        config.password = password;
        return config;
    }

    public void save(Path configPath) {
        try {
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(configPath, GSON.toJson(this));
        } catch (IOException e) {
            LOGGER.atSevere().log("Failed to save database config: " + e.getMessage());
        }
    }

    public boolean hasJdbcUrlOverride() {
        return jdbcUrl != null && !jdbcUrl.isBlank();
    }

    public String resolveJdbcUrl() {
        if (hasJdbcUrlOverride()) {
            return jdbcUrl;
        }
        return "jdbc:mysql://" + host + ":" + port + "/" + database;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public String getDatabase() {
        return database;
    }

    public String getUser() {
        return user;
    }

    public String getPassword() {
        String envPassword = System.getenv(PASSWORD_ENV);
        return envPassword != null ? envPassword : password;
    }

    public int getMaximumPoolSize() {
        return Math.max(2, maximumPoolSize);
    }
}
