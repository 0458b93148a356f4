package io.slwhitelist.config;

import com.google.common.flogger.FluentLogger;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Behaviour settings for accrual, decay and whitelist output, loaded from
 * {@code config/slwhitelist.json}. Missing files are written out with defaults.
 */
public class WhitelistConfig {

    private static final FluentLogger LOGGER = FluentLogger.forEnclosingClass();
    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().create();

    public static final String DEFAULT_WHITELIST_PATH = "SquadGame/ServerConfig/slwhitelist.cfg";
    public static final String DEFAULT_GROUP = "sl_whitelist";
    public static final int DEFAULT_THRESHOLD = 100;
    public static final double DEFAULT_PROGRESS_PER_HOUR = 50.0;
    public static final double DEFAULT_DECAY_PER_HOUR = 12.0;
    public static final int DEFAULT_DECAY_INTERVAL_SECONDS = 300;
    public static final double DEFAULT_DECAY_AFTER_HOURS = 48.0;
    public static final int DEFAULT_MIN_PLAYERS_FOR_DECAY = 40;
    public static final int DEFAULT_MIN_SQUAD_MEMBERS = 4;
    public static final int DEFAULT_WHITELIST_UPDATE_MINUTES = 5;

    private String managedWhitelistPath = DEFAULT_WHITELIST_PATH;
    private String managedWhitelistGroup = DEFAULT_GROUP;
    private int threshold = DEFAULT_THRESHOLD;
    private double progressPerHour = DEFAULT_PROGRESS_PER_HOUR;
    private double decayPerHour = DEFAULT_DECAY_PER_HOUR;
    private int decayIntervalSeconds = DEFAULT_DECAY_INTERVAL_SECONDS;
    private double decayAfterHours = DEFAULT_DECAY_AFTER_HOURS;
    private int minPlayersForDecay = DEFAULT_MIN_PLAYERS_FOR_DECAY;
    private int minSquadMembers = DEFAULT_MIN_SQUAD_MEMBERS;
    private boolean onlyOpenSquads = true;
    private int whitelistUpdateMinutes = DEFAULT_WHITELIST_UPDATE_MINUTES;
    private boolean debugLogs = false;

    public static WhitelistConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            WhitelistConfig defaultConfig = new WhitelistConfig();
            defaultConfig.save(configPath);
            LOGGER.atInfo().log("Created default whitelist config at " + configPath);
            return defaultConfig;
        }

        try {
            WhitelistConfig config = GSON.fromJson(Files.readString(configPath), WhitelistConfig.class);
            if (config == null) {
                LOGGER.atWarning().log("Whitelist config " + configPath + " is empty, using defaults");
                return new WhitelistConfig();
            }
            config.sanitize();
            LOGGER.atInfo().log("Loaded whitelist config from " + configPath);
            return config;
        } catch (IOException | JsonParseException e) {
            LOGGER.atSevere().withCause(e).log("Failed to load whitelist config, using defaults");
            return new WhitelistConfig();
        }
    }

    public void save(Path configPath) {
        try {
            Path parent = configPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(configPath, GSON.toJson(this));
        } catch (IOException e) {
            LOGGER.atSevere().withCause(e).log("Failed to save whitelist config to " + configPath);
        }
    }

    /** Replaces values that would stall or invert the engines with their defaults. */
    void sanitize() {
        if (managedWhitelistPath == null || managedWhitelistPath.isBlank()) {
            warnReset("managedWhitelistPath", managedWhitelistPath);
            managedWhitelistPath = DEFAULT_WHITELIST_PATH;
        }
        if (managedWhitelistGroup == null || managedWhitelistGroup.isBlank()) {
            warnReset("managedWhitelistGroup", managedWhitelistGroup);
            managedWhitelistGroup = DEFAULT_GROUP;
        }
        if (threshold <= 0) {
            warnReset("threshold", threshold);
            threshold = DEFAULT_THRESHOLD;
        }
        if (progressPerHour < 0.0) {
            warnReset("progressPerHour", progressPerHour);
            progressPerHour = DEFAULT_PROGRESS_PER_HOUR;
        }
        if (decayPerHour < 0.0) {
            warnReset("decayPerHour", decayPerHour);
            decayPerHour = DEFAULT_DECAY_PER_HOUR;
        }
        if (decayIntervalSeconds <= 0) {
            warnReset("decayIntervalSeconds", decayIntervalSeconds);
            decayIntervalSeconds = DEFAULT_DECAY_INTERVAL_SECONDS;
        }
        if (decayAfterHours < 0.0) {
            warnReset("decayAfterHours", decayAfterHours);
            decayAfterHours = DEFAULT_DECAY_AFTER_HOURS;
        }
        if (minPlayersForDecay < 0) {
            warnReset("minPlayersForDecay", minPlayersForDecay);
            minPlayersForDecay = DEFAULT_MIN_PLAYERS_FOR_DECAY;
        }
        if (minSquadMembers < 1) {
            warnReset("minSquadMembers", minSquadMembers);
            minSquadMembers = DEFAULT_MIN_SQUAD_MEMBERS;
        }
        if (whitelistUpdateMinutes <= 0) {
            warnReset("whitelistUpdateMinutes", whitelistUpdateMinutes);
            whitelistUpdateMinutes = DEFAULT_WHITELIST_UPDATE_MINUTES;
        }
    }

    private static void warnReset(String key, Object value) {
        LOGGER.atWarning().log("Invalid " + key + " value '" + value + "', using default");
    }

    public String getManagedWhitelistPath() {
        return managedWhitelistPath;
    }

    public String getManagedWhitelistGroup() {
        return managedWhitelistGroup;
    }

    public int getThreshold() {
        return threshold;
    }

    public double getProgressPerHour() {
        return progressPerHour;
    }

    public double getDecayPerHour() {
        return decayPerHour;
    }

    public int getDecayIntervalSeconds() {
        return decayIntervalSeconds;
    }

    public double getDecayAfterHours() {
        return decayAfterHours;
    }

    public int getMinPlayersForDecay() {
        return minPlayersForDecay;
    }

    public int getMinSquadMembers() {
        return minSquadMembers;
    }

    public boolean isOnlyOpenSquads() {
        return onlyOpenSquads;
    }

    public int getWhitelistUpdateMinutes() {
        return whitelistUpdateMinutes;
    }

    public boolean isDebugLogs() {
        return debugLogs;
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Programmatic construction for embedding hosts and tests; values go through the same checks. */
    public static final class Builder {
        private final WhitelistConfig config = new WhitelistConfig();

        private Builder() {
        }

        public Builder managedWhitelistPath(String path) {
            config.managedWhitelistPath = path;
            return this;
        }

        public Builder managedWhitelistGroup(String group) {
            config.managedWhitelistGroup = group;
            return this;
        }

        public Builder threshold(int threshold) {
            config.threshold = threshold;
            return this;
        }

        public Builder progressPerHour(double progressPerHour) {
            config.progressPerHour = progressPerHour;
            return this;
        }

        public Builder decayPerHour(double decayPerHour) {
            config.decayPerHour = decayPerHour;
            return this;
        }

        public Builder decayIntervalSeconds(int seconds) {
            config.decayIntervalSeconds = seconds;
            return this;
        }

        public Builder decayAfterHours(double hours) {
            config.decayAfterHours = hours;
            return this;
        }

        public Builder minPlayersForDecay(int players) {
            config.minPlayersForDecay = players;
            return this;
        }

        public Builder minSquadMembers(int members) {
            config.minSquadMembers = members;
            return this;
        }

        public Builder onlyOpenSquads(boolean onlyOpenSquads) {
            config.onlyOpenSquads = onlyOpenSquads;
            return this;
        }

        public Builder whitelistUpdateMinutes(int minutes) {
            config.whitelistUpdateMinutes = minutes;
            return this;
        }

        public Builder debugLogs(boolean debugLogs) {
            config.debugLogs = debugLogs;
            return this;
        }

        public WhitelistConfig build() {
            config.sanitize();
            return config;
        }
    }
}
