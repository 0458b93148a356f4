package io.slwhitelist;

import com.google.common.flogger.FluentLogger;
import io.slwhitelist.command.WhitelistProgressCommand;
import io.slwhitelist.command.WhitelistStatusService;
import io.slwhitelist.common.util.AsyncExecutionHelper;
import io.slwhitelist.config.WhitelistConfig;
import io.slwhitelist.core.db.DatabaseConfig;
import io.slwhitelist.core.db.DatabaseManager;
import io.slwhitelist.data.ProgressStore;
import io.slwhitelist.manager.ProgressDecayManager;
import io.slwhitelist.manager.WhitelistFileManager;
import io.slwhitelist.notify.NotificationSink;
import io.slwhitelist.roster.RosterSource;
import io.slwhitelist.tracker.SquadLeaderTracker;

import javax.annotation.Nullable;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;

/**
 * Entry point for the host. {@link #setup()} wires the store and schedules the three periodic
 * tasks (roster sampling, decay, whitelist file refresh); {@link #shutdown()} stops them.
 * The host feeds chat commands and new-game events through {@link #onChatCommand} and
 * {@link #onNewGame}; neither ever throws back into the host.
 */
public class SquadLeaderWhitelistPlugin {

    private static final FluentLogger LOGGER = FluentLogger.forEnclosingClass();
    public static final String CONFIG_FILE = "config/slwhitelist.json";
    public static final String DATABASE_CONFIG_FILE = "config/database.json";

    private final Path baseDir;
    private final RosterSource rosterSource;
    private final NotificationSink notificationSink;
    private final Clock clock;
    private final DatabaseManager databaseManager;

    @Nullable
    private WhitelistConfig config;
    @Nullable
    private DatabaseConfig databaseConfig;

    private ScheduledExecutorService scheduler;
    private ScheduledFuture<?> sampleTask;
    private ScheduledFuture<?> decayTask;
    private ScheduledFuture<?> whitelistTask;
    private volatile boolean running;

    private ProgressStore progressStore;
    private SquadLeaderTracker squadLeaderTracker;
    private ProgressDecayManager decayManager;
    private WhitelistFileManager whitelistFileManager;
    private WhitelistProgressCommand progressCommand;

    public SquadLeaderWhitelistPlugin(Path baseDir, RosterSource rosterSource, NotificationSink notificationSink) {
        this(baseDir, rosterSource, notificationSink, Clock.systemUTC(), new DatabaseManager());
    }

    public SquadLeaderWhitelistPlugin(Path baseDir, RosterSource rosterSource, NotificationSink notificationSink,
                                      Clock clock, DatabaseManager databaseManager) {
        this.baseDir = baseDir;
        this.rosterSource = rosterSource;
        this.notificationSink = notificationSink;
        this.clock = clock;
        this.databaseManager = databaseManager;
    }

    /** Uses the given configs instead of reading them from {@code baseDir/config}. */
    public SquadLeaderWhitelistPlugin withConfig(WhitelistConfig config, DatabaseConfig databaseConfig) {
        this.config = config;
        this.databaseConfig = databaseConfig;
        return this;
    }

    /**
     * Starts the plugin. If the database or schema cannot be set up, the failure is logged and
     * no task is scheduled; the host keeps running without this plugin.
     *
     * @return true if the periodic tasks were started
     */
    public synchronized boolean setup() {
        if (running) {
            LOGGER.atWarning().log("SL whitelist already running, skipping setup");
            return true;
        }
        LOGGER.atInfo().log("Setting up SL whitelist (base dir " + baseDir.toAbsolutePath() + ")");
        if (config == null) {
            config = WhitelistConfig.load(baseDir.resolve(CONFIG_FILE));
        }
        if (databaseConfig == null) {
            databaseConfig = DatabaseConfig.load(baseDir.resolve(DATABASE_CONFIG_FILE));
        }

        try {
            databaseManager.initialize(databaseConfig);
            progressStore = new ProgressStore(databaseManager);
            progressStore.initialize();
        } catch (Exception e) {
            LOGGER.at(Level.SEVERE).withCause(e).log("Failed to initialize whitelist progress storage, "
                    + "SL whitelist will not start");
            databaseManager.shutdown();
            return false;
        }
        DatabaseManager.TestResult test = databaseManager.testConnection(ProgressStore.TABLE);
        LOGGER.atInfo().log("Database check: " + test.message());

        squadLeaderTracker = new SquadLeaderTracker(rosterSource, progressStore, notificationSink, config, clock,
                this::isRunning);
        decayManager = new ProgressDecayManager(rosterSource, progressStore, config, clock);
        whitelistFileManager = new WhitelistFileManager(progressStore,
                WhitelistFileManager.resolve(baseDir, config.getManagedWhitelistPath()),
                config.getManagedWhitelistGroup(), config.getThreshold(), config.isDebugLogs());
        progressCommand = new WhitelistProgressCommand(
                new WhitelistStatusService(progressStore, config.getThreshold()), notificationSink,
                config.isDebugLogs());

        whitelistFileManager.ensureFileExists();
        whitelistFileManager.regenerate();

        scheduler = Executors.newScheduledThreadPool(WhitelistTimingConstants.SCHEDULER_THREADS, new TickThreadFactory());
        running = true;
        sampleTask = scheduleTick("roster sample", squadLeaderTracker::tick,
                WhitelistTimingConstants.SAMPLE_INTERVAL_SECONDS, WhitelistTimingConstants.SAMPLE_INTERVAL_SECONDS,
                TimeUnit.SECONDS);
        decayTask = scheduleTick("progress decay", decayManager::tick,
                WhitelistTimingConstants.DECAY_INITIAL_DELAY_SECONDS, config.getDecayIntervalSeconds(),
                TimeUnit.SECONDS);
        whitelistTask = scheduleTick("whitelist file", whitelistFileManager::regenerate,
                config.getWhitelistUpdateMinutes(), config.getWhitelistUpdateMinutes(), TimeUnit.MINUTES);
        LOGGER.atInfo().log("SL whitelist started: threshold=" + config.getThreshold()
                + " progressPerHour=" + config.getProgressPerHour()
                + " decayPerHour=" + config.getDecayPerHour()
                + " output=" + whitelistFileManager.getWhitelistFile());
        return true;
    }

    /**
     * Stops scheduling new ticks, lets in-flight ones finish, then closes the pool.
     */
    public synchronized void shutdown() {
        boolean wasRunning = running;
        running = false;
        cancelScheduled(sampleTask);
        cancelScheduled(decayTask);
        cancelScheduled(whitelistTask);
        sampleTask = null;
        decayTask = null;
        whitelistTask = null;
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(WhitelistTimingConstants.SHUTDOWN_DRAIN_SECONDS, TimeUnit.SECONDS)) {
                    LOGGER.atWarning().log("Whitelist tasks still running after "
                            + WhitelistTimingConstants.SHUTDOWN_DRAIN_SECONDS + "s, closing anyway");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            scheduler = null;
        }
        databaseManager.shutdown();
        if (wasRunning) {
            LOGGER.atInfo().log("SL whitelist stopped");
        }
    }

    /**
     * Chat command hook. The lookup runs on the plugin's own threads so database latency never
     * blocks the host's event dispatch.
     */
    public void onChatCommand(String playerId, String playerName) {
        WhitelistProgressCommand command = progressCommand;
        if (!running || command == null) {
            return;
        }
        AsyncExecutionHelper.runBestEffort(scheduler, () -> command.execute(playerId, playerName),
                "Whitelist progress query", playerId);
    }

    /** New-game hook: refreshes the whitelist file right away instead of waiting for the next tick. */
    public void onNewGame() {
        WhitelistFileManager fileManager = whitelistFileManager;
        if (!running || fileManager == null) {
            return;
        }
        LOGGER.atInfo().log("New game started, regenerating whitelist file");
        AsyncExecutionHelper.runBestEffort(scheduler, fileManager::regenerate, "Whitelist file refresh", "new game");
    }

    public boolean isRunning() {
        return running;
    }

    @Nullable
    public WhitelistConfig getConfig() {
        return config;
    }

    @Nullable
    public WhitelistFileManager getWhitelistFileManager() {
        return whitelistFileManager;
    }

    @Nullable
    public ProgressStore getProgressStore() {
        return progressStore;
    }

    private void cancelScheduled(ScheduledFuture<?> handle) {
        if (handle == null) {
            return;
        }
        handle.cancel(false);
    }

    private ScheduledFuture<?> scheduleTick(String name, Runnable task, long initialDelay, long period, TimeUnit unit) {
        return scheduler.scheduleWithFixedDelay(() -> {
            if (!running) {
                return;
            }
            try {
                task.run();
            } catch (Throwable error) {
                LOGGER.at(Level.SEVERE).withCause(error).log("Tick task failed (" + name + ")");
            }
        }, initialDelay, period, unit);
    }

    private static final class TickThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "slwhitelist-tick-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
