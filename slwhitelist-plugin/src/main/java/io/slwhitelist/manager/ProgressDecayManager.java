package io.slwhitelist.manager;

import com.google.common.flogger.FluentLogger;
import io.slwhitelist.WhitelistTimingConstants;
import io.slwhitelist.common.util.AsyncExecutionHelper;
import io.slwhitelist.common.util.FormatUtils;
import io.slwhitelist.config.WhitelistConfig;
import io.slwhitelist.data.ProgressStore;
import io.slwhitelist.roster.RosterSource;

import java.sql.SQLException;
import java.time.Clock;
import java.util.logging.Level;

/**
 * Periodically lowers the score of players who have not led a squad for a while.
 * Decay only runs while the server is busy enough; on a quiet server nobody loses progress.
 */
public class ProgressDecayManager {

    private static final FluentLogger LOGGER = FluentLogger.forEnclosingClass();

    private final RosterSource rosterSource;
    private final ProgressStore progressStore;
    private final Clock clock;
    private final int minPlayersForDecay;
    private final long idleGraceMs;
    private final double decayPerTick;
    private final Level detailLevel;

    public ProgressDecayManager(RosterSource rosterSource, ProgressStore progressStore,
                                WhitelistConfig config, Clock clock) {
        this.rosterSource = rosterSource;
        this.progressStore = progressStore;
        this.clock = clock;
        this.minPlayersForDecay = config.getMinPlayersForDecay();
        this.idleGraceMs = Math.round(config.getDecayAfterHours() * WhitelistTimingConstants.MILLIS_PER_HOUR);
        this.decayPerTick = config.getDecayPerHour() * (config.getDecayIntervalSeconds() / 3600.0);
        this.detailLevel = config.isDebugLogs() ? Level.INFO : Level.FINE;
    }

    /**
     * One decay tick.
     *
     * @return rows lowered, or 0 when the population gate or a store error skipped the tick
     */
    public int tick() {
        int livePlayers = rosterSource.livePlayerCount();
        if (livePlayers < minPlayersForDecay) {
            LOGGER.at(detailLevel).log("Skipping decay: " + livePlayers + " players online, "
                    + minPlayersForDecay + " required");
            return 0;
        }
        if (decayPerTick <= 0.0) {
            return 0;
        }
        // Only rows idle for strictly longer than the grace period decay.
        long idleCutoff = clock.millis() - idleGraceMs;
        try {
            int decayed = progressStore.decayIdle(decayPerTick, idleCutoff);
            LOGGER.at(detailLevel).log("Decayed " + decayed + " players by " + FormatUtils.formatScore(decayPerTick)
                    + " (idle longer than " + FormatUtils.formatDuration(idleGraceMs) + ")");
            return decayed;
        } catch (SQLException | RuntimeException e) {
            AsyncExecutionHelper.logThrottledWarning("decay", "Progress decay", null, e);
            return 0;
        }
    }

    public double getDecayPerTick() {
        return decayPerTick;
    }

    public long getIdleGraceMs() {
        return idleGraceMs;
    }
}
