package io.slwhitelist.command;

import com.google.common.flogger.FluentLogger;
import io.slwhitelist.notify.NotificationSink;
import io.slwhitelist.notify.WhitelistMessages;

import java.sql.SQLException;
import java.util.logging.Level;

/**
 * Handles the {@code !slwl} chat command: replies privately with the caller's progress.
 * Failures are logged and the player gets no reply.
 */
public class WhitelistProgressCommand {

    private static final FluentLogger LOGGER = FluentLogger.forEnclosingClass();

    private final WhitelistStatusService statusService;
    private final NotificationSink notificationSink;
    private final Level detailLevel;

    public WhitelistProgressCommand(WhitelistStatusService statusService, NotificationSink notificationSink,
                                    boolean debugLogs) {
        this.statusService = statusService;
        this.notificationSink = notificationSink;
        this.detailLevel = debugLogs ? Level.INFO : Level.FINE;
    }

    /**
     * @return true if a reply was sent
     */
    public boolean execute(String playerId, String playerName) {
        if (playerId == null || playerId.isBlank()) {
            return false;
        }
        WhitelistStatus status;
        try {
            status = statusService.lookup(playerId);
        } catch (SQLException e) {
            LOGGER.atWarning().withCause(e).log("Failed to look up whitelist progress for " + playerName
                    + " (" + playerId + ")");
            return false;
        }
        LOGGER.at(detailLevel).log("Progress query from " + playerName + " (" + playerId + "): " + status);

        try {
            notificationSink.warn(playerId, formatReply(status));
            return true;
        } catch (RuntimeException e) {
            LOGGER.atWarning().withCause(e).log("Failed to send progress reply to " + playerId);
            return false;
        }
    }

    public static String formatReply(WhitelistStatus status) {
        return switch (status.kind()) {
            case NO_PROGRESS -> WhitelistMessages.noProgress();
            case IN_PROGRESS -> WhitelistMessages.inProgress(status.percent());
            case WHITELISTED -> WhitelistMessages.whitelisted(status.percent(), status.rank(), status.total());
        };
    }
}
