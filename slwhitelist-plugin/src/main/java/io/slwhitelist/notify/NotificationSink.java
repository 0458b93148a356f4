package io.slwhitelist.notify;

/**
 * Delivers a text message to a single player, typically through the game server's remote
 * console warn command.
 */
@FunctionalInterface
public interface NotificationSink {

    /**
     * @param playerId stable id of the recipient
     * @param message possibly multi-line text
     */
    void warn(String playerId, String message);
}
