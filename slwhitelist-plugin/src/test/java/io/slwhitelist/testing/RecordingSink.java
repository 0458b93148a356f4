package io.slwhitelist.testing;

import io.slwhitelist.notify.NotificationSink;

import java.util.ArrayList;
import java.util.List;

public final class RecordingSink implements NotificationSink {

    private final List<Sent> sent = new ArrayList<>();

    @Override
    public synchronized void warn(String playerId, String message) {
        sent.add(new Sent(playerId, message));
    }

    public synchronized List<Sent> sent() {
        return new ArrayList<>(sent);
    }

    public synchronized List<Sent> sentTo(String playerId) {
        List<Sent> result = new ArrayList<>();
        for (Sent message : sent) {
            if (message.playerId().equals(playerId)) {
                result.add(message);
            }
        }
        return result;
    }

    public synchronized void clear() {
        sent.clear();
    }

    public record Sent(String playerId, String message) {
    }
}
