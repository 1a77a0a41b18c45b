package io.notify4j;

import io.notify4j.core.DispatchException;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Test dispatcher that records every attempt and can be told to fail.
 */
public class RecordingDispatcher implements NotificationDispatcher {

    public record Sent(String chatId, String text) {
    }

    private final List<Sent> attempts = new ArrayList<>();
    private volatile boolean failing;
    private volatile Consumer<Sent> onSend = s -> { };

    @Override
    public void send(String chatId, String text) throws DispatchException {
        Sent sent = new Sent(chatId, text);
        synchronized (attempts) {
            attempts.add(sent);
        }
        onSend.accept(sent);
        if (failing) {
            throw new DispatchException(chatId, "chat unreachable");
        }
    }

    public void failing(boolean failing) {
        this.failing = failing;
    }

    public void onSend(Consumer<Sent> onSend) {
        this.onSend = onSend;
    }

    public List<Sent> attempts() {
        synchronized (attempts) {
            return List.copyOf(attempts);
        }
    }

    public int count() {
        return attempts().size();
    }
}
