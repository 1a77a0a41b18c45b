package io.notify4j.core;

/**
 * A message could not be delivered to its destination.
 *
 * <p>The engine catches and logs this inside timer callbacks; only
 * {@link io.notify4j.NotificationScheduler#sendNow} hands it back to the caller.
 */
public class DispatchException extends Exception {

    private final String chatId;

    public DispatchException(String chatId, String message) {
        super(message);
        this.chatId = chatId;
    }

    public DispatchException(String chatId, String message, Throwable cause) {
        super(message, cause);
        this.chatId = chatId;
    }

    public String chatId() {
        return chatId;
    }
}
