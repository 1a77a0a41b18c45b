package io.notify4j;

import io.notify4j.core.DispatchException;

/**
 * Delivers a text message to a chat destination.
 */
public interface NotificationDispatcher {

    void send(String chatId, String text) throws DispatchException;
}
