package io.notify4j.core;

/**
 * Base type for errors the notification engine reports to its callers.
 */
public class NotifierException extends RuntimeException {

    public NotifierException(String message) {
        super(message);
    }

    public NotifierException(String message, Throwable cause) {
        super(message, cause);
    }
}
