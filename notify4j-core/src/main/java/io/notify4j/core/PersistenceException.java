package io.notify4j.core;

/**
 * Failure of the underlying schedule store. Fatal to the operation that hit it; never retried by the engine.
 */
public class PersistenceException extends NotifierException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
