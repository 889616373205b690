package io.trigger4j.core;

/**
 * Base type of every error raised by trigger4j operations.
 */
public abstract class Trigger4jException extends RuntimeException {

    protected Trigger4jException(String message) {
        super(message);
    }

    protected Trigger4jException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorKind kind();
}
