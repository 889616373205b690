package io.trigger4j.core;

/**
 * Wraps a failure of the persistent store. The enclosing transaction has been rolled back
 * by the time this is thrown.
 */
public class StoreException extends Trigger4jException {

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.INTERNAL;
    }
}
