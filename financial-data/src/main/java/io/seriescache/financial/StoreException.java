package io.seriescache.financial;

/** A store could not be read or written. */
public class StoreException extends Exception {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
