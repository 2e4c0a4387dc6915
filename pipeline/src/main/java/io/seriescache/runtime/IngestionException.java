package io.seriescache.runtime;

/** The drain loop could not finish: the producer died or the draining thread was interrupted. */
public class IngestionException extends RuntimeException {
    public IngestionException(String message, Throwable cause) {
        super(message, cause);
    }
}
