package io.seriescache.core;

/**
 * Raised when the upstream provider could not serve a request. Carries the request so callers can
 * report exactly which unit of work was lost.
 */
public class ProviderFetchFailedException extends RuntimeException {
    private final transient Object request;

    public ProviderFetchFailedException(Object request, Throwable cause) {
        super("provider fetch failed for " + request + ": " + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.request = request;
    }

    public Object request() { return request; }
}
