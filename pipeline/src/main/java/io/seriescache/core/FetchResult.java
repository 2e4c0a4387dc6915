package io.seriescache.core;

/**
 * Pairs a request with what the provider returned for it. Ownership moves from the producer to the
 * consumer through the ingestion queue; {@code failure} is set when the fetch itself gave up.
 */
public record FetchResult<I, O>(I request, O payload, Exception failure) {

    public static <I, O> FetchResult<I, O> of(I request, O payload) {
        return new FetchResult<>(request, payload, null);
    }

    public static <I, O> FetchResult<I, O> failed(I request, Exception failure) {
        return new FetchResult<>(request, null, failure);
    }

    public boolean isFailed() { return failure != null; }

    @Override
    public String toString() {
        return isFailed() ? request + " (failed: " + failure + ")" : String.valueOf(request);
    }
}
