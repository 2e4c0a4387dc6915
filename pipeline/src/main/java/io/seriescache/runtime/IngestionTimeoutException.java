package io.seriescache.runtime;

import java.time.Duration;

/** No result and no end-of-run marker arrived from the producer within the drain timeout. */
public class IngestionTimeoutException extends IngestionException {
    private final Duration waited;
    private final int drained;

    public IngestionTimeoutException(Duration waited, int drained) {
        super("no result from producer within " + waited.toMillis() + "ms after " + drained + " drained item(s)", null);
        this.waited = waited;
        this.drained = drained;
    }

    public Duration waited() { return waited; }
    public int drained() { return drained; }
}
