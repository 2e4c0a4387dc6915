package io.seriescache.runtime;

import java.time.Duration;

/**
 * Outcome of one ingestion run.
 *
 * @param planned       requests handed to the producer
 * @param fetched       requests the provider answered (empty answers included)
 * @param persisted     payloads the sink accepted
 * @param empty         answers that carried no data and were not written
 * @param failed        payloads the sink rejected
 * @param fetchFailures requests the provider never answered after retries
 * @param stopped       whether the run ended early on a stop request
 */
public record IngestionSummary(int planned, int fetched, int persisted, int empty, int failed,
                               int fetchFailures, boolean stopped, Duration elapsed) {

    public int processed() { return fetched + fetchFailures; }

    public int failures() { return failed + fetchFailures; }

    @Override
    public String toString() {
        return "planned=" + planned + " fetched=" + fetched + " persisted=" + persisted + " empty=" + empty
                + " failed=" + failed + " fetchFailures=" + fetchFailures + (stopped ? " (stopped)" : "")
                + " elapsed=" + elapsed.toMillis() + "ms";
    }
}
