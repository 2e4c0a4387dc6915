package io.seriescache.financial;

import java.time.ZonedDateTime;
import java.util.Objects;

/** Fetch {@code key} from {@code beginPeriod} up to now. */
public record FetchRequest(SeriesKey key, ZonedDateTime beginPeriod) {
    public FetchRequest {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(beginPeriod, "beginPeriod");
    }

    @Override
    public String toString() { return key + "@" + beginPeriod.toLocalDate(); }
}
