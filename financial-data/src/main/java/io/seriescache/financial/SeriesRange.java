package io.seriescache.financial;

import java.time.Instant;
import java.util.Objects;

/** Earliest and latest bar currently stored for a series. */
public record SeriesRange(Instant first, Instant last) {
    public SeriesRange {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(last, "last");
    }
}
