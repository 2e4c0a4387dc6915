package io.seriescache.financial;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Backing time-series store for cached bars. Writes are idempotent per series and timestamp:
 * writing a bar twice overwrites it.
 */
public interface SeriesStore extends AutoCloseable {

    /** Earliest stored bar per series. */
    Map<SeriesKey, Instant> firstTimestamps() throws StoreException;

    /** Latest stored bar per series. */
    Map<SeriesKey, Instant> lastTimestamps() throws StoreException;

    /** @return rows written */
    int write(SeriesBars bars) throws StoreException;

    /** Bars of one series with {@code from <= ts < to}, oldest first. */
    List<Bar> read(SeriesKey key, Instant from, Instant to) throws StoreException;

    @Override
    void close() throws StoreException;

    /** Opens a fresh store handle; each cache update owns and closes the one it gets. */
    @FunctionalInterface
    interface Opener {
        SeriesStore open() throws StoreException;
    }
}
