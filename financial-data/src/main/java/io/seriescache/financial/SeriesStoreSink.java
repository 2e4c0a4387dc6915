package io.seriescache.financial;

import io.seriescache.core.FetchResult;
import io.seriescache.core.Sink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Normalizes each fetched table and writes it to the store. Owns the store: closing the sink closes it,
 * and a second close does nothing.
 */
public class SeriesStoreSink implements Sink<FetchResult<FetchRequest, BarTable>> {
    private static final Logger log = LoggerFactory.getLogger(SeriesStoreSink.class);

    private final SeriesStore store;
    private final BarNormalizer normalizer;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private final AtomicLong rows = new AtomicLong();

    public SeriesStoreSink(SeriesStore store, BarNormalizer normalizer) {
        this.store = store;
        this.normalizer = normalizer;
    }

    @Override
    public void accept(FetchResult<FetchRequest, BarTable> item) throws StoreException {
        SeriesBars bars = normalizer.normalize(item.request(), item.payload());
        rows.addAndGet(store.write(bars));
    }

    public long rowsWritten() { return rows.get(); }

    SeriesStore store() { return store; }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        try {
            store.close();
        } catch (StoreException e) {
            log.warn("failed to close series store after writing {} rows", rows.get(), e);
        }
    }
}
