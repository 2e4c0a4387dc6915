package io.seriescache.financial;

import io.seriescache.cache.CachingLoader;
import io.seriescache.cache.ContentCache;
import io.seriescache.cache.JsonCodec;
import io.seriescache.core.ProviderFetchFailedException;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Serves the closed-day part of a bar request from the content cache and asks the wrapped provider
 * for the rest.
 * <p>
 * A request runs up to now, so its answer keeps growing. Only bars before today's midnight in the
 * reference zone are cached, under the request plus the last closed day; the same request on a later
 * day is a different entry. Today's bars always come from the provider. Empty tables are not cached.
 */
public class CachedBarsProvider implements BarsProvider {
    private final BarsProvider delegate;
    private final Clock clock;
    private final ZoneId zone;
    private final CachingLoader<ClosedWindow, BarTable> loader;

    /** Cache key: {@code request} cut off at the end of {@code through}. */
    record ClosedWindow(FetchRequest request, LocalDate through) {}

    public CachedBarsProvider(BarsProvider delegate, ContentCache cache, Clock clock, ZoneId zone) {
        this.delegate = Objects.requireNonNull(delegate);
        this.clock = Objects.requireNonNull(clock);
        this.zone = Objects.requireNonNull(zone);
        this.loader = new CachingLoader<>(cache, JsonCodec.of(ClosedWindow.class), JsonCodec.of(BarTable.class),
                table -> !table.isEmpty());
    }

    @Override
    public BarTable fetch(FetchRequest request) throws Exception {
        ZonedDateTime today = LocalDate.now(clock.withZone(zone)).atStartOfDay(zone);
        if (!request.beginPeriod().isBefore(today)) return delegate.fetch(request);

        AtomicReference<BarTable> fetched = new AtomicReference<>();
        ClosedWindow window = new ClosedWindow(request, today.toLocalDate().minusDays(1));
        BarTable closed;
        try {
            closed = loader.load(window, w -> {
                BarTable full = delegate.fetch(w.request());
                fetched.set(full);
                return before(full, today.toInstant());
            });
        } catch (ProviderFetchFailedException e) {
            throw new ProviderFetchFailedException(request, e.getCause());
        }
        if (closed == null || fetched.get() != null) return fetched.get();

        BarTable recent = delegate.fetch(new FetchRequest(request.key(), today));
        List<Bar> bars = new ArrayList<>(closed.bars());
        if (recent != null) bars.addAll(recent.bars());
        return new BarTable(closed.symbol(), bars);
    }

    private static BarTable before(BarTable table, Instant cutoff) {
        if (table == null) return null;
        List<Bar> kept = new ArrayList<>();
        for (Bar b : table.bars()) {
            if (b.timestamp() != null && b.timestamp().isBefore(cutoff)) kept.add(b);
        }
        return new BarTable(table.symbol(), kept);
    }

    CachingLoader<ClosedWindow, BarTable> loader() { return loader; }
}
