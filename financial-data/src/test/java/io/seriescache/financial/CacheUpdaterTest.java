package io.seriescache.financial;

import com.codahale.metrics.MetricRegistry;
import io.seriescache.cache.MVStoreContentCache;
import io.seriescache.config.PipelineConfig;
import io.seriescache.runtime.IngestionSummary;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.Period;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

public class CacheUpdaterTest {
    private static final ZoneId NY = ZoneId.of("America/New_York");
    private static final Instant NOW = Instant.parse("2021-03-15T12:00:00Z");
    private static final SeriesKey AAPL = SeriesKey.of("AAPL", 60, IntervalType.SECONDS);
    private static final SeriesKey MSFT = SeriesKey.of("MSFT", 60, IntervalType.SECONDS);

    /** Returns two bars an hour apart, starting an hour after the requested begin. */
    static class FakeProvider implements BarsProvider {
        final List<FetchRequest> requests = Collections.synchronizedList(new ArrayList<>());

        @Override
        public BarTable fetch(FetchRequest request) {
            requests.add(request);
            Instant begin = request.beginPeriod().toInstant();
            return new BarTable(request.key().symbol(), List.of(
                    new Bar(begin.plus(Duration.ofHours(1)), 1.0, 2.0, 0.5, 1.5, 10L),
                    new Bar(begin.plus(Duration.ofHours(2)), 1.5, 2.5, 1.0, 2.0, 20L)));
        }
    }

    private static FetchPlanReconciler reconciler() {
        return FetchPlanReconciler.builder()
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .zone(NY)
                .lookback(Period.ofYears(1))
                .build();
    }

    private static CacheUpdater updater(SeriesStore.Opener stores, BarsProvider provider) {
        return new CacheUpdater(stores, reconciler(), provider, PipelineConfig.defaults(), new MetricRegistry(), null);
    }

    @Test
    void continues_cached_series_and_cold_starts_new_ones() throws Exception {
        var store = new InMemorySeriesStore()
                .with(AAPL, new Bar(Instant.parse("2021-03-10T18:00:00Z"), 1.0, 1.0, 1.0, 1.0, 1L));
        var provider = new FakeProvider();

        IngestionSummary summary = updater(() -> store, provider).update(Set.of(MSFT));

        assertEquals(List.of(
                new FetchRequest(AAPL, LocalDate.of(2021, 3, 11).atStartOfDay(NY)),
                new FetchRequest(MSFT, LocalDate.of(2020, 3, 15).atStartOfDay(NY))), provider.requests);
        assertEquals(2, summary.persisted());
        assertEquals(3, store.data.get(AAPL).size());
        assertEquals(2, store.data.get(MSFT).size());
        assertEquals(1, store.closes.get());
    }

    @Test
    void invalid_series_abort_before_the_store_is_opened() {
        AtomicInteger opened = new AtomicInteger();
        var provider = new FakeProvider();
        CacheUpdater updater = updater(() -> { opened.incrementAndGet(); return new InMemorySeriesStore(); }, provider);

        assertThrows(InvalidSeriesKeyException.class,
                () -> updater.update(Set.of(SeriesKey.of("", 60, IntervalType.SECONDS))));
        assertEquals(0, opened.get());
        assertTrue(provider.requests.isEmpty());
    }

    @Test
    void a_rejected_write_is_counted_and_the_rest_still_land() throws Exception {
        var store = new InMemorySeriesStore();
        store.failingSymbols.add("AAPL");
        SeriesKey ibm = SeriesKey.of("IBM", 60, IntervalType.SECONDS);

        IngestionSummary summary = updater(() -> store, new FakeProvider()).update(Set.of(AAPL, MSFT, ibm));

        assertEquals(1, summary.failed());
        assertEquals(2, summary.persisted());
        assertNull(store.data.get(AAPL));
        assertEquals(1, store.closes.get());
    }

    @Test
    void a_foreign_row_with_a_bad_symbol_does_not_block_the_update() throws Exception {
        var store = new InMemorySeriesStore()
                .with(SeriesKey.of("BRK B", 60, IntervalType.SECONDS), new Bar(Instant.parse("2021-03-10T18:00:00Z"), 1.0, 1.0, 1.0, 1.0, 1L));
        var provider = new FakeProvider();

        IngestionSummary summary = updater(() -> store, provider).update(Set.of(MSFT));

        assertEquals(1, summary.persisted());
        assertEquals(List.of(MSFT), provider.requests.stream().map(FetchRequest::key).toList());
    }

    @Test
    void provider_gaps_do_not_touch_the_store() throws Exception {
        var store = new InMemorySeriesStore();
        BarsProvider nothing = request -> BarTable.empty(request.key().symbol());

        IngestionSummary summary = updater(() -> store, nothing).update(Set.of(AAPL));

        assertEquals(1, summary.empty());
        assertEquals(0, summary.persisted());
        assertTrue(store.data.isEmpty());
    }

    @Test
    void second_run_against_h2_continues_where_the_first_stopped() throws Exception {
        String url = JdbcSeriesStoreTest.memUrl() + ";DB_CLOSE_DELAY=-1";
        var provider = new FakeProvider();
        CacheUpdater updater = updater(() -> JdbcSeriesStore.open(url), provider);

        updater.update(Set.of(AAPL));
        updater.update(Set.of());

        assertEquals(2, provider.requests.size());
        FetchRequest second = provider.requests.get(1);
        assertEquals(AAPL, second.key());
        // cold start was 2020-03-15; its last bar is 02:00 New York time on that day
        assertEquals(LocalDate.of(2020, 3, 16).atStartOfDay(NY), second.beginPeriod());
        try (JdbcSeriesStore store = JdbcSeriesStore.open(url)) {
            assertEquals(4, store.read(AAPL, Instant.EPOCH, NOW).size());
        }
    }

    /** A clock the test moves between runs. */
    static class MovableClock extends Clock {
        volatile Instant now;

        MovableClock(String instant) { this.now = Instant.parse(instant); }

        @Override public ZoneId getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return Clock.fixed(now, zone); }
        @Override public Instant instant() { return now; }
    }

    @Test
    void a_weekend_run_does_not_freeze_the_next_weekday() throws Exception {
        MovableClock clock = new MovableClock("2021-03-13T17:00:00Z"); // Saturday
        Bar friday = new Bar(Instant.parse("2021-03-12T20:00:00Z"), 1.0, 1.0, 1.0, 1.0, 1L);
        Bar monday = new Bar(Instant.parse("2021-03-15T15:00:00Z"), 2.0, 2.0, 2.0, 2.0, 2L);
        var store = new InMemorySeriesStore().with(AAPL, friday);
        List<FetchRequest> upstream = new ArrayList<>();
        BarsProvider market = request -> {
            upstream.add(request);
            boolean published = !monday.timestamp().isAfter(clock.instant());
            return new BarTable("AAPL", published ? List.of(monday) : List.of());
        };
        FetchPlanReconciler reconciler = FetchPlanReconciler.builder().clock(clock).zone(NY).build();

        try (var cache = MVStoreContentCache.inMemory()) {
            var provider = new CachedBarsProvider(market, cache, clock, NY);
            var updater = new CacheUpdater(() -> store, reconciler, provider, PipelineConfig.defaults(), new MetricRegistry(), null);

            assertEquals(1, updater.update(Set.of()).empty());
            clock.now = Instant.parse("2021-03-16T17:00:00Z"); // Tuesday
            assertEquals(1, updater.update(Set.of()).persisted());
        }

        assertEquals(2, upstream.size());
        assertEquals(LocalDate.of(2021, 3, 13).atStartOfDay(NY), upstream.get(1).beginPeriod());
        assertEquals(List.of(friday, monday), List.copyOf(store.data.get(AAPL).values()));
    }
}
