package io.seriescache.financial;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

import static org.junit.jupiter.api.Assertions.*;

public class CacheStateInspectorTest {
    private static final SeriesKey MSFT = SeriesKey.of("MSFT", 60, IntervalType.SECONDS);
    private static final SeriesKey AAPL = SeriesKey.of("AAPL", 60, IntervalType.SECONDS);

    @Test
    void reports_first_and_last_per_series_sorted_by_key() throws Exception {
        var store = new InMemorySeriesStore()
                .with(MSFT, new Bar(Instant.ofEpochSecond(300), 1.0, 1.0, 1.0, 1.0, 1L))
                .with(AAPL, new Bar(Instant.ofEpochSecond(100), 1.0, 1.0, 1.0, 1.0, 1L),
                        new Bar(Instant.ofEpochSecond(200), 1.0, 1.0, 1.0, 1.0, 1L));

        SortedMap<SeriesKey, SeriesRange> ranges = new CacheStateInspector(store).inspect();

        assertEquals(List.of(AAPL, MSFT), List.copyOf(ranges.keySet()));
        assertEquals(new SeriesRange(Instant.ofEpochSecond(100), Instant.ofEpochSecond(200)), ranges.get(AAPL));
        assertEquals(new SeriesRange(Instant.ofEpochSecond(300), Instant.ofEpochSecond(300)), ranges.get(MSFT));
    }

    @Test
    void series_missing_one_end_are_dropped() throws Exception {
        SeriesStore lopsided = new InMemorySeriesStore() {
            @Override public synchronized Map<SeriesKey, Instant> firstTimestamps() {
                return Map.of(AAPL, Instant.ofEpochSecond(1), MSFT, Instant.ofEpochSecond(1));
            }
            @Override public synchronized Map<SeriesKey, Instant> lastTimestamps() {
                return Map.of(AAPL, Instant.ofEpochSecond(9));
            }
        };
        assertEquals(List.of(AAPL), List.copyOf(new CacheStateInspector(lopsided).inspect().keySet()));
    }

    @Test
    void malformed_stored_keys_are_skipped() throws Exception {
        SeriesKey spaced = SeriesKey.of("BRK B", 60, IntervalType.SECONDS);
        var store = new InMemorySeriesStore()
                .with(spaced, new Bar(Instant.ofEpochSecond(100), 1.0, 1.0, 1.0, 1.0, 1L))
                .with(AAPL, new Bar(Instant.ofEpochSecond(100), 1.0, 1.0, 1.0, 1.0, 1L));

        assertEquals(List.of(AAPL), List.copyOf(new CacheStateInspector(store).inspect().keySet()));
    }
}
