package io.seriescache.financial;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class JdbcAdjustmentStoreTest {

    @Test
    void events_are_queried_by_symbol_date_range_and_type() throws Exception {
        try (JdbcAdjustmentStore store = JdbcAdjustmentStore.open(JdbcSeriesStoreTest.memUrl())) {
            AdjustmentEvent split = new AdjustmentEvent(LocalDate.of(2020, 8, 31), "AAPL", AdjustmentType.SPLIT, 0.25, "yahoo");
            AdjustmentEvent div = new AdjustmentEvent(LocalDate.of(2020, 8, 7), "AAPL", AdjustmentType.DIVIDEND, 0.82, "yahoo");
            AdjustmentEvent other = new AdjustmentEvent(LocalDate.of(2020, 8, 19), "MSFT", AdjustmentType.DIVIDEND, 0.51, "yahoo");
            store.add(split);
            assertEquals(2, store.addAll(List.of(div, other)));

            assertEquals(List.of(div, split), store.query("AAPL", LocalDate.of(2020, 1, 1), LocalDate.of(2020, 12, 31)));
            assertEquals(List.of(split), store.query("AAPL", LocalDate.of(2020, 1, 1), LocalDate.of(2020, 12, 31), AdjustmentType.SPLIT));
            assertEquals(List.of(div), store.query("AAPL", LocalDate.of(2020, 8, 1), LocalDate.of(2020, 8, 30)));
            assertTrue(store.query("IBM", LocalDate.of(2020, 1, 1), LocalDate.of(2020, 12, 31)).isEmpty());
        }
    }

    @Test
    void appends_never_overwrite() throws Exception {
        try (JdbcAdjustmentStore store = JdbcAdjustmentStore.open(JdbcSeriesStoreTest.memUrl())) {
            AdjustmentEvent div = new AdjustmentEvent(LocalDate.of(2020, 8, 7), "AAPL", AdjustmentType.DIVIDEND, 0.82, "yahoo");
            store.add(div);
            store.add(div);
            assertEquals(2, store.query("AAPL", LocalDate.of(2020, 8, 7), LocalDate.of(2020, 8, 7)).size());
            assertEquals(0, store.addAll(List.of()));
        }
    }
}
