package io.seriescache.financial;

import java.time.LocalDate;
import java.util.List;

/** Append-only store of splits and dividends. */
public interface AdjustmentStore extends AutoCloseable {

    void add(AdjustmentEvent event) throws StoreException;

    /** @return events written */
    int addAll(List<AdjustmentEvent> events) throws StoreException;

    /** Events for {@code symbol} dated {@code from..to} inclusive, oldest first. */
    default List<AdjustmentEvent> query(String symbol, LocalDate from, LocalDate to) throws StoreException {
        return query(symbol, from, to, null);
    }

    /** As {@link #query(String, LocalDate, LocalDate)}, restricted to {@code type} unless it is null. */
    List<AdjustmentEvent> query(String symbol, LocalDate from, LocalDate to, AdjustmentType type) throws StoreException;

    @Override
    void close() throws StoreException;
}
