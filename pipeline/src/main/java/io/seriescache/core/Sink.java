package io.seriescache.core;

import java.io.Closeable;

/**
 * Sink persists items handed over by the ingestion drain loop, one item per call.
 * Closing the sink releases whatever store handle it holds; it is called exactly once per run.
 */
public interface Sink<T> extends Closeable {
    void accept(T item) throws Exception;

    @Override
    default void close() {}
}
