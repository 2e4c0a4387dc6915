package io.seriescache.batch;

/**
 * Resolves auxiliary content for a record that just passed dedup and returns the augmented record.
 */
@FunctionalInterface
public interface ContentEnricher {
    DataRecord enrich(DataRecord record);
}
