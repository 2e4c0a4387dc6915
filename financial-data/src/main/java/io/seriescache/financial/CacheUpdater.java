package io.seriescache.financial;

import com.codahale.metrics.MetricRegistry;
import io.seriescache.config.PipelineConfig;
import io.seriescache.core.FetchResult;
import io.seriescache.error.DeadLetterSink;
import io.seriescache.runtime.BoundedIngestion;
import io.seriescache.runtime.IngestionBuilder;
import io.seriescache.runtime.IngestionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;

/**
 * Brings the bar cache up to date: inspect what is stored, plan the missing fetches, run them through a
 * bounded ingestion into the store. Each call opens its own store handle and releases it on every path.
 */
public class CacheUpdater {
    private static final Logger log = LoggerFactory.getLogger(CacheUpdater.class);

    private final SeriesStore.Opener stores;
    private final FetchPlanReconciler reconciler;
    private final BarsProvider provider;
    private final PipelineConfig config;
    private final MetricRegistry registry;
    private final DeadLetterSink<FetchResult<FetchRequest, BarTable>> deadLetters; // optional
    private final BarNormalizer normalizer = new BarNormalizer();

    public CacheUpdater(SeriesStore.Opener stores, FetchPlanReconciler reconciler, BarsProvider provider,
                        PipelineConfig config, MetricRegistry registry,
                        DeadLetterSink<FetchResult<FetchRequest, BarTable>> deadLetters) {
        this.stores = stores;
        this.reconciler = reconciler;
        this.provider = provider;
        this.config = config;
        this.registry = registry;
        this.deadLetters = deadLetters;
    }

    /**
     * @param desired series to add on top of the ones already cached
     * @throws InvalidSeriesKeyException before any fetch when {@code desired} is malformed
     * @throws StoreException when the store cannot be opened or inspected
     */
    public IngestionSummary update(Set<SeriesKey> desired) throws StoreException {
        reconciler.checkDesired(desired);
        SeriesStoreSink sink = new SeriesStoreSink(stores.open(), normalizer);
        try (sink) {
            return run(sink, desired);
        }
    }

    private IngestionSummary run(SeriesStoreSink sink, Set<SeriesKey> desired) throws StoreException {
        Map<SeriesKey, SeriesRange> state = new CacheStateInspector(sink.store()).inspect();
        FetchPlan plan = reconciler.plan(state, desired);
        if (plan.isEmpty()) {
            log.info("nothing to update");
        }
        BoundedIngestion<FetchRequest, BarTable> ingestion = new IngestionBuilder<FetchRequest, BarTable>()
                .config(config)
                .requests(plan)
                .fetcher(provider)
                .sink(sink)
                .emptyWhen(BarNormalizer::isEmpty)
                .metrics(registry)
                .deadLetters(deadLetters)
                .build();
        try (ingestion) {
            IngestionSummary summary = ingestion.run();
            log.info("cache update done: {}, {} rows written", summary, sink.rowsWritten());
            return summary;
        }
    }
}
