package io.seriescache.financial;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import io.seriescache.cache.ContentCache;
import io.seriescache.cache.MVStoreContentCache;
import io.seriescache.config.PipelineConfig;
import io.seriescache.core.FetchResult;
import io.seriescache.error.DeadLetterSink;
import io.seriescache.error.FileDeadLetterSink;

import java.io.IOException;
import java.time.Clock;

/**
 * Wires the bar cache: stores, reconciler, Yahoo provider (behind the content cache when one is
 * configured) and the {@link CacheUpdater} that ties them together.
 */
public class FinancialDataModule extends AbstractModule {
    private final CacheConfig cacheConfig;
    private final PipelineConfig pipelineConfig;

    public FinancialDataModule(CacheConfig cacheConfig, PipelineConfig pipelineConfig) {
        this.cacheConfig = cacheConfig;
        this.pipelineConfig = pipelineConfig;
    }

    @Override
    protected void configure() {
        bind(CacheConfig.class).toInstance(cacheConfig);
        bind(PipelineConfig.class).toInstance(pipelineConfig);
        bind(YahooClient.class).to(HttpYahooClient.class);
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Clock clock() { return Clock.systemUTC(); }

    @Provides @Singleton FetchPlanReconciler reconciler(Clock clock) {
        return FetchPlanReconciler.builder()
                .clock(clock)
                .zone(cacheConfig.zone())
                .lookback(cacheConfig.lookback())
                .staleAfter(cacheConfig.staleAfter())
                .continuation(cacheConfig.continuation())
                .build();
    }

    @Provides @Singleton ContentCache contentCache() {
        if (cacheConfig.contentPath() == null) return ContentCache.disabled();
        return MVStoreContentCache.open(cacheConfig.contentPath());
    }

    @Provides @Singleton BarsProvider barsProvider(YahooClient client, Clock clock, MetricRegistry registry, ContentCache cache) {
        BarsProvider yahoo = new YahooBarsProvider(client, clock, registry);
        return cache.enabled() ? new CachedBarsProvider(yahoo, cache, clock, cacheConfig.zone()) : yahoo;
    }

    @Provides SeriesStore.Opener seriesStores() {
        String url = cacheConfig.jdbcUrl();
        return () -> JdbcSeriesStore.open(url);
    }

    /** A fresh handle per injection; the caller closes it. */
    @Provides AdjustmentStore adjustmentStore() throws StoreException {
        return JdbcAdjustmentStore.open(cacheConfig.jdbcUrl());
    }

    @Provides @Singleton CacheUpdater cacheUpdater(SeriesStore.Opener stores, FetchPlanReconciler reconciler,
                                                   BarsProvider provider, MetricRegistry registry) throws IOException {
        DeadLetterSink<FetchResult<FetchRequest, BarTable>> dlq = cacheConfig.deadLetter() == null
                ? null
                : new FileDeadLetterSink<>(cacheConfig.deadLetter());
        return new CacheUpdater(stores, reconciler, provider, pipelineConfig, registry, dlq);
    }
}
