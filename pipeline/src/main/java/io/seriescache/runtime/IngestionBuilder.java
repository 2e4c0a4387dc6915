package io.seriescache.runtime;

import com.codahale.metrics.MetricRegistry;
import io.seriescache.config.PipelineConfig;
import io.seriescache.core.FetchResult;
import io.seriescache.core.Fetcher;
import io.seriescache.core.Sink;
import io.seriescache.error.DeadLetterSink;
import io.seriescache.metrics.Metrics;
import io.seriescache.retry.ExponentialBackoffRetryPolicy;
import io.seriescache.retry.RetryPolicy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

public class IngestionBuilder<I, O> {
    private final List<I> requests = new ArrayList<>();
    private Fetcher<I, O> fetcher;
    private Sink<FetchResult<I, O>> sink;
    private Predicate<O> isEmpty = Objects::isNull;
    private RetryPolicy retryPolicy;
    private int queueCapacity;
    private Duration fetchTimeout;
    private Duration drainTimeout;
    private int progressEvery;
    private MetricRegistry metricRegistry = new MetricRegistry();
    private String metricPrefix = "";
    private DeadLetterSink<FetchResult<I, O>> deadLetters;

    public IngestionBuilder() {
        config(PipelineConfig.defaults());
    }

    /** Applies queue, progress, timeout and retry settings in one go. */
    public IngestionBuilder<I, O> config(PipelineConfig c) {
        this.queueCapacity = c.queueCapacity();
        this.progressEvery = c.progressEvery();
        this.fetchTimeout = c.fetchTimeout();
        this.drainTimeout = c.drainTimeout();
        this.retryPolicy = new ExponentialBackoffRetryPolicy(c.retryAttempts(), c.retryBase(), c.retryMax());
        return this;
    }

    public IngestionBuilder<I, O> requests(Iterable<? extends I> rs) { rs.forEach(requests::add); return this; }
    public IngestionBuilder<I, O> fetcher(Fetcher<I, O> f) { this.fetcher = f; return this; }
    public IngestionBuilder<I, O> sink(Sink<FetchResult<I, O>> s) { this.sink = s; return this; }
    public IngestionBuilder<I, O> emptyWhen(Predicate<O> p) { this.isEmpty = p; return this; }
    public IngestionBuilder<I, O> retry(RetryPolicy r) { this.retryPolicy = r; return this; }
    public IngestionBuilder<I, O> queueCapacity(int c) { this.queueCapacity = Math.max(1, c); return this; }
    public IngestionBuilder<I, O> fetchTimeout(Duration d) { this.fetchTimeout = d; return this; }
    public IngestionBuilder<I, O> drainTimeout(Duration d) { this.drainTimeout = d; return this; }
    public IngestionBuilder<I, O> progressEvery(int n) { this.progressEvery = Math.max(1, n); return this; }
    public IngestionBuilder<I, O> metrics(MetricRegistry r) { this.metricRegistry = r; return this; }
    public IngestionBuilder<I, O> metricPrefix(String p) { this.metricPrefix = p; return this; }
    public IngestionBuilder<I, O> deadLetters(DeadLetterSink<FetchResult<I, O>> d) { this.deadLetters = d; return this; }

    public BoundedIngestion<I, O> build() {
        Objects.requireNonNull(fetcher, "fetcher");
        Objects.requireNonNull(sink, "sink");
        Objects.requireNonNull(retryPolicy, "retryPolicy");
        return new BoundedIngestion<>(requests, fetcher, sink, isEmpty, retryPolicy, queueCapacity, fetchTimeout,
                drainTimeout, progressEvery, new Metrics(metricRegistry, metricPrefix), deadLetters);
    }
}
