package io.seriescache.financial.news;

import com.fasterxml.jackson.core.type.TypeReference;
import io.seriescache.batch.BatchAccumulator;
import io.seriescache.batch.BatchListener;
import io.seriescache.batch.LayoutMode;
import io.seriescache.cache.CachingLoader;
import io.seriescache.cache.ContentCache;
import io.seriescache.cache.JsonCodec;
import io.seriescache.core.ProviderFetchFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pulls headlines for each filter in turn and turns them into batch events: a {@code minibatch} event
 * every N new headlines across filters, and a {@code batch} event per filter. Headlines are deduplicated
 * per filter on {@code (story_id, headline)}.
 * <p>
 * {@link #run()} walks the filters on the calling thread; {@link #start()} does it on a daemon thread.
 * {@link #close()} lets the current filter finish, then emits the leftover minibatch. A worker still busy
 * after the close timeout is interrupted.
 * <p>
 * Only headlines of a past day are cached; an undated filter, or one for today, asks the provider every time.
 */
public class NewsBatchListener implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(NewsBatchListener.class);
    private static final TypeReference<List<Headline>> HEADLINES = new TypeReference<>() {};

    private final NewsProvider provider;
    private final Iterable<NewsFilter> filters;
    private final BatchAccumulator accumulator;
    private final CachingLoader<NewsFilter, List<Headline>> headlines;
    private final CachingLoader<NewsFilter, List<Headline>> liveHeadlines;
    private final Clock clock;
    private final Duration closeTimeout;

    private volatile boolean running = true;
    private volatile Thread worker;
    private volatile RuntimeException failure;
    private volatile int processed;
    private boolean closed;

    private NewsBatchListener(Builder b) {
        this.provider = Objects.requireNonNull(b.provider, "provider");
        this.filters = Objects.requireNonNull(b.filters, "filters");
        ContentCache cache = b.cache == null ? ContentCache.disabled() : b.cache;
        BatchAccumulator.Builder acc = BatchAccumulator.builder()
                .identity(Headline.STORY_ID, Headline.HEADLINE)
                .minibatch(b.minibatch)
                .layout(b.layout)
                .fieldSuffix(b.keySuffix);
        if (b.attachText) acc.enricher(new StoryTextEnricher(provider, cache));
        b.listeners.forEach(acc::listener);
        this.accumulator = acc.build();
        this.headlines = new CachingLoader<>(cache, JsonCodec.of(NewsFilter.class), JsonCodec.of(HEADLINES),
                list -> !list.isEmpty());
        this.liveHeadlines = new CachingLoader<>(ContentCache.disabled(), JsonCodec.of(NewsFilter.class), JsonCodec.of(HEADLINES));
        this.clock = b.clock;
        this.closeTimeout = b.closeTimeout;
    }

    public static Builder builder() { return new Builder(); }

    public void addListener(BatchListener listener) { accumulator.addListener(listener); }

    /**
     * Processes every filter on this thread.
     *
     * @throws ProviderFetchFailedException when headlines or a story cannot be fetched; no batch
     *                                      event is emitted for that filter
     */
    public void run() {
        for (NewsFilter f : filters) {
            process(f);
            processed++;
            if (!running) {
                log.info("stop requested after {} filter(s)", processed);
                break;
            }
        }
    }

    /** Runs {@link #run()} on a daemon thread; a failure ends the loop and is kept in {@link #failure()}. */
    public NewsBatchListener start() {
        if (worker != null) throw new IllegalStateException("already started");
        Thread t = new Thread(() -> {
            try {
                run();
            } catch (RuntimeException e) {
                failure = e;
                log.error("news listener stopped after {} filter(s)", processed, e);
            }
        }, "news-listener");
        t.setDaemon(true);
        worker = t;
        t.start();
        return this;
    }

    void process(NewsFilter filter) {
        List<Headline> items = loaderFor(filter).load(filter, provider::headlines);
        accumulator.beginRequest();
        int taken = 0;
        try {
            for (Headline h : items == null ? List.<Headline>of() : items) {
                if (accumulator.append(h.toRecord())) taken++;
            }
        } catch (RuntimeException e) {
            accumulator.abortRequest();
            throw e;
        }
        accumulator.finalizeRequest();
        log.debug("{}: {} headline(s), {} after dedup", filter, items == null ? 0 : items.size(), taken);
    }

    private CachingLoader<NewsFilter, List<Headline>> loaderFor(NewsFilter filter) {
        boolean closedDay = filter.date() != null && filter.date().isBefore(LocalDate.now(clock));
        return closedDay ? headlines : liveHeadlines;
    }

    public RuntimeException failure() { return failure; }

    public int processedFilters() { return processed; }

    public boolean isRunning() {
        Thread t = worker;
        return running && t != null && t.isAlive();
    }

    /** Waits for the background loop to end on its own. */
    public void join() throws InterruptedException {
        Thread t = worker;
        if (t != null) t.join();
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        running = false;
        Thread t = worker;
        if (t != null) {
            try {
                t.join(closeTimeout.toMillis());
                if (t.isAlive()) {
                    log.warn("news listener still busy after {}ms, interrupting it", closeTimeout.toMillis());
                    t.interrupt();
                    t.join(closeTimeout.toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("interrupted while waiting for the news listener to finish");
                return;
            }
            if (t.isAlive()) {
                // the worker still owns the accumulator
                log.error("news listener did not stop within {}ms; leftover minibatch not flushed", 2 * closeTimeout.toMillis());
                return;
            }
        }
        accumulator.flushPending();
    }

    public static final class Builder {
        private NewsProvider provider;
        private Iterable<NewsFilter> filters = List.of(NewsFilter.all());
        private ContentCache cache;
        private Integer minibatch;
        private boolean attachText;
        private LayoutMode layout = LayoutMode.COLUMN;
        private String keySuffix = "";
        private Clock clock = Clock.system(ZoneId.of("America/New_York"));
        private Duration closeTimeout = Duration.ofSeconds(30);
        private final List<BatchListener> listeners = new ArrayList<>();

        public Builder provider(NewsProvider p) { this.provider = p; return this; }
        public Builder filters(Iterable<NewsFilter> f) { this.filters = f; return this; }
        public Builder cache(ContentCache c) { this.cache = c; return this; }
        public Builder minibatch(Integer n) { this.minibatch = n; return this; }
        public Builder attachText(boolean b) { this.attachText = b; return this; }
        public Builder layout(LayoutMode m) { this.layout = m; return this; }
        public Builder keySuffix(String s) { this.keySuffix = s; return this; }
        public Builder listener(BatchListener l) { this.listeners.add(l); return this; }
        /** Decides which dated filters are complete, and so cacheable. */
        public Builder clock(Clock c) { this.clock = Objects.requireNonNull(c); return this; }
        public Builder closeTimeout(Duration d) {
            if (d.isNegative() || d.isZero()) throw new IllegalArgumentException("close timeout must be positive: " + d);
            this.closeTimeout = d;
            return this;
        }

        public NewsBatchListener build() { return new NewsBatchListener(this); }
    }
}
