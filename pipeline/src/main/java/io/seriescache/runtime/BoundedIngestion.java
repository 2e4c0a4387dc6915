package io.seriescache.runtime;

import com.codahale.metrics.Meter;
import com.codahale.metrics.Timer;
import io.seriescache.core.FetchResult;
import io.seriescache.core.Fetcher;
import io.seriescache.core.Sink;
import io.seriescache.error.DeadLetterSink;
import io.seriescache.metrics.Metrics;
import io.seriescache.retry.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/**
 * Runs a fixed list of requests against a {@link Fetcher} on one background producer thread and
 * drains the results on the calling thread into a {@link Sink}.
 * <p>
 * The two sides only meet at a bounded queue: the producer blocks when it is full, the drain loop stops
 * at a poison marker. A sink failure for one item is logged and counted, never fatal for the run.
 * The sink is closed exactly once, whichever way {@link #run()} exits.
 */
public class BoundedIngestion<I, O> implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BoundedIngestion.class);

    private final List<I> requests;
    private final Fetcher<I, O> fetcher;
    private final Sink<FetchResult<I, O>> sink;
    private final Predicate<O> isEmpty;
    private final RetryPolicy retryPolicy;
    private final Duration fetchTimeout; // null: fetch runs on the producer thread without a deadline
    private final Duration drainTimeout; // null: wait for the producer forever
    private final int progressEvery;
    private final DeadLetterSink<FetchResult<I, O>> deadLetters; // optional

    private final ArrayBlockingQueue<Slot<I, O>> queue;
    private final ExecutorService fetchPool;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private volatile Thread producerThread;
    private volatile Throwable producerFailure;
    private volatile boolean producerStopped;

    private final Timer fetchTimer;
    private final Timer sinkTimer;
    private final Meter fetchedMeter;
    private final Meter persistedMeter;
    private final Meter errorMeter;

    BoundedIngestion(List<I> requests,
                     Fetcher<I, O> fetcher,
                     Sink<FetchResult<I, O>> sink,
                     Predicate<O> isEmpty,
                     RetryPolicy retryPolicy,
                     int queueCapacity,
                     Duration fetchTimeout,
                     Duration drainTimeout,
                     int progressEvery,
                     Metrics metrics,
                     DeadLetterSink<FetchResult<I, O>> deadLetters) {
        this.requests = List.copyOf(requests);
        this.fetcher = Objects.requireNonNull(fetcher);
        this.sink = Objects.requireNonNull(sink);
        this.isEmpty = Objects.requireNonNull(isEmpty);
        this.retryPolicy = Objects.requireNonNull(retryPolicy);
        this.queue = new ArrayBlockingQueue<>(Math.max(1, queueCapacity));
        this.fetchTimeout = positiveOrNull(fetchTimeout);
        this.drainTimeout = positiveOrNull(drainTimeout);
        this.progressEvery = Math.max(1, progressEvery);
        this.deadLetters = deadLetters;
        this.fetchPool = this.fetchTimeout == null ? null : Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "ingestion-fetch");
            t.setDaemon(true);
            return t;
        });
        this.fetchTimer = metrics.timer("ingestion.fetch.time");
        this.sinkTimer = metrics.timer("ingestion.sink.time");
        this.fetchedMeter = metrics.meter("ingestion.fetched.rate");
        this.persistedMeter = metrics.meter("ingestion.persisted.rate");
        this.errorMeter = metrics.meter("ingestion.error.rate");
        metrics.gauge("ingestion.queue.depth", queue::size);
    }

    /**
     * Runs the whole request list. May be called once.
     *
     * @throws IngestionTimeoutException when the producer goes quiet for longer than the drain timeout
     * @throws IngestionException when the producer dies or the calling thread is interrupted
     */
    public IngestionSummary run() {
        if (!started.compareAndSet(false, true)) throw new IllegalStateException("ingestion already ran");
        long t0 = System.nanoTime();
        int drained = 0, fetched = 0, persisted = 0, empty = 0, failed = 0, fetchFailures = 0;
        try (Sink<FetchResult<I, O>> s = sink) {
            producerThread = new Thread(this::produce, "ingestion-producer");
            producerThread.setDaemon(true);
            producerThread.start();

            while (true) {
                Slot<I, O> slot = nextSlot(drained);
                if (slot.isPoison()) break;
                drained++;
                FetchResult<I, O> item = slot.result;
                if (item.isFailed()) {
                    fetchFailures++;
                    deadLetter("fetch", item, item.failure());
                } else {
                    fetched++;
                    if (item.payload() == null || isEmpty.test(item.payload())) {
                        empty++;
                    } else {
                        try (Timer.Context ignored = sinkTimer.time()) {
                            s.accept(item);
                            persisted++;
                            persistedMeter.mark();
                        } catch (InterruptedException ie) {
                            Thread.currentThread().interrupt();
                            throw new IngestionException("interrupted while persisting " + item.request(), ie);
                        } catch (Exception e) {
                            failed++;
                            errorMeter.mark();
                            log.error("failed to persist result for {}", item.request(), e);
                            deadLetter("sink", item, e);
                        }
                    }
                }
                if (drained % progressEvery == 0) {
                    log.info("Cached {} of {} queries", drained, requests.size());
                }
            }
            if (producerFailure != null) {
                throw new IngestionException("producer failed after " + drained + " result(s)", producerFailure);
            }
            IngestionSummary summary = new IngestionSummary(requests.size(), fetched, persisted, empty, failed,
                    fetchFailures, producerStopped, Duration.ofNanos(System.nanoTime() - t0));
            log.info("Cached {} of {} queries: {}", drained, requests.size(), summary);
            return summary;
        } finally {
            shutdownProducer();
        }
    }

    /** Lets the in-flight request finish, then ends the run as if the list were exhausted. */
    public void requestStop() { stopRequested.set(true); }

    private Slot<I, O> nextSlot(int drained) {
        try {
            Slot<I, O> slot = drainTimeout == null
                    ? queue.take()
                    : queue.poll(drainTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (slot == null) {
                Thread p = producerThread;
                if (p != null) p.interrupt();
                throw new IngestionTimeoutException(drainTimeout, drained);
            }
            return slot;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IngestionException("interrupted while draining after " + drained + " result(s)", ie);
        }
    }

    private void produce() {
        int produced = 0;
        try {
            for (I request : requests) {
                if (stopRequested.get()) {
                    producerStopped = true;
                    log.info("stop requested; {} of {} requests left unfetched", requests.size() - produced, requests.size());
                    break;
                }
                queue.put(Slot.of(fetchWithRetry(request)));
                produced++;
            }
        } catch (InterruptedException ie) {
            // drain side gave up; nobody is left to read a marker
            Thread.currentThread().interrupt();
            return;
        } catch (RuntimeException | Error e) {
            producerFailure = e;
            log.error("producer failed after {} request(s)", produced, e);
        }
        try {
            queue.put(Slot.poison());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private FetchResult<I, O> fetchWithRetry(I request) throws InterruptedException {
        int attempt = 0;
        while (true) {
            attempt++;
            try (Timer.Context ignored = fetchTimer.time()) {
                O payload = fetchOnce(request);
                fetchedMeter.mark();
                return FetchResult.of(request, payload);
            } catch (InterruptedException ie) {
                throw ie;
            } catch (Exception e) {
                errorMeter.mark();
                if (!retryPolicy.shouldRetry(attempt, e)) {
                    log.warn("giving up on {} after {} attempt(s): {}", request, attempt, e.toString());
                    return FetchResult.failed(request, e);
                }
                long backoff = retryPolicy.backoffMillis(attempt);
                log.debug("attempt {} for {} failed, retrying in {}ms", attempt, request, backoff, e);
                Thread.sleep(backoff);
            }
        }
    }

    private O fetchOnce(I request) throws Exception {
        if (fetchPool == null) return fetcher.fetch(request);
        Future<O> f = fetchPool.submit(() -> fetcher.fetch(request));
        try {
            return f.get(fetchTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            f.cancel(true);
            throw new TimeoutException("fetch of " + request + " exceeded " + fetchTimeout.toMillis() + "ms");
        } catch (InterruptedException ie) {
            f.cancel(true);
            throw ie;
        } catch (ExecutionException ee) {
            Throwable cause = ee.getCause();
            if (cause instanceof Exception ex) throw ex;
            if (cause instanceof Error err) throw err;
            throw ee;
        }
    }

    private void deadLetter(String stage, FetchResult<I, O> item, Exception e) {
        if (deadLetters == null) return;
        deadLetters.acceptFailure(stage, item, e);
    }

    private void shutdownProducer() {
        Thread p = producerThread;
        if (p != null && p.isAlive()) {
            p.interrupt();
            try {
                p.join(5_000);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }
        if (fetchPool != null) fetchPool.shutdownNow();
    }

    @Override
    public void close() {
        requestStop();
        shutdownProducer();
    }

    private static Duration positiveOrNull(Duration d) {
        return d == null || d.isZero() || d.isNegative() ? null : d;
    }

    private static final class Slot<I, O> {
        final FetchResult<I, O> result;
        private final boolean poison;

        private Slot(FetchResult<I, O> result, boolean poison) {
            this.result = result;
            this.poison = poison;
        }

        static <I, O> Slot<I, O> of(FetchResult<I, O> result) { return new Slot<>(result, false); }
        static <I, O> Slot<I, O> poison() { return new Slot<>(null, true); }
        boolean isPoison() { return poison; }
    }
}
