package io.seriescache.retry;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * Retries up to {@code maxAttempts} with doubling backoff capped at {@code maxMillis}.
 * Argument errors and interrupts are never retried; a timed-out fetch is.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;
    private final long maxMillis;

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(1, baseMillis);
        this.maxMillis = Math.max(this.baseMillis, maxMillis);
    }

    public ExponentialBackoffRetryPolicy(int maxAttempts, Duration base, Duration max) {
        this(maxAttempts, base.toMillis(), max.toMillis());
    }

    @Override
    public boolean shouldRetry(int attempt, Exception e) {
        if (attempt >= maxAttempts) return false;
        if (e instanceof TimeoutException) return true;
        return !(e instanceof InterruptedException) && !(e instanceof IllegalArgumentException);
    }

    @Override
    public long backoffMillis(int attempt) {
        long delay = baseMillis * (1L << Math.min(20, Math.max(0, attempt - 1)));
        return Math.min(delay, maxMillis);
    }

    public int maxAttempts() { return maxAttempts; }
}
