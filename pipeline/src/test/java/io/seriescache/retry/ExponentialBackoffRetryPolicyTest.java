package io.seriescache.retry;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

public class ExponentialBackoffRetryPolicyTest {

    @Test
    void backoff_doubles_until_the_cap() {
        var p = new ExponentialBackoffRetryPolicy(10, 100, 500);
        assertEquals(100, p.backoffMillis(1));
        assertEquals(200, p.backoffMillis(2));
        assertEquals(400, p.backoffMillis(3));
        assertEquals(500, p.backoffMillis(4));
        assertEquals(500, p.backoffMillis(30));
    }

    @Test
    void gives_up_after_max_attempts() {
        var p = new ExponentialBackoffRetryPolicy(3, 1, 10);
        assertTrue(p.shouldRetry(1, new IOException()));
        assertTrue(p.shouldRetry(2, new TimeoutException()));
        assertFalse(p.shouldRetry(3, new IOException()));
    }

    @Test
    void argument_errors_and_interrupts_are_not_retried() {
        var p = new ExponentialBackoffRetryPolicy(5, 1, 10);
        assertFalse(p.shouldRetry(1, new IllegalArgumentException("bad interval")));
        assertFalse(p.shouldRetry(1, new InterruptedException()));
    }

    @Test
    void none_never_retries() {
        assertFalse(RetryPolicy.none().shouldRetry(1, new IOException()));
    }
}
