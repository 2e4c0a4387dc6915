package io.seriescache.config;

import java.time.Duration;

/**
 * Tuning for a bounded ingestion run. Each value comes from a system property, then an environment
 * variable, then a default.
 */
public record PipelineConfig(
        int queueCapacity,
        int progressEvery,
        Duration fetchTimeout,
        Duration drainTimeout,
        int retryAttempts,
        Duration retryBase,
        Duration retryMax
) {
    public static PipelineConfig defaults() {
        return new PipelineConfig(100, 20, Duration.ofSeconds(60), Duration.ofMinutes(5), 3,
                Duration.ofMillis(250), Duration.ofSeconds(5));
    }

    public static PipelineConfig fromEnv() {
        int queue = Integer.parseInt(setting("seriescache.queue", "SERIESCACHE_QUEUE", "100"));
        int progress = Integer.parseInt(setting("seriescache.progress", "SERIESCACHE_PROGRESS", "20"));
        long fetchMs = Long.parseLong(setting("seriescache.fetch.timeout.ms", "SERIESCACHE_FETCH_TIMEOUT_MS", "60000"));
        long drainMs = Long.parseLong(setting("seriescache.drain.timeout.ms", "SERIESCACHE_DRAIN_TIMEOUT_MS", "300000"));
        int attempts = Integer.parseInt(setting("seriescache.retry.attempts", "SERIESCACHE_RETRY_ATTEMPTS", "3"));
        long baseMs = Long.parseLong(setting("seriescache.retry.base.ms", "SERIESCACHE_RETRY_BASE_MS", "250"));
        long maxMs = Long.parseLong(setting("seriescache.retry.max.ms", "SERIESCACHE_RETRY_MAX_MS", "5000"));
        return new PipelineConfig(queue, progress, Duration.ofMillis(fetchMs), Duration.ofMillis(drainMs),
                attempts, Duration.ofMillis(baseMs), Duration.ofMillis(maxMs));
    }

    public static String setting(String property, String env, String def) {
        return System.getProperty(property, System.getenv().getOrDefault(env, def));
    }
}
