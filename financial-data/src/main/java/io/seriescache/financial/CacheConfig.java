package io.seriescache.financial;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Period;
import java.time.ZoneId;

import static io.seriescache.config.PipelineConfig.setting;

/**
 * Where the caches live and how the reconciler plans. Read like {@code PipelineConfig}: system property,
 * then environment variable, then default.
 *
 * @param contentPath MVStore file for the content cache; null disables it
 * @param staleAfter  skip series idle for longer than this; null never skips
 * @param deadLetter  JSON-lines file for failed fetches and writes; null disables it
 */
public record CacheConfig(
        String jdbcUrl,
        Path contentPath,
        Period lookback,
        Duration staleAfter,
        ZoneId zone,
        ContinuationPolicy continuation,
        Path deadLetter
) {
    public static final String DEFAULT_JDBC_URL = "jdbc:h2:./series-cache";

    public static CacheConfig defaults() {
        return new CacheConfig(DEFAULT_JDBC_URL, null, FetchPlanReconciler.DEFAULT_LOOKBACK, null,
                FetchPlanReconciler.DEFAULT_ZONE, ContinuationPolicy.NEXT_DAY, null);
    }

    public static CacheConfig fromEnv() {
        String url = setting("seriescache.jdbc.url", "SERIESCACHE_JDBC_URL", DEFAULT_JDBC_URL);
        String content = setting("seriescache.content.path", "SERIESCACHE_CONTENT_PATH", "");
        int years = Integer.parseInt(setting("seriescache.lookback.years", "SERIESCACHE_LOOKBACK_YEARS", "5"));
        String stale = setting("seriescache.stale.days", "SERIESCACHE_STALE_DAYS", "");
        String zone = setting("seriescache.zone", "SERIESCACHE_ZONE", FetchPlanReconciler.DEFAULT_ZONE.getId());
        String policy = setting("seriescache.continuation", "SERIESCACHE_CONTINUATION", ContinuationPolicy.NEXT_DAY.name());
        String dlq = setting("seriescache.deadletter", "SERIESCACHE_DEADLETTER", "");
        return new CacheConfig(
                url,
                content.isBlank() ? null : Path.of(content),
                Period.ofYears(years),
                stale.isBlank() ? null : Duration.ofDays(Long.parseLong(stale)),
                ZoneId.of(zone),
                ContinuationPolicy.valueOf(policy.trim().toUpperCase()),
                dlq.isBlank() ? null : Path.of(dlq));
    }

    public CacheConfig withJdbcUrl(String url) {
        return new CacheConfig(url, contentPath, lookback, staleAfter, zone, continuation, deadLetter);
    }

    public CacheConfig withContentPath(Path path) {
        return new CacheConfig(jdbcUrl, path, lookback, staleAfter, zone, continuation, deadLetter);
    }

    public CacheConfig withLookback(Period p) {
        return new CacheConfig(jdbcUrl, contentPath, p, staleAfter, zone, continuation, deadLetter);
    }

    public CacheConfig withStaleAfter(Duration d) {
        return new CacheConfig(jdbcUrl, contentPath, lookback, d, zone, continuation, deadLetter);
    }

    public CacheConfig withContinuation(ContinuationPolicy c) {
        return new CacheConfig(jdbcUrl, contentPath, lookback, staleAfter, zone, c, deadLetter);
    }
}
