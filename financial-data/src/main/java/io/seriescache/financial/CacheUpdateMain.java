package io.seriescache.financial;

import com.codahale.metrics.Meter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Timer;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.seriescache.cache.ContentCache;
import io.seriescache.config.PipelineConfig;
import io.seriescache.runtime.IngestionSummary;
import picocli.CommandLine;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.Period;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * CLI that brings the bar cache up to date and optionally adds new series.
 */
@CommandLine.Command(name = "series-cache-update", mixinStandardHelpOptions = true,
        description = "Update cached bars to the latest values and add new series")
public final class CacheUpdateMain implements Callable<Integer> {
    @CommandLine.Option(names = {"-s", "--series"}, converter = SeriesKeyConverter.class,
            description = "Series to add, as SYMBOL:LENGTH:TYPE, e.g. AAPL:60:s (repeatable)")
    List<SeriesKey> series = new ArrayList<>();

    @CommandLine.Option(names = "--lookback-years", description = "Cold-start lookback in years")
    Integer lookbackYears;

    @CommandLine.Option(names = "--stale-days", description = "Skip series not updated for more than this many days")
    Long staleDays;

    @CommandLine.Option(names = "--same-day", description = "Re-fetch the last cached day instead of starting the day after")
    boolean sameDay;

    @CommandLine.Option(names = "--jdbc-url", description = "Bar store JDBC URL")
    String jdbcUrl;

    @CommandLine.Option(names = "--content-cache", description = "MVStore file for cached provider responses")
    Path contentCache;

    public static void main(String[] args) {
        int code = new CommandLine(new CacheUpdateMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        CacheConfig config = config(CacheConfig.fromEnv());
        Injector injector = Guice.createInjector(new FinancialDataModule(config, PipelineConfig.fromEnv()));
        CacheUpdater updater = injector.getInstance(CacheUpdater.class);
        MetricRegistry registry = injector.getInstance(MetricRegistry.class);
        try (ContentCache ignored = injector.getInstance(ContentCache.class)) {
            IngestionSummary summary = updater.update(new LinkedHashSet<>(series));
            printOnce(registry);
            System.out.println("Cache update: " + summary);
            return summary.failures() == 0 ? 0 : 1;
        } catch (InvalidSeriesKeyException e) {
            System.err.println(e.getMessage());
            return 2;
        }
    }

    CacheConfig config(CacheConfig base) {
        CacheConfig c = base;
        if (jdbcUrl != null) c = c.withJdbcUrl(jdbcUrl);
        if (contentCache != null) c = c.withContentPath(contentCache);
        if (lookbackYears != null) c = c.withLookback(Period.ofYears(lookbackYears));
        if (staleDays != null) c = c.withStaleAfter(Duration.ofDays(staleDays));
        if (sameDay) c = c.withContinuation(ContinuationPolicy.SAME_DAY);
        return c;
    }

    private static void printOnce(MetricRegistry r) {
        Meter fetched = r.meter("ingestion.fetched.rate");
        Meter persisted = r.meter("ingestion.persisted.rate");
        Meter err = r.meter("ingestion.error.rate");
        Timer fetch = r.timer("ingestion.fetch.time");
        Timer sink = r.timer("ingestion.sink.time");
        System.out.println("[" + Instant.now() + "] metrics:" +
                " fetched=" + fetched.getCount() +
                " | persisted=" + persisted.getCount() +
                " | errors=" + err.getCount() +
                " | t.p50(ms)=" + nsToMs(fetch.getSnapshot().getMedian()) + "/" + nsToMs(sink.getSnapshot().getMedian()));
    }

    private static String nsToMs(double nanos) { return String.format("%.3f", nanos / 1_000_000.0); }
}
