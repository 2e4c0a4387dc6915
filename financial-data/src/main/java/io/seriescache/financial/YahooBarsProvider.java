package io.seriescache.financial;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.seriescache.cache.JsonCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Fetches bars from the Yahoo v8 chart API, from the request's begin period up to now.
 */
public class YahooBarsProvider implements BarsProvider {
    private static final Logger log = LoggerFactory.getLogger(YahooBarsProvider.class);

    private final YahooClient client;
    private final Clock clock;
    private final MetricRegistry registry; // optional
    private final ObjectMapper mapper = JsonCodec.defaultMapper();

    public YahooBarsProvider() { this(new HttpYahooClient(), Clock.systemUTC(), null); }

    public YahooBarsProvider(YahooClient client, Clock clock, MetricRegistry registry) {
        this.client = client;
        this.clock = clock;
        this.registry = registry;
    }

    /** Yahoo's interval code for a series, e.g. {@code 1m} for 60-second bars. */
    public static String yahooInterval(SeriesKey key) {
        switch (key.intervalType()) {
            case SECONDS:
                switch (key.intervalLen()) {
                    case 60: return "1m";
                    case 300: return "5m";
                    case 900: return "15m";
                    case 1800: return "30m";
                    case 3600: return "60m";
                    default: break;
                }
                break;
            case DAILY:
                if (key.intervalLen() == 1) return "1d";
                break;
            case WEEKLY:
                if (key.intervalLen() == 1) return "1wk";
                break;
            case MONTHLY:
                if (key.intervalLen() == 1) return "1mo";
                break;
        }
        throw new IllegalArgumentException("Yahoo has no interval for " + key);
    }

    @Override
    public BarTable fetch(FetchRequest request) throws Exception {
        SeriesKey key = request.key();
        String interval = yahooInterval(key);
        long p1 = request.beginPeriod().toEpochSecond();
        long p2 = clock.instant().getEpochSecond();
        if (registry != null) registry.counter("yahoo.fetch.requests").inc();
        String body = client.fetch(key.symbol(), p1, p2, interval);
        BarTable table = parse(key.symbol(), body);
        if (registry != null) {
            if (table.isEmpty()) registry.counter("yahoo.fetch.zeroRows").inc();
            else registry.counter("yahoo.rows.fetched").inc(table.size());
        }
        log.debug("{} -> {} bars", request, table.size());
        return table;
    }

    BarTable parse(String symbol, String body) throws IOException {
        JsonNode chart = mapper.readTree(body).path("chart");
        JsonNode error = chart.path("error");
        if (!error.isMissingNode() && !error.isNull()) {
            throw new IOException("Yahoo error for " + symbol + ": " + error.path("description").asText(error.toString()));
        }
        JsonNode result = chart.path("result").path(0);
        JsonNode ts = result.path("timestamp");
        if (!ts.isArray() || ts.isEmpty()) return BarTable.empty(symbol);
        JsonNode quote = result.path("indicators").path("quote").path(0);
        JsonNode open = quote.path("open");
        JsonNode high = quote.path("high");
        JsonNode low = quote.path("low");
        JsonNode close = quote.path("close");
        JsonNode volume = quote.path("volume");

        List<Bar> bars = new ArrayList<>(ts.size());
        for (int i = 0; i < ts.size(); i++) {
            JsonNode t = ts.get(i);
            Instant at = t == null || t.isNull() ? null : Instant.ofEpochSecond(t.asLong());
            bars.add(new Bar(at, dbl(open, i), dbl(high, i), dbl(low, i), dbl(close, i), lng(volume, i)));
        }
        return new BarTable(symbol, bars);
    }

    private static Double dbl(JsonNode arr, int i) {
        JsonNode n = arr.path(i);
        return n.isNumber() ? n.asDouble() : null;
    }

    private static Long lng(JsonNode arr, int i) {
        JsonNode n = arr.path(i);
        return n.isNumber() ? n.asLong() : null;
    }
}
