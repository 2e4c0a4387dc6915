package io.seriescache.financial;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * Single-shot HTTP call to Yahoo. Retries and deadlines belong to the ingestion run, not to this client.
 */
final class HttpYahooClient implements YahooClient {
    private static final Logger log = LoggerFactory.getLogger(HttpYahooClient.class);
    private static final String URL = "https://query1.finance.yahoo.com/v8/finance/chart/%s?interval=%s&period1=%d&period2=%d";

    private final HttpClient http = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();

    @Override
    public String fetch(String ticker, long period1, long period2, String interval) throws Exception {
        String url = String.format(URL,
                URLEncoder.encode(ticker, StandardCharsets.UTF_8),
                URLEncoder.encode(interval, StandardCharsets.UTF_8),
                period1, period2);
        HttpRequest req = HttpRequest.newBuilder(URI.create(url))
                .header("User-Agent", "Mozilla/5.0")
                .GET()
                .build();
        HttpResponse<String> resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        log.debug("GET {} -> {}", url, resp.statusCode());
        if (resp.statusCode() != 200) {
            throw new IOException("Yahoo fetch failed for " + ticker + ": HTTP " + resp.statusCode());
        }
        return resp.body();
    }
}
