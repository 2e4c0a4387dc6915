package io.seriescache.financial;

/** Raw access to the Yahoo v8 chart endpoint. Returns the response body. */
public interface YahooClient {
    String fetch(String ticker, long period1, long period2, String interval) throws Exception;
}
