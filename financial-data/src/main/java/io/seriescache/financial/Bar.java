package io.seriescache.financial;

import java.time.Instant;

/** One OHLCV bar. Price and volume fields are null where the provider left gaps. */
public record Bar(Instant timestamp, Double open, Double high, Double low, Double close, Long volume) {}
