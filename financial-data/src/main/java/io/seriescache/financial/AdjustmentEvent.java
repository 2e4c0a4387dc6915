package io.seriescache.financial;

import java.time.LocalDate;
import java.util.Objects;

/**
 * A split or dividend as reported by a provider. {@code value} is the split factor or the dividend rate.
 */
public record AdjustmentEvent(LocalDate date, String symbol, AdjustmentType type, double value, String provider) {
    public AdjustmentEvent {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(symbol, "symbol");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(provider, "provider");
    }
}
