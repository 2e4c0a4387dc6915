package io.seriescache.financial;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/** Bars as the provider returned them: unsorted, possibly with gaps and repeats. */
public record BarTable(String symbol, List<Bar> bars) {
    public BarTable {
        bars = bars == null ? List.of() : List.copyOf(bars);
    }

    public static BarTable empty(String symbol) { return new BarTable(symbol, List.of()); }

    @JsonIgnore
    public boolean isEmpty() { return bars.isEmpty(); }

    public int size() { return bars.size(); }
}
