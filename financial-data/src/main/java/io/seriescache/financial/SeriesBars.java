package io.seriescache.financial;

import java.util.List;

/** Bars ready for the store: tagged with their series, sorted, one per timestamp. */
public record SeriesBars(SeriesKey key, List<Bar> bars) {
    public SeriesBars {
        bars = List.copyOf(bars);
    }

    public boolean isEmpty() { return bars.isEmpty(); }
    public int size() { return bars.size(); }
}
