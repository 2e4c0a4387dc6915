package io.seriescache.financial;

import java.time.Instant;
import java.util.ArrayList;
import java.util.TreeMap;

/**
 * Turns a provider table into store rows for the series it was requested for.
 */
public class BarNormalizer {

    public SeriesBars normalize(FetchRequest request, BarTable table) {
        Instant begin = request.beginPeriod().toInstant();
        TreeMap<Instant, Bar> byTime = new TreeMap<>();
        for (Bar b : table.bars()) {
            if (b.timestamp() == null) continue;
            if (b.timestamp().isBefore(begin)) continue;
            byTime.put(b.timestamp(), b); // later rows win
        }
        return new SeriesBars(request.key(), new ArrayList<>(byTime.values()));
    }

    public static boolean isEmpty(BarTable table) {
        return table == null || table.isEmpty();
    }
}
