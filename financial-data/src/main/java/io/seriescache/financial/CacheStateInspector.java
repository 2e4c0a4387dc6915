package io.seriescache.financial;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Reads the first and last stored timestamp of every series. A series missing either end is left out,
 * and so is one whose stored key is malformed (written by another tool, say); it is logged and skipped.
 */
public class CacheStateInspector {
    private static final Logger log = LoggerFactory.getLogger(CacheStateInspector.class);

    private final SeriesStore store;

    public CacheStateInspector(SeriesStore store) { this.store = store; }

    public SortedMap<SeriesKey, SeriesRange> inspect() throws StoreException {
        Map<SeriesKey, Instant> firsts = store.firstTimestamps();
        Map<SeriesKey, Instant> lasts = store.lastTimestamps();
        SortedMap<SeriesKey, SeriesRange> out = new TreeMap<>();
        for (Map.Entry<SeriesKey, Instant> e : firsts.entrySet()) {
            Instant last = lasts.get(e.getKey());
            if (e.getValue() == null || last == null) continue;
            String problem = e.getKey().problem().orElse(null);
            if (problem != null) {
                log.warn("skipping stored series {}: {}", e.getKey(), problem);
                continue;
            }
            out.put(e.getKey(), new SeriesRange(e.getValue(), last));
        }
        log.info("Found {} cached series", out.size());
        return out;
    }
}
