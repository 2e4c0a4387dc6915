package io.seriescache.financial;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.Period;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Decides what to fetch next: continues every cached series from its last bar and cold-starts every
 * desired series the cache has never seen. Pure: no store or network access happens here, and the
 * current time comes from the injected {@link Clock}.
 */
public class FetchPlanReconciler {
    private static final Logger log = LoggerFactory.getLogger(FetchPlanReconciler.class);

    public static final ZoneId DEFAULT_ZONE = ZoneId.of("America/New_York");
    public static final Period DEFAULT_LOOKBACK = Period.ofYears(5);

    private final Clock clock;
    private final ZoneId zone;
    private final Period lookback;
    private final Duration staleAfter;
    private final ContinuationPolicy continuation;

    private FetchPlanReconciler(Builder b) {
        this.clock = b.clock;
        this.zone = b.zone;
        this.lookback = b.lookback;
        this.staleAfter = b.staleAfter;
        this.continuation = b.continuation;
    }

    public static Builder builder() { return new Builder(); }

    /**
     * @param state   what the store holds now
     * @param desired series that must exist after this pass; may overlap {@code state}
     * @throws InvalidSeriesKeyException when any key in either input is malformed
     */
    public FetchPlan plan(Map<SeriesKey, SeriesRange> state, Set<SeriesKey> desired) {
        validate(state, desired);
        Instant now = clock.instant();

        List<FetchRequest> continuations = new ArrayList<>();
        List<SeriesKey> skipped = new ArrayList<>();
        for (Map.Entry<SeriesKey, SeriesRange> e : new TreeMap<>(state).entrySet()) {
            Instant last = e.getValue().last();
            if (staleAfter != null && Duration.between(last, now).compareTo(staleAfter) > 0) {
                skipped.add(e.getKey());
                continue;
            }
            continuations.add(new FetchRequest(e.getKey(), continuation.begin(last, zone)));
        }

        TreeSet<SeriesKey> fresh = new TreeSet<>(desired);
        fresh.removeAll(state.keySet());
        ZonedDateTime coldBegin = coldStartBegin(now);
        List<FetchRequest> coldStarts = new ArrayList<>(fresh.size());
        for (SeriesKey k : fresh) coldStarts.add(new FetchRequest(k, coldBegin));

        FetchPlan plan = new FetchPlan(continuations, coldStarts, skipped);
        log.info("Updating {} total symbols and intervals; new symbols and intervals: {}; skipped as stale: {}",
                plan.size(), coldStarts.size(), skipped.size());
        return plan;
    }

    /**
     * Checks a desired-series set on its own, so callers can reject bad input before touching a store.
     *
     * @throws InvalidSeriesKeyException naming every malformed key
     */
    public void checkDesired(Set<SeriesKey> desired) {
        validate(Map.of(), desired);
    }

    ZonedDateTime coldStartBegin(Instant now) {
        return now.atZone(zone).minus(lookback).toLocalDate().atStartOfDay(zone);
    }

    private static void validate(Map<SeriesKey, SeriesRange> state, Set<SeriesKey> desired) {
        List<String> problems = new ArrayList<>();
        if (state == null) problems.add("state map is null");
        if (desired == null) problems.add("desired series set is null");
        if (state != null) {
            for (Map.Entry<SeriesKey, SeriesRange> e : state.entrySet()) {
                check(e.getKey(), problems);
                if (e.getValue() == null) problems.add(e.getKey() + ": missing range");
            }
        }
        if (desired != null) {
            for (SeriesKey k : desired) check(k, problems);
        }
        if (!problems.isEmpty()) throw new InvalidSeriesKeyException(problems);
    }

    private static void check(SeriesKey key, List<String> problems) {
        if (key == null) {
            problems.add("null series key");
            return;
        }
        key.problem().ifPresent(p -> problems.add(key + ": " + p));
    }

    public ZoneId zone() { return zone; }
    public Period lookback() { return lookback; }
    public Duration staleAfter() { return staleAfter; }
    public ContinuationPolicy continuation() { return continuation; }

    public static final class Builder {
        private Clock clock = Clock.systemUTC();
        private ZoneId zone = DEFAULT_ZONE;
        private Period lookback = DEFAULT_LOOKBACK;
        private Duration staleAfter;
        private ContinuationPolicy continuation = ContinuationPolicy.NEXT_DAY;

        public Builder clock(Clock clock) { this.clock = Objects.requireNonNull(clock); return this; }
        public Builder zone(ZoneId zone) { this.zone = Objects.requireNonNull(zone); return this; }
        public Builder lookback(Period lookback) { this.lookback = Objects.requireNonNull(lookback); return this; }
        /** Skip continuing series whose last bar is older than this; {@code null} never skips. */
        public Builder staleAfter(Duration staleAfter) { this.staleAfter = staleAfter; return this; }
        public Builder continuation(ContinuationPolicy c) { this.continuation = Objects.requireNonNull(c); return this; }

        public FetchPlanReconciler build() { return new FetchPlanReconciler(this); }
    }
}
