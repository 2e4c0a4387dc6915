package io.seriescache.financial;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/** Where a continuation fetch starts relative to the last stored bar. */
public enum ContinuationPolicy {
    /** Start of the day after the last bar. */
    NEXT_DAY,
    /** Start of the last bar's own day, so late corrections to a partial day are picked up. */
    SAME_DAY;

    public ZonedDateTime begin(Instant last, ZoneId zone) {
        LocalDate day = last.atZone(zone).toLocalDate();
        if (this == NEXT_DAY) day = day.plusDays(1);
        return day.atStartOfDay(zone);
    }
}
