package io.seriescache.financial.news;

import java.time.LocalDate;
import java.util.List;

/**
 * One headline request. Null fields mean "no restriction"; {@code timeout} is in seconds.
 * Serialized as JSON, it doubles as the content-cache key for the headlines it returns.
 */
public record NewsFilter(List<String> sources, List<String> symbols, LocalDate date, Integer timeout, int limit) {
    public static final int DEFAULT_LIMIT = 100_000;

    public NewsFilter {
        sources = sources == null ? null : List.copyOf(sources);
        symbols = symbols == null ? null : List.copyOf(symbols);
        if (limit <= 0) throw new IllegalArgumentException("limit must be positive: " + limit);
    }

    public static NewsFilter all() { return new NewsFilter(null, null, null, null, DEFAULT_LIMIT); }

    public static NewsFilter forSymbols(List<String> symbols) {
        return new NewsFilter(null, symbols, null, null, DEFAULT_LIMIT);
    }

    public NewsFilter onDate(LocalDate d) { return new NewsFilter(sources, symbols, d, timeout, limit); }
}
