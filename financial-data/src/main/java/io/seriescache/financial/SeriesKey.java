package io.seriescache.financial;

import java.util.Comparator;
import java.util.Optional;

/**
 * Identity of one cached bar series: symbol plus interval. The constructor does not validate, so that
 * a malformed key can reach {@link FetchPlanReconciler} and be reported there; see {@link #problem()}.
 */
public record SeriesKey(String symbol, int intervalLen, IntervalType intervalType) implements Comparable<SeriesKey> {

    private static final Comparator<SeriesKey> ORDER = Comparator
            .comparing(SeriesKey::symbol)
            .thenComparing(SeriesKey::intervalType)
            .thenComparingInt(SeriesKey::intervalLen);

    public static SeriesKey of(String symbol, int intervalLen, IntervalType intervalType) {
        return new SeriesKey(symbol, intervalLen, intervalType);
    }

    /** Parses the command-line form {@code AAPL:60:s}. */
    public static SeriesKey parse(String text) {
        String[] parts = text == null ? new String[0] : text.trim().split(":");
        if (parts.length != 3) {
            throw new IllegalArgumentException("expected SYMBOL:LENGTH:TYPE, got '" + text + "'");
        }
        try {
            return new SeriesKey(parts[0], Integer.parseInt(parts[1]), IntervalType.fromCode(parts[2]));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("bad interval length in '" + text + "'", e);
        }
    }

    /** Rebuilds a key from a stored symbol and an interval tag like {@code 60_s}. */
    public static SeriesKey fromTag(String symbol, String intervalTag) {
        int sep = intervalTag == null ? -1 : intervalTag.indexOf('_');
        if (sep <= 0) throw new IllegalArgumentException("bad interval tag '" + intervalTag + "'");
        try {
            int len = Integer.parseInt(intervalTag.substring(0, sep));
            return new SeriesKey(symbol, len, IntervalType.fromCode(intervalTag.substring(sep + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("bad interval tag '" + intervalTag + "'", e);
        }
    }

    public String intervalTag() {
        return intervalLen + "_" + (intervalType == null ? "?" : intervalType.code());
    }

    /** Why this key cannot be fetched, or empty when it is well formed. */
    public Optional<String> problem() {
        if (symbol == null || symbol.isBlank()) return Optional.of("blank symbol");
        if (!symbol.equals(symbol.strip()) || symbol.chars().anyMatch(Character::isWhitespace)) {
            return Optional.of("whitespace in symbol");
        }
        if (intervalLen <= 0) return Optional.of("non-positive interval length " + intervalLen);
        if (intervalType == null) return Optional.of("missing interval type");
        return Optional.empty();
    }

    @Override
    public int compareTo(SeriesKey o) { return ORDER.compare(this, o); }

    @Override
    public String toString() {
        return symbol + ":" + intervalLen + ":" + (intervalType == null ? "?" : intervalType.code());
    }
}
