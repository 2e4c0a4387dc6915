package io.seriescache.batch;

import java.util.Set;

/** A record's field names differ from the ones already buffered. */
public class SchemaMismatchException extends IllegalStateException {
    private final Set<String> expected;
    private final Set<String> actual;

    public SchemaMismatchException(Set<String> expected, Set<String> actual) {
        super("record fields " + actual + " do not match buffered fields " + expected);
        this.expected = Set.copyOf(expected);
        this.actual = Set.copyOf(actual);
    }

    public Set<String> expected() { return expected; }
    public Set<String> actual() { return actual; }
}
