package io.seriescache.financial;

import java.util.List;

/** Reconciler input rejected before any fetch was planned. Lists every problem found. */
public class InvalidSeriesKeyException extends IllegalArgumentException {
    private final List<String> problems;

    public InvalidSeriesKeyException(List<String> problems) {
        super("invalid series keys: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> problems() { return problems; }
}
