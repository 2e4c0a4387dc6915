package io.seriescache.financial;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Ordered fetch requests for one reconciliation pass: continuations first, then cold starts, each
 * sorted by series key. {@link #skipped()} names the stale series that were left alone.
 */
public final class FetchPlan implements Iterable<FetchRequest> {
    private final List<FetchRequest> continuations;
    private final List<FetchRequest> coldStarts;
    private final List<SeriesKey> skipped;

    FetchPlan(List<FetchRequest> continuations, List<FetchRequest> coldStarts, List<SeriesKey> skipped) {
        this.continuations = List.copyOf(continuations);
        this.coldStarts = List.copyOf(coldStarts);
        this.skipped = List.copyOf(skipped);
    }

    public List<FetchRequest> requests() {
        List<FetchRequest> all = new ArrayList<>(continuations.size() + coldStarts.size());
        all.addAll(continuations);
        all.addAll(coldStarts);
        return Collections.unmodifiableList(all);
    }

    public List<FetchRequest> continuations() { return continuations; }
    public List<FetchRequest> coldStarts() { return coldStarts; }
    public List<SeriesKey> skipped() { return skipped; }
    public int size() { return continuations.size() + coldStarts.size(); }
    public boolean isEmpty() { return size() == 0; }

    @Override
    public Iterator<FetchRequest> iterator() { return requests().iterator(); }

    @Override
    public String toString() {
        return "FetchPlan{continuations=" + continuations.size() + ", coldStarts=" + coldStarts.size()
                + ", skipped=" + skipped.size() + "}";
    }
}
