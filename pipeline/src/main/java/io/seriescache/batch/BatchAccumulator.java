package io.seriescache.batch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Folds the records of one upstream request at a time into two kinds of output: fixed-size
 * minibatches that cross request boundaries, and one batch per request.
 * <p>
 * Not thread-safe; one accumulating thread drives it. Listeners run synchronously on that thread
 * and always receive owned snapshots.
 */
public class BatchAccumulator {
    private static final Logger log = LoggerFactory.getLogger(BatchAccumulator.class);

    private final Integer minibatchSize;
    private final LayoutMode layout;
    private final RecordIdentity identity;
    private final ContentEnricher enricher;
    private final String fieldSuffix;
    private final List<BatchListener> listeners = new CopyOnWriteArrayList<>();

    private final List<DataRecord> pending = new ArrayList<>();
    private final List<DataRecord> requestBuffer = new ArrayList<>();
    private final Set<List<Object>> seen = new HashSet<>();
    private boolean inRequest;
    private int pendingMark; // pending records that predate the open request

    private BatchAccumulator(Builder b) {
        this.minibatchSize = b.minibatchSize;
        this.layout = b.layout;
        this.identity = b.identity;
        this.enricher = b.enricher;
        this.fieldSuffix = b.fieldSuffix;
        this.listeners.addAll(b.listeners);
    }

    public static Builder builder() { return new Builder(); }

    public void addListener(BatchListener listener) { listeners.add(Objects.requireNonNull(listener)); }

    /** Opens a new request: clears the request buffer and the dedup set. The pending minibatch carries over. */
    public void beginRequest() {
        requestBuffer.clear();
        seen.clear();
        inRequest = true;
        pendingMark = pending.size();
    }

    /**
     * Adds one record to the open request, opening one if needed.
     *
     * @return false when a record with the same identity was already taken in this request
     * @throws SchemaMismatchException when the record's fields differ from the buffered ones
     */
    public boolean append(DataRecord record) {
        Objects.requireNonNull(record, "record");
        if (!inRequest) beginRequest();
        List<Object> key = identity.keyOf(record);
        if (seen.contains(key)) {
            log.debug("duplicate {} dropped", key);
            return false;
        }
        DataRecord out = enricher == null ? record : enricher.enrich(record);
        out = out.withSuffix(fieldSuffix);
        checkFields(requestBuffer, out);
        if (minibatchSize != null) checkFields(pending, out);

        seen.add(key);
        requestBuffer.add(out);
        if (minibatchSize != null) {
            pending.add(out);
            if (pending.size() >= minibatchSize) emitPending();
        }
        return true;
    }

    /** Emits the request's batch (possibly empty) and closes the request. */
    public BatchData finalizeRequest() {
        BatchData data = new BatchData(requestBuffer, layout);
        requestBuffer.clear();
        seen.clear();
        inRequest = false;
        fire(new BatchEvent(EventType.BATCH, data));
        return data;
    }

    /**
     * Drops the open request without a batch event. Its records still waiting in the pending minibatch
     * are taken back; minibatches already emitted stay emitted.
     */
    public void abortRequest() {
        if (!inRequest) return;
        int dropped = pending.size() - pendingMark;
        pending.subList(pendingMark, pending.size()).clear();
        requestBuffer.clear();
        seen.clear();
        inRequest = false;
        log.debug("request aborted, {} pending record(s) taken back", dropped);
    }

    /** Emits the leftover minibatch, if any. Used on shutdown. */
    public boolean flushPending() {
        if (pending.isEmpty()) return false;
        emitPending();
        return true;
    }

    /** One complete request: begin, append all, finalize. A failing append aborts the request. */
    public BatchData process(Iterable<DataRecord> records) {
        beginRequest();
        try {
            for (DataRecord r : records) append(r);
        } catch (RuntimeException e) {
            abortRequest();
            throw e;
        }
        return finalizeRequest();
    }

    public int pendingSize() { return pending.size(); }

    public int requestSize() { return requestBuffer.size(); }

    private void emitPending() {
        BatchData data = new BatchData(pending, layout);
        pending.clear();
        pendingMark = 0;
        fire(new BatchEvent(EventType.MINIBATCH, data));
    }

    private void fire(BatchEvent event) {
        for (BatchListener l : listeners) l.onEvent(event);
    }

    private static void checkFields(List<DataRecord> buffer, DataRecord incoming) {
        if (buffer.isEmpty()) return;
        Set<String> expected = buffer.get(0).fieldNames();
        if (!expected.equals(incoming.fieldNames())) {
            throw new SchemaMismatchException(expected, incoming.fieldNames());
        }
    }

    public static final class Builder {
        private Integer minibatchSize;
        private LayoutMode layout = LayoutMode.COLUMN;
        private RecordIdentity identity;
        private ContentEnricher enricher;
        private String fieldSuffix;
        private final List<BatchListener> listeners = new ArrayList<>();

        /** Emit a minibatch every {@code n} accepted records; {@code null} disables minibatches. */
        public Builder minibatch(Integer n) {
            if (n != null && n <= 0) throw new IllegalArgumentException("minibatch size must be positive: " + n);
            this.minibatchSize = n;
            return this;
        }

        public Builder layout(LayoutMode layout) { this.layout = Objects.requireNonNull(layout); return this; }
        public Builder identity(RecordIdentity identity) { this.identity = identity; return this; }
        public Builder identity(String primaryField, String secondaryField) {
            return identity(new RecordIdentity(primaryField, secondaryField));
        }
        public Builder enricher(ContentEnricher enricher) { this.enricher = enricher; return this; }
        public Builder fieldSuffix(String suffix) { this.fieldSuffix = suffix; return this; }
        public Builder listener(BatchListener listener) { this.listeners.add(Objects.requireNonNull(listener)); return this; }

        public BatchAccumulator build() {
            Objects.requireNonNull(identity, "identity");
            return new BatchAccumulator(this);
        }
    }
}
