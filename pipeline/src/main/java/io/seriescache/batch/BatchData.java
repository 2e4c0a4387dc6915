package io.seriescache.batch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of accumulated records. Owns its rows: later appends to the accumulator never show up here.
 */
public final class BatchData {
    private final List<DataRecord> rows;
    private final LayoutMode layout;

    BatchData(List<DataRecord> rows, LayoutMode layout) {
        this.rows = List.copyOf(rows);
        this.layout = layout;
    }

    public LayoutMode layout() { return layout; }
    public int size() { return rows.size(); }
    public boolean isEmpty() { return rows.isEmpty(); }
    public List<DataRecord> rows() { return rows; }

    /** Column view: field name to values, fields in first-record order. */
    public Map<String, List<Object>> columns() {
        Map<String, List<Object>> cols = new LinkedHashMap<>();
        if (rows.isEmpty()) return cols;
        for (String name : rows.get(0).fieldNames()) cols.put(name, new ArrayList<>(rows.size()));
        for (DataRecord r : rows) {
            for (Map.Entry<String, List<Object>> e : cols.entrySet()) e.getValue().add(r.get(e.getKey()));
        }
        cols.replaceAll((k, v) -> Collections.unmodifiableList(v));
        return Collections.unmodifiableMap(cols);
    }

    /** What listeners put under {@code "data"}: the column map or the row list, per layout. */
    public Object payload() {
        if (layout == LayoutMode.COLUMN) return columns();
        List<Map<String, Object>> out = new ArrayList<>(rows.size());
        for (DataRecord r : rows) out.add(r.fields());
        return Collections.unmodifiableList(out);
    }

    @Override
    public String toString() { return "BatchData{" + layout + ", size=" + rows.size() + "}"; }
}
