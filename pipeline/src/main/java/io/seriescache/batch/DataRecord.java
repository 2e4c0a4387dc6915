package io.seriescache.batch;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One unit fetched from a record-oriented provider (a headline, say): field names mapped to scalar
 * values, in insertion order. Immutable; {@link #with} and {@link #withSuffix} return copies.
 */
public final class DataRecord {
    private final Map<String, Object> fields;

    private DataRecord(Map<String, Object> fields) {
        this.fields = Collections.unmodifiableMap(fields);
    }

    @JsonCreator
    public static DataRecord of(Map<String, ?> fields) {
        return new DataRecord(new LinkedHashMap<>(Objects.requireNonNull(fields, "fields")));
    }

    public static Builder builder() { return new Builder(); }

    public Object get(String name) { return fields.get(name); }

    public String getString(String name) {
        Object v = fields.get(name);
        return v == null ? null : v.toString();
    }

    public boolean has(String name) { return fields.containsKey(name); }

    public Set<String> fieldNames() { return fields.keySet(); }

    public int size() { return fields.size(); }

    public DataRecord with(String name, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(name, value);
        return new DataRecord(copy);
    }

    /** Same values, every field name suffixed. An empty suffix returns this record. */
    public DataRecord withSuffix(String suffix) {
        if (suffix == null || suffix.isEmpty()) return this;
        Map<String, Object> copy = new LinkedHashMap<>();
        fields.forEach((k, v) -> copy.put(k + suffix, v));
        return new DataRecord(copy);
    }

    @JsonValue
    public Map<String, Object> fields() { return fields; }

    @Override
    public boolean equals(Object o) {
        return o instanceof DataRecord other && fields.equals(other.fields);
    }

    @Override
    public int hashCode() { return fields.hashCode(); }

    @Override
    public String toString() { return fields.toString(); }

    public static final class Builder {
        private final Map<String, Object> fields = new LinkedHashMap<>();

        public Builder put(String name, Object value) {
            fields.put(Objects.requireNonNull(name, "name"), value);
            return this;
        }

        public DataRecord build() { return new DataRecord(new LinkedHashMap<>(fields)); }
    }
}
