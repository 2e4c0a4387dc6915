package io.seriescache.batch;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Two records with equal values in both fields are the same logical item within one request.
 */
public record RecordIdentity(String primaryField, String secondaryField) {

    public RecordIdentity {
        Objects.requireNonNull(primaryField, "primaryField");
        Objects.requireNonNull(secondaryField, "secondaryField");
    }

    public List<Object> keyOf(DataRecord record) {
        return Arrays.asList(record.get(primaryField), record.get(secondaryField));
    }
}
