package io.seriescache.batch;

import com.fasterxml.jackson.annotation.JsonValue;

public enum EventType {
    MINIBATCH("minibatch"),
    BATCH("batch");

    private final String wireName;

    EventType(String wireName) { this.wireName = wireName; }

    @JsonValue
    public String wireName() { return wireName; }
}
