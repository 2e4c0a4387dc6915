package io.seriescache.batch;

import java.util.LinkedHashMap;
import java.util.Map;

public record BatchEvent(EventType type, BatchData data) {

    /** The {@code {"type": ..., "data": ...}} message shape, ready for Jackson. */
    public Map<String, Object> toMessage() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("type", type.wireName());
        m.put("data", data.payload());
        return m;
    }
}
