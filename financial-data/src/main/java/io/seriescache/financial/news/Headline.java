package io.seriescache.financial.news;

import io.seriescache.batch.DataRecord;

import java.time.Instant;
import java.util.List;

public record Headline(String storyId, String source, Instant timestamp, List<String> symbols, String headline) {
    public static final String STORY_ID = "story_id";
    public static final String SOURCE = "source";
    public static final String TIMESTAMP = "timestamp";
    public static final String SYMBOLS = "symbols";
    public static final String HEADLINE = "headline";

    public Headline {
        symbols = symbols == null ? List.of() : List.copyOf(symbols);
    }

    /** Flat record form; symbols are joined with {@code ':'} so every value stays scalar. */
    public DataRecord toRecord() {
        return DataRecord.builder()
                .put(STORY_ID, storyId)
                .put(SOURCE, source)
                .put(TIMESTAMP, timestamp)
                .put(SYMBOLS, String.join(":", symbols))
                .put(HEADLINE, headline)
                .build();
    }
}
