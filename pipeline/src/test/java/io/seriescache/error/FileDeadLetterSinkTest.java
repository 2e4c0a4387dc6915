package io.seriescache.error;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class FileDeadLetterSinkTest {

    @Test
    void failures_are_appended_as_json_lines() throws Exception {
        Path dir = Files.createTempDirectory("dlq");
        var dlq = new FileDeadLetterSink<String>(dir.resolve("out").resolve("dlq.jsonl"));
        dlq.acceptFailure("fetch", "AAPL:60:s@2020-06-02", new java.io.IOException("HTTP 500"));
        dlq.acceptFailure("sink", "MSFT:60:s@2019-06-02", new IllegalStateException("disk full"));

        List<String> lines = dlq.tail(10);
        assertEquals(2, lines.size());
        JsonNode first = new ObjectMapper().readTree(lines.get(0));
        assertEquals("fetch", first.get("stage").asText());
        assertEquals("AAPL:60:s@2020-06-02", first.get("item").asText());
        assertTrue(first.get("error").asText().contains("HTTP 500"));
        assertEquals(1, dlq.tail(1).size());
        assertTrue(dlq.tail(1).get(0).contains("disk full"));
    }
}
