package io.seriescache.cache;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class MVStoreContentCacheTest {

    private static byte[] b(String s) { return s.getBytes(StandardCharsets.UTF_8); }

    @Test
    void a_written_value_reads_back_unchanged() {
        try (var cache = MVStoreContentCache.inMemory()) {
            byte[] value = {0, 1, 2, (byte) 0xff};
            cache.put(b("story_42"), value);
            assertArrayEquals(value, cache.get(b("story_42")));
            assertNull(cache.get(b("story_43")));
        }
    }

    @Test
    void callers_cannot_mutate_stored_bytes() {
        try (var cache = MVStoreContentCache.inMemory()) {
            byte[] value = b("abc");
            cache.put(b("k"), value);
            value[0] = 'z';
            cache.get(b("k"))[1] = 'z';
            assertArrayEquals(b("abc"), cache.get(b("k")));
        }
    }

    @Test
    void entries_survive_a_reopen() throws Exception {
        Path dir = Files.createTempDirectory("content-cache");
        Path file = dir.resolve("nested").resolve("cache.mv.db");
        try (var cache = MVStoreContentCache.open(file)) {
            cache.put(b("filter"), b("[1,2,3]"));
        }
        try (var cache = MVStoreContentCache.open(file)) {
            assertEquals(1, cache.size());
            assertArrayEquals(b("[1,2,3]"), cache.get(b("filter")));
        }
    }

    @Test
    void disabled_cache_remembers_nothing() {
        ContentCache cache = ContentCache.disabled();
        cache.put(b("k"), b("v"));
        assertNull(cache.get(b("k")));
        assertFalse(cache.enabled());
    }
}
