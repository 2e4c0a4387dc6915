package io.seriescache.cache;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/** Turns cache keys and values into bytes and back. */
public interface Codec<T> {
    byte[] encode(T value);

    /** @throws IOException when the bytes are not a valid encoding */
    T decode(byte[] bytes) throws IOException;

    static Codec<String> utf8() {
        return new Codec<>() {
            @Override public byte[] encode(String value) { return value.getBytes(StandardCharsets.UTF_8); }
            @Override public String decode(byte[] bytes) { return new String(bytes, StandardCharsets.UTF_8); }
        };
    }
}
