package io.seriescache.cache;

/**
 * Byte-key to byte-value store that spares repeated provider calls. Entries are written once and
 * read many times; nothing here expires them. Concurrent writers to one key race and the last write wins.
 */
public interface ContentCache extends AutoCloseable {

    /** @return the stored value, or {@code null} on a miss */
    byte[] get(byte[] key);

    void put(byte[] key, byte[] value);

    /** False for the pass-through cache, so callers can skip encoding keys. */
    default boolean enabled() { return true; }

    @Override
    default void close() {}

    /** Remembers nothing; every lookup misses. */
    static ContentCache disabled() {
        return new ContentCache() {
            @Override public byte[] get(byte[] key) { return null; }
            @Override public void put(byte[] key, byte[] value) {}
            @Override public boolean enabled() { return false; }
            @Override public String toString() { return "ContentCache.disabled"; }
        };
    }
}
