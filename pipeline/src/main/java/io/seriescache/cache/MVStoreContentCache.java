package io.seriescache.cache;

import org.h2.mvstore.MVMap;
import org.h2.mvstore.MVStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HexFormat;

/**
 * {@link ContentCache} kept in an H2 MVStore file. Keys are stored hex-encoded; each put is committed
 * before it returns.
 */
public class MVStoreContentCache implements ContentCache {
    private static final Logger log = LoggerFactory.getLogger(MVStoreContentCache.class);
    private static final HexFormat HEX = HexFormat.of();
    static final String MAP_NAME = "content";

    private final MVStore store;
    private final MVMap<String, byte[]> map;
    private final String location;

    private MVStoreContentCache(MVStore store, String location) {
        this.store = store;
        this.map = store.openMap(MAP_NAME);
        this.location = location;
    }

    public static MVStoreContentCache open(Path file) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create directory for " + file, e);
        }
        MVStore store = new MVStore.Builder().fileName(file.toString()).open();
        log.info("content cache opened at {} with {} entries", file, store.openMap(MAP_NAME).size());
        return new MVStoreContentCache(store, file.toString());
    }

    public static MVStoreContentCache inMemory() {
        return new MVStoreContentCache(MVStore.open(null), "memory");
    }

    @Override
    public byte[] get(byte[] key) {
        byte[] v = map.get(HEX.formatHex(key));
        return v == null ? null : v.clone();
    }

    @Override
    public void put(byte[] key, byte[] value) {
        map.put(HEX.formatHex(key), value.clone());
        store.commit();
    }

    public int size() { return map.size(); }

    @Override
    public void close() {
        if (!store.isClosed()) store.close();
    }

    @Override
    public String toString() { return "MVStoreContentCache{" + location + "}"; }
}
