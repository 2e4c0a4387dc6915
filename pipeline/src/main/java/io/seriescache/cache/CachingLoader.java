package io.seriescache.cache;

import io.seriescache.core.Fetcher;
import io.seriescache.core.ProviderFetchFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Read, then fetch on a miss, then write: the lookup pattern every cached provider call goes through.
 * There is no locking across calls, so two identical misses both reach the provider.
 */
public class CachingLoader<K, V> {
    private static final Logger log = LoggerFactory.getLogger(CachingLoader.class);

    private final ContentCache cache;
    private final Codec<K> keyCodec;
    private final Codec<V> valueCodec;
    private final Predicate<? super V> cacheable;
    private final AtomicLong hits = new AtomicLong();
    private final AtomicLong misses = new AtomicLong();

    public CachingLoader(ContentCache cache, Codec<K> keyCodec, Codec<V> valueCodec) {
        this(cache, keyCodec, valueCodec, v -> true);
    }

    /** @param cacheable fetched values failing this test are returned but not written */
    public CachingLoader(ContentCache cache, Codec<K> keyCodec, Codec<V> valueCodec, Predicate<? super V> cacheable) {
        this.cache = cache;
        this.keyCodec = keyCodec;
        this.valueCodec = valueCodec;
        this.cacheable = Objects.requireNonNull(cacheable);
    }

    /**
     * @throws ProviderFetchFailedException when the value is not cached and the fetcher fails;
     *                                      nothing is written in that case
     */
    public V load(K request, Fetcher<? super K, ? extends V> fetcher) {
        byte[] key = null;
        if (cache.enabled()) {
            key = keyCodec.encode(request);
            byte[] blob = cache.get(key);
            if (blob != null) {
                try {
                    V cached = valueCodec.decode(blob);
                    hits.incrementAndGet();
                    return cached;
                } catch (IOException e) {
                    log.warn("unreadable cache entry for {}, fetching again: {}", request, e.toString());
                }
            }
        }
        misses.incrementAndGet();
        V fresh;
        try {
            fresh = fetcher.fetch(request);
        } catch (ProviderFetchFailedException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderFetchFailedException(request, e);
        } catch (Exception e) {
            throw new ProviderFetchFailedException(request, e);
        }
        if (key != null && fresh != null && cacheable.test(fresh)) cache.put(key, valueCodec.encode(fresh));
        return fresh;
    }

    public long hits() { return hits.get(); }
    public long misses() { return misses.get(); }
}
