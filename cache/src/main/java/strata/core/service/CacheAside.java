package strata.core.service;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Supplier;

import com.fasterxml.jackson.databind.JavaType;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strata.core.port.out.CacheStore;

/**
 * Read-through helper for method results.
 *
 * <p>A hit returns the cached value without calling the loader. A miss calls
 * the loader, returns its result and caches a non-null result in the
 * background.
 */
public class CacheAside {

    private static final Logger LOG = Logger.getLogger(CacheAside.class);

    private final CacheStore cache;
    private final CacheWriteBehind writeBehind;
    private final CacheSerializer serializer;

    public CacheAside(CacheStore cache, CacheWriteBehind writeBehind) {
        this(cache, writeBehind, new CacheSerializer());
    }

    public CacheAside(CacheStore cache, CacheWriteBehind writeBehind, CacheSerializer serializer) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.writeBehind = Objects.requireNonNull(writeBehind, "writeBehind must not be null");
        this.serializer = Objects.requireNonNull(serializer, "serializer must not be null");
    }

    public <T> Uni<T> getOrLoad(String key, Class<T> type, Duration ttl, Supplier<Uni<T>> loader) {
        return getOrLoad(key, serializer.typeOf(type), ttl, loader);
    }

    /**
     * Return the cached value for a key, loading and caching it on a miss.
     *
     * @param key the cache key
     * @param type the value type
     * @param ttl time-to-live of a loaded value
     * @param loader supplier of the value on a miss; its failures propagate
     * @return Uni with the cached or loaded value
     */
    public <T> Uni<T> getOrLoad(String key, JavaType type, Duration ttl, Supplier<Uni<T>> loader) {
        Objects.requireNonNull(loader, "loader must not be null");
        return cache.<T>get(key, type).flatMap(cached -> {
            if (cached.isPresent()) {
                LOG.debugf("Cache hit: %s", key);
                return Uni.createFrom().item(cached.get());
            }
            LOG.debugf("Cache miss: %s", key);
            return Uni.createFrom().deferred(loader::get).invoke(value -> {
                if (value != null) {
                    writeBehind.submit(key, value, ttl);
                }
            });
        });
    }
}
