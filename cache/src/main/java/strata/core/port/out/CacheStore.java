package strata.core.port.out;

import java.time.Duration;
import java.util.Optional;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import io.smallrye.mutiny.Uni;

/**
 * Port interface for the application-facing key/value cache.
 *
 * <p>Implementations must degrade instead of failing: a cache outage may turn
 * reads into misses and writes into no-ops, but the returned {@link Uni}s never
 * fail because of the cache itself.
 */
public interface CacheStore {

    /**
     * Get a cached value.
     *
     * @param key the cache key
     * @param type the value type
     * @return Uni with Optional containing the value if present and not expired
     */
    <T> Uni<Optional<T>> get(String key, Class<T> type);

    /**
     * Get a cached value of a generic type.
     *
     * @param key the cache key
     * @param type the value type
     * @return Uni with Optional containing the value if present and not expired
     */
    <T> Uni<Optional<T>> get(String key, TypeReference<T> type);

    /**
     * Get a cached value of a type built at runtime.
     *
     * @param key the cache key
     * @param type the value type
     * @return Uni with Optional containing the value if present and not expired
     */
    <T> Uni<Optional<T>> get(String key, JavaType type);

    /**
     * Cache a value with the default TTL.
     *
     * @param key the cache key
     * @param value the value to cache
     * @return Uni completing when cached
     */
    Uni<Void> set(String key, Object value);

    /**
     * Cache a value with a custom TTL.
     *
     * @param key the cache key
     * @param value the value to cache
     * @param ttl time-to-live, must be positive
     * @return Uni completing when cached
     */
    Uni<Void> set(String key, Object value, Duration ttl);

    /**
     * Remove a cached value. Removing a missing key is not an error.
     *
     * @param key the cache key
     * @return Uni completing when removed
     */
    Uni<Void> delete(String key);

    /**
     * Remove every cached value whose key matches a pattern.
     *
     * @param pattern the pattern, where {@code *} matches any run of characters
     * @return Uni completing when removed
     */
    Uni<Void> deletePattern(String pattern);

    /**
     * Check whether a non-expired value is cached.
     *
     * @param key the cache key
     * @return Uni with true if present
     */
    Uni<Boolean> exists(String key);

    /**
     * Atomically increment a counter with the default TTL.
     *
     * @param key the counter key
     * @return Uni with the value after the increment
     */
    Uni<Long> increment(String key);

    /**
     * Atomically increment a counter. The TTL applies from the first increment.
     *
     * @param key the counter key
     * @param ttl time-to-live of the counter, must be positive
     * @return Uni with the value after the increment
     */
    Uni<Long> increment(String key, Duration ttl);

    /**
     * Build a cache key by joining a prefix and parts with {@code :}.
     *
     * @param prefix the key prefix
     * @param parts the remaining key segments
     * @return the cache key
     */
    String generateKey(String prefix, Object... parts);
}
