package strata.core.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Options for an optimized query.
 *
 * @param enableCache whether results are read from and written to the cache
 * @param cacheTtl time-to-live of cached results
 * @param maxLimit upper bound applied to the requested page size
 */
public record QueryOptions(boolean enableCache, Duration cacheTtl, int maxLimit) {

    public static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(5);
    public static final int DEFAULT_MAX_LIMIT = 100;

    public QueryOptions {
        Objects.requireNonNull(cacheTtl, "cacheTtl must not be null");
        if (cacheTtl.isNegative() || cacheTtl.isZero()) {
            throw new IllegalArgumentException("cacheTtl must be positive, got: " + cacheTtl);
        }
        if (maxLimit < 1) {
            throw new IllegalArgumentException("maxLimit must be >= 1, got: " + maxLimit);
        }
    }

    public static QueryOptions defaults() {
        return new QueryOptions(true, DEFAULT_CACHE_TTL, DEFAULT_MAX_LIMIT);
    }

    public QueryOptions withCache(boolean enabled) {
        return new QueryOptions(enabled, cacheTtl, maxLimit);
    }

    public QueryOptions withCacheTtl(Duration ttl) {
        return new QueryOptions(enableCache, ttl, maxLimit);
    }

    public QueryOptions withMaxLimit(int limit) {
        return new QueryOptions(enableCache, cacheTtl, limit);
    }
}
