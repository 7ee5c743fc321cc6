package strata.core.service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strata.core.model.PageRequest;
import strata.core.model.PageResult;
import strata.core.model.QueryOptions;
import strata.core.port.out.CacheMetrics;
import strata.core.port.out.CacheStore;
import strata.core.port.out.PagedFetcher;

/**
 * Caches query results and runs the page and count queries of a paginated
 * query concurrently.
 *
 * <p>Failures of the underlying query are returned unchanged and never cached.
 * Failures of the cache, on read or write, are logged and turn into a cache
 * miss or a skipped write, so a cache outage only costs latency.
 */
public class QueryOptimizer {

    private static final Logger LOG = Logger.getLogger(QueryOptimizer.class);

    public static final String QUERY_PREFIX = "query";
    public static final Duration DEFAULT_SLOW_THRESHOLD = Duration.ofSeconds(1);

    private static final String FILTER_SEPARATOR = "|";
    private static final String WILDCARD = "*";

    private final CacheStore cache;
    private final CacheSerializer serializer;
    private final CacheMetrics metrics;
    private final QueryOptions defaultOptions;
    private final Duration slowThreshold;

    public QueryOptimizer(CacheStore cache) {
        this(cache, new CacheSerializer(), null, QueryOptions.defaults(), DEFAULT_SLOW_THRESHOLD);
    }

    /**
     * Create a query optimizer.
     *
     * @param cache the cache holding query results
     * @param serializer codec used to build result types
     * @param metrics query metrics (may be null)
     * @param defaultOptions options used when a call passes none
     * @param slowThreshold fetch duration above which a query is logged as slow
     */
    public QueryOptimizer(
            CacheStore cache,
            CacheSerializer serializer,
            CacheMetrics metrics,
            QueryOptions defaultOptions,
            Duration slowThreshold) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.serializer = Objects.requireNonNull(serializer, "serializer must not be null");
        this.metrics = metrics;
        this.defaultOptions = Objects.requireNonNull(defaultOptions, "defaultOptions must not be null");
        this.slowThreshold = Objects.requireNonNull(slowThreshold, "slowThreshold must not be null");
    }

    public <T> Uni<PageResult<T>> optimizePaginatedQuery(
            PagedFetcher<T> fetcher, Class<T> recordType, int page, int limit, String cacheKey) {
        return optimizePaginatedQuery(fetcher, recordType, page, limit, cacheKey, defaultOptions);
    }

    /**
     * Return one page of a query, from the cache when possible.
     *
     * <p>The limit is capped at {@link QueryOptions#maxLimit()} before the
     * offset is computed. On a cache miss the page and count queries are
     * subscribed together and the combined result is cached with
     * {@link QueryOptions#cacheTtl()}.
     *
     * @param fetcher the query
     * @param recordType type of the records, used to decode cached pages
     * @param page 1-based page number
     * @param limit requested page size
     * @param cacheKey cache key of this page, or null/blank to bypass the cache
     * @param options query options
     * @return Uni with the page and the total count
     * @throws IllegalArgumentException if page or limit is less than 1
     */
    public <T> Uni<PageResult<T>> optimizePaginatedQuery(
            PagedFetcher<T> fetcher,
            Class<T> recordType,
            int page,
            int limit,
            String cacheKey,
            QueryOptions options) {
        Objects.requireNonNull(fetcher, "fetcher must not be null");
        Objects.requireNonNull(recordType, "recordType must not be null");
        Objects.requireNonNull(options, "options must not be null");
        final var request = new PageRequest(page, Math.min(limit, options.maxLimit()));
        final var query = fetcher.description();

        final Supplier<Uni<PageResult<T>>> execute = () -> Uni.createFrom().deferred(() -> {
            final var started = System.nanoTime();
            return Uni.combine()
                    .all()
                    .unis(fetcher.fetchPage(request.offset(), request.limit()), fetcher.fetchCount())
                    .asTuple()
                    .map(tuple -> new PageResult<T>(tuple.getItem1(), tuple.getItem2()))
                    .invoke(() -> recordDuration(query, cacheKey, started));
        });

        if (!usesCache(options, cacheKey)) {
            return execute.get();
        }

        final var resultType = serializer.parametricType(PageResult.class, recordType);
        return lookup(cache.<PageResult<T>>get(cacheKey, resultType), cacheKey)
                .flatMap(cached -> {
                    if (cached.isPresent()) {
                        LOG.debugf("Query cache hit: %s", cacheKey);
                        return Uni.createFrom().item(cached.get());
                    }
                    return execute.get().call(result -> store(cacheKey, result, options.cacheTtl()));
                });
    }

    public <T> Uni<List<T>> optimizeQuery(Supplier<Uni<List<T>>> query, Class<T> recordType, String cacheKey) {
        return optimizeQuery(query, recordType, cacheKey, defaultOptions);
    }

    /**
     * Run a non-paginated query, from the cache when possible.
     *
     * <p>Only non-empty results are cached, so an empty result is re-queried
     * on the next call.
     *
     * @param query supplier of the query
     * @param recordType type of the records, used to decode cached results
     * @param cacheKey cache key of the result, or null/blank to bypass the cache
     * @param options query options
     * @return Uni with the records
     */
    public <T> Uni<List<T>> optimizeQuery(
            Supplier<Uni<List<T>>> query, Class<T> recordType, String cacheKey, QueryOptions options) {
        Objects.requireNonNull(query, "query must not be null");
        Objects.requireNonNull(recordType, "recordType must not be null");
        Objects.requireNonNull(options, "options must not be null");

        final Supplier<Uni<List<T>>> execute = () -> Uni.createFrom().deferred(() -> {
            final var started = System.nanoTime();
            return query.get().invoke(() -> recordDuration(recordType.getSimpleName(), cacheKey, started));
        });

        if (!usesCache(options, cacheKey)) {
            return execute.get();
        }

        return lookup(cache.<List<T>>get(cacheKey, serializer.parametricType(List.class, recordType)), cacheKey)
                .flatMap(cached -> {
                    if (cached.isPresent()) {
                        LOG.debugf("Query cache hit: %s", cacheKey);
                        return Uni.createFrom().item(cached.get());
                    }
                    return execute.get().call(result -> result == null || result.isEmpty()
                            ? Uni.createFrom().voidItem()
                            : store(cacheKey, result, options.cacheTtl()));
                });
    }

    /**
     * Derive the cache key of a query.
     *
     * <p>Filters are rendered as {@code key:value} pairs sorted by key and joined
     * with {@code |}, so the key does not depend on map ordering. Filters with a
     * null value are skipped. Pagination is rendered as {@code p:<page>:<limit>}.
     *
     * @param entityName the queried entity
     * @param operation the query operation
     * @param filters query filters (may be null)
     * @param pagination the page (may be null)
     * @return the cache key
     */
    public String generateCacheKey(
            String entityName, String operation, Map<String, ?> filters, PageRequest pagination) {
        final var filterKey = filters == null
                ? ""
                : filters.entrySet().stream()
                        .filter(entry -> entry.getValue() != null)
                        .sorted(Map.Entry.comparingByKey())
                        .map(entry -> entry.getKey() + ":" + entry.getValue())
                        .collect(Collectors.joining(FILTER_SEPARATOR));
        final var paginationKey =
                pagination == null ? "" : "p:" + pagination.page() + ":" + pagination.limit();
        return cache.generateKey(QUERY_PREFIX, entityName, operation, filterKey, paginationKey);
    }

    /**
     * Returns the pattern matching every key {@link #generateCacheKey} derives
     * for an entity.
     */
    public String invalidationPattern(String entityName) {
        return cache.generateKey(QUERY_PREFIX, entityName, WILDCARD);
    }

    private static boolean usesCache(QueryOptions options, String cacheKey) {
        return options.enableCache() && cacheKey != null && !cacheKey.isBlank();
    }

    private static <T> Uni<Optional<T>> lookup(Uni<Optional<T>> cached, String cacheKey) {
        return cached.onFailure().recoverWithItem(error -> {
            LOG.warnf("Failed to read cached query result for key %s, running query: %s", cacheKey, error.getMessage());
            return Optional.empty();
        });
    }

    private Uni<Void> store(String cacheKey, Object result, Duration ttl) {
        return cache.set(cacheKey, result, ttl).onFailure().recoverWithItem(error -> {
            LOG.warnf("Failed to cache query result for key %s: %s", cacheKey, error.getMessage());
            return null;
        });
    }

    private void recordDuration(String query, String cacheKey, long startedNanos) {
        final var duration = Duration.ofNanos(System.nanoTime() - startedNanos);
        final var slow = duration.compareTo(slowThreshold) > 0;
        if (slow) {
            LOG.warnf("Slow query detected: %s took %d ms (key: %s)", query, duration.toMillis(), cacheKey);
        }
        if (metrics != null) {
            metrics.recordQuery(query, duration, slow);
        }
    }
}
