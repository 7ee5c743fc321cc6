package strata.core.service;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strata.core.cache.KeyPatternMatcher;
import strata.core.cache.LocalCacheBackend;
import strata.core.model.CacheStatus;
import strata.core.port.out.CacheMetrics;
import strata.core.port.out.CacheStore;
import strata.core.port.out.RemoteCacheBackend;
import strata.core.port.out.RemoteConnectionListener;

/**
 * Two-tier cache facade with automatic fallback.
 *
 * <p>Every operation goes to the remote backend while it is available and to the
 * local backend otherwise. A remote failure (connection error, timeout, server
 * error) is logged and the operation is retried against the local backend. A
 * local failure degrades to a miss or a no-op. Cache failures are never
 * propagated to callers.
 *
 * <h2>Availability</h2>
 * Remote availability is tracked from the backend's connection lifecycle
 * events (connect sets it, error and end clear it) and checked together with
 * {@link RemoteCacheBackend#isReady()} before every operation.
 *
 * <h2>Consistency</h2>
 * Writes go to one tier only. A value written while the remote backend is down
 * exists only in this process's local tier and is not copied to the remote
 * backend when it recovers; it stays visible locally only while the remote is
 * down and disappears from view once reads switch back. Callers needing
 * freshness must rely on TTLs and invalidation.
 */
public class CacheCoordinator implements CacheStore {

    private static final Logger LOG = Logger.getLogger(CacheCoordinator.class);

    public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
    private static final String KEY_SEPARATOR = ":";

    private final RemoteCacheBackend remote;
    private final LocalCacheBackend local;
    private final CacheSerializer serializer;
    private final KeyPatternMatcher patternMatcher;
    private final CacheMetrics metrics;
    private final Duration defaultTtl;
    private final AtomicBoolean remoteAvailable = new AtomicBoolean(false);
    private final Set<String> pendingExpiry = ConcurrentHashMap.newKeySet();

    /**
     * Create a coordinator with a local tier only.
     *
     * @param local the local backend
     */
    public CacheCoordinator(LocalCacheBackend local) {
        this(null, local, new CacheSerializer(), new KeyPatternMatcher(), null, DEFAULT_TTL);
    }

    /**
     * Create a coordinator.
     *
     * @param remote the remote backend, may be null for local-only operation
     * @param local the local backend
     * @param serializer codec for cached values
     * @param patternMatcher translator for invalidation patterns
     * @param metrics cache metrics (may be null)
     * @param defaultTtl TTL used when none is given
     */
    public CacheCoordinator(
            RemoteCacheBackend remote,
            LocalCacheBackend local,
            CacheSerializer serializer,
            KeyPatternMatcher patternMatcher,
            CacheMetrics metrics,
            Duration defaultTtl) {
        this.remote = remote;
        this.local = Objects.requireNonNull(local, "local must not be null");
        this.serializer = Objects.requireNonNull(serializer, "serializer must not be null");
        this.patternMatcher = Objects.requireNonNull(patternMatcher, "patternMatcher must not be null");
        this.metrics = metrics;
        this.defaultTtl = requirePositive(defaultTtl);

        if (remote != null) {
            remote.addConnectionListener(new AvailabilityTracker());
        } else {
            LOG.info("No remote cache configured, using local cache only");
        }
    }

    @Override
    public <T> Uni<Optional<T>> get(String key, Class<T> type) {
        return get(key, serializer.typeOf(type));
    }

    @Override
    public <T> Uni<Optional<T>> get(String key, TypeReference<T> type) {
        return get(key, serializer.typeOf(type));
    }

    @Override
    public <T> Uni<Optional<T>> get(String key, JavaType type) {
        Objects.requireNonNull(key, "key must not be null");
        return withFallback(
                        "get",
                        key,
                        () -> remote.get(key).invoke(raw -> recordLookup(CacheMetrics.REMOTE, raw.isPresent())),
                        () -> {
                            final var raw = local.get(key);
                            recordLookup(CacheMetrics.LOCAL, raw.isPresent());
                            return raw;
                        },
                        Optional::<String>empty)
                .map(raw -> raw.flatMap(json -> decode(key, json, type)));
    }

    @Override
    public Uni<Void> set(String key, Object value) {
        return set(key, value, defaultTtl);
    }

    @Override
    public Uni<Void> set(String key, Object value, Duration ttl) {
        Objects.requireNonNull(key, "key must not be null");
        requirePositive(ttl);
        if (value == null) {
            LOG.debugf("Skipping cache write of null value for key: %s", key);
            return Uni.createFrom().voidItem();
        }

        final String json;
        try {
            json = serializer.serialize(value);
        } catch (CacheSerializationException e) {
            LOG.errorf(e, "Failed to serialize value for cache key: %s", key);
            return Uni.createFrom().voidItem();
        }

        return withFallback(
                "set",
                key,
                () -> remote.set(key, json, ttl),
                () -> {
                    local.set(key, json, ttl);
                    return null;
                },
                () -> null);
    }

    @Override
    public Uni<Void> delete(String key) {
        Objects.requireNonNull(key, "key must not be null");
        return withFallback(
                "delete",
                key,
                () -> remote.delete(List.of(key)).replaceWithVoid(),
                () -> {
                    local.delete(key);
                    return null;
                },
                () -> null);
    }

    @Override
    public Uni<Void> deletePattern(String pattern) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        return withFallback(
                "deletePattern",
                pattern,
                () -> deleteRemoteMatching(pattern),
                () -> {
                    final var removed = local.deletePattern(pattern);
                    LOG.debugf("Deleted %d local cache entries matching %s", removed, pattern);
                    return null;
                },
                () -> null);
    }

    @Override
    public Uni<Boolean> exists(String key) {
        Objects.requireNonNull(key, "key must not be null");
        return withFallback("exists", key, () -> remote.exists(key), () -> local.exists(key), () -> false);
    }

    @Override
    public Uni<Long> increment(String key) {
        return increment(key, defaultTtl);
    }

    @Override
    public Uni<Long> increment(String key, Duration ttl) {
        Objects.requireNonNull(key, "key must not be null");
        requirePositive(ttl);
        return withFallback(
                "increment",
                key,
                () -> remote.increment(key)
                        .call(count -> count == 1L || pendingExpiry.contains(key)
                                ? expireQuietly(key, ttl)
                                : Uni.createFrom().voidItem()),
                () -> local.increment(key, ttl),
                () -> 0L);
    }

    @Override
    public String generateKey(String prefix, Object... parts) {
        final Stream<Object> segments = parts == null ? Stream.empty() : Arrays.stream(parts);
        return segments.map(part -> part == null ? "" : String.valueOf(part))
                .collect(Collectors.joining(KEY_SEPARATOR, (prefix == null ? "" : prefix) + KEY_SEPARATOR, ""));
    }

    /**
     * Whether the remote backend is currently used.
     */
    public boolean isRemoteAvailable() {
        return remote != null && remoteAvailable.get() && remote.isReady();
    }

    /**
     * Snapshot of both tiers.
     */
    public CacheStatus status() {
        return new CacheStatus(isRemoteAvailable(), local.size(), local.capacity());
    }

    public Duration defaultTtl() {
        return defaultTtl;
    }

    // A failed EXPIRE keeps the remote count and is retried on the next increment
    private Uni<Void> expireQuietly(String key, Duration ttl) {
        return remote.expire(key, ttl)
                .invoke(() -> pendingExpiry.remove(key))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Failed to set expiry on remote counter %s: %s", key, error.getMessage());
                    pendingExpiry.add(key);
                    return null;
                });
    }

    private Uni<Void> deleteRemoteMatching(String pattern) {
        return remote.keys(patternMatcher.toRedisGlob(pattern)).flatMap(keys -> {
            if (keys.isEmpty()) {
                return Uni.createFrom().voidItem();
            }
            return remote.delete(keys)
                    .invoke(removed -> LOG.debugf("Deleted %d remote cache entries matching %s", removed, pattern))
                    .replaceWithVoid();
        });
    }

    /**
     * Runs an operation against the remote tier when it is usable, otherwise
     * (or when the remote call fails) against the local tier. The tier is
     * chosen at subscription.
     */
    private <T> Uni<T> withFallback(
            String operation,
            String target,
            Supplier<Uni<T>> remoteCall,
            Supplier<T> localCall,
            Supplier<T> failureValue) {
        return Uni.createFrom().<T>deferred(() -> {
            if (!isRemoteAvailable()) {
                return Uni.createFrom().item(() -> runLocal(operation, target, localCall, failureValue));
            }
            return Uni.createFrom().deferred(remoteCall::get).onFailure().recoverWithItem(error -> {
                LOG.warnf(
                        "Remote cache %s failed for %s, falling back to local cache: %s",
                        operation, target, error.getMessage());
                if (metrics != null) {
                    metrics.recordFallback(operation);
                }
                return runLocal(operation, target, localCall, failureValue);
            });
        });
    }

    private <T> T runLocal(String operation, String target, Supplier<T> localCall, Supplier<T> failureValue) {
        try {
            return localCall.get();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Local cache %s failed for %s", operation, target);
            return failureValue.get();
        }
    }

    private <T> Optional<T> decode(String key, String json, JavaType type) {
        try {
            return Optional.ofNullable(serializer.deserialize(json, type));
        } catch (CacheSerializationException e) {
            LOG.errorf(e, "Discarding unreadable cache entry for key: %s", key);
            return Optional.empty();
        }
    }

    private void recordLookup(String tier, boolean hit) {
        if (metrics != null) {
            metrics.recordLookup(tier, hit);
        }
    }

    private static Duration requirePositive(Duration ttl) {
        Objects.requireNonNull(ttl, "ttl must not be null");
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive, got: " + ttl);
        }
        return ttl;
    }

    /**
     * Sole writer of {@link #remoteAvailable}.
     */
    private final class AvailabilityTracker implements RemoteConnectionListener {

        @Override
        public void onConnected() {
            if (!remoteAvailable.getAndSet(true)) {
                LOG.info("Connected to remote cache");
                recordAvailability(true);
            }
        }

        @Override
        public void onError(Throwable error) {
            if (remoteAvailable.getAndSet(false)) {
                LOG.warnf("Remote cache error, falling back to local cache: %s", error.getMessage());
                recordAvailability(false);
            } else {
                LOG.debugf("Remote cache error while unavailable: %s", error.getMessage());
            }
        }

        @Override
        public void onEnded() {
            if (remoteAvailable.getAndSet(false)) {
                LOG.warn("Remote cache connection ended, falling back to local cache");
                recordAvailability(false);
            }
        }

        private void recordAvailability(boolean available) {
            if (metrics != null) {
                metrics.recordRemoteAvailability(available);
            }
        }
    }
}
