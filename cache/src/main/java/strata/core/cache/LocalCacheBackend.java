package strata.core.cache;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

import org.jboss.logging.Logger;

import strata.core.model.CacheEntry;
import strata.core.port.out.CacheMetrics;

/**
 * Bounded in-process cache with per-entry TTL.
 *
 * <p>Used as the fallback tier when the remote cache is unavailable, so it
 * requires no external service. Values are opaque strings.
 *
 * <h2>Expiry</h2>
 * Expired entries are invisible to reads and removed lazily when read. A
 * background sweep removes the remaining expired entries at a fixed interval so
 * memory stays bounded under read-light workloads.
 *
 * <h2>Eviction</h2>
 * Entries are kept in insertion order. When the cache is full, the oldest
 * 10% of entries (at least one) are evicted before a new entry is stored.
 * Overwriting a key keeps its original position.
 *
 * <h2>Thread Safety</h2>
 * All operations are guarded by a single lock. Most critical sections are
 * constant time; pattern deletion, eviction and the sweep scan at most
 * {@code capacity} entries.
 *
 * <p>This cache is process-private: multiple instances do not share entries.
 */
public class LocalCacheBackend implements AutoCloseable {

    private static final Logger LOG = Logger.getLogger(LocalCacheBackend.class);

    public static final int DEFAULT_CAPACITY = 1000;
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofSeconds(60);
    private static final double EVICTION_FRACTION = 0.1;

    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final int capacity;
    private final Clock clock;
    private final KeyPatternMatcher patternMatcher;
    private final CacheMetrics metrics;
    private final ScheduledExecutorService sweepExecutor;

    /**
     * Create a cache with the default capacity (1000) and sweep interval (60s).
     */
    public LocalCacheBackend() {
        this(DEFAULT_CAPACITY, DEFAULT_SWEEP_INTERVAL);
    }

    /**
     * Create a cache using the system clock.
     *
     * @param capacity maximum number of entries
     * @param sweepInterval interval between expiry sweeps
     */
    public LocalCacheBackend(int capacity, Duration sweepInterval) {
        this(capacity, sweepInterval, Clock.systemUTC(), new KeyPatternMatcher(), null);
    }

    /**
     * Create a cache.
     *
     * @param capacity maximum number of entries
     * @param sweepInterval interval between expiry sweeps
     * @param clock time source for expiry
     * @param patternMatcher matcher used by {@link #deletePattern(String)}
     * @param metrics eviction metrics (may be null)
     */
    public LocalCacheBackend(
            int capacity,
            Duration sweepInterval,
            Clock clock,
            KeyPatternMatcher patternMatcher,
            CacheMetrics metrics) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        requirePositive(sweepInterval, "sweepInterval");
        this.capacity = capacity;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.patternMatcher = Objects.requireNonNull(patternMatcher, "patternMatcher must not be null");
        this.metrics = metrics;

        this.sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "local-cache-sweep");
            t.setDaemon(true);
            return t;
        });
        final var intervalMillis = sweepInterval.toMillis();
        sweepExecutor.scheduleAtFixedRate(this::sweepQuietly, intervalMillis, intervalMillis, TimeUnit.MILLISECONDS);
        LOG.debugf("Initialized local cache: capacity=%d, sweepInterval=%s", capacity, sweepInterval);
    }

    /**
     * Get a value.
     *
     * @param key the key
     * @return the value, or empty if missing or expired
     */
    public Optional<String> get(String key) {
        Objects.requireNonNull(key, "key must not be null");
        lock.lock();
        try {
            return Optional.ofNullable(liveEntry(key)).map(CacheEntry::value);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Store a value, evicting the oldest entries first if the cache is full.
     *
     * @param key the key
     * @param value the value
     * @param ttl time-to-live, must be positive
     */
    public void set(String key, String value, Duration ttl) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        requirePositive(ttl, "ttl");
        final var entry = new CacheEntry(value, clock.instant().plus(ttl));
        lock.lock();
        try {
            if (entries.size() >= capacity) {
                evictOldest();
            }
            entries.put(key, entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove a key. Missing keys are ignored.
     *
     * @param key the key
     */
    public void delete(String key) {
        Objects.requireNonNull(key, "key must not be null");
        lock.lock();
        try {
            entries.remove(key);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove every key matching a pattern.
     *
     * @param pattern the pattern, where {@code *} matches any run of characters
     * @return number of removed entries
     */
    public int deletePattern(String pattern) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        final var regex = patternMatcher.compile(pattern);
        lock.lock();
        try {
            final var before = entries.size();
            entries.keySet().removeIf(key -> regex.matcher(key).matches());
            return before - entries.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Check whether a non-expired value exists.
     *
     * @param key the key
     * @return true if present
     */
    public boolean exists(String key) {
        return get(key).isPresent();
    }

    /**
     * Atomically increment an integer value.
     *
     * <p>A missing or expired key starts at 1 and expires after {@code ttl}.
     * An existing counter keeps its expiry.
     *
     * @param key the key
     * @param ttl time-to-live applied when the counter is created
     * @return the value after the increment
     * @throws IllegalStateException if the current value is not an integer
     */
    public long increment(String key, Duration ttl) {
        Objects.requireNonNull(key, "key must not be null");
        requirePositive(ttl, "ttl");
        lock.lock();
        try {
            final var current = liveEntry(key);
            if (current == null) {
                if (entries.size() >= capacity) {
                    evictOldest();
                }
                entries.put(key, new CacheEntry("1", clock.instant().plus(ttl)));
                return 1L;
            }
            final long next;
            try {
                next = Long.parseLong(current.value()) + 1;
            } catch (NumberFormatException e) {
                throw new IllegalStateException("Value at " + key + " is not an integer", e);
            }
            entries.put(key, current.withValue(Long.toString(next)));
            return next;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Remove all entries.
     */
    public void clear() {
        lock.lock();
        try {
            entries.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns the number of stored entries, including expired entries not yet swept.
     */
    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public int capacity() {
        return capacity;
    }

    /**
     * Remove all expired entries now.
     *
     * @return number of removed entries
     */
    public int sweepExpired() {
        final var now = clock.instant();
        final int removed;
        lock.lock();
        try {
            final var before = entries.size();
            entries.values().removeIf(entry -> entry.isExpiredAt(now));
            removed = before - entries.size();
        } finally {
            lock.unlock();
        }
        if (removed > 0) {
            LOG.debugf("Cleaned up %d expired local cache entries", removed);
        }
        return removed;
    }

    /**
     * Stops the expiry sweep. Entries remain readable.
     */
    @Override
    public void close() {
        sweepExecutor.shutdown();
        try {
            if (!sweepExecutor.awaitTermination(5, TimeUnit.SECONDS)) {
                sweepExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            sweepExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private void sweepQuietly() {
        // An exception would cancel the scheduled task
        try {
            sweepExpired();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Local cache sweep failed");
        }
    }

    // Caller must hold the lock
    private CacheEntry liveEntry(String key) {
        final var entry = entries.get(key);
        if (entry == null) {
            return null;
        }
        if (entry.isExpiredAt(clock.instant())) {
            entries.remove(key);
            return null;
        }
        return entry;
    }

    // Caller must hold the lock
    private void evictOldest() {
        final var toRemove = Math.max(1, (int) (capacity * EVICTION_FRACTION));
        final var iterator = entries.keySet().iterator();
        int evicted = 0;
        while (iterator.hasNext() && evicted < toRemove) {
            iterator.next();
            iterator.remove();
            evicted++;
        }
        if (metrics != null) {
            metrics.recordEvictions(evicted);
        }
        LOG.debugf("Evicted %d items from local cache", evicted);
    }

    private static void requirePositive(Duration duration, String name) {
        Objects.requireNonNull(duration, name + " must not be null");
        if (duration.isNegative() || duration.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, got: " + duration);
        }
    }
}
