package strata.core.service;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Semaphore;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strata.core.port.out.CacheMetrics;
import strata.core.port.out.CacheStore;

/**
 * Writes values to the cache without making the caller wait.
 *
 * <p>At most {@code maxInFlight} writes run at once. Further writes are dropped
 * and counted; the next read of the key is then a miss.
 */
public class CacheWriteBehind {

    private static final Logger LOG = Logger.getLogger(CacheWriteBehind.class);

    public static final int DEFAULT_MAX_IN_FLIGHT = 64;

    private final CacheStore cache;
    private final CacheMetrics metrics;
    private final Semaphore permits;
    private final int maxInFlight;

    public CacheWriteBehind(CacheStore cache) {
        this(cache, null, DEFAULT_MAX_IN_FLIGHT);
    }

    /**
     * @param cache the target cache
     * @param metrics metrics for dropped writes (may be null)
     * @param maxInFlight maximum number of concurrent background writes
     */
    public CacheWriteBehind(CacheStore cache, CacheMetrics metrics, int maxInFlight) {
        if (maxInFlight < 1) {
            throw new IllegalArgumentException("maxInFlight must be >= 1, got: " + maxInFlight);
        }
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
        this.metrics = metrics;
        this.maxInFlight = maxInFlight;
        this.permits = new Semaphore(maxInFlight);
    }

    /**
     * Start a background write.
     *
     * @param key the cache key
     * @param value the value to cache
     * @param ttl time-to-live of the entry
     * @return true if the write was started, false if it was dropped
     */
    public boolean submit(String key, Object value, Duration ttl) {
        if (!permits.tryAcquire()) {
            LOG.debugf("Dropping background cache write for key %s: %d writes in flight", key, maxInFlight);
            if (metrics != null) {
                metrics.recordDroppedWrite();
            }
            return false;
        }

        Uni.createFrom()
                .deferred(() -> cache.set(key, value, ttl))
                .eventually(() -> permits.release())
                .subscribe()
                .with(
                        ignored -> LOG.debugf("Background cache write completed: %s", key),
                        error -> LOG.warnf("Background cache write failed for key %s: %s", key, error.getMessage()));
        return true;
    }

    /**
     * Returns the number of background writes currently running.
     */
    public int inFlight() {
        return maxInFlight - permits.availablePermits();
    }
}
