package strata.core.port.out;

import java.time.Duration;

/**
 * Port interface for recording cache and query metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 * All methods must be cheap and must never throw.
 */
public interface CacheMetrics {

    /** Tier label for the remote backend. */
    String REMOTE = "remote";

    /** Tier label for the local backend. */
    String LOCAL = "local";

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record a cache lookup.
     *
     * @param tier the tier that served the lookup ({@link #REMOTE} or {@link #LOCAL})
     * @param hit whether a value was found
     */
    void recordLookup(String tier, boolean hit);

    /**
     * Record a fallback from the remote tier to the local tier.
     *
     * @param operation the cache operation that fell back
     */
    void recordFallback(String operation);

    /**
     * Record entries evicted from the local tier to stay within capacity.
     *
     * @param count number of evicted entries
     */
    void recordEvictions(int count);

    /**
     * Record a change of remote tier availability.
     *
     * @param available the new availability
     */
    void recordRemoteAvailability(boolean available);

    /**
     * Record a remote operation abandoned because it exceeded the timeout.
     *
     * @param operation the remote operation
     */
    void recordRemoteTimeout(String operation);

    /**
     * Record the duration of an uncached query.
     *
     * @param description the logical query description
     * @param duration wall-clock duration of the fetch
     * @param slow whether the duration exceeded the slow-operation threshold
     */
    void recordQuery(String description, Duration duration, boolean slow);

    /**
     * Record a background cache write dropped because too many were in flight.
     */
    void recordDroppedWrite();
}
