package strata.core.service;

import java.util.Arrays;
import java.util.Objects;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strata.core.port.out.CacheStore;

/**
 * Invalidates cached entries after writes to the underlying data.
 *
 * <p>Invalidation never fails the write that triggered it: failures are logged
 * and the stale entries expire with their TTL.
 */
public class CacheInvalidator {

    private static final Logger LOG = Logger.getLogger(CacheInvalidator.class);

    private final CacheStore cache;

    public CacheInvalidator(CacheStore cache) {
        this.cache = Objects.requireNonNull(cache, "cache must not be null");
    }

    /**
     * Delete every entry matching any of the patterns, one pattern at a time.
     *
     * @param patterns invalidation patterns, where {@code *} matches any run of characters
     * @return Uni completing when all patterns were processed
     */
    public Uni<Void> invalidate(String... patterns) {
        Uni<Void> chain = Uni.createFrom().voidItem();
        for (final var pattern : Arrays.asList(patterns)) {
            chain = chain.chain(() -> deleteQuietly(pattern));
        }
        return chain;
    }

    /**
     * Start an invalidation without waiting for it.
     *
     * @param patterns invalidation patterns
     */
    public void invalidateInBackground(String... patterns) {
        invalidate(patterns)
                .subscribe()
                .with(
                        ignored -> LOG.debugf("Invalidated cache patterns: %s", Arrays.toString(patterns)),
                        error -> LOG.warnf(
                                "Background cache invalidation failed for %s: %s",
                                Arrays.toString(patterns), error.getMessage()));
    }

    private Uni<Void> deleteQuietly(String pattern) {
        return Uni.createFrom()
                .deferred(() -> cache.deletePattern(pattern))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Failed to invalidate cache pattern %s: %s", pattern, error.getMessage());
                    return null;
                });
    }
}
