package strata.adapter.out.telemetry;

import java.time.Duration;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import strata.config.CacheConfigMapping;
import strata.core.port.out.CacheMetrics;

/**
 * Records cache and query metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, making it safe
 * to inject and call without checking configuration at each call site.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code strata.cache.lookups} - Lookups by tier and result (hit, miss)</li>
 *   <li>{@code strata.cache.fallbacks} - Remote operations retried on the local tier, by operation</li>
 *   <li>{@code strata.cache.evictions} - Local entries evicted to stay within capacity</li>
 *   <li>{@code strata.cache.remote.available} - 1 while the remote tier is used, 0 otherwise</li>
 *   <li>{@code strata.cache.remote.timeouts} - Remote operations that exceeded the timeout</li>
 *   <li>{@code strata.query.duration} - Duration of uncached queries</li>
 *   <li>{@code strata.query.slow} - Queries slower than the slow-query threshold</li>
 *   <li>{@code strata.cache.writes.dropped} - Background writes dropped under load</li>
 * </ul>
 *
 * <p>The {@code query} tag takes the query description, which should be a fixed
 * name per query. At most {@value #MAX_QUERY_TAGS} distinct descriptions are
 * tagged; later ones are recorded under {@value #OTHER_QUERY}.
 */
@ApplicationScoped
public class MicrometerCacheMetrics implements CacheMetrics {

    static final int MAX_QUERY_TAGS = 100;
    static final String OTHER_QUERY = "other";

    private final MeterRegistry registry;
    private final boolean enabled;
    private final AtomicInteger remoteAvailable = new AtomicInteger(0);
    private final Set<String> queryTags = ConcurrentHashMap.newKeySet();

    @Inject
    public MicrometerCacheMetrics(MeterRegistry registry, CacheConfigMapping config) {
        this(registry, config != null && config.metrics().enabled());
    }

    public MicrometerCacheMetrics(MeterRegistry registry, boolean enabled) {
        this.registry = registry;
        this.enabled = enabled && registry != null;
    }

    @PostConstruct
    void init() {
        if (!enabled) {
            return;
        }

        Gauge.builder("strata.cache.remote.available", remoteAvailable, AtomicInteger::get)
                .description("Whether the remote cache tier is in use (1) or bypassed (0)")
                .register(registry);
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordLookup(String tier, boolean hit) {
        if (!enabled) {
            return;
        }

        Counter.builder("strata.cache.lookups")
                .description("Cache lookups by tier and result")
                .tag("tier", tier)
                .tag("result", hit ? "hit" : "miss")
                .register(registry)
                .increment();
    }

    @Override
    public void recordFallback(String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("strata.cache.fallbacks")
                .description("Remote cache operations retried on the local tier")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordEvictions(int count) {
        if (!enabled || count <= 0) {
            return;
        }

        Counter.builder("strata.cache.evictions")
                .description("Local cache entries evicted to stay within capacity")
                .register(registry)
                .increment(count);
    }

    @Override
    public void recordRemoteAvailability(boolean available) {
        remoteAvailable.set(available ? 1 : 0);
    }

    @Override
    public void recordRemoteTimeout(String operation) {
        if (!enabled) {
            return;
        }

        Counter.builder("strata.cache.remote.timeouts")
                .description("Remote cache operations that exceeded the timeout")
                .tag("operation", operation)
                .register(registry)
                .increment();
    }

    @Override
    public void recordQuery(String description, Duration duration, boolean slow) {
        if (!enabled) {
            return;
        }

        final var query = queryTag(description);
        Timer.builder("strata.query.duration")
                .description("Duration of uncached queries")
                .tag("query", query)
                .register(registry)
                .record(duration);

        if (slow) {
            Counter.builder("strata.query.slow")
                    .description("Queries slower than the slow-query threshold")
                    .tag("query", query)
                    .register(registry)
                    .increment();
        }
    }

    @Override
    public void recordDroppedWrite() {
        if (!enabled) {
            return;
        }

        Counter.builder("strata.cache.writes.dropped")
                .description("Background cache writes dropped because too many were in flight")
                .register(registry)
                .increment();
    }

    private String queryTag(String description) {
        final var query = nullSafe(description);
        if (queryTags.contains(query)) {
            return query;
        }
        // Racing callers may overshoot the limit by a few tags
        if (queryTags.size() >= MAX_QUERY_TAGS) {
            return OTHER_QUERY;
        }
        queryTags.add(query);
        return query;
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
