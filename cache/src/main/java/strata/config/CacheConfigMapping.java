package strata.config;

import java.time.Duration;
import java.util.Optional;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration for the two-tier cache and the query optimizer.
 *
 * <p>Example configuration:
 * <pre>{@code
 * strata.cache.default-ttl=PT5M
 * strata.cache.remote.host=redis.internal
 * strata.cache.remote.timeout=PT1S
 * strata.cache.local.capacity=1000
 * strata.cache.query.slow-threshold=PT1S
 * }</pre>
 */
@ConfigMapping(prefix = "strata.cache")
public interface CacheConfigMapping {

    /**
     * TTL used when a cache write does not specify one.
     *
     * @return TTL duration (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration defaultTtl();

    /**
     * Remote (Redis) tier configuration.
     */
    RemoteConfig remote();

    /**
     * Local in-process tier configuration.
     */
    LocalConfig local();

    /**
     * Query optimizer configuration.
     */
    QueryConfig query();

    /**
     * Background cache write configuration.
     */
    WriteBehindConfig writeBehind();

    /**
     * Metrics configuration.
     */
    MetricsConfig metrics();

    /**
     * Remote tier configuration.
     */
    interface RemoteConfig {
        /**
         * Use the remote tier. When disabled, only the local tier is used.
         */
        @WithDefault("true")
        boolean enabled();

        @WithDefault("localhost")
        String host();

        @WithDefault("6379")
        int port();

        Optional<String> password();

        @WithDefault("0")
        int database();

        /**
         * Maximum time a single Redis command may take before the operation
         * falls back to the local tier.
         *
         * @return command timeout (default: 1 second)
         */
        @WithDefault("PT1S")
        Duration timeout();

        /**
         * Delay before reconnecting after the connection is lost or a
         * connect attempt fails.
         *
         * @return reconnect delay (default: 5 seconds)
         */
        @WithDefault("PT5S")
        Duration reconnectDelay();
    }

    /**
     * Local tier configuration.
     */
    interface LocalConfig {
        /**
         * Maximum number of entries. When full, the oldest 10% are evicted.
         *
         * @return capacity (default: 1000)
         */
        @WithDefault("1000")
        int capacity();

        /**
         * Interval between removals of expired entries.
         *
         * @return sweep interval (default: 60 seconds)
         */
        @WithDefault("PT60S")
        Duration sweepInterval();
    }

    /**
     * Query optimizer configuration.
     */
    interface QueryConfig {
        @WithDefault("true")
        boolean enableCache();

        @WithDefault("PT5M")
        Duration cacheTtl();

        /**
         * Upper bound applied to requested page sizes.
         */
        @WithDefault("100")
        int maxLimit();

        /**
         * Fetch duration above which a query is logged as slow.
         */
        @WithDefault("PT1S")
        Duration slowThreshold();
    }

    /**
     * Background cache write configuration.
     */
    interface WriteBehindConfig {
        /**
         * Maximum number of background writes in flight. Further writes are dropped.
         */
        @WithDefault("64")
        int maxInFlight();
    }

    /**
     * Metrics configuration.
     */
    interface MetricsConfig {
        /**
         * Record cache metrics with Micrometer.
         */
        @WithDefault("true")
        boolean enabled();
    }
}
