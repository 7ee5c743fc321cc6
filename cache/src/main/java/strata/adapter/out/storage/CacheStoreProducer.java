package strata.adapter.out.storage;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vertx.mutiny.core.Vertx;
import io.vertx.redis.client.RedisOptions;
import org.jboss.logging.Logger;

import strata.adapter.out.storage.redis.RedisTimeoutHelper;
import strata.adapter.out.storage.redis.VertxRedisCacheBackend;
import strata.adapter.out.telemetry.MicrometerCacheMetrics;
import strata.config.CacheConfigMapping;
import strata.core.cache.KeyPatternMatcher;
import strata.core.cache.LocalCacheBackend;
import strata.core.model.QueryOptions;
import strata.core.service.CacheAside;
import strata.core.service.CacheCoordinator;
import strata.core.service.CacheInvalidator;
import strata.core.service.CacheSerializer;
import strata.core.service.CacheWriteBehind;
import strata.core.service.QueryOptimizer;

/**
 * CDI producer for the cache components.
 *
 * <p>The remote tier is created only when {@code strata.cache.remote.enabled}
 * is true. Its connection is opened when the coordinator is created; until it
 * is established, operations are served by the local tier.
 */
@ApplicationScoped
public class CacheStoreProducer {

    private static final Logger LOG = Logger.getLogger(CacheStoreProducer.class);

    private final CacheConfigMapping config;
    private final MicrometerCacheMetrics metrics;
    private final Vertx vertx;

    private VertxRedisCacheBackend remote;

    @Inject
    public CacheStoreProducer(CacheConfigMapping config, MicrometerCacheMetrics metrics, Vertx vertx) {
        this.config = config;
        this.metrics = metrics;
        this.vertx = vertx;
    }

    @Produces
    @Singleton
    public KeyPatternMatcher keyPatternMatcher() {
        return new KeyPatternMatcher();
    }

    @Produces
    @Singleton
    public CacheSerializer cacheSerializer(ObjectMapper objectMapper) {
        return new CacheSerializer(objectMapper);
    }

    @Produces
    @Singleton
    public LocalCacheBackend localCacheBackend(KeyPatternMatcher patternMatcher) {
        final var local = config.local();
        LOG.infof(
                "Creating local cache backend: capacity=%d, sweepInterval=%s",
                local.capacity(), local.sweepInterval());
        return new LocalCacheBackend(
                local.capacity(), local.sweepInterval(), Clock.systemUTC(), patternMatcher, metrics);
    }

    @Produces
    @Singleton
    public CacheCoordinator cacheCoordinator(
            LocalCacheBackend local, CacheSerializer serializer, KeyPatternMatcher patternMatcher) {
        if (!config.remote().enabled()) {
            LOG.info("Remote cache disabled, using local cache only");
            return new CacheCoordinator(null, local, serializer, patternMatcher, metrics, config.defaultTtl());
        }

        remote = createRemote();
        final var coordinator =
                new CacheCoordinator(remote, local, serializer, patternMatcher, metrics, config.defaultTtl());
        remote.connect()
                .subscribe()
                .with(
                        v -> LOG.debug("Initial Redis connect attempt finished"),
                        e -> LOG.errorf(e, "Failed to start Redis connection"));
        return coordinator;
    }

    @Produces
    @Singleton
    public QueryOptimizer queryOptimizer(CacheCoordinator coordinator, CacheSerializer serializer) {
        final var query = config.query();
        final var options = new QueryOptions(query.enableCache(), query.cacheTtl(), query.maxLimit());
        return new QueryOptimizer(coordinator, serializer, metrics, options, query.slowThreshold());
    }

    @Produces
    @Singleton
    public CacheWriteBehind cacheWriteBehind(CacheCoordinator coordinator) {
        return new CacheWriteBehind(coordinator, metrics, config.writeBehind().maxInFlight());
    }

    @Produces
    @Singleton
    public CacheAside cacheAside(
            CacheCoordinator coordinator, CacheWriteBehind writeBehind, CacheSerializer serializer) {
        return new CacheAside(coordinator, writeBehind, serializer);
    }

    @Produces
    @Singleton
    public CacheInvalidator cacheInvalidator(CacheCoordinator coordinator) {
        return new CacheInvalidator(coordinator);
    }

    void closeLocalCacheBackend(@Disposes LocalCacheBackend local) {
        LOG.info("Stopping local cache sweep");
        local.close();
    }

    void closeCacheCoordinator(@Disposes CacheCoordinator coordinator) {
        if (remote != null) {
            remote.close();
            remote = null;
        }
    }

    private VertxRedisCacheBackend createRemote() {
        final var remoteConfig = config.remote();
        final var options = new RedisOptions()
                .setConnectionString(
                        "redis://" + remoteConfig.host() + ":" + remoteConfig.port() + "/" + remoteConfig.database());
        remoteConfig.password().ifPresent(options::setPassword);

        LOG.infof(
                "Creating Redis cache backend: %s:%d (db %d), timeout=%s",
                remoteConfig.host(), remoteConfig.port(), remoteConfig.database(), remoteConfig.timeout());
        return new VertxRedisCacheBackend(
                vertx,
                options,
                new RedisTimeoutHelper(remoteConfig.timeout(), metrics),
                remoteConfig.reconnectDelay());
    }
}
