package strata.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Objects;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import strata.core.port.out.CacheMetrics;

/**
 * Helper for applying timeouts to Redis operations.
 *
 * <p>A Redis command that does not answer within the timeout fails with
 * {@link RedisTimeoutException}. Other failures (connection errors, server
 * errors) are propagated unchanged. The cache coordinator treats both the same
 * way and retries the operation against the local tier.
 *
 * <h2>Metrics</h2>
 * Timeouts are recorded as {@code strata.cache.remote.timeouts}.
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final CacheMetrics metrics;

    /**
     * Create a new timeout helper.
     *
     * @param timeout the timeout duration for Redis operations
     * @param metrics the metrics instance for recording timeouts (may be null)
     */
    public RedisTimeoutHelper(Duration timeout, CacheMetrics metrics) {
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.metrics = metrics;
    }

    /**
     * Apply the timeout to an operation.
     *
     * @param operation the Redis operation
     * @param operationName name for logging and metrics
     * @param <T> the result type
     * @return a Uni that fails with RedisTimeoutException on timeout; other failures propagate
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation.ifNoItem().after(timeout).failWith(() -> {
            LOG.warnv("Redis operation timeout: {0} after {1}", operationName, timeout);
            if (metrics != null) {
                metrics.recordRemoteTimeout(operationName);
            }
            return new RedisTimeoutException(operationName, timeout);
        });
    }

    public Duration timeout() {
        return timeout;
    }

    /**
     * Exception indicating a Redis operation timeout.
     */
    public static class RedisTimeoutException extends RuntimeException {
        private final String operation;
        private final Duration timeout;

        public RedisTimeoutException(String operation, Duration timeout) {
            super("Redis operation timeout: " + operation + " after " + timeout);
            this.operation = operation;
            this.timeout = timeout;
        }

        /** Returns the name of the operation that timed out. */
        public String getOperation() {
            return operation;
        }

        /** Returns the timeout that was exceeded. */
        public Duration getTimeout() {
            return timeout;
        }
    }
}
