package strata.adapter.out.storage.redis;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.function.Function;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.redis.client.Redis;
import io.vertx.mutiny.redis.client.RedisAPI;
import io.vertx.mutiny.redis.client.RedisConnection;
import io.vertx.mutiny.redis.client.Response;
import io.vertx.redis.client.RedisOptions;
import org.jboss.logging.Logger;

import strata.core.port.out.RemoteCacheBackend;
import strata.core.port.out.RemoteConnectionListener;

/**
 * Redis implementation of RemoteCacheBackend on a single Vert.x Redis connection.
 *
 * <p>Connection lifecycle events are forwarded to registered listeners:
 * a successful connect fires {@code onConnected}, a connection exception fires
 * {@code onError} and a closed connection fires {@code onEnded}. After an error,
 * an end or a failed connect attempt, a reconnect is scheduled after the
 * configured delay.
 *
 * <p>Every command is bounded by {@link RedisTimeoutHelper#withTimeout}. Commands
 * issued while disconnected fail immediately.
 *
 * <p>Key format is chosen by the caller; pattern deletion uses {@code KEYS},
 * which scans the whole keyspace.
 */
public class VertxRedisCacheBackend implements RemoteCacheBackend {

    private static final Logger LOG = Logger.getLogger(VertxRedisCacheBackend.class);

    private final Vertx vertx;
    private final Redis client;
    private final RedisTimeoutHelper timeoutHelper;
    private final Duration reconnectDelay;
    private final List<RemoteConnectionListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicReference<RedisAPI> api = new AtomicReference<>();
    private final AtomicBoolean connecting = new AtomicBoolean(false);
    private final AtomicBoolean reconnectScheduled = new AtomicBoolean(false);
    private volatile boolean closed;

    /**
     * Create a backend. No connection is opened until {@link #connect()}.
     *
     * @param vertx the Vert.x instance running the client and reconnect timers
     * @param options Redis connection options
     * @param timeoutHelper timeout applied to every command
     * @param reconnectDelay delay before reconnecting after a connection loss
     */
    public VertxRedisCacheBackend(
            Vertx vertx, RedisOptions options, RedisTimeoutHelper timeoutHelper, Duration reconnectDelay) {
        this.vertx = Objects.requireNonNull(vertx, "vertx must not be null");
        this.timeoutHelper = Objects.requireNonNull(timeoutHelper, "timeoutHelper must not be null");
        this.reconnectDelay = Objects.requireNonNull(reconnectDelay, "reconnectDelay must not be null");
        this.client = Redis.createClient(vertx, Objects.requireNonNull(options, "options must not be null"));
    }

    /**
     * Open the connection.
     *
     * <p>Never fails: a failed attempt is reported to listeners as an error and
     * retried after the reconnect delay. Calls made while an attempt is in
     * progress are ignored.
     *
     * @return Uni completing when the attempt finished
     */
    public Uni<Void> connect() {
        if (closed || !connecting.compareAndSet(false, true)) {
            return Uni.createFrom().voidItem();
        }
        return client.connect().onItemOrFailure().transform((connection, error) -> {
            connecting.set(false);
            if (error != null) {
                LOG.warnf("Failed to connect to Redis, retrying in %s: %s", reconnectDelay, error.getMessage());
                notifyListeners(listener -> listener.onError(error));
                scheduleReconnect();
            } else {
                attach(connection);
            }
            return null;
        });
    }

    @Override
    public void addConnectionListener(RemoteConnectionListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        listeners.add(listener);
        if (isReady()) {
            listener.onConnected();
        }
    }

    @Override
    public boolean isReady() {
        return !closed && api.get() != null;
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return command("get", redis -> redis.get(key))
                .map(response -> Optional.ofNullable(response).map(Response::toString));
    }

    @Override
    public Uni<Void> set(String key, String value, Duration ttl) {
        return command("set", redis -> redis.setex(key, String.valueOf(toSeconds(ttl)), value))
                .replaceWithVoid();
    }

    @Override
    public Uni<Long> delete(Collection<String> keys) {
        if (keys.isEmpty()) {
            return Uni.createFrom().item(0L);
        }
        return command("delete", redis -> redis.del(new ArrayList<>(keys))).map(Response::toLong);
    }

    @Override
    public Uni<List<String>> keys(String glob) {
        return command("keys", redis -> redis.keys(glob)).map(response -> {
            final var keys = new ArrayList<String>(response.size());
            for (int i = 0; i < response.size(); i++) {
                keys.add(response.get(i).toString());
            }
            return keys;
        });
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return command("exists", redis -> redis.exists(List.of(key))).map(response -> response.toLong() > 0);
    }

    @Override
    public Uni<Long> increment(String key) {
        return command("increment", redis -> redis.incr(key)).map(Response::toLong);
    }

    @Override
    public Uni<Void> expire(String key, Duration ttl) {
        return command("expire", redis -> redis.expire(List.of(key, String.valueOf(toSeconds(ttl)))))
                .replaceWithVoid();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        final var current = api.getAndSet(null);
        if (current != null) {
            current.close();
        }
        client.close();
        LOG.info("Closed Redis cache connection");
    }

    private <T> Uni<T> command(String operationName, Function<RedisAPI, Uni<T>> command) {
        return timeoutHelper.withTimeout(
                Uni.createFrom().<T>deferred(() -> {
                    final var current = api.get();
                    if (current == null) {
                        return Uni.createFrom()
                                .<T>failure(new IllegalStateException("Redis connection not established"));
                    }
                    return command.apply(current);
                }),
                operationName);
    }

    private void attach(RedisConnection connection) {
        if (closed) {
            RedisAPI.api(connection).close();
            return;
        }
        connection.exceptionHandler(this::handleConnectionError);
        connection.endHandler(this::handleConnectionEnd);
        api.set(RedisAPI.api(connection));
        LOG.info("Connected to Redis");
        notifyListeners(RemoteConnectionListener::onConnected);
    }

    private void handleConnectionError(Throwable error) {
        LOG.warnf("Redis connection error: %s", error.getMessage());
        final var current = api.getAndSet(null);
        notifyListeners(listener -> listener.onError(error));
        if (current != null) {
            current.close();
        }
        scheduleReconnect();
    }

    private void handleConnectionEnd() {
        api.set(null);
        if (closed) {
            return;
        }
        LOG.warn("Redis connection ended");
        notifyListeners(RemoteConnectionListener::onEnded);
        scheduleReconnect();
    }

    private void scheduleReconnect() {
        if (closed || !reconnectScheduled.compareAndSet(false, true)) {
            return;
        }
        vertx.setTimer(Math.max(1L, reconnectDelay.toMillis()), timerId -> {
            reconnectScheduled.set(false);
            connect().subscribe().with(
                    ignored -> LOG.debug("Redis reconnect attempt finished"),
                    error -> LOG.warnf("Redis reconnect attempt failed: %s", error.getMessage()));
        });
    }

    private void notifyListeners(Consumer<RemoteConnectionListener> event) {
        for (final var listener : listeners) {
            try {
                event.accept(listener);
            } catch (RuntimeException e) {
                LOG.errorf(e, "Redis connection listener failed");
            }
        }
    }

    // Redis TTLs have one-second resolution, rounded up
    private static long toSeconds(Duration ttl) {
        return Math.max(1L, (ttl.toMillis() + 999) / 1000);
    }
}
