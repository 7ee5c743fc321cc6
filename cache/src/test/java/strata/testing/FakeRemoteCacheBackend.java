package strata.testing;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import io.smallrye.mutiny.Uni;

import strata.core.cache.KeyPatternMatcher;
import strata.core.port.out.RemoteCacheBackend;
import strata.core.port.out.RemoteConnectionListener;

/**
 * In-memory remote backend with controllable connection state and failures.
 *
 * <p>TTLs are recorded but not enforced.
 */
public class FakeRemoteCacheBackend implements RemoteCacheBackend {

    private final Map<String, String> values = new ConcurrentHashMap<>();
    private final Map<String, Duration> ttls = new ConcurrentHashMap<>();
    private final List<RemoteConnectionListener> listeners = new CopyOnWriteArrayList<>();
    private final KeyPatternMatcher matcher = new KeyPatternMatcher();
    private final AtomicInteger expireCalls = new AtomicInteger();
    private final AtomicInteger calls = new AtomicInteger();
    private final AtomicReference<RuntimeException> nextExpireFailure = new AtomicReference<>();

    private volatile boolean ready;
    private volatile RuntimeException failure;

    public void connect() {
        ready = true;
        listeners.forEach(RemoteConnectionListener::onConnected);
    }

    public void error(Throwable error) {
        ready = false;
        listeners.forEach(listener -> listener.onError(error));
    }

    public void end() {
        ready = false;
        listeners.forEach(RemoteConnectionListener::onEnded);
    }

    /**
     * Make every following operation fail with the given exception, or succeed again when null.
     */
    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    /**
     * Make the next {@code expire} call fail with the given exception.
     */
    public void failNextExpire(RuntimeException failure) {
        nextExpireFailure.set(failure);
    }

    /**
     * Flip readiness without emitting a lifecycle event.
     */
    public void setReady(boolean ready) {
        this.ready = ready;
    }

    public Map<String, String> values() {
        return values;
    }

    public Optional<Duration> ttlOf(String key) {
        return Optional.ofNullable(ttls.get(key));
    }

    public int expireCalls() {
        return expireCalls.get();
    }

    public int calls() {
        return calls.get();
    }

    @Override
    public void addConnectionListener(RemoteConnectionListener listener) {
        listeners.add(listener);
        if (ready) {
            listener.onConnected();
        }
    }

    @Override
    public boolean isReady() {
        return ready;
    }

    @Override
    public Uni<Optional<String>> get(String key) {
        return run(() -> Optional.ofNullable(values.get(key)));
    }

    @Override
    public Uni<Void> set(String key, String value, Duration ttl) {
        return run(() -> {
            values.put(key, value);
            ttls.put(key, ttl);
            return null;
        });
    }

    @Override
    public Uni<Long> delete(Collection<String> keys) {
        return run(() -> keys.stream().filter(key -> values.remove(key) != null).count());
    }

    @Override
    public Uni<List<String>> keys(String glob) {
        return run(() -> {
            final var pattern = unescape(glob);
            final var matching = new ArrayList<String>();
            for (final var key : values.keySet()) {
                if (matcher.matches(pattern, key)) {
                    matching.add(key);
                }
            }
            return matching;
        });
    }

    @Override
    public Uni<Boolean> exists(String key) {
        return run(() -> values.containsKey(key));
    }

    @Override
    public Uni<Long> increment(String key) {
        return run(() -> {
            final var next = values.merge(key, "1", (current, one) -> Long.toString(Long.parseLong(current) + 1));
            return Long.parseLong(next);
        });
    }

    @Override
    public Uni<Void> expire(String key, Duration ttl) {
        final var expireFailure = nextExpireFailure.getAndSet(null);
        if (expireFailure != null) {
            expireCalls.incrementAndGet();
            return Uni.createFrom().failure(expireFailure);
        }
        return run(() -> {
            expireCalls.incrementAndGet();
            ttls.put(key, ttl);
            return null;
        });
    }

    @Override
    public void close() {
        ready = false;
    }

    private <T> Uni<T> run(Supplier<T> operation) {
        calls.incrementAndGet();
        final var current = failure;
        if (current != null) {
            return Uni.createFrom().failure(current);
        }
        return Uni.createFrom().item(operation);
    }

    private static String unescape(String glob) {
        final var pattern = new StringBuilder(glob.length());
        for (int i = 0; i < glob.length(); i++) {
            final var c = glob.charAt(i);
            if (c == '\\' && i + 1 < glob.length()) {
                pattern.append(glob.charAt(++i));
            } else {
                pattern.append(c);
            }
        }
        return pattern.toString();
    }
}
