package strata.core.port.out;

import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

/**
 * Port interface for a networked key/value store used as the primary cache tier.
 *
 * <p>Values are opaque strings. Every operation may fail (connection loss,
 * timeout, server error); failures are reported through the returned
 * {@link Uni}, never by blocking the caller.
 *
 * <p>Liveness is reported to registered {@link RemoteConnectionListener}s.
 */
public interface RemoteCacheBackend {

    /**
     * Register a listener for connection lifecycle events.
     *
     * <p>If the backend is already connected, the listener is notified
     * immediately with {@link RemoteConnectionListener#onConnected()}.
     *
     * @param listener the listener
     */
    void addConnectionListener(RemoteConnectionListener listener);

    /**
     * Whether the underlying connection is currently established.
     *
     * @return true if commands can be sent
     */
    boolean isReady();

    /**
     * Get a value.
     *
     * @param key the key
     * @return Uni with the value, or empty if the key does not exist
     */
    Uni<Optional<String>> get(String key);

    /**
     * Set a value with a time-to-live.
     *
     * @param key the key
     * @param value the value
     * @param ttl time-to-live, at least one second
     * @return Uni completing when stored
     */
    Uni<Void> set(String key, String value, Duration ttl);

    /**
     * Delete keys. Deleting a missing key is not an error.
     *
     * @param keys the keys to delete
     * @return Uni with the number of keys removed
     */
    Uni<Long> delete(Collection<String> keys);

    /**
     * List keys matching a store-native glob.
     *
     * @param glob the glob, already escaped for the store
     * @return Uni with the matching keys
     */
    Uni<List<String>> keys(String glob);

    /**
     * Check whether a key exists.
     *
     * @param key the key
     * @return Uni with true if the key exists
     */
    Uni<Boolean> exists(String key);

    /**
     * Atomically increment an integer value, creating it at 1 if absent.
     *
     * @param key the key
     * @return Uni with the value after the increment
     */
    Uni<Long> increment(String key);

    /**
     * Set the time-to-live of an existing key.
     *
     * @param key the key
     * @param ttl time-to-live, at least one second
     * @return Uni completing when applied
     */
    Uni<Void> expire(String key, Duration ttl);

    /**
     * Close the connection. No further lifecycle events are emitted.
     */
    void close();
}
