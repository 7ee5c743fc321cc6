package strata.core.port.out;

/**
 * Receives connection lifecycle events from a {@link RemoteCacheBackend}.
 *
 * <p>Callbacks may be invoked from I/O threads and must not block.
 */
public interface RemoteConnectionListener {

    /**
     * The connection was (re-)established and is ready for commands.
     */
    void onConnected();

    /**
     * The connection reported an error.
     *
     * @param error the connection error
     */
    void onError(Throwable error);

    /**
     * The connection was closed.
     */
    void onEnded();
}
