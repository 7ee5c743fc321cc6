package strata.core.service;

/**
 * A cached payload could not be written or read as JSON.
 *
 * <p>On reads this is treated as a cache miss; on writes the value is not cached.
 */
public class CacheSerializationException extends RuntimeException {

    public CacheSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
