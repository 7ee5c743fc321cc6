package strata.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A cached payload with its absolute expiry.
 *
 * <p>An entry is logically absent once the current time is after
 * {@code expiresAt}, whether or not it has been purged yet.
 *
 * @param value the serialized payload
 * @param expiresAt the instant after which the entry is expired
 */
public record CacheEntry(String value, Instant expiresAt) {

    public CacheEntry {
        Objects.requireNonNull(value, "value must not be null");
        Objects.requireNonNull(expiresAt, "expiresAt must not be null");
    }

    /**
     * Checks whether this entry is expired at the given instant.
     *
     * @param now the current instant
     * @return true if {@code now} is strictly after the expiry
     */
    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }

    /**
     * Returns a copy holding a new value with the same expiry.
     */
    public CacheEntry withValue(String newValue) {
        return new CacheEntry(newValue, expiresAt);
    }
}
