package org.gtfslake.gtfs_rt.cache;

import java.util.Optional;

/**
 * Key/value store for serialized feed responses.
 *
 * <p>Entries expire on their own once their time-to-live has elapsed; callers
 * never evict. Implementations must be safe for concurrent use and may throw
 * runtime exceptions when the backend is unreachable.</p>
 *
 * @since 1.0
 */
public interface ResponseCache {

    /**
     * Looks up a cached payload.
     *
     * @param key the cache key
     * @return the cached bytes, or empty on a miss or after expiry
     */
    Optional<byte[]> get(String key);

    /**
     * Stores a payload.
     *
     * @param key the cache key
     * @param value the payload
     * @param ttlSeconds time-to-live in seconds, positive
     */
    void set(String key, byte[] value, int ttlSeconds);
}
