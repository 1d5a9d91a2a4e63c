package com.counselflow.cache.content;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Set;

/**
 * Durable key-value store behind the content cache. Operations are atomic per key
 * and TTLs are enforced by the store. Failures surface as
 * {@link com.counselflow.exception.CacheException}.
 */
public interface ContentCacheStore {

    byte[] get(String key);

    void set(String key, byte[] value, Duration ttl);

    /**
     * @return number of keys that existed and were removed
     */
    long delete(Collection<String> keys);

    /**
     * Keys matching a glob pattern where {@code *} matches any run of characters.
     */
    Set<String> keys(String pattern);

    void expire(String key, Duration ttl);

    void hashPut(String key, String field, byte[] value);

    Map<String, byte[]> hashGetAll(String key);

    void hashDelete(String key, Collection<String> fields);

    /**
     * Atomically add to a numeric hash field, creating it at 0.
     *
     * @return the new value
     */
    long hashIncrement(String key, String field, long delta);
}
