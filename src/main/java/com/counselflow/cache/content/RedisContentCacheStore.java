package com.counselflow.cache.content;

import com.counselflow.exception.CacheException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.HashOperations;
import org.springframework.data.redis.core.RedisTemplate;

import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Redis-backed store. TTLs, increments and deletes map to native Redis commands.
 */
@Slf4j
public class RedisContentCacheStore implements ContentCacheStore {

    private final RedisTemplate<String, byte[]> redisTemplate;
    private final HashOperations<String, String, byte[]> hashOps;

    public RedisContentCacheStore(RedisTemplate<String, byte[]> redisTemplate) {
        this.redisTemplate = redisTemplate;
        this.hashOps = redisTemplate.opsForHash();
    }

    @Override
    public byte[] get(String key) {
        return execute("GET " + key, () -> redisTemplate.opsForValue().get(key));
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        execute("SETEX " + key, () -> {
            redisTemplate.opsForValue().set(key, value, ttl);
            return null;
        });
    }

    @Override
    public long delete(Collection<String> keys) {
        if (keys.isEmpty()) {
            return 0;
        }
        Long deleted = execute("DEL", () -> redisTemplate.delete(keys));
        return deleted != null ? deleted : 0;
    }

    @Override
    public Set<String> keys(String pattern) {
        Set<String> keys = execute("KEYS " + pattern, () -> redisTemplate.keys(pattern));
        return keys != null ? keys : Set.of();
    }

    @Override
    public void expire(String key, Duration ttl) {
        execute("EXPIRE " + key, () -> redisTemplate.expire(key, ttl));
    }

    @Override
    public void hashPut(String key, String field, byte[] value) {
        execute("HSET " + key, () -> {
            hashOps.put(key, field, value);
            return null;
        });
    }

    @Override
    public Map<String, byte[]> hashGetAll(String key) {
        Map<String, byte[]> entries = execute("HGETALL " + key, () -> hashOps.entries(key));
        return entries != null ? entries : Map.of();
    }

    @Override
    public void hashDelete(String key, Collection<String> fields) {
        if (fields.isEmpty()) {
            return;
        }
        execute("HDEL " + key, () -> hashOps.delete(key, fields.toArray()));
    }

    @Override
    public long hashIncrement(String key, String field, long delta) {
        Long value = execute("HINCRBY " + key, () -> hashOps.increment(key, field, delta));
        return value != null ? value : 0;
    }

    private <T> T execute(String command, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new CacheException("Redis command failed: " + command, e);
        }
    }
}
