package com.counselflow.cache.content;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Caffeine-backed store with per-entry expiry, for single-node deployments and tests.
 */
@Slf4j
public class InMemoryContentCacheStore implements ContentCacheStore {

    private final Cache<String, StoreEntry> cache;

    public InMemoryContentCacheStore(long maxEntries) {
        this(maxEntries, Ticker.systemTicker());
    }

    public InMemoryContentCacheStore(long maxEntries, Ticker ticker) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxEntries)
                .expireAfter(new EntryExpiry())
                .ticker(ticker)
                .build();
        log.info("Content cache using in-memory store (max {} entries)", maxEntries);
    }

    @Override
    public byte[] get(String key) {
        StoreEntry entry = cache.getIfPresent(key);
        return entry != null ? entry.value : null;
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) {
        cache.put(key, StoreEntry.value(value, ttl));
    }

    @Override
    public long delete(Collection<String> keys) {
        long removed = 0;
        for (String key : keys) {
            if (cache.asMap().remove(key) != null) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public Set<String> keys(String pattern) {
        Pattern regex = globToRegex(pattern);
        return cache.asMap().keySet().stream()
                .filter(key -> regex.matcher(key).matches())
                .collect(Collectors.toSet());
    }

    @Override
    public void expire(String key, Duration ttl) {
        cache.policy().expireVariably().ifPresent(policy -> policy.setExpiresAfter(key, ttl));
    }

    @Override
    public void hashPut(String key, String field, byte[] value) {
        cache.asMap().compute(key, (k, existing) -> {
            StoreEntry entry = existing != null && existing.hash != null ? existing : StoreEntry.hash();
            entry.hash.put(field, value);
            return entry;
        });
    }

    @Override
    public Map<String, byte[]> hashGetAll(String key) {
        StoreEntry entry = cache.getIfPresent(key);
        if (entry == null || entry.hash == null) {
            return Map.of();
        }
        return new HashMap<>(entry.hash);
    }

    @Override
    public void hashDelete(String key, Collection<String> fields) {
        cache.asMap().computeIfPresent(key, (k, entry) -> {
            if (entry.hash == null) {
                return entry;
            }
            fields.forEach(entry.hash::remove);
            return entry.hash.isEmpty() ? null : entry;
        });
    }

    @Override
    public long hashIncrement(String key, String field, long delta) {
        long[] result = new long[1];
        cache.asMap().compute(key, (k, existing) -> {
            StoreEntry entry = existing != null && existing.hash != null ? existing : StoreEntry.hash();
            byte[] current = entry.hash.get(field);
            long value = (current != null ? Long.parseLong(new String(current, StandardCharsets.UTF_8)) : 0L) + delta;
            entry.hash.put(field, Long.toString(value).getBytes(StandardCharsets.UTF_8));
            result[0] = value;
            return entry;
        });
        return result[0];
    }

    /**
     * Redis {@code KEYS} glob: {@code *}, {@code ?}, {@code [...]} classes with
     * {@code ^} negation and ranges, and backslash escapes.
     */
    static Pattern globToRegex(String glob) {
        StringBuilder regex = new StringBuilder();
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i);
            if (c == '\\' && i + 1 < glob.length()) {
                regex.append(Pattern.quote(String.valueOf(glob.charAt(i + 1))));
                i += 2;
                continue;
            }
            if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else if (c == '[' && glob.indexOf(']', i + 1) > i + 1) {
                int end = glob.indexOf(']', i + 1);
                regex.append(characterClass(glob.substring(i + 1, end)));
                i = end;
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
            i++;
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }

    private static String characterClass(String body) {
        StringBuilder out = new StringBuilder("[");
        int start = 0;
        if (body.charAt(0) == '^') {
            if (body.length() == 1) {
                return Pattern.quote("[^]");
            }
            out.append('^');
            start = 1;
        }
        for (int j = start; j < body.length(); j++) {
            char c = body.charAt(j);
            if (c == '-' && j > start && j < body.length() - 1) {
                out.append('-');
            } else if (Character.isLetterOrDigit(c)) {
                out.append(c);
            } else {
                out.append('\\').append(c);
            }
        }
        return out.append(']').toString();
    }

    private static final class StoreEntry {
        private final byte[] value;
        private final Map<String, byte[]> hash;
        // null: keep the current expiry on update
        private final Duration ttl;

        private StoreEntry(byte[] value, Map<String, byte[]> hash, Duration ttl) {
            this.value = value;
            this.hash = hash;
            this.ttl = ttl;
        }

        static StoreEntry value(byte[] value, Duration ttl) {
            return new StoreEntry(value, null, ttl);
        }

        static StoreEntry hash() {
            return new StoreEntry(null, new ConcurrentHashMap<>(), null);
        }
    }

    private static final class EntryExpiry implements Expiry<String, StoreEntry> {

        @Override
        public long expireAfterCreate(String key, StoreEntry entry, long currentTime) {
            return entry.ttl != null ? entry.ttl.toNanos() : Long.MAX_VALUE;
        }

        @Override
        public long expireAfterUpdate(String key, StoreEntry entry, long currentTime, long currentDuration) {
            return entry.ttl != null ? entry.ttl.toNanos() : currentDuration;
        }

        @Override
        public long expireAfterRead(String key, StoreEntry entry, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
