package com.counselflow.cache;

import com.counselflow.config.CounselFlowProperties;
import com.counselflow.model.NormalizedResponse;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-process exact-match cache for generated text.
 * <p>
 * Keyed by a SHA-256 of (prompt, provider, model, maxTokens, temperature). Entries
 * expire after the configured TTL; when the entry count goes over the bound the
 * oldest entries are dropped first.
 */
@Slf4j
@Component
public class ResponseCache {

    private final Map<String, CacheEntry> entries = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();

    @Autowired
    public ResponseCache(CounselFlowProperties properties) {
        this(properties.getResponseCache().getTtl(), properties.getResponseCache().getMaxEntries(), Clock.systemUTC());
    }

    public ResponseCache(Duration ttl, int maxEntries, Clock clock) {
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    /**
     * Build the cache key. Provider and model are the caller's request values, null allowed.
     */
    public static String key(String prompt, String provider, String model, int maxTokens, double temperature) {
        String raw = String.join("|",
                prompt,
                provider != null ? provider : "",
                model != null ? model : "",
                Integer.toString(maxTokens),
                Double.toString(temperature));
        return DigestUtils.sha256Hex(raw);
    }

    /**
     * Unexpired entry for the key, already marked as cached.
     */
    public Optional<NormalizedResponse> get(String key) {
        CacheEntry entry = entries.get(key);
        if (entry == null) {
            misses.increment();
            return Optional.empty();
        }
        if (entry.isExpiredAt(clock.instant(), ttl)) {
            entries.remove(key, entry);
            misses.increment();
            log.debug("Response cache entry expired: {}", key);
            return Optional.empty();
        }

        hits.increment();
        log.debug("Response cache HIT: {}", key);
        return Optional.of(entry.response().asCached());
    }

    /**
     * Store a private copy, so later changes by the caller do not reach cache hits.
     */
    public void put(String key, NormalizedResponse response) {
        entries.put(key, new CacheEntry(response.copy(), clock.instant()));
        if (entries.size() > maxEntries) {
            evict();
        }
    }

    public int size() {
        return entries.size();
    }

    public long hitCount() {
        return hits.sum();
    }

    public long missCount() {
        return misses.sum();
    }

    public void clear() {
        entries.clear();
        log.info("Response cache cleared");
    }

    // Expired first, then oldest until back under the bound
    private synchronized void evict() {
        Instant now = clock.instant();
        entries.entrySet().removeIf(e -> e.getValue().isExpiredAt(now, ttl));

        int excess = entries.size() - maxEntries;
        if (excess <= 0) {
            return;
        }

        entries.entrySet().stream()
                .sorted(Comparator.comparing(e -> e.getValue().storedAt()))
                .limit(excess)
                .map(Map.Entry::getKey)
                .toList()
                .forEach(entries::remove);

        log.debug("Response cache evicted {} oldest entries", excess);
    }

    private record CacheEntry(NormalizedResponse response, Instant storedAt) {

        boolean isExpiredAt(Instant now, Duration ttl) {
            return !now.isBefore(storedAt.plus(ttl));
        }
    }
}
