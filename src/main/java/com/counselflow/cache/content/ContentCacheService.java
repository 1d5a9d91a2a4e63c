package com.counselflow.cache.content;

import com.counselflow.config.CounselFlowProperties;
import com.counselflow.exception.CacheException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.LongAdder;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Content-addressed cache for expensive AI operations.
 * <p>
 * Key layout: {@code ai_cache:{type}:{hash}[:user:{id}][:params:{hash}]}. Each type
 * also keeps a similarity index {@code ai_similarity:{type}} (content hash to SimHash
 * fingerprint) and usage counters {@code ai_cache_stats:{type}}. Store and
 * serialization failures are logged and read as misses.
 */
@Slf4j
@Service
public class ContentCacheService {

    static final String KEY_PREFIX = "ai_cache:";
    static final String SIMILARITY_PREFIX = "ai_similarity:";
    static final String STATS_PREFIX = "ai_cache_stats:";

    private static final int COMPRESSION_THRESHOLD_BYTES = 1024;
    private static final Duration INDEX_TTL_EXTENSION = Duration.ofHours(1);
    private static final Duration STATS_TTL = Duration.ofHours(24);
    private static final byte GZIP_MAGIC_0 = (byte) 0x1f;
    private static final byte GZIP_MAGIC_1 = (byte) 0x8b;

    private final ContentCacheStore store;
    private final ObjectMapper objectMapper;
    private final ObjectWriter canonicalWriter;
    private final Map<OperationType, OperationCacheConfig> configs = new EnumMap<>(OperationType.class);
    private final Map<OperationType, LongAdder> hits = new EnumMap<>(OperationType.class);
    private final Map<OperationType, LongAdder> misses = new EnumMap<>(OperationType.class);

    public ContentCacheService(ContentCacheStore store, ObjectMapper objectMapper, CounselFlowProperties properties) {
        this.store = store;
        this.objectMapper = objectMapper;
        this.canonicalWriter = objectMapper.writer().with(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS);

        Map<String, CounselFlowProperties.OperationOverride> overrides = properties.getContentCache().getOperations();
        for (OperationType type : OperationType.values()) {
            configs.put(type, type.defaults().merge(findOverride(overrides, type)));
            hits.put(type, new LongAdder());
            misses.put(type, new LongAdder());
        }
    }

    public OperationCacheConfig configFor(OperationType type) {
        return configs.get(type);
    }

    /**
     * Look up a cached result: exact key first, then near-duplicates from the similarity index.
     */
    public Optional<CacheHit> get(OperationType type, String content, String userId, Map<String, Object> extraParams) {
        OperationCacheConfig config = configs.get(type);

        if (content == null || content.length() > config.maxContentLength()) {
            log.debug("Content too long for caching: type={}, length={}", type.code(),
                    content != null ? content.length() : 0);
            misses.get(type).increment();
            return Optional.empty();
        }

        try {
            String contentHash = ContentNormalizer.contentHash(content, type);
            String paramsHash = paramsHash(extraParams);

            // 1. Exact match
            String exactKey = buildKey(type, contentHash, userId, paramsHash);
            Optional<ContentCacheRecord> exact = read(exactKey);
            if (exact.isPresent()) {
                log.info("AI cache hit (exact): type={}, hash={}", type.code(), contentHash.substring(0, 8));
                hits.get(type).increment();
                return Optional.of(toHit(exact.get(), CacheHit.EXACT, 1.0, contentHash, contentHash));
            }

            // 2. Near-duplicate match
            if (config.useContentHash() && config.similarityThreshold() < 1.0) {
                Optional<CacheHit> similar = findSimilar(type, content, contentHash, userId, paramsHash, config);
                if (similar.isPresent()) {
                    hits.get(type).increment();
                    return similar;
                }
            }
        } catch (CacheException e) {
            log.warn("AI cache lookup failed, treating as miss: type={}: {}", type.code(), e.getMessage());
        }

        misses.get(type).increment();
        return Optional.empty();
    }

    /**
     * Store a result. Returns false when the content or payload is over its limit or the store fails.
     */
    public boolean put(
            OperationType type,
            String content,
            Map<String, Object> result,
            String userId,
            Map<String, Object> extraParams,
            Map<String, Object> metadata) {
        OperationCacheConfig config = configs.get(type);

        if (content == null || content.length() > config.maxContentLength()) {
            log.warn("Content too long for caching: type={}, length={}, max={}",
                    type.code(), content != null ? content.length() : 0, config.maxContentLength());
            return false;
        }

        try {
            String normalized = ContentNormalizer.normalize(content, type);
            String contentHash = ContentNormalizer.contentHash(content, type);
            String key = buildKey(type, contentHash, userId, paramsHash(extraParams));

            ContentCacheRecord record = ContentCacheRecord.builder()
                    .result(result)
                    .operationType(type)
                    .contentHash(contentHash)
                    .contentLength(content.length())
                    .userId(userId)
                    .additionalParams(extraParams)
                    .metadata(metadata != null ? metadata : Map.of())
                    .cachedAt(Instant.now())
                    .ttlSeconds(config.ttlSeconds())
                    .build();

            byte[] payload = serialize(record);
            if (payload.length > config.maxCacheSizeBytes()) {
                log.warn("AI result too large to cache: type={}, size={}, max={}",
                        type.code(), payload.length, config.maxCacheSizeBytes());
                return false;
            }

            if (config.compress() && payload.length > COMPRESSION_THRESHOLD_BYTES) {
                byte[] compressed = gzip(payload);
                if (compressed.length < payload.length) {
                    payload = compressed;
                }
            }

            Duration ttl = Duration.ofSeconds(config.ttlSeconds());
            store.set(key, payload, ttl);

            // Similarity index outlives the entries it points at
            String indexKey = SIMILARITY_PREFIX + type.code();
            long fingerprint = SimHashFingerprint.of(normalized);
            store.hashPut(indexKey, contentHash, Long.toString(fingerprint).getBytes(StandardCharsets.UTF_8));
            store.expire(indexKey, ttl.plus(INDEX_TTL_EXTENSION));

            String statsKey = STATS_PREFIX + type.code();
            store.hashIncrement(statsKey, "total_cached", 1);
            store.hashIncrement(statsKey, "total_size", payload.length);
            store.expire(statsKey, STATS_TTL);

            log.info("AI result cached: type={}, hash={}, size={}, ttl={}s",
                    type.code(), contentHash.substring(0, 8), payload.length, config.ttlSeconds());
            return true;

        } catch (CacheException e) {
            log.error("Failed to cache AI result: type={}: {}", type.code(), e.getMessage());
            return false;
        }
    }

    /**
     * Remove every entry of a type along with its similarity index.
     *
     * @return number of entries removed
     */
    public long invalidateByOperationType(OperationType type) {
        try {
            Set<String> keys = store.keys(KEY_PREFIX + type.code() + ":*");
            long deleted = store.delete(keys);
            store.delete(List.of(SIMILARITY_PREFIX + type.code()));
            log.info("AI cache invalidated by operation type: type={}, deleted={}", type.code(), deleted);
            return deleted;
        } catch (CacheException e) {
            log.error("Failed to invalidate AI cache: type={}: {}", type.code(), e.getMessage());
            return 0;
        }
    }

    /**
     * Remove every user-partitioned entry of a user, with or without a params segment.
     *
     * @return number of entries removed
     */
    public long invalidateByUser(String userId) {
        if (userId == null || userId.isBlank()) {
            return 0;
        }
        try {
            String user = escapeGlob(userId);
            Set<String> keys = new HashSet<>(store.keys(KEY_PREFIX + "*:user:" + user));
            keys.addAll(store.keys(KEY_PREFIX + "*:user:" + user + ":params:*"));
            long deleted = store.delete(keys);
            log.info("User AI cache invalidated: user={}, deleted={}", userId, deleted);
            return deleted;
        } catch (CacheException e) {
            log.error("Failed to invalidate user AI cache: user={}: {}", userId, e.getMessage());
            return 0;
        }
    }

    public ContentCacheStatistics getStatistics() {
        Map<String, OperationCacheConfig> configurations = new LinkedHashMap<>();
        Map<String, ContentCacheStatistics.UsageStats> usage = new LinkedHashMap<>();
        long totalSize = 0;

        for (OperationType type : OperationType.values()) {
            configurations.put(type.code(), configs.get(type));

            long hitCount = hits.get(type).sum();
            long missCount = misses.get(type).sum();
            ContentCacheStatistics.UsageStats.UsageStatsBuilder stats = ContentCacheStatistics.UsageStats.builder()
                    .hits(hitCount)
                    .misses(missCount)
                    .hitRate(hitCount + missCount == 0 ? 0.0 : (double) hitCount / (hitCount + missCount));

            try {
                Map<String, byte[]> counters = store.hashGetAll(STATS_PREFIX + type.code());
                stats.totalCached(counter(counters, "total_cached"));
                stats.totalSize(counter(counters, "total_size"));

                Set<String> keys = store.keys(KEY_PREFIX + type.code() + ":*");
                stats.currentEntries(keys.size());

                // Extrapolate from one sampled entry
                if (!keys.isEmpty()) {
                    byte[] sample = store.get(keys.iterator().next());
                    long estimated = sample != null ? (long) sample.length * keys.size() : 0;
                    stats.estimatedSize(estimated);
                    totalSize += estimated;
                }
            } catch (CacheException e) {
                log.error("Failed to read AI cache statistics: type={}: {}", type.code(), e.getMessage());
            }

            usage.put(type.code(), stats.build());
        }

        return ContentCacheStatistics.builder()
                .operationTypes(OperationType.values().length)
                .configurations(configurations)
                .usageStats(usage)
                .totalCacheSize(totalSize)
                .build();
    }

    /**
     * Drop similarity index members whose entries have all expired.
     *
     * @return number of index members removed
     */
    @Scheduled(fixedDelayString = "${counselflow.content-cache.cleanup-interval:PT1H}")
    public int cleanupExpiredIndexes() {
        int removed = 0;
        for (OperationType type : OperationType.values()) {
            try {
                String indexKey = SIMILARITY_PREFIX + type.code();
                Map<String, byte[]> index = store.hashGetAll(indexKey);
                if (index.isEmpty()) {
                    continue;
                }

                Set<String> liveHashes = new HashSet<>();
                for (String key : store.keys(KEY_PREFIX + type.code() + ":*")) {
                    String[] parts = key.split(":");
                    if (parts.length > 2) {
                        liveHashes.add(parts[2]);
                    }
                }

                List<String> stale = index.keySet().stream()
                        .filter(hash -> !liveHashes.contains(hash))
                        .toList();
                if (!stale.isEmpty()) {
                    store.hashDelete(indexKey, stale);
                    removed += stale.size();
                }
            } catch (CacheException e) {
                log.warn("Similarity index cleanup failed: type={}: {}", type.code(), e.getMessage());
            }
        }

        if (removed > 0) {
            log.info("Removed {} stale similarity index entries", removed);
        }
        return removed;
    }

    String buildKey(OperationType type, String contentHash, String userId, String paramsHash) {
        StringBuilder key = new StringBuilder(KEY_PREFIX)
                .append(type.code())
                .append(':')
                .append(contentHash);

        if (configs.get(type).cacheByUser() && userId != null && !userId.isBlank()) {
            key.append(":user:").append(userId);
        }
        if (paramsHash != null) {
            key.append(":params:").append(paramsHash);
        }
        return key.toString();
    }

    private Optional<CacheHit> findSimilar(
            OperationType type,
            String content,
            String contentHash,
            String userId,
            String paramsHash,
            OperationCacheConfig config) {
        Map<String, byte[]> index = store.hashGetAll(SIMILARITY_PREFIX + type.code());
        if (index.isEmpty()) {
            return Optional.empty();
        }

        long fingerprint = SimHashFingerprint.of(ContentNormalizer.normalize(content, type));

        List<Candidate> candidates = new ArrayList<>();
        for (Map.Entry<String, byte[]> entry : index.entrySet()) {
            if (entry.getKey().equals(contentHash)) {
                continue;
            }
            try {
                long other = Long.parseLong(new String(entry.getValue(), StandardCharsets.UTF_8));
                double score = SimHashFingerprint.similarity(fingerprint, other);
                if (score >= config.similarityThreshold()) {
                    candidates.add(new Candidate(entry.getKey(), score));
                }
            } catch (NumberFormatException e) {
                log.debug("Skipping malformed similarity index entry {}", entry.getKey());
            }
        }
        candidates.sort(Comparator.comparingDouble(Candidate::score).reversed());

        for (Candidate candidate : candidates) {
            Optional<ContentCacheRecord> record = read(buildKey(type, candidate.hash(), userId, paramsHash));
            if (record.isPresent()) {
                log.info("AI cache hit (similar): type={}, hash={}, similar={}, score={}",
                        type.code(), contentHash.substring(0, 8), candidate.hash().substring(0, 8), candidate.score());
                return Optional.of(toHit(record.get(), CacheHit.SIMILAR, candidate.score(), contentHash, candidate.hash()));
            }
        }
        return Optional.empty();
    }

    // Missing or undecodable entries read as absent
    private Optional<ContentCacheRecord> read(String key) {
        byte[] data = store.get(key);
        if (data == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(deserialize(data));
        } catch (CacheException e) {
            log.warn("Failed to deserialize cached AI result {}: {}", key, e.getMessage());
            return Optional.empty();
        }
    }

    private CacheHit toHit(ContentCacheRecord record, String hitType, double score, String contentHash, String matchedHash) {
        return new CacheHit(record.getResult(), hitType, score, contentHash, matchedHash,
                record.getCachedAt(), record.getMetadata());
    }

    private String paramsHash(Map<String, Object> extraParams) {
        if (extraParams == null || extraParams.isEmpty()) {
            return null;
        }
        try {
            return ContentNormalizer.paramsHash(canonicalWriter.writeValueAsString(extraParams));
        } catch (JsonProcessingException e) {
            throw new CacheException("Failed to serialize cache params", e);
        }
    }

    private byte[] serialize(ContentCacheRecord record) {
        try {
            return objectMapper.writeValueAsBytes(record);
        } catch (JsonProcessingException e) {
            throw new CacheException("Failed to serialize AI result", e);
        }
    }

    private ContentCacheRecord deserialize(byte[] data) {
        try {
            byte[] json = isGzip(data) ? gunzip(data) : data;
            return objectMapper.readValue(json, ContentCacheRecord.class);
        } catch (IOException e) {
            throw new CacheException("Failed to deserialize AI result", e);
        }
    }

    /**
     * Escape Redis glob metacharacters so the value matches only itself.
     */
    static String escapeGlob(String value) {
        StringBuilder out = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
                out.append('\\');
            }
            out.append(c);
        }
        return out.toString();
    }

    private static boolean isGzip(byte[] data) {
        return data.length > 2 && data[0] == GZIP_MAGIC_0 && data[1] == GZIP_MAGIC_1;
    }

    private static byte[] gzip(byte[] data) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream();
             GZIPOutputStream gzipOut = new GZIPOutputStream(out)) {
            gzipOut.write(data);
            gzipOut.finish();
            return out.toByteArray();
        } catch (IOException e) {
            throw new CacheException("Failed to compress AI result", e);
        }
    }

    private static byte[] gunzip(byte[] data) throws IOException {
        try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(data))) {
            return in.readAllBytes();
        }
    }

    private static long counter(Map<String, byte[]> counters, String field) {
        byte[] value = counters.get(field);
        return value != null ? Long.parseLong(new String(value, StandardCharsets.UTF_8)) : 0L;
    }

    // Relaxed binding may strip the underscore from map keys, so compare alphanumerics only
    private static CounselFlowProperties.OperationOverride findOverride(
            Map<String, CounselFlowProperties.OperationOverride> overrides, OperationType type) {
        if (overrides == null) {
            return null;
        }
        String wanted = type.code().replaceAll("[^a-z0-9]", "");
        return overrides.entrySet().stream()
                .filter(e -> e.getKey().toLowerCase().replaceAll("[^a-z0-9]", "").equals(wanted))
                .map(Map.Entry::getValue)
                .findFirst()
                .orElse(null);
    }

    private record Candidate(String hash, double score) {
    }
}
