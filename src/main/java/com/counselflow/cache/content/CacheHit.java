package com.counselflow.cache.content;

import java.time.Instant;
import java.util.Map;

/**
 * A content cache hit: the stored result plus how it was found.
 *
 * @param hitType         {@link #EXACT} or {@link #SIMILAR}
 * @param similarityScore 1.0 for exact hits
 * @param matchedHash     hash of the stored entry that answered the lookup
 */
public record CacheHit(
        Map<String, Object> result,
        String hitType,
        double similarityScore,
        String contentHash,
        String matchedHash,
        Instant cachedAt,
        Map<String, Object> metadata) {

    public static final String EXACT = "exact";
    public static final String SIMILAR = "similar";

    public boolean isExact() {
        return EXACT.equals(hitType);
    }
}
