package com.counselflow.cache;

import com.counselflow.MutableClock;
import com.counselflow.model.NormalizedResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ResponseCacheTest {

    private MutableClock clock;
    private ResponseCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T10:00:00Z"));
        cache = new ResponseCache(Duration.ofSeconds(300), 3, clock);
    }

    @Test
    void testHitIsMarkedCached() {
        String key = ResponseCache.key("Summarize the NDA", "openai", null, 4000, 0.1);
        cache.put(key, response("summary"));

        Optional<NormalizedResponse> hit = cache.get(key);

        assertTrue(hit.isPresent());
        assertTrue(hit.get().isCached());
        assertEquals("summary", hit.get().getContent());
        assertEquals(1, cache.hitCount());
    }

    @Test
    void testKeyDependsOnEveryParameter() {
        String base = ResponseCache.key("prompt", "openai", "gpt-4", 4000, 0.1);

        assertEquals(base, ResponseCache.key("prompt", "openai", "gpt-4", 4000, 0.1));
        assertNotEquals(base, ResponseCache.key("prompt!", "openai", "gpt-4", 4000, 0.1));
        assertNotEquals(base, ResponseCache.key("prompt", "anthropic", "gpt-4", 4000, 0.1));
        assertNotEquals(base, ResponseCache.key("prompt", "openai", "gpt-4o", 4000, 0.1));
        assertNotEquals(base, ResponseCache.key("prompt", "openai", "gpt-4", 2000, 0.1));
        assertNotEquals(base, ResponseCache.key("prompt", "openai", "gpt-4", 4000, 0.7));
        assertNotEquals(base, ResponseCache.key("prompt", null, "gpt-4", 4000, 0.1));
    }

    @Test
    void testEntryExpiresAfterTtl() {
        cache.put("k", response("v"));

        clock.advance(Duration.ofSeconds(299));
        assertTrue(cache.get("k").isPresent());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(cache.get("k").isEmpty());
        assertEquals(0, cache.size());
        assertEquals(1, cache.missCount());
    }

    @Test
    void testOldestEntriesEvictedOverBound() {
        for (int i = 0; i < 5; i++) {
            cache.put("k" + i, response("v" + i));
            clock.advance(Duration.ofSeconds(1));
        }

        assertEquals(3, cache.size());
        assertTrue(cache.get("k0").isEmpty());
        assertTrue(cache.get("k1").isEmpty());
        assertTrue(cache.get("k4").isPresent());
    }

    @Test
    void testCallerChangesDoNotReachCachedCopies() {
        String key = ResponseCache.key("Summarize the NDA", "openai", null, 4000, 0.1);
        NormalizedResponse original = response("summary");
        original.setMetadata(new HashMap<>(Map.of("finish_reason", "stop")));
        cache.put(key, original);

        original.setContent("edited by caller");
        original.getMetadata().put("finish_reason", "edited");

        NormalizedResponse first = cache.get(key).orElseThrow();
        assertEquals("summary", first.getContent());
        assertEquals("stop", first.getMetadata().get("finish_reason"));

        first.setContent("edited after hit");
        first.getMetadata().put("extra", true);

        NormalizedResponse second = cache.get(key).orElseThrow();
        assertEquals("summary", second.getContent());
        assertEquals(Map.of("finish_reason", "stop"), second.getMetadata());
    }

    @Test
    void testClear() {
        cache.put("k", response("v"));
        cache.clear();
        assertEquals(0, cache.size());
    }

    private static NormalizedResponse response(String content) {
        return NormalizedResponse.builder()
                .content(content)
                .provider("openai")
                .model("gpt-4")
                .tokensUsed(10)
                .timestamp(Instant.now())
                .build();
    }
}
