package com.counselflow.config;

import com.counselflow.cache.content.ContentCacheStore;
import com.counselflow.cache.content.InMemoryContentCacheStore;
import com.counselflow.cache.content.RedisContentCacheStore;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisTemplate;

/**
 * Selects the content cache store from {@code counselflow.content-cache.store}.
 */
@Configuration
public class ContentCacheConfiguration {

    @Bean
    @ConditionalOnProperty(prefix = "counselflow.content-cache", name = "store", havingValue = "redis")
    public ContentCacheStore redisContentCacheStore(
            @Qualifier("contentCacheRedisTemplate") RedisTemplate<String, byte[]> contentCacheRedisTemplate) {
        return new RedisContentCacheStore(contentCacheRedisTemplate);
    }

    @Bean
    @ConditionalOnProperty(prefix = "counselflow.content-cache", name = "store", havingValue = "memory", matchIfMissing = true)
    public ContentCacheStore inMemoryContentCacheStore(CounselFlowProperties properties) {
        return new InMemoryContentCacheStore(properties.getContentCache().getMaxInMemoryEntries());
    }
}
