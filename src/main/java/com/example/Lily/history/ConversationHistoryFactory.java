package com.example.Lily.history;

import com.example.Lily.config.LilyProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

/**
 * Creates the history store of a new session according to {@code lily.history.store}.
 */
@Component
@RequiredArgsConstructor
public class ConversationHistoryFactory {

    public static final String STORE_MEMORY = "memory";
    public static final String STORE_REDIS = "redis";

    private final LilyProperties properties;
    private final ObjectProvider<StringRedisTemplate> redisTemplateProvider;
    private final ObjectMapper objectMapper;

    public ConversationHistory create(String sessionId) {
        String store = properties.getHistory().getStore();
        if (STORE_REDIS.equalsIgnoreCase(store)) {
            StringRedisTemplate redisTemplate = redisTemplateProvider.getIfAvailable();
            if (redisTemplate == null) {
                throw new IllegalStateException("lily.history.store=redis but no StringRedisTemplate is configured");
            }
            return new RedisConversationHistory(sessionId, redisTemplate, objectMapper, properties.getHistory().getTtl());
        }
        if (!STORE_MEMORY.equalsIgnoreCase(store)) {
            throw new IllegalStateException("Unknown lily.history.store: " + store);
        }
        return new InMemoryConversationHistory();
    }
}
