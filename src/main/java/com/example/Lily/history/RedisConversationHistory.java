package com.example.Lily.history;

import com.example.Lily.model.Message;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * History kept in one Redis list per session.
 * <p>
 * RPUSH of a whole turn, LRANGE and DEL are each single commands, so a reader never
 * sees half a turn or a half-cleared list.
 */
public class RedisConversationHistory implements ConversationHistory {

    private static final Logger log = LoggerFactory.getLogger(RedisConversationHistory.class);

    static final String KEY_PREFIX = "chat:memory:";

    private final String key;
    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    /**
     * Rolling TTL: a conversation is kept as long as it had a new turn within this window.
     */
    private final Duration ttl;

    public RedisConversationHistory(String sessionId,
                                    StringRedisTemplate redisTemplate,
                                    ObjectMapper objectMapper,
                                    Duration ttl) {
        this.key = KEY_PREFIX + sessionId;
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = ttl;
    }

    @Override
    public void append(Message message) {
        appendAll(List.of(message));
    }

    @Override
    public void appendAll(List<Message> messages) {
        if (messages.isEmpty()) {
            return;
        }
        List<String> raw = new ArrayList<>(messages.size());
        for (Message message : messages) {
            try {
                raw.add(objectMapper.writeValueAsString(message));
            } catch (JsonProcessingException e) {
                throw new IllegalStateException("Failed to serialize message for " + key, e);
            }
        }
        redisTemplate.opsForList().rightPushAll(key, raw);
        redisTemplate.expire(key, ttl);
    }

    @Override
    public List<Message> snapshot() {
        List<String> rawMessages = redisTemplate.opsForList().range(key, 0, -1);
        if (rawMessages == null || rawMessages.isEmpty()) {
            return List.of();
        }

        List<Message> messages = new ArrayList<>(rawMessages.size());
        for (String raw : rawMessages) {
            try {
                messages.add(objectMapper.readValue(raw, Message.class));
            } catch (JsonProcessingException e) {
                // Skip malformed entries instead of failing the whole load
                log.warn("Skipping malformed history entry in {}: {}", key, e.getOriginalMessage());
            }
        }
        return List.copyOf(messages);
    }

    @Override
    public void reset() {
        redisTemplate.delete(key);
    }
}
