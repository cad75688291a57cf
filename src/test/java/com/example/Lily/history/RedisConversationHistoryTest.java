package com.example.Lily.history;

import com.example.Lily.model.CommitReason;
import com.example.Lily.model.Message;
import com.example.Lily.model.MessageRole;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.redis.core.ListOperations;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RedisConversationHistoryTest {

    private static final String KEY = "chat:memory:s1";

    private StringRedisTemplate redisTemplate;
    private ListOperations<String, String> listOps;
    private ObjectMapper objectMapper;
    private RedisConversationHistory history;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        redisTemplate = mock(StringRedisTemplate.class);
        listOps = mock(ListOperations.class);
        when(redisTemplate.opsForList()).thenReturn(listOps);
        objectMapper = new ObjectMapper();
        history = new RedisConversationHistory("s1", redisTemplate, objectMapper, Duration.ofDays(7));
    }

    @Test
    @SuppressWarnings("unchecked")
    void shouldPushWholeTurnInOneCommandAndRefreshTtl() throws Exception {
        history.appendAll(List.of(Message.user("hi"), Message.agent("hello", CommitReason.ACCEPTED)));

        ArgumentCaptor<Collection<String>> pushed = ArgumentCaptor.forClass(Collection.class);
        verify(listOps).rightPushAll(org.mockito.ArgumentMatchers.eq(KEY), pushed.capture());
        verify(redisTemplate).expire(KEY, Duration.ofDays(7));

        List<String> raw = List.copyOf(pushed.getValue());
        assertEquals(2, raw.size());
        Message agent = objectMapper.readValue(raw.get(1), Message.class);
        assertEquals(MessageRole.AGENT, agent.role());
        assertEquals(CommitReason.ACCEPTED, agent.commitReason());
    }

    @Test
    void shouldSkipMalformedEntriesOnRead() throws Exception {
        String user = objectMapper.writeValueAsString(Message.user("hi"));
        when(listOps.range(KEY, 0, -1)).thenReturn(List.of(user, "{not json"));

        List<Message> messages = history.snapshot();

        assertEquals(1, messages.size());
        assertEquals("hi", messages.get(0).content());
        assertNull(messages.get(0).commitReason());
    }

    @Test
    void shouldReadMissingKeyAsEmptyHistory() {
        when(listOps.range(KEY, 0, -1)).thenReturn(null);

        assertTrue(history.snapshot().isEmpty());
    }

    @Test
    void shouldDeleteKeyOnReset() {
        history.reset();

        verify(redisTemplate).delete(KEY);
    }

    @Test
    void shouldIgnoreEmptyAppend() {
        history.appendAll(List.of());

        verify(listOps, never()).rightPushAll(anyString(), anyCollection());
    }
}
