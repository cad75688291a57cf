package com.example.Lily.agent;

import com.example.Lily.config.LilyProperties;
import com.example.Lily.history.ConversationHistoryFactory;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Sessions by id, created on first use and dropped again after {@code lily.history.session-idle}
 * without traffic. Stored history is not touched by eviction; the Redis store keeps it until its TTL.
 */
@Component
@RequiredArgsConstructor
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final ConversationHistoryFactory historyFactory;
    private final LilyProperties properties;
    private final Map<String, ConversationSession> sessions = new ConcurrentHashMap<>();

    public ConversationSession getOrCreate(String sessionId) {
        Instant now = Instant.now();
        return sessions.compute(sessionId, (id, existing) -> {
            ConversationSession session = existing;
            if (session == null) {
                log.info("Opening conversation session {}", id);
                session = new ConversationSession(id, historyFactory.create(id));
            }
            session.touch(now);
            return session;
        });
    }

    @Scheduled(fixedDelayString = "${lily.history.eviction-interval:PT10M}")
    public void evictIdle() {
        int evicted = evictIdleSince(Instant.now().minus(properties.getHistory().getSessionIdle()));
        if (evicted > 0) {
            log.info("Evicted {} idle session(s), {} remaining", evicted, sessions.size());
        }
    }

    int evictIdleSince(Instant cutoff) {
        int evicted = 0;
        for (String id : List.copyOf(sessions.keySet())) {
            ConversationSession removed = sessions.computeIfPresent(id,
                    (key, session) -> session.isIdleSince(cutoff) ? null : session);
            if (removed == null) {
                log.debug("Session {} evicted after inactivity", id);
                evicted++;
            }
        }
        return evicted;
    }
}
