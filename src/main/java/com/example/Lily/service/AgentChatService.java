package com.example.Lily.service;

import com.example.Lily.agent.ConversationSession;
import com.example.Lily.agent.LoopController;
import com.example.Lily.agent.SessionRegistry;
import com.example.Lily.agent.StreamingSink;
import com.example.Lily.config.LilyProperties;
import com.example.Lily.model.ChatLog;
import com.example.Lily.model.ChatRequest;
import com.example.Lily.model.ResetResponse;
import com.example.Lily.model.ThinkingEvent;
import com.example.Lily.model.TurnOutcome;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Optional;

/**
 * Entry point for the chat endpoints: resolves the session, runs the turn and keeps the audit log.
 */
@Service
@RequiredArgsConstructor
public class AgentChatService {

    private static final Logger log = LoggerFactory.getLogger(AgentChatService.class);

    static final String RESET_MESSAGE = "Chat history has been reset";
    static final String NOTHING_TO_REGENERATE = "There is no previous question to regenerate an answer for.";

    private final SessionRegistry sessionRegistry;
    private final LoopController loopController;
    private final ChatLogService chatLogService;
    private final LilyProperties properties;

    public Mono<TurnOutcome> chat(ChatRequest request, StreamingSink sink) {
        ConversationSession session = sessionRegistry.getOrCreate(request.resolveSessionId());
        return runAndRecord(session, request.query(), request.resolveModel(), sink);
    }

    /**
     * Answer again, either the given query or the last user question of the session.
     * The new exchange is appended; earlier messages stay untouched.
     */
    public Mono<TurnOutcome> regenerate(ChatRequest request, StreamingSink sink) {
        ConversationSession session = sessionRegistry.getOrCreate(request.resolveSessionId());
        Optional<String> query = request.hasQuery()
                ? Optional.of(request.query())
                : session.lastUserQuery();

        if (query.isEmpty()) {
            log.info("Nothing to regenerate in session {}", session.id());
            sink.emit(ThinkingEvent.error(NOTHING_TO_REGENERATE));
            sink.complete();
            return Mono.empty();
        }
        log.info("Regenerating answer in session {}", session.id());
        return runAndRecord(session, query.get(), request.resolveModel(), sink);
    }

    public ResetResponse reset(String sessionId) {
        String id = new ChatRequest(null, sessionId, null).resolveSessionId();
        sessionRegistry.getOrCreate(id).reset();
        log.info("Session {} reset", id);
        return new ResetResponse(RESET_MESSAGE, properties.getAgent().getIntroduction());
    }

    public List<ChatLog> turnLog(String sessionId) {
        return chatLogService.turnsOf(new ChatRequest(null, sessionId, null).resolveSessionId());
    }

    private Mono<TurnOutcome> runAndRecord(ConversationSession session, String query, String model, StreamingSink sink) {
        String loggedModel = model != null ? model : properties.getAgent().getDrafterModel();
        // the caller's stream ends only after the audit row is written
        return loopController.runTurn(session, query, model, new HeldCompletionSink(sink))
                .flatMap(outcome -> Mono.fromRunnable(() -> chatLogService.recordTurn(outcome, loggedModel))
                        .subscribeOn(Schedulers.boundedElastic())
                        .thenReturn(outcome))
                .doFinally(signal -> sink.complete());
    }

    /**
     * Forwards events but leaves completing the real sink to {@link #runAndRecord}.
     */
    private static final class HeldCompletionSink implements StreamingSink {

        private final StreamingSink delegate;

        private HeldCompletionSink(StreamingSink delegate) {
            this.delegate = delegate;
        }

        @Override
        public void emit(ThinkingEvent event) {
            delegate.emit(event);
        }

        @Override
        public void complete() {
            log.trace("Turn finished; completion held until the audit record is written");
        }
    }
}
