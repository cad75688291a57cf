package com.example.Lily.controller;

import com.example.Lily.agent.TurnInProgressException;
import com.example.Lily.model.ChatLog;
import com.example.Lily.model.ChatRequest;
import com.example.Lily.model.ResetResponse;
import com.example.Lily.model.TurnOutcome;
import com.example.Lily.service.AgentChatService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.function.Function;

@RestController
@RequestMapping("/api")
@Tag(name = "chat")
@RequiredArgsConstructor
public class ChatController {

    private static final Logger log = LoggerFactory.getLogger(ChatController.class);

    private final AgentChatService chatService;

    /**
     * Stream one turn as SSE events: start / analysis / retrieval / answer_delta / validation / retry
     * / answer_final, or a single error event.
     */
    @PostMapping(value = "/chat", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter chat(@RequestBody ChatRequest request) {
        if (!request.hasQuery()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "query is required");
        }
        return stream(sink -> chatService.chat(request, sink));
    }

    @PostMapping(value = "/regenerate", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter regenerate(@RequestBody(required = false) ChatRequest request) {
        ChatRequest effective = request != null ? request : new ChatRequest(null, null, null);
        return stream(sink -> chatService.regenerate(effective, sink));
    }

    @PostMapping("/reset")
    public ResetResponse reset(@RequestBody(required = false) ChatRequest request) {
        return chatService.reset(request != null ? request.sessionId() : null);
    }

    /**
     * Audit log of committed turns for one session, oldest first.
     */
    @GetMapping("/chat-log")
    public List<ChatLog> chatLog(@RequestParam(required = false) String sessionId) {
        return chatService.turnLog(sessionId);
    }

    private SseEmitter stream(Function<SseStreamingSink, Mono<TurnOutcome>> turn) {
        // 0L means no timeout; the turn itself is bounded by lily.agent.turn-timeout
        SseEmitter emitter = new SseEmitter(0L);
        SseStreamingSink sink = new SseStreamingSink(emitter);

        Disposable subscription = turn.apply(sink).subscribe(
                outcome -> log.debug("Streamed turn for session {}", outcome.sessionId()),
                error -> {
                    // the loop already reported the problem to the client through the sink
                    if (error instanceof TurnInProgressException busy) {
                        log.info("Session {} busy, query rejected", busy.getSessionId());
                    } else {
                        log.error("Chat stream failed", error);
                    }
                    sink.complete();
                },
                sink::complete
        );

        // Ensure we clean up the subscription when the SSE connection ends
        emitter.onCompletion(subscription::dispose);
        emitter.onTimeout(() -> {
            sink.close();
            subscription.dispose();
        });
        emitter.onError(t -> {
            sink.close();
            subscription.dispose();
        });

        return emitter;
    }
}
