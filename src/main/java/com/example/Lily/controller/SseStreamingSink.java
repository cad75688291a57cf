package com.example.Lily.controller;

import com.example.Lily.agent.StreamingSink;
import com.example.Lily.model.ThinkingEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bridges turn events into an {@link SseEmitter}. The stage is used as SSE event name so the
 * frontend can handle each stage separately.
 */
public class SseStreamingSink implements StreamingSink {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingSink.class);

    private final SseEmitter emitter;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public SseStreamingSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void emit(ThinkingEvent event) {
        if (closed.get()) {
            return;
        }
        try {
            emitter.send(SseEmitter.event()
                    .name(event.stage())
                    .data(event));
        } catch (IOException e) {
            log.debug("SSE client went away: {}", e.getMessage());
            if (closed.compareAndSet(false, true)) {
                emitter.completeWithError(e);
            }
        }
    }

    @Override
    public void complete() {
        if (closed.compareAndSet(false, true)) {
            emitter.complete();
        }
    }

    /**
     * Marks the sink closed after the emitter was completed from outside.
     */
    void close() {
        closed.set(true);
    }
}
