package com.example.Lily.tools;

import com.example.Lily.config.LilyProperties;
import com.example.Lily.model.ToolCall;
import com.example.Lily.model.ToolResult;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * Runs a batch of tool calls concurrently and returns exactly one result per call, in call order.
 * <p>
 * A failing or timed-out call becomes a failure-marked result; it never aborts the batch and is
 * never retried here.
 */
@Service
@RequiredArgsConstructor
public class ToolDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ToolDispatcher.class);

    static final String NO_RESULTS = "No results.";

    private final ToolRegistry toolRegistry;
    private final LilyProperties properties;

    public Mono<List<ToolResult>> dispatch(List<ToolCall> batch) {
        if (batch == null || batch.isEmpty()) {
            return Mono.just(List.of());
        }
        Duration timeout = properties.getAgent().getToolTimeout();
        return Flux.fromIterable(batch)
                // Subscribes to all calls at once but emits results in input order
                .flatMapSequential(call -> execute(call, timeout), batch.size())
                .collectList()
                .doOnNext(results -> log.info("Tool batch finished: {} call(s), {} failed",
                        results.size(), results.stream().filter(ToolResult::failed).count()));
    }

    private Mono<ToolResult> execute(ToolCall call, Duration timeout) {
        Optional<RetrievalTool> tool = toolRegistry.findByName(call.toolName());
        if (tool.isEmpty()) {
            log.warn("Tool call names unknown tool '{}'", call.toolName());
            return Mono.just(ToolResult.failure(String.valueOf(call.toolName()), "unknown tool"));
        }

        return Mono.fromCallable(() -> tool.get().execute(call.arguments()))
                .subscribeOn(Schedulers.boundedElastic())
                .timeout(timeout)
                .map(payload -> ToolResult.external(call.toolName(), payload))
                .defaultIfEmpty(ToolResult.external(call.toolName(), NO_RESULTS))
                .onErrorResume(e -> {
                    String reason = describe(e, timeout);
                    log.warn("Tool call {} {} failed: {}", call.toolName(), call.arguments(), reason);
                    return Mono.just(ToolResult.failure(call.toolName(), reason));
                });
    }

    private String describe(Throwable e, Duration timeout) {
        if (e instanceof TimeoutException) {
            return "timed out after " + timeout.toMillis() + " ms";
        }
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
