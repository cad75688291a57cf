package com.example.Lily.agent;

import com.example.Lily.config.LilyProperties;
import com.example.Lily.model.CommitReason;
import com.example.Lily.model.Message;
import com.example.Lily.model.QueryAnalysis;
import com.example.Lily.model.ResponseValidation;
import com.example.Lily.model.ThinkingEvent;
import com.example.Lily.model.ToolCall;
import com.example.Lily.model.ToolResult;
import com.example.Lily.model.TurnOutcome;
import com.example.Lily.tools.ToolDispatcher;
import com.example.Lily.tools.ToolRegistry;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs one turn through analyze, retrieve, draft and validate, retrying the draft with judge
 * feedback until it is accepted or the retry budget is spent, then commits the exchange.
 *
 * <pre>
 * ANALYZING -> (RETRIEVING) -> DRAFTING -> VALIDATING -> COMMITTING
 *                                  ^            |
 *                                  +-- retry ---+
 * </pre>
 *
 * Stages are strictly sequential. Only a completed COMMITTING step touches history, and it appends
 * the (user, agent) pair as one unit.
 */
@Service
@RequiredArgsConstructor
public class LoopController {

    private static final Logger log = LoggerFactory.getLogger(LoopController.class);

    static final String GENERATION_ERROR_MESSAGE =
            "Sorry, I couldn't generate an answer right now. Please try asking again.";
    static final String BUSY_MESSAGE =
            "I'm still working on your previous question. Please wait for it to finish.";

    private final QueryAnalyzer queryAnalyzer;
    private final ToolDispatcher toolDispatcher;
    private final ToolRegistry toolRegistry;
    private final DraftGenerator draftGenerator;
    private final ResponseValidator responseValidator;
    private final LilyProperties properties;

    /**
     * Process one user query in {@code session}.
     * <p>
     * The returned Mono emits the outcome once the turn is committed. It completes empty when the
     * turn failed (an error event was emitted to the sink) or was cancelled, and errors with
     * {@link TurnInProgressException} if the session is busy. Disposing the subscription cancels the turn.
     *
     * @param model optional drafter model override
     */
    public Mono<TurnOutcome> runTurn(ConversationSession session, String query, String model, StreamingSink sink) {
        return Mono.defer(() -> {
            TurnSink turnSink = new TurnSink(sink);
            List<Message> history;
            try {
                history = session.history().snapshot();
            } catch (RuntimeException e) {
                log.error("Could not load history of session {}", session.id(), e);
                turnSink.emit(ThinkingEvent.error(GENERATION_ERROR_MESSAGE));
                turnSink.complete();
                return Mono.<TurnOutcome>empty();
            }

            Turn turn = new Turn(session.id(), query, model, history);
            if (!session.claim(turn)) {
                log.info("Rejecting query for session {}: a turn is already in progress", session.id());
                turnSink.emit(ThinkingEvent.error(BUSY_MESSAGE));
                turnSink.complete();
                return Mono.<TurnOutcome>error(new TurnInProgressException(session.id()));
            }

            log.info("Turn {} started (session={})", turn.id(), session.id());
            Duration turnTimeout = properties.getAgent().getTurnTimeout();

            return process(turn, session, turnSink)
                    .timeout(turnTimeout, Mono.error(() -> new GenerationException(
                            "Turn timed out after " + turnTimeout.toMillis() + " ms")))
                    .onErrorResume(e -> fail(turn, session, turnSink, e))
                    .takeUntilOther(turn.cancellation())
                    .doFinally(signal -> finish(turn, session, turnSink, signal));
        });
    }

    private Mono<TurnOutcome> process(Turn turn, ConversationSession session, StreamingSink sink) {
        sink.emit(new ThinkingEvent(
                ThinkingEvent.START,
                "Request received. Analyzing your question.",
                Map.of("turnId", turn.id(), "ts", System.currentTimeMillis())
        ));

        return analyze(turn)
                .flatMap(analysis -> {
                    turn.setAnalysis(analysis);
                    sink.emit(new ThinkingEvent(ThinkingEvent.ANALYSIS, "Classified the question.", summarize(analysis)));
                    return analysis.needsRetrieval() ? retrieve(turn, sink) : Mono.just(turn);
                })
                .flatMap(t -> draftRound(t, sink))
                .flatMap(t -> commit(t, session, sink));
    }

    private Mono<QueryAnalysis> analyze(Turn turn) {
        return queryAnalyzer.analyze(turn.history(), turn.query())
                .onErrorResume(AnalysisException.class, e -> {
                    log.warn("Turn {}: analysis failed, assuming in-scope with retrieval: {}", turn.id(), e.getMessage());
                    return Mono.just(QueryAnalysis.failOpen());
                });
    }

    private Mono<Turn> retrieve(Turn turn, StreamingSink sink) {
        turn.transition(TurnState.RETRIEVING);
        List<ToolCall> batch = planToolCalls(turn);
        log.info("Turn {}: dispatching {} tool call(s)", turn.id(), batch.size());

        return toolDispatcher.dispatch(batch)
                .map(results -> {
                    turn.addEvidence(results);
                    sink.emit(new ThinkingEvent(
                            ThinkingEvent.RETRIEVAL,
                            "Searched repair guides and the parts catalog.",
                            results.stream().map(LoopController::summarize).toList()
                    ));
                    return turn;
                });
    }

    /**
     * Analyzer hints first; when there are none, one default call per registered tool.
     */
    List<ToolCall> planToolCalls(Turn turn) {
        List<ToolCall> hints = turn.analysis().retrievalHints();
        List<ToolCall> planned = hints.isEmpty() ? toolRegistry.defaultCalls(turn.query()) : hints;
        int max = properties.getAgent().getMaxToolCalls();
        if (planned.size() > max) {
            log.debug("Turn {}: capping {} tool calls to {}", turn.id(), planned.size(), max);
            return planned.subList(0, max);
        }
        return planned;
    }

    private Mono<Turn> draftRound(Turn turn, StreamingSink sink) {
        return Mono.defer(() -> {
            turn.transition(TurnState.DRAFTING);
            int round = turn.round();
            StringBuilder buffer = new StringBuilder();

            return draftGenerator.generate(turn.history(), turn.query(), turn.analysis(), turn.evidence(), turn.model())
                    .doOnNext(token -> {
                        buffer.append(token);
                        sink.emit(new ThinkingEvent(ThinkingEvent.ANSWER_DELTA, "Generating answer.", token));
                    })
                    .then(Mono.fromCallable(buffer::toString))
                    .flatMap(candidate -> {
                        if (candidate.isBlank()) {
                            return Mono.<ResponseValidation>error(new GenerationException("Drafter returned an empty answer"));
                        }
                        turn.setCandidate(candidate);
                        turn.transition(TurnState.VALIDATING);
                        return validate(turn);
                    })
                    .flatMap(validation -> {
                        sink.emit(new ThinkingEvent(ThinkingEvent.VALIDATION, "Reviewed the draft.", summarize(validation, round)));

                        Optional<CommitReason> commitReason = decide(turn, validation);
                        if (commitReason.isPresent()) {
                            turn.setCommitReason(commitReason.get());
                            return Mono.just(turn);
                        }

                        turn.recordRetry(validation.feedback());
                        log.info("Turn {}: draft {} rejected, retrying ({}/{}): {}", turn.id(), round,
                                turn.retryCount(), properties.getAgent().getMaxRetries(), validation.feedback());
                        sink.emit(new ThinkingEvent(
                                ThinkingEvent.RETRY,
                                "Improving the answer based on review feedback.",
                                Map.of("round", turn.round(), "feedback", validation.feedback())
                        ));
                        return draftRound(turn, sink);
                    });
        });
    }

    private Mono<ResponseValidation> validate(Turn turn) {
        return responseValidator.validate(turn.candidate(), turn.evidence(), turn.analysis())
                .onErrorResume(ValidationException.class, e -> {
                    log.warn("Turn {}: validation failed, accepting draft {} without review: {}",
                            turn.id(), turn.round(), e.getMessage());
                    return Mono.just(ResponseValidation.failOpen());
                });
    }

    /**
     * Empty means "retry with the judge's feedback".
     */
    Optional<CommitReason> decide(Turn turn, ResponseValidation validation) {
        if (validation.accepted()) {
            return Optional.of(validation.fallback() ? CommitReason.VALIDATION_FALLBACK : CommitReason.ACCEPTED);
        }
        if (!validation.hasActionableFeedback()) {
            return Optional.of(CommitReason.NON_ACTIONABLE_REJECTION);
        }
        if (turn.retryCount() >= properties.getAgent().getMaxRetries()) {
            return Optional.of(CommitReason.RETRY_BUDGET_EXHAUSTED);
        }
        return Optional.empty();
    }

    private Mono<TurnOutcome> commit(Turn turn, ConversationSession session, StreamingSink sink) {
        CommitReason reason = turn.commitReason();
        Message agentMessage = Message.agent(turn.candidate(), reason);

        if (!session.commit(turn, List.of(Message.user(turn.query()), agentMessage))) {
            log.info("Turn {} was cancelled before commit; history untouched", turn.id());
            return Mono.empty();
        }
        turn.transition(TurnState.COMMITTING);

        TurnOutcome outcome = new TurnOutcome(
                turn.sessionId(),
                turn.query(),
                turn.candidate(),
                reason,
                turn.round(),
                turn.analysis(),
                turn.evidence(),
                draftGenerator.buildPrompt(turn.history(), turn.query(), turn.analysis(), turn.evidence())
        );
        log.info("Turn {} committed: reason={}, rounds={}", turn.id(), reason, outcome.rounds());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("answer", outcome.answer());
        payload.put("commitReason", reason.name());
        payload.put("lowConfidence", outcome.lowConfidence());
        payload.put("rounds", outcome.rounds());
        sink.emit(new ThinkingEvent(ThinkingEvent.ANSWER_FINAL, "Finalized answer.", payload));
        // free the slot before the client sees the end of the stream
        session.release(turn);
        sink.complete();
        return Mono.just(outcome);
    }

    private Mono<TurnOutcome> fail(Turn turn, ConversationSession session, StreamingSink sink, Throwable e) {
        if (e instanceof GenerationException) {
            log.error("Turn {} failed: {}", turn.id(), e.getMessage());
        } else {
            log.error("Turn {} failed unexpectedly", turn.id(), e);
        }
        if (!turn.state().isTerminal()) {
            turn.transition(TurnState.FAILED);
        }
        sink.emit(ThinkingEvent.error(GENERATION_ERROR_MESSAGE));
        session.release(turn);
        sink.complete();
        return Mono.empty();
    }

    private void finish(Turn turn, ConversationSession session, StreamingSink sink, SignalType signal) {
        if (!turn.state().isTerminal()) {
            turn.transition(TurnState.CANCELLED);
            log.info("Turn {} cancelled ({}) before commit", turn.id(), signal);
        }
        session.release(turn);
        sink.complete();
    }

    private static Map<String, Object> summarize(QueryAnalysis analysis) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("inScope", analysis.inScope());
        summary.put("needsRetrieval", analysis.needsRetrieval());
        summary.put("rationale", analysis.rationale());
        summary.put("fallback", analysis.fallback());
        return summary;
    }

    private static Map<String, Object> summarize(ResponseValidation validation, int round) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("round", round);
        summary.put("accepted", validation.accepted());
        summary.put("inScope", validation.inScope());
        summary.put("hallucinationDetected", validation.hallucinationDetected());
        summary.put("appropriate", validation.appropriate());
        summary.put("fallback", validation.fallback());
        if (validation.feedback() != null) {
            summary.put("feedback", validation.feedback());
        }
        return summary;
    }

    private static Map<String, Object> summarize(ToolResult result) {
        String preview = String.valueOf(result.payload());
        if (preview.length() > 200) {
            preview = preview.substring(0, 200) + "...";
        }
        return Map.of(
                "tool", result.sourceTool(),
                "failed", result.failed(),
                "preview", preview
        );
    }

    /**
     * Makes {@link StreamingSink#complete()} idempotent and drops events after completion.
     */
    private static final class TurnSink implements StreamingSink {

        private final StreamingSink delegate;
        private final AtomicBoolean completed = new AtomicBoolean(false);

        private TurnSink(StreamingSink delegate) {
            this.delegate = delegate;
        }

        @Override
        public void emit(ThinkingEvent event) {
            if (!completed.get()) {
                delegate.emit(event);
            }
        }

        @Override
        public void complete() {
            if (completed.compareAndSet(false, true)) {
                delegate.complete();
            }
        }
    }
}
