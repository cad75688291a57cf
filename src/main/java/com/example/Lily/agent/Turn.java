package com.example.Lily.agent;

import com.example.Lily.model.CommitReason;
import com.example.Lily.model.Message;
import com.example.Lily.model.QueryAnalysis;
import com.example.Lily.model.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Working state of one user query while the loop processes it.
 * <p>
 * Stages of a turn run strictly one after another, so the mutable fields are only touched
 * by one thread at a time; {@link #cancel()} may come from any thread.
 */
public class Turn {

    private static final Logger log = LoggerFactory.getLogger(Turn.class);

    private final String id = UUID.randomUUID().toString().substring(0, 8);
    private final String sessionId;
    private final String query;
    private final String model;
    private final List<Message> history;

    private final List<TurnState> trail = new ArrayList<>();
    private final List<ToolResult> evidence = new ArrayList<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final Sinks.One<Boolean> cancellation = Sinks.one();

    private volatile TurnState state = TurnState.ANALYZING;
    private QueryAnalysis analysis;
    private String candidate;
    private int retryCount;
    private CommitReason commitReason;

    /**
     * @param history snapshot of the conversation before this query; never includes the query itself
     * @param model   optional drafter model override, null for the configured one
     */
    public Turn(String sessionId, String query, String model, List<Message> history) {
        this.sessionId = sessionId;
        this.query = query;
        this.model = model;
        this.history = List.copyOf(history);
        this.trail.add(state);
    }

    public synchronized void transition(TurnState next) {
        if (!state.canTransitionTo(next)) {
            throw new IllegalStateException("Illegal turn transition " + state + " -> " + next + " (turn=" + id + ")");
        }
        log.debug("Turn {} {} -> {}", id, state, next);
        state = next;
        trail.add(next);
    }

    /**
     * Fold judge feedback into the evidence set and count one retry.
     */
    public void recordRetry(String feedback) {
        evidence.add(ToolResult.judgeFeedback(feedback));
        retryCount++;
    }

    public void addEvidence(List<ToolResult> results) {
        evidence.addAll(results);
    }

    /**
     * Request cancellation. Returns false if the turn was already cancelled.
     */
    public boolean cancel() {
        if (cancelled.compareAndSet(false, true)) {
            cancellation.tryEmitValue(Boolean.TRUE);
            return true;
        }
        return false;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Emits once {@link #cancel()} is called.
     */
    public Mono<Boolean> cancellation() {
        return cancellation.asMono();
    }

    public String id() {
        return id;
    }

    public String sessionId() {
        return sessionId;
    }

    public String query() {
        return query;
    }

    public String model() {
        return model;
    }

    public List<Message> history() {
        return history;
    }

    public TurnState state() {
        return state;
    }

    public synchronized List<TurnState> trail() {
        return List.copyOf(trail);
    }

    public QueryAnalysis analysis() {
        return analysis;
    }

    public void setAnalysis(QueryAnalysis analysis) {
        this.analysis = analysis;
    }

    public List<ToolResult> evidence() {
        return List.copyOf(evidence);
    }

    public String candidate() {
        return candidate;
    }

    public void setCandidate(String candidate) {
        this.candidate = candidate;
    }

    public int retryCount() {
        return retryCount;
    }

    /**
     * 1-based number of the draft currently being produced or judged.
     */
    public int round() {
        return retryCount + 1;
    }

    public CommitReason commitReason() {
        return commitReason;
    }

    public void setCommitReason(CommitReason commitReason) {
        this.commitReason = commitReason;
    }
}
