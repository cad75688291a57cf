package com.example.Lily.agent;

import com.example.Lily.model.ThinkingEvent;

/**
 * Output channel of one turn, independent of how events reach the caller.
 * <p>
 * The loop calls {@link #emit(ThinkingEvent)} zero or more times and {@link #complete()} exactly once,
 * either after committing, after a failure, or when the turn is cancelled.
 */
public interface StreamingSink {

    void emit(ThinkingEvent event);

    void complete();
}
