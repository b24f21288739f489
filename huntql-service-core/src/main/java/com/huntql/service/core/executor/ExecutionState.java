package com.huntql.service.core.executor;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one {@code execute} call.
 *
 * <pre>
 * PENDING -> PARSING -> OPTIMIZING -> GENERATING -> EXECUTING -> COMPLETED | FAILED | TIMED_OUT
 *            PARSING -> COMPLETED (cache hit)
 * </pre>
 * Every non-terminal state may also go to {@code FAILED}.
 */
public enum ExecutionState {
    PENDING,
    PARSING,
    OPTIMIZING,
    GENERATING,
    EXECUTING,
    COMPLETED,
    FAILED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == TIMED_OUT;
    }

    public boolean canTransitionTo(ExecutionState next) {
        return successors().contains(next);
    }

    private Set<ExecutionState> successors() {
        return switch (this) {
            case PENDING -> EnumSet.of(PARSING, FAILED);
            case PARSING -> EnumSet.of(OPTIMIZING, COMPLETED, FAILED);
            case OPTIMIZING -> EnumSet.of(GENERATING, FAILED);
            case GENERATING -> EnumSet.of(EXECUTING, FAILED);
            case EXECUTING -> EnumSet.of(COMPLETED, FAILED, TIMED_OUT);
            case COMPLETED, FAILED, TIMED_OUT -> EnumSet.noneOf(ExecutionState.class);
        };
    }
}
