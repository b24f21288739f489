package com.huntql.service.core.executor;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class ExecutionStateTest {

    @Test
    void happyPathIsAChain() {
        assertThat(ExecutionState.PENDING.canTransitionTo(ExecutionState.PARSING)).isTrue();
        assertThat(ExecutionState.PARSING.canTransitionTo(ExecutionState.OPTIMIZING)).isTrue();
        assertThat(ExecutionState.OPTIMIZING.canTransitionTo(ExecutionState.GENERATING)).isTrue();
        assertThat(ExecutionState.GENERATING.canTransitionTo(ExecutionState.EXECUTING)).isTrue();
        assertThat(ExecutionState.EXECUTING.canTransitionTo(ExecutionState.COMPLETED)).isTrue();
    }

    @Test
    void cacheHitCompletesStraightFromParsing() {
        assertThat(ExecutionState.PARSING.canTransitionTo(ExecutionState.COMPLETED)).isTrue();
        assertThat(ExecutionState.OPTIMIZING.canTransitionTo(ExecutionState.COMPLETED)).isFalse();
    }

    @Test
    void onlyExecutingCanTimeOut() {
        for (ExecutionState state : ExecutionState.values()) {
            assertThat(state.canTransitionTo(ExecutionState.TIMED_OUT)).isEqualTo(state == ExecutionState.EXECUTING);
        }
    }

    @ParameterizedTest
    @EnumSource(value = ExecutionState.class, names = {"COMPLETED", "FAILED", "TIMED_OUT"})
    void terminalStatesHaveNoSuccessor(ExecutionState terminal) {
        assertThat(terminal.isTerminal()).isTrue();
        for (ExecutionState next : ExecutionState.values()) {
            assertThat(terminal.canTransitionTo(next)).isFalse();
        }
    }

    @ParameterizedTest
    @EnumSource(value = ExecutionState.class, names = {"PENDING", "PARSING", "OPTIMIZING", "GENERATING", "EXECUTING"})
    void everyRunningStateCanFail(ExecutionState running) {
        assertThat(running.isTerminal()).isFalse();
        assertThat(running.canTransitionTo(ExecutionState.FAILED)).isTrue();
    }
}
