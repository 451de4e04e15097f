package com.homepurse.analysis.agent;

import com.homepurse.analysis.audit.AttemptRecord;
import java.util.List;

/**
 * What the repair loop produced for one question. {@code finalSql} and {@code result} are set only
 * when the run succeeded; {@code lastFailure} only when it was exhausted.
 */
public record AgentRun(
        LoopState state,
        List<AttemptRecord> attempts,
        String finalSql,
        QueryResult result,
        String lastFailure
) {
    public AgentRun {
        attempts = List.copyOf(attempts);
        if (!state.isTerminal()) {
            throw new IllegalArgumentException("A run must end in a terminal state, was " + state);
        }
    }

    public boolean succeeded() {
        return state == LoopState.SUCCEEDED;
    }

    public int attemptCount() {
        return attempts.size();
    }
}
