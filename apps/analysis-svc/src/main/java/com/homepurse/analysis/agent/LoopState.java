package com.homepurse.analysis.agent;

public enum LoopState {
    INIT,
    GENERATING,
    VALIDATING,
    EXECUTING,
    REPAIRING,
    SUCCEEDED,
    EXHAUSTED;

    public boolean isTerminal() {
        return this == SUCCEEDED || this == EXHAUSTED;
    }
}
