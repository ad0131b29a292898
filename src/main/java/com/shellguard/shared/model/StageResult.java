package com.shellguard.shared.model;

/**
 * Outcome of one pipeline stage for a single fragment.
 */
public enum StageResult {
    REJECT,
    CONTINUE,
    APPROVE;

    public boolean isConclusive() {
        return this != CONTINUE;
    }
}
