package com.shellguard.observability;

/**
 * Collector for stage decisions. Level 1 is verdicts, 2 is handler detail, 3 is parser internals.
 * Messages use SLF4J {@code {}} placeholders. Implementations must not influence the verdict.
 */
public interface DecisionTrace {

    DecisionTrace NOOP = (level, message, args) -> { };

    void record(int level, String message, Object... args);
}
