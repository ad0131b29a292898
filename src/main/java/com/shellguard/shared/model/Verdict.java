package com.shellguard.shared.model;

/**
 * Command-level outcome. FALLTHROUGH defers to the normal approval gate.
 */
public enum Verdict {
    APPROVE,
    FALLTHROUGH
}
