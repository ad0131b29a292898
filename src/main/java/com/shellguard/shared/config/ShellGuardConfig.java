package com.shellguard.shared.config;

public record ShellGuardConfig(
    PolicySettings policy,
    int traceVerbosity
) {
    public static ShellGuardConfig defaults() {
        return new ShellGuardConfig(PolicySettings.defaults(), 0);
    }
}
