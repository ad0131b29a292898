package com.shellguard.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Appends decisions up to the configured verbosity to the {@code com.shellguard.trace} logger (a file appender in logback.xml).
 */
public class LoggingDecisionTrace implements DecisionTrace {

    private static final Logger trace = LoggerFactory.getLogger("com.shellguard.trace");

    private final int verbosity;

    public LoggingDecisionTrace(int verbosity) {
        this.verbosity = verbosity;
    }

    public static DecisionTrace forVerbosity(int verbosity) {
        return verbosity > 0 ? new LoggingDecisionTrace(verbosity) : DecisionTrace.NOOP;
    }

    @Override
    public void record(int level, String message, Object... args) {
        if (level > verbosity) return;
        trace.info("[{}] " + message, prepend(level, args));
    }

    public int verbosity() { return verbosity; }

    private static Object[] prepend(int level, Object[] args) {
        var all = new Object[args.length + 1];
        all[0] = level;
        System.arraycopy(args, 0, all, 1, args.length);
        return all;
    }
}
