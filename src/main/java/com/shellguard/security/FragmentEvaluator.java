package com.shellguard.security;

import com.shellguard.observability.DecisionTrace;
import com.shellguard.shared.model.CommandFragment;
import com.shellguard.shared.model.StageResult;

/**
 * Re-entry point for handlers that need to judge an embedded command with the same policy as the outer one.
 */
@FunctionalInterface
public interface FragmentEvaluator {

    StageResult evaluate(CommandFragment fragment);

    default DecisionTrace trace() {
        return DecisionTrace.NOOP;
    }
}
