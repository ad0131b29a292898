package com.shellguard.security;

import com.shellguard.shared.model.CommandFragment;
import com.shellguard.shared.model.StageResult;

/**
 * Result of wrapper normalization: either a conclusive stage result or the unwrapped fragment to keep evaluating.
 */
public record Normalization(StageResult result, CommandFragment fragment) {

    static Normalization proceed(CommandFragment fragment) {
        return new Normalization(StageResult.CONTINUE, fragment);
    }

    static Normalization conclude(StageResult result, CommandFragment fragment) {
        return new Normalization(result, fragment);
    }

    public boolean isConclusive() {
        return result.isConclusive();
    }
}
