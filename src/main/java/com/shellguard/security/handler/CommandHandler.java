package com.shellguard.security.handler;

import com.shellguard.security.FragmentEvaluator;

import java.util.List;

/**
 * Argument-aware check for one executable. PASS only means "nothing dangerous found"; later stages still decide.
 */
public interface CommandHandler {

    /**
     * @param args      arguments after the executable, quotes already removed
     * @param evaluator pipeline to judge embedded commands with the same policy
     */
    HandlerResult check(List<String> args, FragmentEvaluator evaluator);
}
