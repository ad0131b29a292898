package com.shellguard.security.handler;

import com.shellguard.security.FragmentEvaluator;

import java.util.List;

/**
 * Rejects in-place editing in every spelling: {@code -i}, {@code -i.bak}, {@code -ni}, {@code --in-place[=SUFFIX]}
 * and unambiguous abbreviations such as {@code --in}.
 */
public class SedHandler implements CommandHandler {

    private static final String IN_PLACE = "in-place";

    @Override
    public HandlerResult check(List<String> args, FragmentEvaluator evaluator) {
        for (var arg : args) {
            if (isInPlace(arg)) {
                evaluator.trace().record(2, "sed in-place flag: {}", arg);
                return HandlerResult.REJECT;
            }
        }
        return HandlerResult.PASS;
    }

    static boolean isInPlace(String arg) {
        if (arg.startsWith("--")) {
            var name = arg.substring(2);
            int eq = name.indexOf('=');
            if (eq >= 0) {
                name = name.substring(0, eq);
            }
            return !name.isEmpty() && IN_PLACE.startsWith(name);
        }
        return arg.startsWith("-") && arg.indexOf('i', 1) > 0;
    }
}
