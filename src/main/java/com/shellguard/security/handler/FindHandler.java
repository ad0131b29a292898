package com.shellguard.security.handler;

import com.shellguard.security.FragmentEvaluator;
import com.shellguard.shared.model.CommandFragment;
import com.shellguard.shared.model.StageResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Rejects actions that delete or write files and runs every {@code -exec}-style inner command back through the
 * pipeline.
 */
public class FindHandler implements CommandHandler {

    private static final Set<String> DESTRUCTIVE = Set.of("-delete", "-fprint", "-fprint0", "-fprintf", "-fls");
    private static final Set<String> EXEC_ACTIONS = Set.of("-exec", "-execdir", "-ok", "-okdir");
    private static final Set<String> TERMINATORS = Set.of(";", "+");

    @Override
    public HandlerResult check(List<String> args, FragmentEvaluator evaluator) {
        var trace = evaluator.trace();
        int i = 0;
        while (i < args.size()) {
            var arg = args.get(i);
            if (DESTRUCTIVE.contains(arg)) {
                trace.record(2, "find destructive action: {}", arg);
                return HandlerResult.REJECT;
            }
            if (!EXEC_ACTIONS.contains(arg)) {
                i++;
                continue;
            }
            int end = i + 1;
            while (end < args.size() && !TERMINATORS.contains(args.get(end))) {
                end++;
            }
            if (end >= args.size()) {
                trace.record(2, "find {} without terminator", arg);
                return HandlerResult.REJECT;
            }
            var inner = new ArrayList<String>();
            for (var word : args.subList(i + 1, end)) {
                if (!word.equals("{}")) {
                    inner.add(word);
                }
            }
            if (inner.isEmpty()) {
                trace.record(2, "find {} without a command", arg);
                return HandlerResult.REJECT;
            }
            if (evaluator.evaluate(CommandFragment.of(inner)) == StageResult.REJECT) {
                trace.record(2, "find {} runs a rejected command: {}", arg, inner.get(0));
                return HandlerResult.REJECT;
            }
            i = end + 1;
        }
        return HandlerResult.PASS;
    }
}
