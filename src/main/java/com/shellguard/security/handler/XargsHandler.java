package com.shellguard.security.handler;

import com.shellguard.security.FragmentEvaluator;
import com.shellguard.security.LongOptions;
import com.shellguard.shared.model.CommandFragment;
import com.shellguard.shared.model.StageResult;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Strips xargs' own options and evaluates the command it would run. With no command xargs echoes its input.
 * Options are read as GNU xargs reads them; one it does not know makes the command position uncertain and rejects.
 */
public class XargsHandler implements CommandHandler {

    private static final String SHORT_FLAGS = "0prtx";
    private static final String SHORT_VALUED = "aEILnsPd";
    /** Take a value only when it is attached, as in {@code -i{}}. */
    private static final String SHORT_OPTIONAL = "eil";

    private static final Set<String> LONG_VALUED = Set.of(
            "arg-file", "delimiter", "max-args", "max-chars", "max-procs", "process-slot-var");
    private static final Set<String> LONG_OPTIONAL = Set.of("replace", "eof", "max-lines");
    private static final Set<String> LONG_FLAGS = Set.of(
            "null", "open-tty", "interactive", "no-run-if-empty", "show-limits", "verbose", "exit", "help", "version");
    private static final Set<String> LONG_ALL = union(LONG_VALUED, LONG_OPTIONAL, LONG_FLAGS);

    @Override
    public HandlerResult check(List<String> args, FragmentEvaluator evaluator) {
        int i = 0;
        while (i < args.size()) {
            var arg = args.get(i);
            if (arg.equals("--")) {
                i++;
                break;
            }
            int consumed;
            if (arg.startsWith("--")) {
                consumed = longOption(arg);
            } else if (arg.startsWith("-") && arg.length() > 1) {
                consumed = shortCluster(arg);
            } else {
                break;
            }
            if (consumed < 0) {
                evaluator.trace().record(2, "xargs option {} is not understood", arg);
                return HandlerResult.REJECT;
            }
            i += consumed;
        }
        if (i >= args.size()) {
            return HandlerResult.PASS;
        }
        var inner = CommandFragment.of(args.subList(i, args.size()));
        if (evaluator.evaluate(inner) == StageResult.REJECT) {
            evaluator.trace().record(2, "xargs runs a rejected command: {}", inner.executable());
            return HandlerResult.REJECT;
        }
        return HandlerResult.PASS;
    }

    private static int longOption(String arg) {
        var option = LongOptions.resolve(arg, LONG_ALL);
        if (option.isEmpty()) {
            return -1;
        }
        if (LONG_VALUED.contains(option.get())) {
            return LongOptions.hasAttachedValue(arg) ? 1 : 2;
        }
        if (LONG_FLAGS.contains(option.get()) && LongOptions.hasAttachedValue(arg)) {
            return -1;
        }
        return 1;
    }

    private static int shortCluster(String arg) {
        for (int c = 1; c < arg.length(); c++) {
            char ch = arg.charAt(c);
            if (SHORT_OPTIONAL.indexOf(ch) >= 0) {
                return 1;
            }
            if (SHORT_VALUED.indexOf(ch) >= 0) {
                return c + 1 < arg.length() ? 1 : 2;
            }
            if (SHORT_FLAGS.indexOf(ch) < 0) {
                return -1;
            }
        }
        return 1;
    }

    @SafeVarargs
    private static Set<String> union(Set<String>... sets) {
        var all = new HashSet<String>();
        for (var set : sets) {
            all.addAll(set);
        }
        return Set.copyOf(all);
    }
}
