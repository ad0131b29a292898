package com.shellguard.security.handler;

import com.shellguard.observability.DecisionTrace;
import com.shellguard.security.FragmentEvaluator;
import com.shellguard.security.LongOptions;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Lexical scan of awk programs, active only in awk safe mode. Programs loaded from files or extensions cannot be
 * seen and are rejected; inline programs are rejected when they call {@code system()}, pipe, or redirect output.
 * Options follow gawk's parsing, attached and abbreviated forms included.
 */
public class AwkHandler implements CommandHandler {

    private static final Pattern SYSTEM_CALL = Pattern.compile("\\bsystem\\s*\\(");

    private static final String SHORT_HIDDEN = "fEil";
    private static final String SHORT_WRITERS = "dDop";
    private static final String SHORT_VALUED = "FvZ";
    private static final String SHORT_FLAGS = "bcCghnNOMPrsStVY";

    private static final Set<String> LONG_VALUED = Set.of("field-separator", "assign", "locale");
    private static final Set<String> LONG_HIDDEN = Set.of("file", "exec", "include", "load");
    private static final Set<String> LONG_WRITERS = Set.of("dump-variables", "profile", "pretty-print", "debug");
    private static final Set<String> LONG_FLAGS = Set.of(
            "characters-as-bytes", "traditional", "posix", "re-interval", "lint", "optimize", "no-optimize",
            "sandbox", "copyright", "version", "help", "usage", "use-lc-numeric", "non-decimal-data", "bignum",
            "csv", "gen-pot", "lint-old");
    private static final Set<String> LONG_ALL = longOptions();

    @Override
    public HandlerResult check(List<String> args, FragmentEvaluator evaluator) {
        var trace = evaluator.trace();
        var programs = new ArrayList<String>();
        boolean inlineSource = false;
        int i = 0;
        while (i < args.size()) {
            var arg = args.get(i);
            if (arg.equals("--")) {
                i++;
                break;
            }
            if (arg.startsWith("--")) {
                var option = LongOptions.resolve(arg, LONG_ALL);
                if (option.isEmpty() || rejects(option.get(), arg, trace)) {
                    return HandlerResult.REJECT;
                }
                var name = option.get();
                boolean attached = LongOptions.hasAttachedValue(arg);
                if (name.equals("source")) {
                    if (attached) {
                        programs.add(arg.substring(arg.indexOf('=') + 1));
                    } else if (i + 1 < args.size()) {
                        programs.add(args.get(i + 1));
                    }
                    inlineSource = true;
                }
                i += (name.equals("source") || LONG_VALUED.contains(name)) && !attached ? 2 : 1;
            } else if (arg.startsWith("-") && arg.length() > 1) {
                int before = programs.size();
                int consumed = shortCluster(arg, args, i, programs, trace);
                if (consumed < 0) {
                    return HandlerResult.REJECT;
                }
                inlineSource |= programs.size() > before;
                i += consumed;
            } else {
                break;
            }
        }
        if (!inlineSource && i < args.size()) {
            programs.add(args.get(i));
        }
        for (var program : programs) {
            if (SYSTEM_CALL.matcher(program).find() || program.contains("|") || program.contains(">")
                    || program.contains("@load") || program.contains("@include")) {
                trace.record(2, "awk program may run commands or write files");
                return HandlerResult.REJECT;
            }
        }
        return HandlerResult.PASS;
    }

    private static boolean rejects(String option, String arg, DecisionTrace trace) {
        if (LONG_HIDDEN.contains(option)) {
            trace.record(2, "awk program loaded from elsewhere: {}", arg);
            return true;
        }
        if (LONG_WRITERS.contains(option)) {
            trace.record(2, "awk option {} writes a file", arg);
            return true;
        }
        return false;
    }

    /** Number of words the cluster at {@code index} consumes, or -1 when it must be rejected. */
    private static int shortCluster(String arg, List<String> args, int index, List<String> programs,
                                    DecisionTrace trace) {
        for (int c = 1; c < arg.length(); c++) {
            char ch = arg.charAt(c);
            boolean last = c + 1 == arg.length();
            if (SHORT_HIDDEN.indexOf(ch) >= 0) {
                trace.record(2, "awk program loaded from elsewhere: {}", arg);
                return -1;
            }
            if (SHORT_WRITERS.indexOf(ch) >= 0) {
                trace.record(2, "awk option {} writes a file", arg);
                return -1;
            }
            if (ch == 'e') {
                if (!last) {
                    programs.add(arg.substring(c + 1));
                    return 1;
                }
                if (index + 1 < args.size()) {
                    programs.add(args.get(index + 1));
                }
                return 2;
            }
            if (SHORT_VALUED.indexOf(ch) >= 0) {
                return last ? 2 : 1;
            }
            if (ch == 'L') {
                // optional lint value, attached only
                return 1;
            }
            if (SHORT_FLAGS.indexOf(ch) < 0) {
                trace.record(2, "awk option {} is not understood", arg);
                return -1;
            }
        }
        return 1;
    }

    private static Set<String> longOptions() {
        var all = new HashSet<String>();
        all.add("source");
        all.addAll(LONG_VALUED);
        all.addAll(LONG_HIDDEN);
        all.addAll(LONG_WRITERS);
        all.addAll(LONG_FLAGS);
        return Set.copyOf(all);
    }
}
