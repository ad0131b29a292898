package com.shellguard.security;

import com.shellguard.observability.DecisionTrace;
import com.shellguard.shared.model.CommandFragment;
import com.shellguard.shared.model.StageResult;

import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reduces the executable to its last path component and peels transparent wrappers
 * ({@code env}, {@code nice}, {@code time}, {@code command}, {@code nohup}) until the real command is exposed.
 * Wrapper options are parsed the way the wrapper itself parses them; an option outside the known set rejects.
 */
public class WrapperNormalizer {

    private static final Set<String> ENV_LONG = Set.of(
            "ignore-environment", "null", "unset", "chdir", "split-string", "debug",
            "block-signal", "default-signal", "ignore-signal", "list-signal-handling", "help", "version");
    private static final Set<String> ENV_LONG_VALUE = Set.of("unset", "chdir");
    private static final Set<String> NICE_LONG = Set.of("adjustment", "help", "version");
    private static final Set<String> TIME_LONG = Set.of(
            "format", "portability", "output", "append", "verbose", "quiet", "help", "version");
    private static final Pattern NICE_LEGACY = Pattern.compile("--?\\d+");

    private final DecisionTrace trace;

    public WrapperNormalizer(DecisionTrace trace) {
        this.trace = trace;
    }

    private record Unwrapped(StageResult result, int commandIndex) {

        static final Unwrapped REJECTED = new Unwrapped(StageResult.REJECT, -1);

        static Unwrapped at(int index) {
            return new Unwrapped(StageResult.CONTINUE, index);
        }

        static Unwrapped lookupOnly() {
            return new Unwrapped(StageResult.APPROVE, -1);
        }
    }

    public Normalization normalize(CommandFragment fragment) {
        var current = fragment;
        while (true) {
            if (current.isExpanded(0)) {
                trace.record(1, "REJECT: executable {} comes from an expansion", current.executable());
                return Normalization.conclude(StageResult.REJECT, current);
            }
            var executable = basename(current.executable());
            current = current.withExecutable(executable);
            if (!CommandSets.WRAPPERS.contains(executable)) {
                return Normalization.proceed(current);
            }
            var args = current.args();
            var unwrapped = switch (executable) {
                case "env" -> unwrapEnv(args);
                case "nice" -> unwrapNice(args);
                case "time" -> unwrapTime(args);
                case "command" -> unwrapCommand(args);
                default -> unwrapNohup(args);
            };
            if (unwrapped.result() == StageResult.REJECT) {
                trace.record(1, "REJECT: {} option outside the known set", executable);
                return Normalization.conclude(StageResult.REJECT, current);
            }
            int consumed = unwrapped.result() == StageResult.APPROVE
                    ? args.size() : Math.min(unwrapped.commandIndex(), args.size());
            if (current.expandsLeadingArgs(consumed)) {
                trace.record(1, "REJECT: {} options come from an expansion", executable);
                return Normalization.conclude(StageResult.REJECT, current);
            }
            if (unwrapped.result() == StageResult.APPROVE) {
                trace.record(1, "APPROVE: {} only looks the command up", executable);
                return Normalization.conclude(StageResult.APPROVE, current);
            }
            int index = unwrapped.commandIndex();
            if (index >= args.size()) {
                trace.record(1, "APPROVE: {} wraps no command", executable);
                return Normalization.conclude(StageResult.APPROVE, current);
            }
            trace.record(2, "Unwrapped {} -> {}", executable, args.get(index));
            current = current.unwrap(index);
        }
    }

    static String basename(String executable) {
        return executable.substring(executable.lastIndexOf('/') + 1);
    }

    private static Unwrapped unwrapEnv(List<String> args) {
        int i = 0;
        while (i < args.size()) {
            var arg = args.get(i);
            if (arg.equals("--")) {
                i++;
                break;
            }
            if (arg.equals("-")) {
                i++;
            } else if (arg.startsWith("--")) {
                var option = LongOptions.resolve(arg, ENV_LONG);
                // split-string re-splits its operand into a new command line
                if (option.isEmpty() || option.get().equals("split-string")) {
                    return Unwrapped.REJECTED;
                }
                i += ENV_LONG_VALUE.contains(option.get()) && !LongOptions.hasAttachedValue(arg) ? 2 : 1;
            } else if (arg.startsWith("-")) {
                int consumed = LongOptions.shortCluster(arg, "i0v", "uC");
                if (consumed < 0) {
                    return Unwrapped.REJECTED;
                }
                i += consumed;
            } else {
                break;
            }
        }
        // options end at the first assignment
        while (i < args.size() && args.get(i).indexOf('=') > 0) {
            i++;
        }
        return Unwrapped.at(i);
    }

    private static Unwrapped unwrapNice(List<String> args) {
        int i = 0;
        while (i < args.size()) {
            var arg = args.get(i);
            if (arg.equals("--")) {
                i++;
                break;
            }
            if (NICE_LEGACY.matcher(arg).matches()) {
                i++;
            } else if (arg.startsWith("--")) {
                var option = LongOptions.resolve(arg, NICE_LONG);
                if (option.isEmpty()) {
                    return Unwrapped.REJECTED;
                }
                i += option.get().equals("adjustment") && !LongOptions.hasAttachedValue(arg) ? 2 : 1;
            } else if (arg.startsWith("-") && arg.length() > 1) {
                int consumed = LongOptions.shortCluster(arg, "", "n");
                if (consumed < 0) {
                    return Unwrapped.REJECTED;
                }
                i += consumed;
            } else {
                break;
            }
        }
        return Unwrapped.at(i);
    }

    private static Unwrapped unwrapTime(List<String> args) {
        int i = 0;
        while (i < args.size()) {
            var arg = args.get(i);
            if (arg.equals("--")) {
                i++;
                break;
            }
            if (arg.startsWith("--")) {
                var option = LongOptions.resolve(arg, TIME_LONG);
                // GNU time writes its report to the --output file
                if (option.isEmpty() || option.get().equals("output")) {
                    return Unwrapped.REJECTED;
                }
                i += option.get().equals("format") && !LongOptions.hasAttachedValue(arg) ? 2 : 1;
            } else if (arg.startsWith("-") && arg.length() > 1) {
                int consumed = LongOptions.shortCluster(arg, "apvqV", "f");
                if (consumed < 0) {
                    return Unwrapped.REJECTED;
                }
                i += consumed;
            } else {
                break;
            }
        }
        return Unwrapped.at(i);
    }

    private static Unwrapped unwrapCommand(List<String> args) {
        int i = 0;
        while (i < args.size()) {
            var arg = args.get(i);
            if (arg.equals("--")) {
                i++;
                break;
            }
            if (!arg.startsWith("-") || arg.length() < 2) {
                break;
            }
            if (arg.startsWith("--")) {
                return Unwrapped.REJECTED;
            }
            for (int c = 1; c < arg.length(); c++) {
                switch (arg.charAt(c)) {
                    case 'v', 'V' -> {
                        // lookup only, nothing runs
                        return Unwrapped.lookupOnly();
                    }
                    case 'p' -> {
                    }
                    default -> {
                        return Unwrapped.REJECTED;
                    }
                }
            }
            i++;
        }
        return Unwrapped.at(i);
    }

    private static Unwrapped unwrapNohup(List<String> args) {
        if (args.isEmpty()) {
            return Unwrapped.at(0);
        }
        var first = args.get(0);
        if (first.equals("--")) {
            return Unwrapped.at(1);
        }
        return first.startsWith("-") && first.length() > 1 ? Unwrapped.REJECTED : Unwrapped.at(0);
    }
}
