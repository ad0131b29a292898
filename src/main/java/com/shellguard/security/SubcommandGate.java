package com.shellguard.security;

import com.shellguard.observability.DecisionTrace;
import com.shellguard.shared.model.CommandFragment;
import com.shellguard.shared.model.StageResult;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Per-executable allow-list of subcommands. The first non-flag argument is the subcommand; {@code git} gets its
 * own global-flag parsing plus guards for configuration that would make git run another program.
 */
public class SubcommandGate {

    private static final Set<String> GIT_FLAGS_WITH_VALUE = Set.of("-C", "-c", "--git-dir", "--work-tree", "--namespace");
    private static final Set<String> GIT_FLAGS_NO_VALUE = Set.of("--no-pager", "--bare", "--no-replace-objects");
    private static final Set<String> CONFIG_SCOPE_FLAGS = Set.of("--global", "--system", "--file", "-f");

    /** Config keys whose value git executes as a command. */
    private static final Pattern COMMAND_KEY = Pattern.compile(
            "core\\.(pager|editor|sshcommand|fsmonitor|askpass)|pager\\..+|sequence\\.editor|diff\\.external"
                    + "|diff\\..+\\.(textconv|command)|gpg(\\..+)?\\.program|credential(\\..+)?\\.helper"
                    + "|interactive\\.difffilter|filter\\..+\\.(clean|smudge|process)|merge\\..+\\.driver");
    /** Config keys that are never acceptable on the command line, whatever their value. */
    private static final Pattern FORBIDDEN_KEY = Pattern.compile(
            "alias\\..+|core\\.hookspath|include\\.path|includeif\\..+\\.path");
    private static final Pattern SHELL_META = Pattern.compile("[;|&$`()<>\\\\\"'!*?\\[\\]{}~\\n]");

    private final PolicyConfig policy;
    private final DecisionTrace trace;

    public SubcommandGate(PolicyConfig policy, DecisionTrace trace) {
        this.policy = policy;
        this.trace = trace;
    }

    public StageResult check(CommandFragment fragment, FragmentEvaluator evaluator) {
        var executable = fragment.executable();
        var allowed = policy.subcommandsFor(executable);
        if (allowed.isEmpty()) {
            return StageResult.CONTINUE;
        }
        if (executable.equals("git")) {
            return checkGit(fragment.args(), allowed.get(), evaluator);
        }
        var subcommand = fragment.args().stream().filter(a -> !a.startsWith("-")).findFirst();
        if (subcommand.isEmpty()) {
            trace.record(1, "REJECT: bare {} (no subcommand)", executable);
            return StageResult.REJECT;
        }
        if (allowed.get().contains(subcommand.get())) {
            trace.record(1, "APPROVE: {} subcommand {}", executable, subcommand.get());
            return StageResult.APPROVE;
        }
        trace.record(1, "REJECT: {} subcommand {} not allowed", executable, subcommand.get());
        return StageResult.REJECT;
    }

    private StageResult checkGit(List<String> args, Set<String> allowed, FragmentEvaluator evaluator) {
        int i = 0;
        while (i < args.size()) {
            var arg = args.get(i);
            if (arg.equals("-c")) {
                if (i + 1 >= args.size() || checkConfigOverride(args.get(i + 1), evaluator) == StageResult.REJECT) {
                    return StageResult.REJECT;
                }
                i += 2;
            } else if (arg.startsWith("--exec-path=") || arg.startsWith("--config-env")) {
                trace.record(1, "REJECT: git {}", arg);
                return StageResult.REJECT;
            } else if (GIT_FLAGS_WITH_VALUE.contains(arg)) {
                i += 2;
            } else if (GIT_FLAGS_NO_VALUE.contains(arg) || arg.startsWith("-")) {
                i++;
            } else {
                break;
            }
        }
        if (i >= args.size()) {
            trace.record(1, "REJECT: bare git (no subcommand)");
            return StageResult.REJECT;
        }
        var subcommand = args.get(i);
        var rest = args.subList(i + 1, args.size());
        if (!allowed.contains(subcommand)) {
            trace.record(1, "REJECT: git {} is not read-only", subcommand);
            return StageResult.REJECT;
        }
        for (var arg : rest) {
            if (arg.equals("--output") || arg.startsWith("--output=")) {
                trace.record(1, "REJECT: git {} writes to a file", subcommand);
                return StageResult.REJECT;
            }
        }
        if (subcommand.equals("config") && policy.gitLocalWrites() && !localConfigOnly(rest)) {
            trace.record(1, "REJECT: git config outside the repository scope");
            return StageResult.REJECT;
        }
        trace.record(1, "APPROVE: git {}", subcommand);
        return StageResult.APPROVE;
    }

    private boolean localConfigOnly(List<String> rest) {
        for (var arg : rest) {
            if (CONFIG_SCOPE_FLAGS.contains(arg) || arg.startsWith("--file=") || arg.equals("-e") || arg.equals("--edit")) {
                return false;
            }
            var key = arg.toLowerCase(Locale.ROOT);
            if (COMMAND_KEY.matcher(key).matches() || FORBIDDEN_KEY.matcher(key).matches()) {
                return false;
            }
        }
        return true;
    }

    /** A {@code -c key=value} override is safe when the key runs nothing, or the command it names is itself safe. */
    private StageResult checkConfigOverride(String assignment, FragmentEvaluator evaluator) {
        int eq = assignment.indexOf('=');
        var key = (eq < 0 ? assignment : assignment.substring(0, eq)).toLowerCase(Locale.ROOT);
        var value = eq < 0 ? "" : assignment.substring(eq + 1).strip();
        if (FORBIDDEN_KEY.matcher(key).matches()) {
            trace.record(1, "REJECT: git -c {}", key);
            return StageResult.REJECT;
        }
        if (!COMMAND_KEY.matcher(key).matches() || value.isEmpty()) {
            return StageResult.CONTINUE;
        }
        if (SHELL_META.matcher(value).find()) {
            trace.record(1, "REJECT: git -c {} runs a shell snippet", key);
            return StageResult.REJECT;
        }
        var words = Arrays.asList(value.split("\\s+"));
        var inner = evaluator.evaluate(CommandFragment.of(words));
        trace.record(2, "git -c {} command evaluated to {}", key, inner);
        return inner == StageResult.APPROVE ? StageResult.CONTINUE : StageResult.REJECT;
    }
}
