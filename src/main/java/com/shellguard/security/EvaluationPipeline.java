package com.shellguard.security;

import com.shellguard.observability.DecisionTrace;
import com.shellguard.security.handler.HandlerResult;
import com.shellguard.shared.model.CommandFragment;
import com.shellguard.shared.model.StageResult;

/**
 * Seven-stage decision procedure for a single fragment. Each stage may conclude; the last one always rejects.
 * <ol>
 *   <li>output redirect</li>
 *   <li>wrapper normalization</li>
 *   <li>never-approve gate</li>
 *   <li>domain handler</li>
 *   <li>subcommand whitelist</li>
 *   <li>general whitelist</li>
 *   <li>default deny</li>
 * </ol>
 * Handlers re-enter through {@link #evaluate}, so nested commands see the same policy.
 */
public class EvaluationPipeline implements FragmentEvaluator {

    private final PolicyConfig policy;
    private final DecisionTrace trace;
    private final WrapperNormalizer wrappers;
    private final SubcommandGate subcommands;

    public EvaluationPipeline(PolicyConfig policy, DecisionTrace trace) {
        this.policy = policy;
        this.trace = trace;
        this.wrappers = new WrapperNormalizer(trace);
        this.subcommands = new SubcommandGate(policy, trace);
    }

    public EvaluationPipeline(PolicyConfig policy) {
        this(policy, DecisionTrace.NOOP);
    }

    @Override
    public DecisionTrace trace() {
        return trace;
    }

    @Override
    public StageResult evaluate(CommandFragment fragment) {
        if (fragment.hasOutputRedirect()) {
            trace.record(1, "REJECT: output redirect on {}", printable(fragment.executable()));
            return StageResult.REJECT;
        }

        var normalized = wrappers.normalize(fragment);
        if (normalized.isConclusive()) {
            return normalized.result();
        }
        var current = normalized.fragment();
        var executable = current.executable();

        if (policy.isNeverApprove(executable)) {
            trace.record(1, "REJECT: {} is never approved", executable);
            return StageResult.REJECT;
        }

        var handler = policy.handlerFor(executable);
        if (current.hasExpandedArgs() && (handler.isPresent() || policy.subcommandsFor(executable).isPresent())) {
            // option checks need the words the shell will actually pass
            trace.record(1, "REJECT: {} arguments come from an expansion", executable);
            return StageResult.REJECT;
        }
        if (handler.isPresent() && handler.get().check(current.args(), this) == HandlerResult.REJECT) {
            trace.record(1, "REJECT: {} handler", executable);
            return StageResult.REJECT;
        }

        var subcommand = subcommands.check(current, this);
        if (subcommand.isConclusive()) {
            return subcommand;
        }

        if (policy.isWhitelisted(executable)) {
            trace.record(1, "APPROVE: {} is whitelisted", executable);
            return StageResult.APPROVE;
        }

        trace.record(1, "REJECT: {} is not whitelisted", printable(executable));
        return StageResult.REJECT;
    }

    private static String printable(String executable) {
        return executable.replace("\0", "\\0");
    }
}
