package com.shellguard.security;

import com.shellguard.observability.ClassifierMetrics;
import com.shellguard.observability.DecisionTrace;
import com.shellguard.parser.CommandParser;
import com.shellguard.shared.model.CommandFragment;
import com.shellguard.shared.model.StageResult;
import com.shellguard.shared.model.Verdict;

import java.util.List;

/**
 * Whole-command verdict: APPROVE only when every fragment is approved. The first rejected fragment turns the
 * command into FALLTHROUGH without looking at the rest.
 */
public class CommandClassifier {

    private final CommandParser parser;
    private final EvaluationPipeline pipeline;
    private final DecisionTrace trace;
    private final ClassifierMetrics metrics;

    public CommandClassifier(PolicyConfig policy, DecisionTrace trace, ClassifierMetrics metrics) {
        this.trace = trace;
        this.metrics = metrics;
        this.parser = new CommandParser(trace);
        this.pipeline = new EvaluationPipeline(policy, trace);
    }

    public CommandClassifier(PolicyConfig policy) {
        this(policy, DecisionTrace.NOOP, null);
    }

    public Verdict classify(String command) {
        if (metrics == null) {
            return classify(parser.parse(command));
        }
        return metrics.classifyLatency().record(() -> classify(parser.parse(command)));
    }

    public Verdict classify(List<CommandFragment> fragments) {
        var verdict = evaluateAll(fragments);
        if (metrics != null) {
            metrics.fragments().increment(fragments.size());
            metrics.verdicts(verdict).increment();
        }
        return verdict;
    }

    private Verdict evaluateAll(List<CommandFragment> fragments) {
        if (fragments.isEmpty()) {
            trace.record(1, "APPROVE: nothing to execute");
            return Verdict.APPROVE;
        }
        for (var fragment : fragments) {
            if (pipeline.evaluate(fragment) != StageResult.APPROVE) {
                trace.record(1, "FALLTHROUGH: fragment rejected");
                return Verdict.FALLTHROUGH;
            }
        }
        trace.record(1, "APPROVE: all {} fragment(s) passed", fragments.size());
        return Verdict.APPROVE;
    }
}
