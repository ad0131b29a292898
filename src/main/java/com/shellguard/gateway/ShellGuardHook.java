package com.shellguard.gateway;

import com.shellguard.approval.HookProcessor;
import com.shellguard.observability.ClassifierMetrics;
import com.shellguard.observability.LoggingDecisionTrace;
import com.shellguard.security.CommandClassifier;
import com.shellguard.security.PolicyConfig;
import com.shellguard.shared.config.ConfigLoader;
import com.shellguard.shared.config.ShellGuardConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Hook process entry point: one request on stdin, at most one response on stdout, exit status always 0.
 */
public class ShellGuardHook {

    private static final Logger log = LoggerFactory.getLogger(ShellGuardHook.class);

    public static void main(String[] args) {
        run(System.in, System.out, ConfigLoader::load);
        System.exit(0);
    }

    static void run(InputStream stdin, PrintStream stdout, Supplier<ShellGuardConfig> settings) {
        try {
            var request = new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
            var config = settings.get();
            var trace = LoggingDecisionTrace.forVerbosity(config.traceVerbosity());
            var metrics = new ClassifierMetrics();
            var classifier = new CommandClassifier(PolicyConfig.from(config.policy()), trace, metrics);

            new HookProcessor(classifier).process(request).ifPresent(stdout::println);
            stdout.flush();

            var latency = metrics.classifyLatency();
            trace.record(2, "Classified in {} ms", latency.totalTime(TimeUnit.MILLISECONDS));
        } catch (IOException e) {
            log.warn("Cannot read hook request: {}", e.getMessage());
        } catch (RuntimeException | StackOverflowError e) {
            // anything unexpected degrades to "no decision"
            log.error("Hook failed, falling through", e);
        }
    }
}
