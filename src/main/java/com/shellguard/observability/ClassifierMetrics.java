package com.shellguard.observability;

import com.shellguard.shared.model.Verdict;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.Locale;

public class ClassifierMetrics {

    private final MeterRegistry registry;

    public ClassifierMetrics() {
        this(new SimpleMeterRegistry());
    }

    public ClassifierMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Timer classifyLatency() {
        return Timer.builder("shellguard.classify.latency").register(registry);
    }

    public Counter verdicts(Verdict verdict) {
        return Counter.builder("shellguard.verdict")
                .tag("result", verdict.name().toLowerCase(Locale.ROOT))
                .register(registry);
    }

    public Counter fragments() {
        return Counter.builder("shellguard.fragments").register(registry);
    }
}
