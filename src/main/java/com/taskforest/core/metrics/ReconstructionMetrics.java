package com.taskforest.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for hierarchy reconstruction runs.
 */
@Service
public class ReconstructionMetrics {

    private final MeterRegistry registry;

    public ReconstructionMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordRunDuration(long ms, boolean succeeded) {
        Timer.builder("taskforest.run.duration")
                .tag("outcome", succeeded ? "completed" : "failed")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordMalformedRecord() {
        Counter.builder("taskforest.records.malformed")
                .description("Raw records skipped because they could not produce a skeleton")
                .register(registry)
                .increment();
    }

    /**
     * @param reason lowercase rejection reason code, e.g. "temporal"
     */
    public void recordInvalidatedEdge(String reason) {
        Counter.builder("taskforest.edges.invalidated")
                .description("Declared edges cleared during re-validation")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void recordResolvedEdge(int prefixLength) {
        Counter.builder("taskforest.edges.resolved")
                .description("Edges inferred from the prefix index")
                .tag("prefixLength", String.valueOf(prefixLength))
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "ambiguous" or "unresolved"
     */
    public void recordUnresolved(String outcome) {
        Counter.builder("taskforest.skeletons.unresolved")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordForestDepth(int maxDepth) {
        DistributionSummary.builder("taskforest.forest.depth")
                .description("Maximum depth of the reconstructed forest per run")
                .register(registry)
                .record(maxDepth);
    }
}
