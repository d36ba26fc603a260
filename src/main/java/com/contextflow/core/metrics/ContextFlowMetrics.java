package com.contextflow.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for task analysis, workflow composition and execution.
 */
@Service
public class ContextFlowMetrics {

    private final MeterRegistry registry;

    public ContextFlowMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAnalysis(String complexity, long ms) {
        Timer.builder("contextflow.analysis.duration")
                .tag("complexity", complexity)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordComposition(boolean templateUsed, long ms) {
        Timer.builder("contextflow.composition.duration")
                .tag("source", templateUsed ? "template" : "synthesized")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordValidationScore(double score, boolean repaired) {
        DistributionSummary.builder("contextflow.validation.score")
                .description("Workflow validation score after composition")
                .tag("repaired", String.valueOf(repaired))
                .register(registry)
                .record(score);
    }

    public void recordPhaseExecution(String context, String outcome, long ms) {
        Timer.builder("contextflow.phase.duration")
                .tag("context", context)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordPhaseTimeout(String context) {
        Counter.builder("contextflow.phase.timeouts")
                .tag("context", context)
                .register(registry)
                .increment();
    }

    public void recordRecoveryAction(String actionType) {
        Counter.builder("contextflow.recovery.actions")
                .tag("action", actionType)
                .register(registry)
                .increment();
    }

    public void recordParallelGroup(int size) {
        DistributionSummary.builder("contextflow.parallel.group_size")
                .description("Number of phases per parallel group")
                .register(registry)
                .record(size);
    }

    public void recordWorkflowResult(String status, double successRate) {
        Counter.builder("contextflow.workflows.total")
                .tag("status", status)
                .register(registry)
                .increment();
        DistributionSummary.builder("contextflow.workflows.success_rate")
                .register(registry)
                .record(successRate);
    }
}
