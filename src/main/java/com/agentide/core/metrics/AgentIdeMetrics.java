package com.agentide.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Micrometer meters for session execution.
 */
@Service
public class AgentIdeMetrics {

    private final MeterRegistry registry;

    public AgentIdeMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordPlanningDuration(long ms, boolean fallback) {
        Timer.builder("agentide.planning.duration")
                .tag("fallback", String.valueOf(fallback))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordWorkerExecution(String component, boolean completed, long ms) {
        Timer.builder("agentide.worker.duration")
                .tag("component", component)
                .tag("completed", String.valueOf(completed))
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordWorkerAttempts(String component, int attempts) {
        DistributionSummary.builder("agentide.worker.attempts")
                .tag("component", component)
                .register(registry)
                .record(attempts);
    }

    public void recordReviewDecision(boolean approved) {
        Counter.builder("agentide.review.decisions")
                .tag("result", approved ? "approved" : "revised")
                .register(registry)
                .increment();
    }

    /**
     * @param outcome one of "completed", "suspended", "failed"
     */
    public void recordSessionRun(String outcome) {
        Counter.builder("agentide.sessions.runs")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordRoutingFallback() {
        Counter.builder("agentide.routing.fallbacks")
                .description("Unknown routing values that defaulted to the write worker")
                .register(registry)
                .increment();
    }
}
