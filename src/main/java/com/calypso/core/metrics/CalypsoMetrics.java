package com.calypso.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for builds, verification and deployments.
 */
@Service
public class CalypsoMetrics {

    private final MeterRegistry registry;

    public CalypsoMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordBuildDuration(String framework, long ms) {
        Timer.builder("calypso.build.duration")
                .tag("framework", framework)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * @param outcome "complete", "unverified", "failed" or "cancelled"
     */
    public void recordBuildResult(String outcome) {
        Counter.builder("calypso.builds.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordGeneratedFiles(int count) {
        DistributionSummary.builder("calypso.build.files")
                .description("Files extracted from one generation stream")
                .register(registry)
                .record(count);
    }

    public void recordVerification(String outcome) {
        Counter.builder("calypso.verifications.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordRepairRounds(int rounds) {
        DistributionSummary.builder("calypso.repair.rounds")
                .description("Verification rounds per build")
                .register(registry)
                .record(rounds);
    }

    public void incrementDeadlineAborts(String phase) {
        Counter.builder("calypso.deadline.aborts")
                .description("Phases cut short by the wall-clock budget")
                .tag("phase", phase)
                .register(registry)
                .increment();
    }

    // --- Deployments ---

    public void recordPublish(boolean success) {
        Counter.builder("calypso.publish.total")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordAccountDeploy(boolean success) {
        Counter.builder("calypso.account.deploy.total")
                .tag("result", success ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordPreview(boolean reused) {
        Counter.builder("calypso.preview.total")
                .tag("reused", String.valueOf(reused))
                .register(registry)
                .increment();
    }

    public void recordDeploymentReadiness(long ms) {
        Timer.builder("calypso.deployment.readiness")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }
}
