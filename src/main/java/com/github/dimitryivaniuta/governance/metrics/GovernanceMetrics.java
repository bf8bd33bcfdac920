package com.github.dimitryivaniuta.governance.metrics;

import com.github.dimitryivaniuta.governance.governor.AdmissionResult;
import com.github.dimitryivaniuta.governance.scheduler.JobOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
public class GovernanceMetrics {

    private final MeterRegistry registry;

    public GovernanceMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    // ---- Admission ----
    public void admission(String routeClass, AdmissionResult result) {
        String outcome = result.admitted() ? "admitted" : result.reason().name().toLowerCase();
        Counter.builder("governance_admissions_total")
                .tag("route_class", routeClass == null ? "unknown" : routeClass)
                .tag("outcome", outcome) // admitted | unauthenticated | forbidden | rate_limited
                .register(registry)
                .increment();
    }

    // ---- Maintenance jobs ----
    public void jobFinished(String jobName, JobOutcome outcome, Duration took) {
        Counter.builder("governance_job_runs_total")
                .tag("job", jobName)
                .tag("outcome", outcome.name().toLowerCase())
                .register(registry)
                .increment();
        Timer.builder("governance_job_duration_seconds")
                .tag("job", jobName)
                .register(registry)
                .record(took);
    }

    public void jobAffected(String jobName, int affected) {
        Counter.builder("governance_job_affected_total")
                .tag("job", jobName)
                .register(registry)
                .increment(affected);
    }

    public void jobSkipped(String jobName) {
        Counter.builder("governance_job_skipped_total")
                .tag("job", jobName)
                .register(registry)
                .increment();
    }
}
