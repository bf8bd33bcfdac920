package com.github.dimitryivaniuta.governance.scheduler;

import com.github.dimitryivaniuta.governance.config.GovernanceProperties;
import com.github.dimitryivaniuta.governance.metrics.GovernanceMetrics;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs maintenance jobs and keeps their records.
 *
 * Per job: IDLE -> RUNNING -> (SUCCEEDED | FAILED) -> IDLE. Job bodies execute on the
 * maintenance executor, bounded by a Resilience4j {@link TimeLimiter}; a run that exceeds
 * the maximum duration is abandoned and recorded FAILED. A failure is logged and recorded,
 * never rethrown, so one job cannot stop another or the trigger loop. There is no retry
 * inside a cycle: the next scheduled firing tries again.
 */
@Slf4j
@Service
public class MaintenanceScheduler {

    private final Map<String, MaintenanceJob> jobs = new LinkedHashMap<>();
    private final Map<String, AtomicReference<JobRecord>> records = new LinkedHashMap<>();
    private final Map<String, CompletableFuture<Void>> inFlight = new ConcurrentHashMap<>();

    private final Executor executor;
    private final TimeLimiter timeLimiter;
    private final Duration maxRunDuration;
    private final Clock clock;
    private final GovernanceMetrics metrics;

    public MaintenanceScheduler(List<MaintenanceJob> jobs,
                                @Qualifier("maintenanceExecutor") Executor executor,
                                GovernanceProperties properties,
                                Clock clock,
                                GovernanceMetrics metrics) {
        for (MaintenanceJob job : jobs) {
            if (this.jobs.putIfAbsent(job.name(), job) != null) {
                throw new IllegalStateException("Duplicate maintenance job name: " + job.name());
            }
            this.records.put(job.name(), new AtomicReference<>(JobRecord.initial(job.name(), job.schedule())));
        }
        this.executor = executor;
        this.maxRunDuration = properties.getScheduler().getMaxRunDuration();
        this.timeLimiter = TimeLimiter.of("maintenance", TimeLimiterConfig.custom()
                .timeoutDuration(maxRunDuration)
                .cancelRunningFuture(true)
                .build());
        this.clock = clock;
        this.metrics = metrics;
    }

    /**
     * Runs one job to completion (or timeout) on the maintenance executor.
     * A trigger that arrives while the job is still running, or while an abandoned
     * run is still executing, is skipped.
     *
     * @return the job record after the run
     */
    public JobRecord run(String jobName) {
        MaintenanceJob job = jobs.get(jobName);
        if (job == null) {
            throw new IllegalArgumentException("Unknown maintenance job: " + jobName);
        }
        AtomicReference<JobRecord> ref = records.get(jobName);

        JobRecord current = ref.get();
        if (current.state() == JobState.RUNNING) {
            log.warn("Skipping job {}: already running", jobName);
            metrics.jobSkipped(jobName);
            return current;
        }
        CompletableFuture<Void> previous = inFlight.get(jobName);
        if (previous != null && !previous.isDone()) {
            log.warn("Skipping job {}: an abandoned run is still executing", jobName);
            metrics.jobSkipped(jobName);
            return current;
        }

        Instant startedAt = clock.instant();
        if (!ref.compareAndSet(current, current.running(startedAt))) {
            log.warn("Skipping job {}: started concurrently", jobName);
            metrics.jobSkipped(jobName);
            return ref.get();
        }

        log.debug("Maintenance job {} started at {}", jobName, startedAt);
        long t0 = System.nanoTime();
        JobOutcome outcome = JobOutcome.FAILED;
        try {
            int affected = timeLimiter.executeFutureSupplier(() -> {
                // completes when the body returns, even after the limiter gave up on it
                CompletableFuture<Void> bodyDone = new CompletableFuture<>();
                CompletableFuture<Integer> f = CompletableFuture.supplyAsync(() -> {
                    try {
                        return job.run(startedAt);
                    } finally {
                        bodyDone.complete(null);
                    }
                }, executor);
                inFlight.put(jobName, bodyDone);
                return f;
            });
            ref.set(ref.get().succeeded(clock.instant(), affected));
            outcome = JobOutcome.SUCCEEDED;
            metrics.jobAffected(jobName, affected);
            if (affected > 0) {
                log.info("Maintenance job {} changed {} rows", jobName, affected);
            } else {
                log.debug("Maintenance job {} found nothing to change", jobName);
            }
        } catch (TimeoutException ex) {
            fail(ref, new SchedulerJobFailedException(jobName,
                    new TimeoutException("abandoned after exceeding " + maxRunDuration)));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            fail(ref, new SchedulerJobFailedException(jobName, ex));
        } catch (Exception ex) {
            fail(ref, new SchedulerJobFailedException(jobName, ex));
        } catch (Error err) {
            // TimeLimiter rethrows errors from the body unwrapped; the record must still leave RUNNING
            fail(ref, new SchedulerJobFailedException(jobName, err));
        } finally {
            metrics.jobFinished(jobName, outcome, Duration.ofNanos(System.nanoTime() - t0));
        }
        return ref.get();
    }

    /** Runs every job once, one after another, from the calling thread. */
    public void runAll() {
        for (String name : jobs.keySet()) {
            run(name);
        }
    }

    public List<JobRecord> records() {
        return records.values().stream().map(AtomicReference::get).toList();
    }

    public Optional<JobRecord> record(String jobName) {
        AtomicReference<JobRecord> ref = records.get(jobName);
        return Optional.ofNullable(ref == null ? null : ref.get());
    }

    private void fail(AtomicReference<JobRecord> ref, SchedulerJobFailedException failure) {
        log.error(failure.getMessage(), failure.getCause());
        ref.set(ref.get().failed(clock.instant(), failure.getMessage()));
    }
}
