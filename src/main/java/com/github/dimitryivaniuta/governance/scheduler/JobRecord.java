package com.github.dimitryivaniuta.governance.scheduler;

import java.time.Instant;

/**
 * Immutable snapshot of a maintenance job's state. Replaced, never mutated, by the scheduler.
 *
 * @param name           job name
 * @param schedule       cron expression the job fires on
 * @param state          IDLE or RUNNING
 * @param lastStartedAt  start of the most recent run, null before the first run
 * @param lastFinishedAt end of the most recent completed run
 * @param lastOutcome    outcome of the most recent completed run
 * @param lastAffected   rows changed by the most recent successful run
 * @param lastError      failure message of the most recent failed run
 */
public record JobRecord(
        String name,
        String schedule,
        JobState state,
        Instant lastStartedAt,
        Instant lastFinishedAt,
        JobOutcome lastOutcome,
        int lastAffected,
        String lastError
) {
    public static JobRecord initial(String name, String schedule) {
        return new JobRecord(name, schedule, JobState.IDLE, null, null, null, 0, null);
    }

    JobRecord running(Instant startedAt) {
        return new JobRecord(name, schedule, JobState.RUNNING, startedAt, lastFinishedAt, lastOutcome, lastAffected, lastError);
    }

    JobRecord succeeded(Instant finishedAt, int affected) {
        return new JobRecord(name, schedule, JobState.IDLE, lastStartedAt, finishedAt, JobOutcome.SUCCEEDED, affected, null);
    }

    JobRecord failed(Instant finishedAt, String error) {
        return new JobRecord(name, schedule, JobState.IDLE, lastStartedAt, finishedAt, JobOutcome.FAILED, 0, error);
    }
}
