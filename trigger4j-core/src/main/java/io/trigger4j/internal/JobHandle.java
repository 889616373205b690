package io.trigger4j.internal;

import io.trigger4j.JobCallback;
import io.trigger4j.core.JobState;
import io.trigger4j.core.ScheduleDescriptor;

import java.time.Instant;

/**
 * Runtime state of one registered job. Mutable fields are guarded by the owning scheduler's lock.
 */
final class JobHandle {
    private final String jobId;
    private final ScheduleDescriptor schedule;
    private final JobCallback callback;

    private JobState state = JobState.PENDING;
    private Instant nextFireAt;
    private Instant lastStartedAt;

    JobHandle(String jobId, ScheduleDescriptor schedule, JobCallback callback, Instant nextFireAt) {
        this.jobId = jobId;
        this.schedule = schedule;
        this.callback = callback;
        this.nextFireAt = nextFireAt;
    }

    String jobId() {
        return jobId;
    }

    ScheduleDescriptor schedule() {
        return schedule;
    }

    JobCallback callback() {
        return callback;
    }

    JobState state() {
        return state;
    }

    Instant nextFireAt() {
        return nextFireAt;
    }

    Instant lastStartedAt() {
        return lastStartedAt;
    }

    boolean isDue(Instant now) {
        return state == JobState.PENDING && !nextFireAt.isAfter(now);
    }

    void markFiring(Instant startedAt) {
        if (state != JobState.PENDING) {
            throw new IllegalStateException("job " + jobId + " cannot fire from state " + state);
        }
        state = JobState.FIRING;
        lastStartedAt = startedAt;
    }

    /**
     * Back to PENDING with the next fire time, or CANCELLED when there is none.
     * A handle cancelled while firing stays cancelled.
     */
    void completeFiring(Instant next) {
        if (state == JobState.CANCELLED) {
            return;
        }
        if (next == null) {
            state = JobState.CANCELLED;
            return;
        }
        nextFireAt = next;
        state = JobState.PENDING;
    }

    void cancel() {
        state = JobState.CANCELLED;
    }
}
