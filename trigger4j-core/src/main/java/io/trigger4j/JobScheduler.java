package io.trigger4j;

import io.trigger4j.core.JobState;
import io.trigger4j.core.RegistrationResult;
import io.trigger4j.core.ScheduleDescriptor;

import java.time.Instant;
import java.util.Optional;
import java.util.Set;

/**
 * Time-driven dispatcher that owns the firing timing of every registered job.
 *
 * <p>Guarantees:
 * <ul>
 *   <li>Firings of one job are sequential: the next one is not started before the callback of the
 *       previous one has returned</li>
 *   <li>A failing callback is logged and never affects other jobs or the dispatch loop</li>
 *   <li>Cancelling a job stops future occurrences; a firing already in progress completes</li>
 * </ul>
 */
public interface JobScheduler {
    void start();

    void stop();

    /**
     * Register a job, replacing any job with the same id.
     *
     * @throws io.trigger4j.core.ScheduleException if no fire time can be computed for the schedule;
     *                                             the registry is left unchanged
     */
    RegistrationResult register(String jobId, ScheduleDescriptor schedule, JobCallback callback);

    /**
     * Cancel a job. Unknown ids are ignored.
     *
     * @return true if a job was registered under this id
     */
    boolean cancel(String jobId);

    Optional<JobState> state(String jobId);

    Optional<Instant> nextFireTime(String jobId);

    Set<String> jobIds();
}
