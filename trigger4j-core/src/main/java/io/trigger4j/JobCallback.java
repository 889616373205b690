package io.trigger4j;

/**
 * Invoked by the {@link JobScheduler} once per due occurrence of a job.
 */
@FunctionalInterface
public interface JobCallback {
    void fire(String jobId) throws Exception;
}
