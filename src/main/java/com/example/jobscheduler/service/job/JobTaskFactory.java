package com.example.jobscheduler.service.job;

/**
 * Implementation of a job class.
 * <p>
 * Each factory is registered under the {@code job_class} string stored in
 * {@code scheduled_job} rows and creates a fresh {@link JobTask} per run.
 * The row's {@code opts} are bound onto an instance of the options type;
 * options that the type does not declare are rejected, and Jakarta Bean
 * Validation constraints on it are enforced before {@link #create} is called.
 *
 * @param <O> options type
 */
public interface JobTaskFactory<O> {

    /**
     * Job class this factory implements, {@code namespace.TypeName}
     */
    String getJobClass();

    Class<O> getOptionsType();

    JobTask create(JobContext context, O options);
}
