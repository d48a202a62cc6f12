package com.example.jobscheduler.service.job;

/**
 * One run of a scheduled job
 */
@FunctionalInterface
public interface JobTask {

    void run() throws Exception;
}
