package com.example.jobscheduler.service.job.builtin;

import com.example.jobscheduler.service.job.JobContext;
import com.example.jobscheduler.service.job.JobTask;
import com.example.jobscheduler.service.job.JobTaskFactory;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Ends the scheduler loop so the process exits and its supervisor restarts it.
 * Scheduled as the "Restart Scheduler" job.
 */
@Slf4j
@Component
public class StopSchedulerJob implements JobTaskFactory<StopSchedulerJob.Options> {

    public static final String JOB_CLASS = "stop_scheduler.Stop";

    @Override
    public String getJobClass() {
        return JOB_CLASS;
    }

    @Override
    public Class<Options> getOptionsType() {
        return Options.class;
    }

    @Override
    public JobTask create(JobContext context, Options options) {
        return () -> {
            log.info("{} stopping the scheduler", context.getName());
            context.getControl().stop();
        };
    }

    @Data
    public static class Options {

        /**
         * Accepted for existing rows, not used
         */
        private String dbserver;
    }
}
