package com.example.jobscheduler.service.job.builtin;

import com.example.jobscheduler.service.engine.RegisteredJob;
import com.example.jobscheduler.service.job.JobContext;
import com.example.jobscheduler.service.job.JobTask;
import com.example.jobscheduler.service.job.JobTaskFactory;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Reports the jobs registered with the engine and when they fire next.
 */
@Slf4j
@Component
public class JobListJob implements JobTaskFactory<JobListJob.Options> {

    public static final String JOB_CLASS = "job_list.Reporter";

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
            var report = buildReport(context.getControl().getRegisteredJobs());
            log.info("Pending scheduled jobs for {}:\n{}", Recipients.parse(options.getRecips()), report);
        };
    }

    static String buildReport(List<RegisteredJob> jobs) {
        if (jobs.isEmpty()) {
            return "No jobs registered";
        }
        var lines = new ArrayList<String>();
        for (var job : jobs) {
            var next = job.isPaused() ? "paused" : job.getNextFireTime() != null
                    ? "next run at " + job.getNextFireTime()
                    : "no further runs";
            lines.add(String.format("%s (trigger: cron[%s] %s, %s)", job.getName(), job.getCronExpression(), job.getZone(), next));
        }
        return String.join("\n", lines);
    }

    @Data
    public static class Options {

        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
        private List<String> recips;
    }
}
