package com.example.jobscheduler.service.job.builtin;

import com.example.jobscheduler.exception.JobExecutionException;
import com.example.jobscheduler.service.job.JobContext;
import com.example.jobscheduler.service.job.JobTask;
import com.example.jobscheduler.service.job.JobTaskFactory;
import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Warns when free space on a file system drops below a threshold.
 * <p>
 * Options:
 * - paths: one or more paths whose file systems are checked
 * - threshold: minimum free space in GB (default 10)
 * - recips: who the warnings are for
 */
@Slf4j
@Component
public class DiskSpaceJob implements JobTaskFactory<DiskSpaceJob.Options> {

    public static final String JOB_CLASS = "disk_space.Monitor";

    static final long GB = 1024L * 1024 * 1024;

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
            var problems = check(context.getName(), options.getPaths(), options.getThreshold());
            if (problems.isEmpty()) {
                log.info("disk space OK");
            } else {
                log.warn("*** WARNING: DISK SPACE CHECK *** for {}:\n{}",
                        Recipients.parse(options.getRecips()), String.join("\n", problems));
            }
        };
    }

    /**
     * Check every path.
     *
     * @return one line per path that is low on space or could not be checked
     * @throws JobExecutionException if no path could be checked at all
     */
    List<String> check(String jobName, List<String> paths, long thresholdGb) {
        var problems = new ArrayList<String>();
        var checked = 0;
        for (var path : paths) {
            long free;
            try {
                free = Files.getFileStore(Path.of(path)).getUsableSpace();
            } catch (IOException | RuntimeException e) {
                log.error("failure checking {}", path, e);
                problems.add("failure checking " + path + ": " + e.getMessage());
                continue;
            }
            checked++;
            if (free < thresholdGb * GB) {
                var problem = String.format("%s down to %d bytes (%.1fG)", path, free, (double) free / GB);
                log.warn(problem);
                problems.add(problem);
            }
        }
        if (checked == 0) {
            throw new JobExecutionException(jobName, String.join("; ", problems));
        }
        return problems;
    }

    @Data
    public static class Options {

        @NotEmpty
        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
        private List<String> paths = List.of("/");

        @Min(0)
        @Max(1_000_000)
        private long threshold = 10;

        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
        private List<String> recips;
    }
}
