package com.example.jobscheduler.service.job.builtin;

import com.example.jobscheduler.service.job.JobContext;
import com.example.jobscheduler.service.job.JobTask;
import com.example.jobscheduler.service.job.JobTaskFactory;
import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Stub job for testing basic operation of the scheduler
 */
@Slf4j
@Component
public class StubJob implements JobTaskFactory<StubJob.Options> {

    public static final String JOB_CLASS = "test.Stub";

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
        return () -> log.info("Running {} job with opts {}", context.getName(), options.getValues());
    }

    /**
     * Takes any option
     */
    public static class Options {

        private final Map<String, Object> values = new LinkedHashMap<>();

        @JsonAnySetter
        public void set(String key, Object value) {
            values.put(key, value);
        }

        @JsonAnyGetter
        public Map<String, Object> getValues() {
            return values;
        }
    }
}
