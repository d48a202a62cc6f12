package com.example.jobscheduler.service.job.builtin;

import com.example.jobscheduler.config.HealthCheckProperties;
import com.example.jobscheduler.service.job.JobContext;
import com.example.jobscheduler.service.job.JobTask;
import com.example.jobscheduler.service.job.JobTaskFactory;
import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Checks that a server answers its ping URL with the expected text.
 * <p>
 * Problems are counted until they are reported. Reports go out at most once
 * per {@code delay} minutes, so a server that stays down does not flood the
 * recipients. Counts are kept across runs for the life of the process.
 * <p>
 * Options:
 * - url: address to probe (defaults to health-check.default-url)
 * - expected: body of a healthy answer (default "OK")
 * - delay: minutes between reports (default 60)
 * - recips: who the report is for
 */
@Slf4j
@Component
public class HealthCheckJob implements JobTaskFactory<HealthCheckJob.Options> {

    public static final String JOB_CLASS = "health_check.Monitor";

    private final WebClient webClient;
    private final HealthCheckProperties properties;
    private final Clock clock;

    private final Map<String, Integer> unreportedFailures = new LinkedHashMap<>();
    private Instant lastNotification;

    @Autowired
    public HealthCheckJob(@Qualifier("healthCheckWebClient") WebClient webClient, HealthCheckProperties properties) {
        this(webClient, properties, Clock.systemUTC());
    }

    HealthCheckJob(WebClient webClient, HealthCheckProperties properties, Clock clock) {
        this.webClient = webClient;
        this.properties = properties;
        this.clock = clock;
    }

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
        var url = options.getUrl() != null ? options.getUrl() : properties.getDefaultUrl();
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("no url option and no health-check.default-url configured");
        }
        return () -> {
            checkHealth(url, options.getExpected());
            notifyFailures(context.getName(), Duration.ofMinutes(options.getDelay()), Recipients.parse(options.getRecips()));
        };
    }

    /**
     * Probe the URL once and count any problem
     */
    void checkHealth(String url, String expected) {
        try {
            var body = webClient.get()
                    .uri(url)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(Duration.ofSeconds(properties.getTimeoutSeconds()));
            var status = body != null ? body.strip() : "";
            if (!expected.equals(status)) {
                log.error("Health check of {} answered: {}", url, status);
                countFailure(status.isEmpty() ? "empty response" : status);
            } else {
                log.debug("Health check of {} OK", url);
            }
        } catch (RuntimeException e) {
            log.error("Health check failure for {}", url, e);
            countFailure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        }
    }

    /**
     * Report unreported problems if enough time has passed since the last report
     *
     * @return whether a report was made
     */
    synchronized boolean notifyFailures(String jobName, Duration delay, List<String> recips) {
        if (unreportedFailures.isEmpty()) {
            return false;
        }
        var now = clock.instant();
        if (lastNotification != null && now.isBefore(lastNotification.plus(delay))) {
            return false;
        }

        var problems = new ArrayList<String>();
        unreportedFailures.forEach((problem, count) -> problems.add(problem + " (" + count + ")"));
        log.error("*** {} FAILURES *** for {}:\n{}", jobName, recips, String.join("\n", problems));

        lastNotification = now;
        unreportedFailures.clear();
        return true;
    }

    synchronized Map<String, Integer> getUnreportedFailures() {
        return Map.copyOf(unreportedFailures);
    }

    private synchronized void countFailure(String problem) {
        unreportedFailures.merge(problem, 1, Integer::sum);
    }

    @Data
    public static class Options {

        private String url;

        @NotBlank
        private String expected = "OK";

        /**
         * Minutes between reports
         */
        @Min(1)
        private int delay = 60;

        @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
        private List<String> recips;
    }
}
