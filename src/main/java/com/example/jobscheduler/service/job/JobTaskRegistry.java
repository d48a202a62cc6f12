package com.example.jobscheduler.service.job;

import com.example.jobscheduler.service.dispatch.JobResolution;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.validation.Validator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Registry for job implementations.
 * <p>
 * Discovers all {@link JobTaskFactory} beans and resolves a job class string
 * plus an options map into a ready-to-run {@link JobTask}.
 */
@Slf4j
@Component
public class JobTaskRegistry {

    private final Map<String, JobTaskFactory<?>> factories = new TreeMap<>();
    private final List<JobTaskFactory<?>> factoryBeans;
    private final ObjectMapper optionsMapper;
    private final Validator validator;

    public JobTaskRegistry(List<JobTaskFactory<?>> factoryBeans, ObjectMapper objectMapper, Validator validator) {
        this.factoryBeans = factoryBeans;
        this.optionsMapper = objectMapper.copy().enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        this.validator = validator;
    }

    @PostConstruct
    public void initialize() {
        for (var factory : factoryBeans) {
            var jobClass = factory.getJobClass();
            if (factories.containsKey(jobClass)) {
                log.warn("Duplicate implementation for job class {}: {} will override {}",
                        jobClass, factory.getClass().getSimpleName(),
                        factories.get(jobClass).getClass().getSimpleName());
            }
            factories.put(jobClass, factory);
            log.debug("Registered job class {}: {}", jobClass, factory.getClass().getSimpleName());
        }
        log.info("Job registry initialized with {} job classes: {}", factories.size(), getRegisteredJobClasses());
    }

    /**
     * Resolve a job class and its options into a task.
     * Failures are reported in the result, never thrown.
     */
    public JobResolution resolve(String jobClass, Map<String, Object> opts, JobContext context) {
        var factory = factories.get(jobClass);
        if (factory == null) {
            return JobResolution.failed(JobResolution.Failure.UNKNOWN_JOB_CLASS,
                    "No implementation registered for job class " + jobClass);
        }
        return create(factory, opts != null ? opts : Map.of(), context);
    }

    private <O> JobResolution create(JobTaskFactory<O> factory, Map<String, Object> opts, JobContext context) {
        O options;
        try {
            options = optionsMapper.convertValue(opts, factory.getOptionsType());
        } catch (IllegalArgumentException e) {
            return JobResolution.failed(JobResolution.Failure.INVALID_OPTIONS,
                    "Options rejected by " + factory.getJobClass() + ": " + e.getMessage());
        }

        var violations = validator.validate(options);
        if (!violations.isEmpty()) {
            var message = violations.stream()
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .sorted()
                    .collect(Collectors.joining(", "));
            return JobResolution.failed(JobResolution.Failure.INVALID_OPTIONS,
                    "Options rejected by " + factory.getJobClass() + ": " + message);
        }

        try {
            var task = factory.create(context, options);
            if (task == null) {
                return JobResolution.failed(JobResolution.Failure.CONSTRUCTION_ERROR,
                        factory.getJobClass() + " created no task");
            }
            return JobResolution.resolved(task);
        } catch (RuntimeException e) {
            log.debug("Failed to create task for {}", factory.getJobClass(), e);
            return JobResolution.failed(JobResolution.Failure.CONSTRUCTION_ERROR,
                    "Failed to create " + factory.getJobClass() + ": " + e.getMessage());
        }
    }

    /**
     * Get all registered job classes, sorted
     */
    public Set<String> getRegisteredJobClasses() {
        return Collections.unmodifiableSet(factories.keySet());
    }
}
