package com.example.jobscheduler.mapper;

import com.example.jobscheduler.domain.entity.ScheduledJob;
import com.example.jobscheduler.domain.model.JobSchedule;
import com.example.jobscheduler.domain.model.ScheduledJobRecord;
import com.example.jobscheduler.exception.MalformedRecordException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Maps raw {@link ScheduledJob} rows to validated {@link ScheduledJobRecord} snapshots.
 */
@Component
@RequiredArgsConstructor
public class ScheduledJobRecordMapper {

    private static final Pattern JOB_CLASS = Pattern.compile("[A-Za-z_][\\w]*\\.[A-Za-z_][\\w]*");

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    /**
     * Parse and validate a row.
     *
     * @throws MalformedRecordException if any column cannot be interpreted
     */
    public ScheduledJobRecord toRecord(ScheduledJob row) {
        var id = row.getId();
        if (row.getName() == null || row.getName().isBlank()) {
            throw new MalformedRecordException(id, "name is empty");
        }
        if (row.getJobClass() == null || !JOB_CLASS.matcher(row.getJobClass()).matches()) {
            throw new MalformedRecordException(id, "job_class '" + row.getJobClass() + "' is not of the form namespace.TypeName");
        }

        var opts = parseObject(id, "opts", row.getOpts());
        var schedule = parseSchedule(id, row.getSchedule());

        return ScheduledJobRecord.builder()
                .id(id)
                .name(row.getName())
                .jobClass(row.getJobClass())
                .schedule(schedule)
                .enabled(row.isEnabled())
                .opts(opts)
                .build();
    }

    private JobSchedule parseSchedule(String id, String json) {
        var values = parseObject(id, "schedule", json);
        if (values.isEmpty()) {
            return null;
        }

        JobSchedule schedule;
        try {
            schedule = JobSchedule.fromMap(values);
            if (schedule == null) {
                return null;
            }
            CronExpression.parse(schedule.toCronExpression());
        } catch (IllegalArgumentException e) {
            throw new MalformedRecordException(id, "invalid schedule " + json + ": " + e.getMessage(), e);
        }

        try {
            schedule.zoneOr(null);
        } catch (DateTimeException e) {
            throw new MalformedRecordException(id, "unknown timezone '" + schedule.getTimezone() + "'", e);
        }
        return schedule;
    }

    /**
     * Blank and {@code null} columns read as an empty object
     */
    private Map<String, Object> parseObject(String id, String column, String json) {
        if (json == null || json.isBlank()) {
            return Collections.emptyMap();
        }
        try {
            var tree = objectMapper.readTree(json);
            if (tree.isNull()) {
                return Collections.emptyMap();
            }
            if (!tree.isObject()) {
                throw new MalformedRecordException(id, column + " is not a JSON object");
            }
            Map<String, Object> values = objectMapper.convertValue(tree, JSON_OBJECT);
            return Collections.unmodifiableMap(new LinkedHashMap<>(values));
        } catch (JsonProcessingException e) {
            throw new MalformedRecordException(id, column + " is not valid JSON: " + e.getOriginalMessage(), e);
        }
    }
}
