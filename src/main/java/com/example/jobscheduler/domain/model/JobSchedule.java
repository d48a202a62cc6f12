package com.example.jobscheduler.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.ZoneId;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Cron-like schedule of a recurring job, as stored in the {@code schedule} column.
 * <p>
 * Fields follow the column's JSON keys: {@code month}, {@code day},
 * {@code day_of_week}, {@code hour}, {@code minute}, {@code second}, plus an
 * optional {@code timezone}. Any field may be omitted. Omitted fields more
 * significant than the least significant given field match everything, less
 * significant ones take their minimum value, so {"hour": 1, "minute": 15}
 * fires daily at 01:15:00.
 * <p>
 * Numeric days of the week count from Monday = 0.
 */
@Value
@Builder
public class JobSchedule {

    private static final Set<String> SUPPORTED_FIELDS = Set.of(
            "month", "day", "day_of_week", "hour", "minute", "second", "timezone");

    private static final String[] DAY_NAMES = {"MON", "TUE", "WED", "THU", "FRI", "SAT", "SUN"};

    // Day numbers, skipping step values after a slash
    private static final Pattern DAY_NUMBER = Pattern.compile("(?<![/\\d])(\\d+)");

    String month;
    String day;
    String dayOfWeek;
    String hour;
    String minute;
    String second;
    String timezone;

    /**
     * Build a schedule from the parsed JSON object.
     *
     * @param values parsed {@code schedule} column
     * @return the schedule, or {@code null} if the object sets no field at all
     * @throws IllegalArgumentException for unsupported fields or values
     */
    public static JobSchedule fromMap(Map<String, Object> values) {
        if (values == null || values.values().stream().allMatch(v -> v == null)) {
            return null;
        }
        for (var key : values.keySet()) {
            if (!SUPPORTED_FIELDS.contains(key)) {
                throw new IllegalArgumentException("unsupported schedule field '" + key + "'");
            }
        }

        var schedule = JobSchedule.builder()
                .month(normalize(values.get("month")))
                .day(normalize(values.get("day")))
                .dayOfWeek(normalize(values.get("day_of_week")))
                .hour(normalize(values.get("hour")))
                .minute(normalize(values.get("minute")))
                .second(normalize(values.get("second")))
                .timezone(normalize(values.get("timezone")))
                .build();

        if (schedule.leastSignificantField() < 0) {
            throw new IllegalArgumentException("schedule sets no cron field");
        }
        return schedule;
    }

    /**
     * Convert to a six-field Spring cron expression
     * ({@code second minute hour day-of-month month day-of-week}).
     */
    public String toCronExpression() {
        // Most significant first, day_of_week between day and hour
        var given = new String[]{month, day, dayOfWeek, hour, minute, second};
        var minimums = new String[]{"1", "1", "*", "0", "0", "0"};
        var last = leastSignificantField();

        var resolved = new String[given.length];
        for (var i = 0; i < given.length; i++) {
            if (given[i] != null) {
                resolved[i] = given[i];
            } else {
                resolved[i] = i > last ? minimums[i] : "*";
            }
        }

        return String.join(" ",
                resolved[5],
                resolved[4],
                resolved[3],
                translateDay(resolved[1]),
                resolved[0],
                translateDayOfWeek(resolved[2]));
    }

    /**
     * Zone to evaluate this schedule in
     */
    public ZoneId zoneOr(ZoneId defaultZone) {
        return timezone != null ? ZoneId.of(timezone) : defaultZone;
    }

    private int leastSignificantField() {
        var given = new String[]{month, day, dayOfWeek, hour, minute, second};
        var last = -1;
        for (var i = 0; i < given.length; i++) {
            if (given[i] != null) {
                last = i;
            }
        }
        return last;
    }

    private static String normalize(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return String.valueOf(number.longValue());
        }
        if (value instanceof String text) {
            var trimmed = text.trim();
            if (trimmed.isEmpty()) {
                throw new IllegalArgumentException("empty schedule value");
            }
            return trimmed;
        }
        throw new IllegalArgumentException("schedule values must be numbers or strings, got " + value);
    }

    private static String translateDay(String value) {
        return "last".equalsIgnoreCase(value) ? "L" : value;
    }

    private static String translateDayOfWeek(String value) {
        var matcher = DAY_NUMBER.matcher(value);
        var result = new StringBuilder();
        while (matcher.find()) {
            var number = Integer.parseInt(matcher.group(1));
            if (number >= DAY_NAMES.length) {
                throw new IllegalArgumentException("day_of_week out of range: " + number);
            }
            matcher.appendReplacement(result, Matcher.quoteReplacement(DAY_NAMES[number]));
        }
        matcher.appendTail(result);
        return result.toString().toUpperCase(Locale.ROOT);
    }
}
