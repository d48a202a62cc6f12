package com.example.jobscheduler.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.support.CronExpression;

import java.time.ZoneId;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JobSchedule Tests")
class JobScheduleTest {

    private static String cron(Map<String, Object> values) {
        return JobSchedule.fromMap(values).toCronExpression();
    }

    @Nested
    @DisplayName("Cron conversion")
    class CronConversionTests {

        @Test
        @DisplayName("Should zero fields below the least significant given field")
        void shouldZeroLessSignificantFields() {
            assertThat(cron(Map.of("hour", 1, "minute", 15))).isEqualTo("0 15 1 * * *");
        }

        @Test
        @DisplayName("Should match everything above the most significant given field")
        void shouldWildcardMoreSignificantFields() {
            assertThat(cron(Map.of("minute", "*/5"))).isEqualTo("0 */5 * * * *");
        }

        @Test
        @DisplayName("Should start day and month at one")
        void shouldUseOneForDayAndMonthMinimums() {
            assertThat(cron(Map.of("month", 6))).isEqualTo("0 0 0 1 6 *");
        }

        @Test
        @DisplayName("Should leave day of week open when only later fields are given")
        void shouldLeaveDayOfWeekOpen() {
            assertThat(cron(Map.of("day", 15))).isEqualTo("0 0 0 15 * *");
        }

        @Test
        @DisplayName("Should keep explicit seconds")
        void shouldKeepSeconds() {
            assertThat(cron(Map.of("second", "*/10"))).isEqualTo("*/10 * * * * *");
        }

        @Test
        @DisplayName("Should translate last day of month")
        void shouldTranslateLastDay() {
            assertThat(cron(Map.of("day", "last", "hour", 3))).isEqualTo("0 0 3 L * *");
        }

        @Test
        @DisplayName("Should number days of the week from Monday")
        void shouldTranslateNumericDaysOfWeek() {
            assertThat(cron(Map.of("day_of_week", "0-4", "hour", "9"))).isEqualTo("0 0 9 * * MON-FRI");
            assertThat(cron(Map.of("day_of_week", 6, "hour", 2))).isEqualTo("0 0 2 * * SUN");
        }

        @Test
        @DisplayName("Should keep step values and day names")
        void shouldKeepStepsAndNames() {
            assertThat(cron(Map.of("day_of_week", "*/2"))).isEqualTo("0 0 0 * * */2");
            assertThat(cron(Map.of("day_of_week", "mon,wed", "hour", 8))).isEqualTo("0 0 8 * * MON,WED");
        }

        @Test
        @DisplayName("Should produce expressions Spring can parse")
        void shouldProduceParsableExpressions() {
            var expression = cron(Map.of("day_of_week", "0-4", "hour", "1", "minute", "15"));
            assertThat(CronExpression.isValidExpression(expression)).isTrue();
        }

        @Test
        @DisplayName("Should reject out of range day of week")
        void shouldRejectOutOfRangeDayOfWeek() {
            var schedule = JobSchedule.fromMap(Map.of("day_of_week", 7));
            assertThatThrownBy(schedule::toCronExpression)
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("day_of_week");
        }
    }

    @Nested
    @DisplayName("fromMap")
    class FromMapTests {

        @Test
        @DisplayName("Empty object is no schedule")
        void emptyObjectIsNoSchedule() {
            assertThat(JobSchedule.fromMap(Map.of())).isNull();
            assertThat(JobSchedule.fromMap(null)).isNull();
        }

        @Test
        @DisplayName("Null values are treated as absent")
        void nullValuesAreAbsent() {
            var values = new HashMap<String, Object>();
            values.put("hour", null);
            assertThat(JobSchedule.fromMap(values)).isNull();

            values.put("minute", 30);
            assertThat(JobSchedule.fromMap(values).toCronExpression()).isEqualTo("0 30 * * * *");
        }

        @Test
        @DisplayName("Should reject unsupported fields")
        void shouldRejectUnsupportedFields() {
            assertThatThrownBy(() -> JobSchedule.fromMap(Map.of("year", 2030)))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("year");
            assertThatThrownBy(() -> JobSchedule.fromMap(Map.of("week", 2, "hour", 1)))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should reject timezone without any cron field")
        void shouldRejectTimezoneOnly() {
            assertThatThrownBy(() -> JobSchedule.fromMap(Map.of("timezone", "UTC")))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Should reject values that are neither numbers nor strings")
        void shouldRejectOtherValueTypes() {
            assertThatThrownBy(() -> JobSchedule.fromMap(Map.of("hour", true)))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> JobSchedule.fromMap(Map.of("hour", " ")))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("Numbers and strings with the same value are equal schedules")
        void numbersAndStringsAreEqual() {
            assertThat(JobSchedule.fromMap(Map.of("hour", 1)))
                    .isEqualTo(JobSchedule.fromMap(Map.of("hour", "1")));
        }
    }

    @Test
    @DisplayName("Should use its own timezone when it has one")
    void shouldResolveZone() {
        var fallback = ZoneId.of("America/New_York");
        assertThat(JobSchedule.fromMap(Map.of("hour", 1)).zoneOr(fallback)).isEqualTo(fallback);
        assertThat(JobSchedule.fromMap(Map.of("hour", 1, "timezone", "UTC")).zoneOr(fallback)).isEqualTo(ZoneId.of("UTC"));
    }
}
