package com.workflowops.core.schedule;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link CronSchedule}.
 */
class CronScheduleTest {

    @Test
    @DisplayName("Should accept Quartz expressions")
    void shouldAcceptValid() {
        assertThat(CronSchedule.isValid("00 00 03 * * ?")).isTrue();
        assertThat(CronSchedule.isValid("0 30 6 ? * MON-FRI")).isTrue();
        assertThat(CronSchedule.isValid("0 0/15 * * * ?")).isTrue();
        assertThat(CronSchedule.isValid("0 0 12 1 1 ? 2030")).isTrue();
    }

    @Test
    @DisplayName("Should reject malformed expressions")
    void shouldRejectInvalid() {
        assertThat(CronSchedule.validate("0 3 * * *")).isPresent();
        assertThat(CronSchedule.validate("00 00 03 * * *")).isPresent();
        assertThat(CronSchedule.validate("every day")).isPresent();
        assertThat(CronSchedule.validate("0 0 25 * * ?")).isPresent();
    }

    @Test
    @DisplayName("Should reject a blank expression")
    void shouldRejectBlank() {
        assertThat(CronSchedule.validate("  ")).contains("cron expression must not be blank");
        assertThat(CronSchedule.validate(null)).isPresent();
    }

    @Test
    @DisplayName("Should compute the next run in the given zone")
    void shouldComputeNextRun() {
        ZoneId london = ZoneId.of("Europe/London");
        Instant after = ZonedDateTime.of(2024, 7, 1, 4, 0, 0, 0, london).toInstant();

        assertThat(CronSchedule.nextRunAfter("00 00 03 * * ?", after, london))
                .contains(ZonedDateTime.of(2024, 7, 2, 3, 0, 0, 0, london).toInstant());
    }

    @Test
    @DisplayName("Should throw when computing the next run of an invalid expression")
    void shouldThrowForInvalidNextRun() {
        assertThatThrownBy(() -> CronSchedule.nextRunAfter("nope", Instant.now(), ZoneId.of("UTC")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("nope");
    }
}
