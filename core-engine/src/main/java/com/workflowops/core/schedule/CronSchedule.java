package com.workflowops.core.schedule;

import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Date;
import java.util.Objects;
import java.util.Optional;
import java.util.TimeZone;

/**
 * Quartz cron expressions as used in job schedules.
 *
 * <p>
 * Expressions are seconds-first with six fields and an optional seventh year
 * field, e.g. {@code "00 00 03 * * ?"} (every day at 03:00:00). Quartz
 * requires one of day-of-month and day-of-week to be {@code ?}.
 * </p>
 */
public final class CronSchedule {

    private CronSchedule() {
    }

    /**
     * @param expression cron expression; may be {@code null}
     * @return a description of why the expression is invalid, or empty if it
     *         is valid
     */
    public static Optional<String> validate(String expression) {
        if (expression == null || expression.isBlank()) {
            return Optional.of("cron expression must not be blank");
        }
        try {
            CronExpression.validateExpression(expression);
            return Optional.empty();
        } catch (ParseException e) {
            return Optional.of(e.getMessage());
        }
    }

    public static boolean isValid(String expression) {
        return validate(expression).isEmpty();
    }

    /**
     * Computes the first fire time strictly after {@code after}.
     *
     * @param expression valid cron expression
     * @param after      reference instant
     * @param zone       time zone the expression is evaluated in
     * @return next fire time, or empty if the expression never fires again
     * @throws IllegalArgumentException if the expression is invalid
     */
    public static Optional<Instant> nextRunAfter(String expression, Instant after, ZoneId zone) {
        Objects.requireNonNull(after, "after must not be null");
        Objects.requireNonNull(zone, "zone must not be null");
        CronExpression cron;
        try {
            cron = new CronExpression(expression);
        } catch (ParseException e) {
            throw new IllegalArgumentException("Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
        cron.setTimeZone(TimeZone.getTimeZone(zone));
        Date next = cron.getNextValidTimeAfter(Date.from(after));
        return Optional.ofNullable(next).map(Date::toInstant);
    }
}
