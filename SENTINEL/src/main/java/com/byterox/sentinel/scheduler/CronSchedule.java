package com.byterox.sentinel.scheduler;

import com.byterox.sentinel.exception.ValidationException;
import org.springframework.scheduling.support.CronExpression;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * A standard five-field cron expression ({@code minute hour day-of-month month day-of-week}).
 * <p>
 * Evaluation is delegated to Spring's {@link CronExpression} with a zero seconds field. When both
 * day-of-month and day-of-week are restricted, a date must satisfy both.
 */
public final class CronSchedule {

    private static final int FIELDS = 5;

    private final String expression;
    private final CronExpression cron;

    private CronSchedule(String expression, CronExpression cron) {
        this.expression = expression;
        this.cron = cron;
    }

    /**
     * @throws ValidationException if the expression is not a valid five-field cron or never fires
     */
    public static CronSchedule parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ValidationException("cronExpression is required");
        }
        String normalized = expression.trim().replaceAll("\\s+", " ");
        int fields = normalized.split(" ").length;
        if (fields != FIELDS) {
            throw new ValidationException("Invalid cron expression '" + expression + "': expected "
                    + FIELDS + " fields but found " + fields);
        }
        CronExpression cron;
        try {
            cron = CronExpression.parse("0 " + normalized);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Invalid cron expression '" + expression + "': " + e.getMessage());
        }
        if (cron.next(ZonedDateTime.now(ZoneId.of("UTC"))) == null) {
            throw new ValidationException("Cron expression '" + expression + "' never fires");
        }
        return new CronSchedule(normalized, cron);
    }

    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (ValidationException e) {
            return false;
        }
    }

    /**
     * @return the first fire time strictly after {@code after}, or null if there is none
     */
    public Instant next(Instant after, ZoneId zone) {
        ZonedDateTime next = cron.next(ZonedDateTime.ofInstant(after, zone));
        return next != null ? next.toInstant() : null;
    }

    public String expression() {
        return expression;
    }

    @Override
    public String toString() {
        return expression;
    }
}
