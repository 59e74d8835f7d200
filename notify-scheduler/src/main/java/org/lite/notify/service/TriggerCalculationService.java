package org.lite.notify.service;

import org.lite.notify.exception.InvalidExpressionException;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Service for calculating cron-related timing information
 */
public interface TriggerCalculationService {

    /**
     * Calculate the next fire time strictly after a reference instant.
     * @param cronExpression 5-field (minute hour day month weekday) or 6-field (second first) expression
     * @param after the reference instant
     * @return the next fire instant
     * @throws InvalidExpressionException if the expression cannot be parsed or never fires again
     */
    Instant nextFireTime(String cronExpression, Instant after);

    /**
     * Translate a 5/6-field expression into the Quartz form used by live cron triggers.
     * @return empty when both day-of-month and day-of-week are restricted, since
     *         a Quartz cron trigger cannot require both; such schedules are
     *         driven from {@link #nextFireTime} instead
     * @throws InvalidExpressionException if the expression cannot be parsed
     */
    Optional<String> toQuartzExpression(String cronExpression);

    /**
     * Check the expression parses and has at least one future fire time.
     * @throws InvalidExpressionException otherwise
     */
    void validate(String cronExpression);

    ZoneId getZone();
}
