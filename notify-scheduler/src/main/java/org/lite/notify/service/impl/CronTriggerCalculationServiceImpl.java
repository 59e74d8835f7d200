package org.lite.notify.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.notify.config.SchedulerProperties;
import org.lite.notify.exception.InvalidExpressionException;
import org.lite.notify.service.TriggerCalculationService;
import org.quartz.CronExpression;
import org.springframework.stereotype.Service;

import java.text.ParseException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.BitSet;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.TimeZone;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

@Service
@Slf4j
public class CronTriggerCalculationServiceImpl implements TriggerCalculationService {

    // Crontab day numbering: 0 (or 7) is Sunday
    private static final List<String> DAY_NAMES = List.of("SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT");
    // Covers the 28-year cycle after which weekday and date line up again
    private static final int MAX_SEARCH_YEARS = 30;

    private final ZoneId zone;
    private final Clock clock;

    public CronTriggerCalculationServiceImpl(SchedulerProperties properties, Clock clock) {
        this.zone = properties.zoneId();
        this.clock = clock;
    }

    @Override
    public Instant nextFireTime(String cronExpression, Instant after) {
        CronFields fields = split(cronExpression);
        if (!fields.bothDaysRestricted()) {
            return next(cronExpression, compile(cronExpression, fields.quartzExpression()), after);
        }

        // Both day fields must match: walk the day-of-month schedule and keep the selected weekdays
        CronExpression byDayOfMonth = compile(cronExpression, fields.dayOfMonthExpression());
        ZonedDateTime limit = after.atZone(zone).plusYears(MAX_SEARCH_YEARS);
        Instant candidate = next(cronExpression, byDayOfMonth, after);
        while (true) {
            ZonedDateTime local = candidate.atZone(zone);
            if (local.isAfter(limit)) {
                throw new InvalidExpressionException(cronExpression, "expression yields no future fire time");
            }
            if (fields.days().get(local.getDayOfWeek().getValue() % 7)) {
                return candidate;
            }
            Instant lastMomentOfDay = local.toLocalDate().plusDays(1).atStartOfDay(zone).toInstant().minusMillis(1);
            candidate = next(cronExpression, byDayOfMonth, lastMomentOfDay);
        }
    }

    @Override
    public Optional<String> toQuartzExpression(String cronExpression) {
        CronFields fields = split(cronExpression);
        return fields.bothDaysRestricted() ? Optional.empty() : Optional.of(fields.quartzExpression());
    }

    @Override
    public void validate(String cronExpression) {
        nextFireTime(cronExpression, clock.instant());
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    private CronFields split(String cronExpression) {
        if (cronExpression == null || cronExpression.trim().isEmpty()) {
            throw new InvalidExpressionException(cronExpression, "expression is empty");
        }

        String[] fields = cronExpression.trim().split("\\s+");
        if (fields.length == 5) {
            return toFields(cronExpression, "0", fields[0], fields[1], fields[2], fields[3], fields[4]);
        }
        if (fields.length == 6) {
            return toFields(cronExpression, fields[0], fields[1], fields[2], fields[3], fields[4], fields[5]);
        }
        throw new InvalidExpressionException(cronExpression, "expected 5 or 6 fields but found " + fields.length);
    }

    private CronFields toFields(String cronExpression, String second, String minute, String hour,
                                String dayOfMonth, String month, String dayOfWeek) {
        BitSet days = expandDayOfWeek(cronExpression, dayOfWeek);
        boolean dayOfWeekRestricted = days.cardinality() < DAY_NAMES.size();
        boolean dayOfMonthRestricted = !"*".equals(dayOfMonth) && !"?".equals(dayOfMonth);
        String head = String.join(" ", second, minute, hour);
        return new CronFields(head, "?".equals(dayOfMonth) ? "*" : dayOfMonth, month, days,
                dayOfMonthRestricted, dayOfWeekRestricted);
    }

    private CronExpression compile(String cronExpression, String quartzExpression) {
        try {
            CronExpression cron = new CronExpression(quartzExpression);
            cron.setTimeZone(TimeZone.getTimeZone(zone));
            return cron;
        } catch (ParseException e) {
            log.error("Error parsing cron expression '{}' (quartz form '{}'): {}",
                    cronExpression, quartzExpression, e.getMessage());
            throw new InvalidExpressionException(cronExpression, e.getMessage(), e);
        }
    }

    private Instant next(String cronExpression, CronExpression cron, Instant after) {
        Date nextFireTime = cron.getNextValidTimeAfter(Date.from(after));
        if (nextFireTime == null) {
            log.warn("No next fire time for cron expression: {}", cronExpression);
            throw new InvalidExpressionException(cronExpression, "expression yields no future fire time");
        }
        return nextFireTime.toInstant();
    }

    /**
     * Expands a crontab day-of-week field (numbers 0-7, names, ranges, lists, steps)
     * into the set of days it selects.
     */
    private BitSet expandDayOfWeek(String cronExpression, String field) {
        BitSet days = new BitSet(7);
        for (String part : field.split(",")) {
            String range = part;
            int step = 1;
            int slash = part.indexOf('/');
            if (slash >= 0) {
                range = part.substring(0, slash);
                step = parseNumber(cronExpression, part.substring(slash + 1));
                if (step < 1) {
                    throw new InvalidExpressionException(cronExpression, "day-of-week step must be positive");
                }
            }

            int start;
            int end;
            if ("*".equals(range) || "?".equals(range)) {
                start = 0;
                end = 6;
            } else if (range.contains("-")) {
                String[] bounds = range.split("-", 2);
                start = parseDay(cronExpression, bounds[0]);
                end = parseDay(cronExpression, bounds[1]);
                if (end < start) {
                    end += 7;
                }
            } else {
                start = parseDay(cronExpression, range);
                end = slash >= 0 ? 6 : start;
            }

            int last = end;
            int increment = step;
            IntStream.iterate(start, day -> day <= last, day -> day + increment)
                    .forEach(day -> days.set(day % 7));
        }
        if (days.isEmpty()) {
            throw new InvalidExpressionException(cronExpression, "day-of-week selects no day");
        }
        return days;
    }

    private int parseDay(String cronExpression, String token) {
        String upper = token.trim().toUpperCase(Locale.ROOT);
        int named = DAY_NAMES.indexOf(upper);
        if (named >= 0) {
            return named;
        }
        int day = parseNumber(cronExpression, upper);
        if (day < 0 || day > 7) {
            throw new InvalidExpressionException(cronExpression, "day-of-week value out of range: " + token);
        }
        return day;
    }

    private int parseNumber(String cronExpression, String token) {
        try {
            return Integer.parseInt(token.trim());
        } catch (NumberFormatException e) {
            throw new InvalidExpressionException(cronExpression, "unexpected token '" + token + "'", e);
        }
    }

    /**
     * Crontab fields in Quartz terms. Quartz wants '?' in one of the two day
     * fields, so an expression restricting both has no single Quartz form.
     */
    private record CronFields(String head, String dayOfMonth, String month, BitSet days,
                              boolean dayOfMonthRestricted, boolean dayOfWeekRestricted) {

        boolean bothDaysRestricted() {
            return dayOfMonthRestricted && dayOfWeekRestricted;
        }

        String quartzExpression() {
            if (dayOfWeekRestricted) {
                String names = days.stream().mapToObj(DAY_NAMES::get).collect(Collectors.joining(","));
                return String.join(" ", head, "?", month, names);
            }
            return dayOfMonthExpression();
        }

        String dayOfMonthExpression() {
            return String.join(" ", head, dayOfMonth, month, "?");
        }
    }
}
