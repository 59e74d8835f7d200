package org.lite.notify.util;

import org.lite.notify.config.SchedulerProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.TextStyle;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces the fixed set of time placeholders ({{date}}, {{time}}, {{weekday}}, ...)
 * in message text. Unknown placeholders are left as written.
 */
@Component
public class MessageTemplateRenderer {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{\\{\\s*([a-z_]+)\\s*}}");

    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("HH:mm:ss");
    private static final DateTimeFormatter DATETIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;
    private final ZoneId zone;

    public MessageTemplateRenderer(Clock clock, SchedulerProperties properties) {
        this.clock = clock;
        this.zone = properties.zoneId();
    }

    public String render(String text) {
        if (text == null || !text.contains("{{")) {
            return text;
        }
        Map<String, String> values = currentValues();
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder rendered = new StringBuilder();
        while (matcher.find()) {
            String value = values.get(matcher.group(1));
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(value != null ? value : matcher.group()));
        }
        matcher.appendTail(rendered);
        return rendered.toString();
    }

    private Map<String, String> currentValues() {
        ZonedDateTime now = ZonedDateTime.ofInstant(clock.instant(), zone);
        Map<String, String> values = new LinkedHashMap<>();
        values.put("date", now.format(DATE));
        values.put("time", now.format(TIME));
        values.put("datetime", now.format(DATETIME));
        values.put("year", String.valueOf(now.getYear()));
        values.put("month", String.format("%02d", now.getMonthValue()));
        values.put("day", String.format("%02d", now.getDayOfMonth()));
        values.put("hour", String.format("%02d", now.getHour()));
        values.put("minute", String.format("%02d", now.getMinute()));
        values.put("second", String.format("%02d", now.getSecond()));
        values.put("weekday", now.getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.ENGLISH));
        values.put("timestamp", String.valueOf(now.toEpochSecond()));
        return values;
    }
}
