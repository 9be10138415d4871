package com.example.oncallrotation.cron;

import com.example.oncallrotation.exception.InvalidInputException;
import lombok.extern.slf4j.Slf4j;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Date;
import java.util.Optional;
import java.util.TimeZone;
import java.util.regex.Pattern;

/**
 * Computes the next occurrence of a cron expression in a timezone.
 * <p>
 * Accepted shapes:
 * - 5 fields: minute hour day-of-month month day-of-week, Unix weekday numbering (0 or 7 = Sunday)
 * - 6 fields: minute hour day-of-month month day-of-week year (EventBridge shape)
 * - 7 fields: second minute hour day-of-month month day-of-week year
 * <p>
 * The 6 and 7 field shapes use Quartz weekday numbering (1 = Sunday). Expressions are normalized to
 * the 7-field Quartz form before evaluation. Evaluation never
 * returns the reference instant itself, only strictly later matches.
 */
@Slf4j
public final class CronEvaluator {

    private static final String ANY = "*";
    private static final String NO_SPECIFIC_VALUE = "?";

    private static final DateTimeFormatter AT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private static final Pattern UNIX_DAY_RANGE = Pattern.compile("(\\d+)(?:-(\\d+))?");

    private static final int DAY_OF_MONTH = 3;
    private static final int DAY_OF_WEEK = 5;

    private CronEvaluator() {
    }

    /**
     * Next occurrence strictly after {@code from}.
     *
     * @return empty when the expression has no reachable future match, which callers treat as
     * "retire the task"
     * @throws InvalidInputException if the expression is malformed
     */
    public static Optional<CronOccurrence> nextOccurrence(String cronExpression, ZoneId zone, Instant from) {
        var fields = normalize(cronExpression);
        var quartz = parse(String.join(" ", fields), cronExpression);
        quartz.setTimeZone(TimeZone.getTimeZone(zone));

        var next = quartz.getNextValidTimeAfter(Date.from(from));
        if (next == null) {
            log.debug("Cron '{}' has no occurrence after {}", cronExpression, from);
            return Optional.empty();
        }

        var at = next.toInstant().atZone(zone);

        return Optional.of(CronOccurrence.builder()
                .cron(canonical(fields))
                .zone(zone)
                .singleShotExpression(singleShotExpression(at))
                .nextTimestampUtc(at.toEpochSecond())
                .nextDateTime(at)
                .build());
    }

    /**
     * Same as {@link #nextOccurrence(String, ZoneId, Instant)} with the zone given by IANA name.
     */
    public static Optional<CronOccurrence> nextOccurrence(String cronExpression, String timezone, Instant from) {
        return nextOccurrence(cronExpression, parseZone(timezone), from);
    }

    /**
     * Canonical (seconds-stripped) form of an expression. Two expressions describing the same
     * schedule share a canonical form.
     */
    public static String canonicalize(String cronExpression) {
        var fields = normalize(cronExpression);
        parse(String.join(" ", fields), cronExpression);
        return canonical(fields);
    }

    public static ZoneId parseZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            throw new InvalidInputException("timezone", "Timezone is required");
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            throw new InvalidInputException("timezone", "Unknown timezone: " + timezone);
        }
    }

    /**
     * One-off {@code at(...)} expression for the local date-time of the given instant, seconds
     * included. It fires at exactly {@link CronOccurrence#getNextTimestampUtc()}.
     */
    static String singleShotExpression(ZonedDateTime at) {
        return "at(" + AT_FORMAT.format(at.toLocalDateTime()) + ")";
    }

    static String[] normalize(String cronExpression) {
        if (cronExpression == null || cronExpression.isBlank()) {
            throw new InvalidInputException("cron", "Cron expression is required");
        }

        var parts = cronExpression.trim().split("\\s+");
        String[] fields;
        switch (parts.length) {
            case 5 -> {
                fields = new String[7];
                fields[0] = "0";
                System.arraycopy(parts, 0, fields, 1, 5);
                fields[DAY_OF_WEEK] = toQuartzDaysOfWeek(parts[4]);
                fields[6] = ANY;
            }
            case 6 -> {
                fields = new String[7];
                fields[0] = "0";
                System.arraycopy(parts, 0, fields, 1, 6);
            }
            case 7 -> fields = Arrays.copyOf(parts, 7);
            default -> throw new InvalidInputException("cron",
                    String.format("Cron expression must have 5, 6 or 7 fields but has %d: %s", parts.length, cronExpression));
        }

        // Quartz needs '?' in exactly one of the day fields
        if (!NO_SPECIFIC_VALUE.equals(fields[DAY_OF_MONTH]) && !NO_SPECIFIC_VALUE.equals(fields[DAY_OF_WEEK])) {
            if (ANY.equals(fields[DAY_OF_WEEK])) {
                fields[DAY_OF_WEEK] = NO_SPECIFIC_VALUE;
            } else if (ANY.equals(fields[DAY_OF_MONTH])) {
                fields[DAY_OF_MONTH] = NO_SPECIFIC_VALUE;
            }
        }
        return fields;
    }

    /**
     * Renumbers a Unix day-of-week field (0-7, Sunday = 0 or 7) to Quartz (1-7, Sunday = 1). Names,
     * wildcards, step values and the {@code #} ordinal are left alone.
     */
    static String toQuartzDaysOfWeek(String field) {
        var items = new ArrayList<String>();
        for (var item : field.split(",")) {
            var suffixAt = indexOfAny(item, '/', '#');
            var days = suffixAt < 0 ? item : item.substring(0, suffixAt);
            var suffix = suffixAt < 0 ? "" : item.substring(suffixAt);

            var range = UNIX_DAY_RANGE.matcher(days);
            if (!range.matches()) {
                items.add(item);
                continue;
            }
            var start = toQuartzDay(range.group(1));
            if (range.group(2) == null) {
                items.add(start + suffix);
                continue;
            }
            var end = toQuartzDay(range.group(2));
            if (end < start && suffix.isEmpty()) {
                // 5-7 is Friday to Sunday, which wraps past Saturday in Quartz numbering
                items.add(start + "-7");
                items.add(end == 1 ? "1" : "1-" + end);
            } else {
                items.add(start + "-" + end + suffix);
            }
        }
        return String.join(",", items);
    }

    private static int toQuartzDay(String unixDay) {
        var day = Integer.parseInt(unixDay);
        if (day > 7) {
            throw new InvalidInputException("cron", "Day-of-week values must be between 0 and 7: " + unixDay);
        }
        return day % 7 + 1;
    }

    private static int indexOfAny(String value, char first, char second) {
        var a = value.indexOf(first);
        var b = value.indexOf(second);
        if (a < 0) {
            return b;
        }
        return b < 0 ? a : Math.min(a, b);
    }

    private static String canonical(String[] fields) {
        return String.join(" ", Arrays.copyOfRange(fields, 1, fields.length));
    }

    private static CronExpression parse(String normalized, String original) {
        try {
            return new CronExpression(normalized);
        } catch (ParseException e) {
            throw new InvalidInputException("cron", String.format("Invalid cron expression '%s': %s", original, e.getMessage()));
        }
    }
}
