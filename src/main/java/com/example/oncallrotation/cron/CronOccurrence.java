package com.example.oncallrotation.cron;

import lombok.Builder;
import lombok.Value;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;

/**
 * The next concrete occurrence of a cron expression in a timezone.
 * <p>
 * {@code nextTimestampUtc} is always strictly later than the reference instant the occurrence
 * was computed from.
 */
@Value
@Builder
public class CronOccurrence {

    /**
     * Canonical expression, seconds field stripped
     */
    String cron;

    ZoneId zone;

    /**
     * {@code at(yyyy-MM-ddTHH:mm:ss)} expression firing once at {@link #nextDateTime}
     */
    String singleShotExpression;

    /**
     * Epoch seconds
     */
    long nextTimestampUtc;

    ZonedDateTime nextDateTime;

    /**
     * ISO-8601 rendering with offset, e.g. {@code 2023-01-02T09:00:00+11:00}
     */
    public String formatLocal() {
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(nextDateTime);
    }
}
