package com.company.anomaly.util;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Locale;

public class TimeUtils {

    private TimeUtils() {
    }

    /**
     * Milliseconds rendered as seconds with one decimal, e.g. {@code 135000 -> "135.0s"}.
     */
    public static String formatSeconds(double millis) {
        return String.format(Locale.ROOT, "%.1fs", millis / 1000.0);
    }

    /**
     * Parses either a full ISO-8601 instant or a plain date. A plain date maps to the
     * start of that day (UTC), or to its last millisecond when {@code endOfDay} is set.
     */
    public static Instant parseInstantOrDate(String value, boolean endOfDay) {
        if (value.length() == 10) {
            LocalDate date = LocalDate.parse(value);
            Instant startOfDay = date.atStartOfDay(ZoneOffset.UTC).toInstant();
            return endOfDay ? startOfDay.plus(Duration.ofDays(1)).minusMillis(1) : startOfDay;
        }
        return Instant.parse(value);
    }
}
