package com.bko.workouttracker.shared;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * User-facing date labels: "Today" and "Yesterday" for the current and prior
 * calendar day, ISO {@code yyyy-MM-dd} otherwise.
 */
public final class DateLabels {
    public static final String TODAY = "Today";
    public static final String YESTERDAY = "Yesterday";

    private DateLabels() {
    }

    public static String format(LocalDate date, LocalDate today) {
        if (date == null) {
            return "";
        }
        if (date.equals(today)) {
            return TODAY;
        }
        if (date.equals(today.minusDays(1))) {
            return YESTERDAY;
        }
        return date.format(DateTimeFormatter.ISO_LOCAL_DATE);
    }

    public static String format(LocalDate date, Clock clock) {
        return format(date, LocalDate.now(clock));
    }
}
