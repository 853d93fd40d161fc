package com.example.roster.roster;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Locale-independent {@code yyyy-MM-dd} keys used throughout the roster output.
 */
public final class DateKeys {

    private static final DateTimeFormatter FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;

    private DateKeys() {
    }

    public static String format(LocalDate date) {
        return FORMAT.format(date);
    }
}
