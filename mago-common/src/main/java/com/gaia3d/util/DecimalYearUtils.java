package com.gaia3d.util;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Decimal year conversions used by time-dependent geophysical models (e.g. 2025.5 for early July 2025).
 */
public class DecimalYearUtils {

    private DecimalYearUtils() {
    }

    public static double toDecimalYear(LocalDate date) {
        int year = date.getYear();
        return year + (date.getDayOfYear() - 1) / (double) date.lengthOfYear();
    }

    public static double toDecimalYear(Instant instant) {
        return toDecimalYear(LocalDate.ofInstant(instant, ZoneOffset.UTC));
    }

    public static double currentDecimalYear() {
        return toDecimalYear(Instant.now());
    }
}
