package com.hockey.prediction.stats;

import java.time.LocalDate;
import java.time.Month;

/**
 * Season identifiers in the league's {@code 20252026} form.
 */
public final class Seasons {

    private Seasons() {
    }

    /**
     * Season a date belongs to; a new season starts on 1 September.
     */
    public static String forDate(LocalDate date) {
        int startYear = date.getMonthValue() >= Month.SEPTEMBER.getValue()
                ? date.getYear()
                : date.getYear() - 1;
        return String.valueOf(startYear) + (startYear + 1);
    }
}
