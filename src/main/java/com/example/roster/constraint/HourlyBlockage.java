package com.example.roster.constraint;

import java.time.LocalDate;
import java.time.LocalTime;

public record HourlyBlockage(String personId, LocalDate date, LocalTime startTime, LocalTime endTime) {

    private static final LocalTime DAY_END = LocalTime.of(23, 59);

    /** Only a blockage spanning the whole day matters here; partial ones belong to shift assignment. */
    public boolean isFullDay() {
        return startTime != null && endTime != null
                && startTime.equals(LocalTime.MIDNIGHT)
                && !endTime.isBefore(DAY_END);
    }
}
