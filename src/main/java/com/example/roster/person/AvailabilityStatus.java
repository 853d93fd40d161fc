package com.example.roster.person;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Status written on a single day of a person's availability calendar.
 */
public enum AvailabilityStatus {
    BASE,
    HOME,
    ARRIVAL,
    DEPARTURE,
    UNAVAILABLE;

    /** False when the person cannot be on base that day at all. */
    public boolean isAvailable() {
        return this != HOME && this != UNAVAILABLE;
    }

    /** Day that starts or continues time away from base. */
    public boolean startsHomeIntent() {
        return this == HOME || this == UNAVAILABLE || this == DEPARTURE;
    }

    /** Day that ends time away from base. */
    public boolean endsHomeIntent() {
        return this == BASE || this == ARRIVAL;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AvailabilityStatus fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        String normalized = code.trim().toUpperCase(Locale.ROOT);
        if ("FULL".equals(normalized)) {
            return BASE;
        }
        return AvailabilityStatus.valueOf(normalized);
    }
}
