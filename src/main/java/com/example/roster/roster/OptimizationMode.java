package com.example.roster.roster;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum OptimizationMode {
    RATIO("ratio"),
    MIN_STAFF("min_staff"),
    TASKS("tasks"),
    ANNEALING("annealing");

    private final String code;

    OptimizationMode(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @JsonCreator
    public static OptimizationMode fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        for (OptimizationMode mode : values()) {
            if (mode.code.equals(normalized) || mode.name().equalsIgnoreCase(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown optimization mode: " + code);
    }
}
