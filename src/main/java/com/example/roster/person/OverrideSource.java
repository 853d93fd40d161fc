package com.example.roster.person;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Who wrote a day override. Values written by a previous roster run are not treated as constraints.
 */
public enum OverrideSource {
    MANUAL,
    ALGORITHM;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static OverrideSource fromCode(String code) {
        if (code == null || code.isBlank()) {
            return MANUAL;
        }
        return "algorithm".equalsIgnoreCase(code.trim()) ? ALGORITHM : MANUAL;
    }
}
