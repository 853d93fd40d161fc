package com.example.roster.constraint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ConstraintKind {
    NEVER_ASSIGN,
    ALWAYS_ASSIGN,
    TIME_BLOCK;

    /** Every kind except {@link #ALWAYS_ASSIGN} forbids base assignment. */
    public boolean forbidsBase() {
        return this != ALWAYS_ASSIGN;
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ConstraintKind fromCode(String code) {
        if (code == null || code.isBlank()) {
            return NEVER_ASSIGN;
        }
        return ConstraintKind.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
