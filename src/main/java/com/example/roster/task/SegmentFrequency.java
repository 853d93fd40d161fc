package com.example.roster.task;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SegmentFrequency {
    DAILY,
    WEEKLY,
    SPECIFIC_DATE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static SegmentFrequency fromCode(String code) {
        if (code == null || code.isBlank()) {
            return null;
        }
        return SegmentFrequency.valueOf(code.trim().replace('-', '_').toUpperCase(Locale.ROOT));
    }
}
