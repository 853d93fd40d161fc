package com.example.roster.roster;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DayStatus {
    BASE,
    HOME,
    UNAVAILABLE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
