package com.example.roster.person;

public record DayOverride(AvailabilityStatus status, OverrideSource source) {

    public boolean isManual() {
        return source != OverrideSource.ALGORITHM;
    }

    public boolean isAvailable() {
        return status == null || status.isAvailable();
    }
}
