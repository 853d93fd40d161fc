package com.example.roster.person;

import jakarta.validation.constraints.NotBlank;

import java.time.LocalDate;
import java.util.Collections;
import java.util.Map;

/**
 * Snapshot of a person as supplied by the caller.
 *
 * @param dailyAvailability per-day overrides keyed by calendar date, may be null
 * @param active            null is treated as active
 */
public record Person(
        @NotBlank(message = "person id is required") String id,
        String name,
        String teamId,
        Map<LocalDate, DayOverride> dailyAvailability,
        Boolean active) {

    public Person(String id, String name, String teamId) {
        this(id, name, teamId, Collections.emptyMap(), true);
    }

    public boolean isActive() {
        return !Boolean.FALSE.equals(active);
    }

    public Map<LocalDate, DayOverride> overrides() {
        return dailyAvailability == null ? Collections.emptyMap() : dailyAvailability;
    }

    public String displayName() {
        return name == null || name.isBlank() ? id : name;
    }
}
