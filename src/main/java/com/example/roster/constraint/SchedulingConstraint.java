package com.example.roster.constraint;

import java.time.LocalDate;

/**
 * Date range tied to a person, or to every member of a team when {@code personId} is absent.
 * Both ends are inclusive.
 */
public record SchedulingConstraint(
        String personId,
        String teamId,
        ConstraintKind kind,
        LocalDate startDate,
        LocalDate endDate,
        String description) {

    public SchedulingConstraint(String personId, ConstraintKind kind, LocalDate startDate, LocalDate endDate) {
        this(personId, null, kind, startDate, endDate, null);
    }

    public ConstraintKind effectiveKind() {
        return kind == null ? ConstraintKind.NEVER_ASSIGN : kind;
    }

    public boolean appliesTo(String candidatePersonId, String candidateTeamId) {
        if (personId != null && !personId.isBlank()) {
            return personId.equals(candidatePersonId);
        }
        return teamId != null && teamId.equals(candidateTeamId);
    }
}
