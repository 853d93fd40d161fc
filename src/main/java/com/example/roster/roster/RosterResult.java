package com.example.roster.roster;

import java.util.List;
import java.util.Map;

/**
 * Complete output of one run. Non-empty {@code warnings} or {@code unfulfilledConstraints}
 * mean the run succeeded with caveats.
 *
 * @param personStatuses date key -> person id -> status, same content as {@code roster}
 */
public record RosterResult(
        List<DailyPresence> roster,
        Map<String, Map<String, DayStatus>> personStatuses,
        Stats stats,
        List<String> warnings,
        List<UnfulfilledConstraint> unfulfilledConstraints) {

    public record Stats(int totalDays, double avgStaffPerDay, ConstraintStats constraintStats) {
    }

    public record ConstraintStats(int total, int met, int percentage) {
    }
}
