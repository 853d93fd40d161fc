package com.example.roster.roster;

import java.util.List;

/**
 * Output of one strategy run. Warnings travel with the grid instead of being written into shared state.
 *
 * @param minStaff floor the strategy actually worked against
 */
public record StrategyResult(ScheduleGrid grid, int minStaff, List<String> warnings) {

    public StrategyResult {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }
}
