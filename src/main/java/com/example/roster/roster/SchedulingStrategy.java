package com.example.roster.roster;

/**
 * One way of filling the base/home grid for a prepared context.
 */
public interface SchedulingStrategy {

    OptimizationMode mode();

    StrategyResult generate(SchedulingContext context);

    /** Floor this strategy will enforce; used for the feasibility check before the run. */
    default int effectiveMinStaff(SchedulingContext context) {
        return context.minStaff();
    }
}
