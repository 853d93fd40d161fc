package com.example.roster.config;

import com.example.roster.roster.OptimizationMode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;

/**
 * Engine tunables, bound from {@code roster.*} properties.
 */
@Component
public class RosterSettings {

    private final int defaultDaysBase;
    private final int defaultDaysHome;
    private final OptimizationMode defaultMode;
    private final int defaultMinStaff;
    private final boolean reserveExitDay;
    private final int maxRepairPasses;
    private final int seedDaysBase;
    private final int seedDaysHome;
    private final int releaseMargin;
    private final int annealingIterations;
    private final double annealingInitialTemperature;
    private final double annealingCoolingRate;
    private final boolean propagateHomeIntent;
    private final boolean avoidRestDayTransitions;
    private final DayOfWeek restDay;

    public RosterSettings(
            @Value("${roster.rotation.default-days-base:11}") int defaultDaysBase,
            @Value("${roster.rotation.default-days-home:3}") int defaultDaysHome,
            @Value("${roster.optimization.default-mode:ratio}") String defaultMode,
            @Value("${roster.min-staff.default:0}") int defaultMinStaff,
            @Value("${roster.ratio.reserve-exit-day:false}") boolean reserveExitDay,
            @Value("${roster.min-headcount.max-repair-passes:200}") int maxRepairPasses,
            @Value("${roster.min-headcount.seed-days-base:8}") int seedDaysBase,
            @Value("${roster.min-headcount.seed-days-home:6}") int seedDaysHome,
            @Value("${roster.min-headcount.release-margin:2}") int releaseMargin,
            @Value("${roster.annealing.iterations:20000}") int annealingIterations,
            @Value("${roster.annealing.initial-temperature:100}") double annealingInitialTemperature,
            @Value("${roster.annealing.cooling-rate:0.9995}") double annealingCoolingRate,
            @Value("${roster.constraints.propagate-home-intent:false}") boolean propagateHomeIntent,
            @Value("${roster.weekend.avoid-saturday-transitions:false}") boolean avoidRestDayTransitions,
            @Value("${roster.weekend.rest-day:SATURDAY}") DayOfWeek restDay) {
        this.defaultDaysBase = defaultDaysBase;
        this.defaultDaysHome = defaultDaysHome;
        this.defaultMode = OptimizationMode.fromCode(defaultMode);
        this.defaultMinStaff = Math.max(0, defaultMinStaff);
        this.reserveExitDay = reserveExitDay;
        this.maxRepairPasses = Math.max(0, maxRepairPasses);
        this.seedDaysBase = Math.max(1, seedDaysBase);
        this.seedDaysHome = Math.max(0, seedDaysHome);
        this.releaseMargin = Math.max(0, releaseMargin);
        this.annealingIterations = Math.max(0, annealingIterations);
        this.annealingInitialTemperature = annealingInitialTemperature;
        this.annealingCoolingRate = annealingCoolingRate;
        this.propagateHomeIntent = propagateHomeIntent;
        this.avoidRestDayTransitions = avoidRestDayTransitions;
        this.restDay = restDay == null ? DayOfWeek.SATURDAY : restDay;
    }

    /** Same values as an empty {@code application.properties}. */
    public static RosterSettings defaults() {
        return new RosterSettings(11, 3, "ratio", 0, false, 200, 8, 6, 2,
                20000, 100, 0.9995, false, false, DayOfWeek.SATURDAY);
    }

    public int getDefaultDaysBase() { return defaultDaysBase; }
    public int getDefaultDaysHome() { return defaultDaysHome; }
    public OptimizationMode getDefaultMode() { return defaultMode; }
    public int getDefaultMinStaff() { return defaultMinStaff; }
    public boolean isReserveExitDay() { return reserveExitDay; }
    public int getMaxRepairPasses() { return maxRepairPasses; }
    public int getSeedDaysBase() { return seedDaysBase; }
    public int getSeedDaysHome() { return seedDaysHome; }
    public int getReleaseMargin() { return releaseMargin; }
    public int getAnnealingIterations() { return annealingIterations; }
    public double getAnnealingInitialTemperature() { return annealingInitialTemperature; }
    public double getAnnealingCoolingRate() { return annealingCoolingRate; }
    public boolean isPropagateHomeIntent() { return propagateHomeIntent; }
    public boolean isAvoidRestDayTransitions() { return avoidRestDayTransitions; }
    public DayOfWeek getRestDay() { return restDay; }
}
