package com.example.roster.rotation;

/**
 * Repeating cycle of {@code daysBase} days on base followed by {@code daysHome} days at home.
 */
public record RotationConfig(int daysBase, int daysHome) {

    public int cycleLength() {
        return daysBase + daysHome;
    }

    public boolean isValid() {
        return daysBase >= 1 && daysHome >= 0;
    }

    /** Position within the cycle for day {@code day} when the person starts at {@code offset}. */
    public boolean isBaseDay(int day, int offset) {
        return Math.floorMod(day + offset, cycleLength()) < daysBase;
    }

    /** Share of days spent on base. */
    public double baseRatio() {
        return cycleLength() == 0 ? 0.0 : (double) daysBase / cycleLength();
    }

    /**
     * Moves one base day into the home block so the exit day is counted as away.
     * A cycle without home days, or with a single base day, is returned unchanged.
     */
    public RotationConfig withExitDay() {
        if (daysHome == 0 || daysBase <= 1) {
            return this;
        }
        return new RotationConfig(daysBase - 1, daysHome + 1);
    }
}
