package com.example.roster.roster;

import com.example.roster.constraint.Absence;
import com.example.roster.constraint.HourlyBlockage;
import com.example.roster.constraint.SchedulingConstraint;
import com.example.roster.person.Person;
import com.example.roster.rotation.PersonHistory;
import com.example.roster.rotation.RotationConfig;
import com.example.roster.rotation.TeamRotation;
import com.example.roster.task.TaskTemplate;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Fully resolved input for one roster run. Both dates are inclusive.
 */
public record RosterGenerationRequest(
        @NotNull(message = "startDate is required") LocalDate startDate,
        @NotNull(message = "endDate is required") LocalDate endDate,
        @Valid List<Person> people,
        List<TeamRotation> teamRotations,
        List<SchedulingConstraint> constraints,
        List<Absence> absences,
        List<HourlyBlockage> hourlyBlockages,
        OptimizationMode mode,
        @Min(value = 0, message = "customMinStaff must not be negative") Integer customMinStaff,
        RotationConfig customRotation,
        Map<String, PersonHistory> history,
        List<TaskTemplate> tasks,
        Boolean avoidSaturdayTransitions,
        Long randomSeed) {

    public static Builder builder(LocalDate startDate, LocalDate endDate) {
        return new Builder(startDate, endDate);
    }

    public static final class Builder {
        private final LocalDate startDate;
        private final LocalDate endDate;
        private List<Person> people = List.of();
        private List<TeamRotation> teamRotations = List.of();
        private List<SchedulingConstraint> constraints = List.of();
        private List<Absence> absences = List.of();
        private List<HourlyBlockage> hourlyBlockages = List.of();
        private OptimizationMode mode;
        private Integer customMinStaff;
        private RotationConfig customRotation;
        private Map<String, PersonHistory> history = Map.of();
        private List<TaskTemplate> tasks = List.of();
        private Boolean avoidSaturdayTransitions;
        private Long randomSeed;

        private Builder(LocalDate startDate, LocalDate endDate) {
            this.startDate = startDate;
            this.endDate = endDate;
        }

        public Builder people(List<Person> people) { this.people = people; return this; }
        public Builder teamRotations(List<TeamRotation> teamRotations) { this.teamRotations = teamRotations; return this; }
        public Builder constraints(List<SchedulingConstraint> constraints) { this.constraints = constraints; return this; }
        public Builder absences(List<Absence> absences) { this.absences = absences; return this; }
        public Builder hourlyBlockages(List<HourlyBlockage> hourlyBlockages) { this.hourlyBlockages = hourlyBlockages; return this; }
        public Builder mode(OptimizationMode mode) { this.mode = mode; return this; }
        public Builder customMinStaff(Integer customMinStaff) { this.customMinStaff = customMinStaff; return this; }
        public Builder customRotation(RotationConfig customRotation) { this.customRotation = customRotation; return this; }
        public Builder history(Map<String, PersonHistory> history) { this.history = history; return this; }
        public Builder tasks(List<TaskTemplate> tasks) { this.tasks = tasks; return this; }
        public Builder avoidSaturdayTransitions(Boolean avoid) { this.avoidSaturdayTransitions = avoid; return this; }
        public Builder randomSeed(Long randomSeed) { this.randomSeed = randomSeed; return this; }

        public RosterGenerationRequest build() {
            return new RosterGenerationRequest(startDate, endDate, people, teamRotations, constraints, absences,
                    hourlyBlockages, mode, customMinStaff, customRotation, history, tasks,
                    avoidSaturdayTransitions, randomSeed);
        }
    }
}
