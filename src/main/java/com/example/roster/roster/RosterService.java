package com.example.roster.roster;

import com.example.roster.config.RosterSettings;
import com.example.roster.constraint.ConstraintCompiler;
import com.example.roster.exception.RosterConfigurationException;
import com.example.roster.person.Person;
import com.example.roster.rotation.RotationConfig;
import com.example.roster.rotation.RotationResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.*;

/**
 * Runs one roster generation: compile constraints, resolve rotations, run the selected
 * strategy and format the grid. Holds no state between calls.
 */
@Service
public class RosterService {

    private static final Logger logger = LoggerFactory.getLogger(RosterService.class);

    private final RosterSettings settings;
    private final ConstraintCompiler constraintCompiler;
    private final RotationResolver rotationResolver;
    private final StrategySelector strategySelector;
    private final WeekendTransitionAdjuster weekendAdjuster;
    private final RosterFormatter formatter;

    public RosterService(RosterSettings settings,
                         ConstraintCompiler constraintCompiler,
                         RotationResolver rotationResolver,
                         StrategySelector strategySelector,
                         WeekendTransitionAdjuster weekendAdjuster,
                         RosterFormatter formatter) {
        this.settings = settings;
        this.constraintCompiler = constraintCompiler;
        this.rotationResolver = rotationResolver;
        this.strategySelector = strategySelector;
        this.weekendAdjuster = weekendAdjuster;
        this.formatter = formatter;
    }

    public RosterResult generateRoster(RosterGenerationRequest request) {
        long started = System.currentTimeMillis();
        LocalDate startDate = request.startDate();
        LocalDate endDate = request.endDate();
        if (startDate == null || endDate == null || endDate.isBefore(startDate)) {
            throw new RosterConfigurationException(RosterConfigurationException.INVALID_DATE_RANGE,
                    "Invalid date range: " + startDate + " - " + endDate, startDate, endDate);
        }
        OptimizationMode mode = resolveMode(request.mode());
        if (mode == OptimizationMode.TASKS && Optional.ofNullable(request.tasks()).orElse(List.of()).isEmpty()) {
            throw new RosterConfigurationException(RosterConfigurationException.EMPTY_TASK_LIST,
                    "Task-based optimization needs at least one task");
        }

        List<Person> people = Optional.ofNullable(request.people()).orElse(List.of()).stream()
                .filter(Objects::nonNull)
                .filter(Person::isActive)
                .toList();
        int totalDays = (int) ChronoUnit.DAYS.between(startDate, endDate) + 1;
        logger.info("Generating roster {} - {} ({} days) for {} people, mode={}",
                startDate, endDate, totalDays, people.size(), mode.getCode());

        Map<String, Set<Integer>> hardConstraints = constraintCompiler.compile(startDate, totalDays, people,
                request.constraints(), request.absences(), request.hourlyBlockages());
        Map<String, RotationConfig> rotations = rotationResolver.resolve(people, request.teamRotations(),
                request.customRotation());
        int minStaff = Optional.ofNullable(request.customMinStaff()).orElse(settings.getDefaultMinStaff());

        SchedulingContext ctx = new SchedulingContext(startDate, totalDays, people, hardConstraints, rotations,
                minStaff, request.history(), request.tasks(), request.randomSeed());

        SchedulingStrategy strategy = strategySelector.select(mode);
        List<String> warnings = new ArrayList<>(feasibilityWarnings(ctx, strategy.effectiveMinStaff(ctx)));

        StrategyResult result = strategy.generate(ctx);
        warnings.addAll(result.warnings());

        boolean avoidTransitions = Optional.ofNullable(request.avoidSaturdayTransitions())
                .orElse(settings.isAvoidRestDayTransitions());
        if (avoidTransitions) {
            weekendAdjuster.adjust(ctx, result.grid(), result.minStaff());
        }

        RosterResult roster = formatter.format(ctx, result.grid(), warnings);
        logger.info("Roster generated in {} ms: avg {} on base, constraints met {}/{}, {} warning(s)",
                System.currentTimeMillis() - started,
                String.format(Locale.ROOT, "%.1f", roster.stats().avgStaffPerDay()),
                roster.stats().constraintStats().met(),
                roster.stats().constraintStats().total(),
                roster.warnings().size());
        return roster;
    }

    public OptimizationMode resolveMode(OptimizationMode requested) {
        return Optional.ofNullable(requested).orElse(settings.getDefaultMode());
    }

    /**
     * Advisory only: the run continues with best effort output.
     */
    List<String> feasibilityWarnings(SchedulingContext ctx, int floor) {
        if (floor <= 0) {
            return List.of();
        }
        List<String> warnings = new ArrayList<>();
        if (ctx.people().size() < floor) {
            warnings.add("Minimum headcount " + floor + " exceeds the " + ctx.people().size() + " people available");
        }
        double capacity = 0;
        for (Person p : ctx.people()) {
            RotationConfig rotation = ctx.rotationOf(p.id());
            if (rotation != null && rotation.isValid()) {
                capacity += rotation.baseRatio();
            }
        }
        if (capacity < floor) {
            String message = String.format(Locale.ROOT,
                    "Configured rotations provide about %.1f people per day, below the required minimum of %d",
                    capacity, floor);
            logger.warn(message);
            warnings.add(message);
        }
        return warnings;
    }
}
