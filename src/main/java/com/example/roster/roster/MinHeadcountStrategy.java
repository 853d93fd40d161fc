package com.example.roster.roster;

import com.example.roster.config.RosterSettings;
import com.example.roster.person.Person;
import com.example.roster.rotation.PersonHistory;
import com.example.roster.rotation.RotationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Guarantees a minimum number of people on base every day.
 * <ol>
 *   <li>Seed a staggered rotation so roughly the same share of people is on base each day.</li>
 *   <li>Repair day by day: pull in unconstrained people where short, shed constrained people where
 *       comfortably over the floor. Stops when a pass changes nothing.</li>
 *   <li>Iron floor: any day still short takes the people with the fewest base days so far,
 *       constraint or not, and records a warning for every constraint it breaks.</li>
 * </ol>
 * Deterministic for a given input.
 */
@Component
public class MinHeadcountStrategy implements SchedulingStrategy {

    private static final Logger logger = LoggerFactory.getLogger(MinHeadcountStrategy.class);

    private final RotationConfig seedRotation;
    private final int maxRepairPasses;
    private final int releaseMargin;

    @Autowired
    public MinHeadcountStrategy(RosterSettings settings) {
        this(new RotationConfig(settings.getSeedDaysBase(), settings.getSeedDaysHome()),
                settings.getMaxRepairPasses(), settings.getReleaseMargin());
    }

    public MinHeadcountStrategy(RotationConfig seedRotation, int maxRepairPasses, int releaseMargin) {
        this.seedRotation = seedRotation;
        this.maxRepairPasses = maxRepairPasses;
        this.releaseMargin = releaseMargin;
    }

    @Override
    public OptimizationMode mode() {
        return OptimizationMode.MIN_STAFF;
    }

    @Override
    public StrategyResult generate(SchedulingContext ctx) {
        List<String> warnings = new ArrayList<>();
        ScheduleGrid grid = seed(ctx);
        int floor = ctx.minStaff();

        int passes = repair(ctx, grid, floor);
        logger.debug("Repair finished after {} pass(es), floor={}", passes, floor);

        enforceIronFloor(ctx, grid, floor, warnings);
        return new StrategyResult(grid, floor, warnings);
    }

    ScheduleGrid seed(SchedulingContext ctx) {
        List<Person> people = ctx.people();
        ScheduleGrid grid = new ScheduleGrid(ctx.personIds(), ctx.totalDays());
        int cycle = seedRotation.cycleLength();
        int n = people.size();
        for (int i = 0; i < n; i++) {
            Person p = people.get(i);
            int offset = (int) ((long) i * cycle / Math.max(1, n));
            PersonHistory history = ctx.historyOf(p.id());
            if (history != null) {
                int aligned = history.impliedOffset(seedRotation);
                if (aligned >= 0) {
                    offset = aligned;
                }
            }
            for (int d = 0; d < ctx.totalDays(); d++) {
                grid.set(p.id(), d, seedRotation.isBaseDay(d, offset) && !ctx.isConstrained(p.id(), d));
            }
        }
        return grid;
    }

    int repair(SchedulingContext ctx, ScheduleGrid grid, int floor) {
        Map<String, Integer> assigned = assignedCounts(ctx, grid);
        int pass = 0;
        while (pass < maxRepairPasses) {
            pass++;
            int changes = 0;
            for (int d = 0; d < ctx.totalDays(); d++) {
                int count = grid.headcount(d);
                if (count < floor) {
                    for (Person p : pullCandidates(ctx, grid, d, assigned)) {
                        if (count >= floor) break;
                        grid.set(p.id(), d, true);
                        assigned.merge(p.id(), 1, Integer::sum);
                        count++;
                        changes++;
                    }
                } else if (count > floor + releaseMargin) {
                    // only fires for grids not built by seed(), which already keeps constrained days home
                    for (Person p : releaseCandidates(ctx, grid, d)) {
                        if (count <= floor + releaseMargin) break;
                        grid.set(p.id(), d, false);
                        assigned.merge(p.id(), -1, Integer::sum);
                        count--;
                        changes++;
                    }
                }
            }
            if (changes == 0) {
                break;
            }
        }
        return pass;
    }

    void enforceIronFloor(SchedulingContext ctx, ScheduleGrid grid, int floor, List<String> warnings) {
        Map<String, Integer> assigned = assignedCounts(ctx, grid);
        for (int d = 0; d < ctx.totalDays(); d++) {
            int count = grid.headcount(d);
            if (count >= floor) {
                continue;
            }
            final int day = d;
            List<Person> candidates = ctx.people().stream()
                    .filter(p -> !grid.isBase(p.id(), day))
                    .sorted(Comparator.comparingInt((Person p) -> assigned.get(p.id())))
                    .toList();
            for (Person p : candidates) {
                if (count >= floor) break;
                grid.set(p.id(), d, true);
                assigned.merge(p.id(), 1, Integer::sum);
                count++;
                if (ctx.isConstrained(p.id(), d)) {
                    String message = "Minimum headcount " + floor + " on " + DateKeys.format(ctx.dateOf(d))
                            + " forced " + p.displayName() + " to base despite a hard constraint";
                    logger.warn(message);
                    warnings.add(message);
                }
            }
            if (count < floor) {
                String message = "Minimum headcount " + floor + " on " + DateKeys.format(ctx.dateOf(d))
                        + " cannot be reached: only " + count + " people available";
                logger.warn(message);
                warnings.add(message);
            }
        }
    }

    private List<Person> pullCandidates(SchedulingContext ctx, ScheduleGrid grid, int day, Map<String, Integer> assigned) {
        return ctx.people().stream()
                .filter(p -> !grid.isBase(p.id(), day) && !ctx.isConstrained(p.id(), day))
                .sorted(Comparator.comparingInt((Person p) -> ctx.constraintsOf(p.id()).size())
                        .thenComparingInt(p -> assigned.get(p.id())))
                .toList();
    }

    private List<Person> releaseCandidates(SchedulingContext ctx, ScheduleGrid grid, int day) {
        return ctx.people().stream()
                .filter(p -> grid.isBase(p.id(), day) && ctx.isConstrained(p.id(), day))
                .sorted(Comparator.comparingInt((Person p) -> ctx.constraintsOf(p.id()).size()).reversed())
                .toList();
    }

    private Map<String, Integer> assignedCounts(SchedulingContext ctx, ScheduleGrid grid) {
        Map<String, Integer> assigned = new HashMap<>();
        for (Person p : ctx.people()) {
            assigned.put(p.id(), grid.baseDays(p.id()));
        }
        return assigned;
    }
}
