package com.example.roster.roster;

import com.example.roster.config.RosterSettings;
import com.example.roster.person.Person;
import com.example.roster.rotation.RotationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Alternate ratio optimizer: simulated annealing over home blocks.
 * <p>
 * Starts from each person's rotation at a random phase with constraints forced home, then
 * shifts and resizes home blocks to lower a weighted cost of long base stints, short home
 * blocks, uneven daily headcount and unequal home-day totals. A move that would put someone
 * on base on a constrained day is never proposed, so constraints stay honored.
 * <p>
 * Output differs from {@link RatioStrategy}; runs are reproducible only with a fixed seed.
 */
@Component
public class AnnealingStrategy implements SchedulingStrategy {

    private static final Logger logger = LoggerFactory.getLogger(AnnealingStrategy.class);

    static final long WEIGHT_CONSTRAINT = 1_000_000L;
    static final long WEIGHT_FATIGUE = 10_000L;
    static final long WEIGHT_FRAGMENTATION = 5_000L;
    static final long WEIGHT_CAPACITY = 100L;
    static final long WEIGHT_EQUITY = 200L;

    private final int iterations;
    private final double initialTemperature;
    private final double coolingRate;

    @Autowired
    public AnnealingStrategy(RosterSettings settings) {
        this(settings.getAnnealingIterations(), settings.getAnnealingInitialTemperature(), settings.getAnnealingCoolingRate());
    }

    public AnnealingStrategy(int iterations, double initialTemperature, double coolingRate) {
        this.iterations = iterations;
        this.initialTemperature = initialTemperature;
        this.coolingRate = coolingRate;
    }

    @Override
    public OptimizationMode mode() {
        return OptimizationMode.ANNEALING;
    }

    @Override
    public StrategyResult generate(SchedulingContext ctx) {
        Random random = ctx.randomSeed() != null ? new Random(ctx.randomSeed()) : new Random();
        ScheduleGrid grid = new ScheduleGrid(ctx.personIds(), ctx.totalDays());
        List<String> warnings = new ArrayList<>();
        List<Person> people = new ArrayList<>();
        for (Person p : ctx.people()) {
            RotationConfig rotation = ctx.rotationOf(p.id());
            if (rotation == null || !rotation.isValid()) {
                warnings.add("No usable rotation for " + p.displayName() + "; left at home for the whole period");
                continue;
            }
            people.add(p);
        }
        if (people.isEmpty() || ctx.totalDays() == 0) {
            return new StrategyResult(grid, ctx.minStaff(), warnings);
        }

        Search search = new Search(ctx, grid, people, targetCapacity(ctx, people));
        search.initialize(random);
        long initialCost = search.cost();
        search.optimize(random);
        logger.debug("Annealing finished: cost {} -> {} after {} iterations", initialCost, search.cost(), iterations);
        return new StrategyResult(grid, ctx.minStaff(), warnings);
    }

    static int targetCapacity(SchedulingContext ctx, List<Person> people) {
        double theoretical = 0;
        for (Person p : people) {
            theoretical += ctx.rotationOf(p.id()).baseRatio();
        }
        return Math.max((int) Math.round(theoretical), ctx.minStaff());
    }

    /** Mutable search state for one run. */
    final class Search {
        private final SchedulingContext ctx;
        private final ScheduleGrid grid;
        private final List<Person> people;
        private final int target;
        private final int[] capacity;
        private final Map<String, Long> personCosts = new HashMap<>();

        Search(SchedulingContext ctx, ScheduleGrid grid, List<Person> people, int target) {
            this.ctx = ctx;
            this.grid = grid;
            this.people = people;
            this.target = target;
            this.capacity = new int[ctx.totalDays()];
        }

        void initialize(Random random) {
            for (Person p : people) {
                RotationConfig rotation = ctx.rotationOf(p.id());
                int offset = random.nextInt(rotation.cycleLength());
                for (int d = 0; d < ctx.totalDays(); d++) {
                    boolean base = rotation.isBaseDay(d, offset) && !ctx.isConstrained(p.id(), d);
                    grid.set(p.id(), d, base);
                    if (base) capacity[d]++;
                }
                personCosts.put(p.id(), personCost(p.id()));
            }
        }

        long cost() {
            long total = capacityCost();
            for (long c : personCosts.values()) {
                total += c;
            }
            return total;
        }

        void optimize(Random random) {
            long current = cost();
            double temperature = initialTemperature;
            for (int iter = 0; iter < iterations; iter++, temperature *= coolingRate) {
                Person person = people.get(random.nextInt(people.size()));
                String pid = person.id();
                List<int[]> blocks = homeBlocks(pid);
                if (blocks.isEmpty()) {
                    continue;
                }
                int[] block = blocks.get(random.nextInt(blocks.size()));
                int newStart = block[0];
                int newEnd = block[1];
                if (random.nextBoolean()) {
                    int shift = random.nextBoolean() ? 1 : -1;
                    newStart += shift;
                    newEnd += shift;
                } else if (random.nextBoolean()) {
                    if (random.nextBoolean()) newEnd++; else newStart--;
                } else if (newEnd > newStart) {
                    if (random.nextBoolean()) newEnd--; else newStart++;
                }
                if (newStart < 0 || newEnd >= ctx.totalDays()) {
                    continue;
                }
                if (exposesConstraint(pid, block, newStart, newEnd)) {
                    continue;
                }

                int min = Math.min(block[0], newStart);
                int max = Math.max(block[1], newEnd);
                boolean[] before = grid.row(pid);
                long oldPersonCost = personCosts.get(pid);
                long oldCapacityCost = capacityCost();
                for (int d = min; d <= max; d++) {
                    applyDay(pid, d, d < newStart || d > newEnd);
                }
                long newPersonCost = personCost(pid);
                long delta = (newPersonCost - oldPersonCost) + (capacityCost() - oldCapacityCost);

                if (delta < 0 || random.nextDouble() < Math.exp(-delta / Math.max(temperature, 1e-9))) {
                    personCosts.put(pid, newPersonCost);
                    current += delta;
                } else {
                    for (int d = min; d <= max; d++) {
                        applyDay(pid, d, before[d]);
                    }
                }
            }
            logger.trace("Final annealing cost {}", current);
        }

        private boolean exposesConstraint(String pid, int[] block, int newStart, int newEnd) {
            for (int d = block[0]; d <= block[1]; d++) {
                if ((d < newStart || d > newEnd) && ctx.isConstrained(pid, d)) {
                    return true;
                }
            }
            return false;
        }

        private void applyDay(String pid, int day, boolean base) {
            boolean was = grid.isBase(pid, day);
            if (was == base) return;
            grid.set(pid, day, base);
            capacity[day] += base ? 1 : -1;
        }

        private List<int[]> homeBlocks(String pid) {
            List<int[]> blocks = new ArrayList<>();
            int start = -1;
            for (int d = 0; d < ctx.totalDays(); d++) {
                if (!grid.isBase(pid, d)) {
                    if (start == -1) start = d;
                } else if (start != -1) {
                    blocks.add(new int[]{start, d - 1});
                    start = -1;
                }
            }
            if (start != -1) blocks.add(new int[]{start, ctx.totalDays() - 1});
            return blocks;
        }

        private long capacityCost() {
            long cost = 0;
            for (int c : capacity) {
                long diff = c - target;
                cost += diff * diff * WEIGHT_CAPACITY;
            }
            return cost;
        }

        long personCost(String pid) {
            RotationConfig rotation = ctx.rotationOf(pid);
            long cost = 0;
            int fatigue = 0;
            int homeBlock = 0;
            int homeDays = 0;
            for (int d = 0; d < ctx.totalDays(); d++) {
                boolean base = grid.isBase(pid, d);
                if (base && ctx.isConstrained(pid, d)) {
                    cost += WEIGHT_CONSTRAINT;
                }
                if (base) {
                    fatigue++;
                    if (homeBlock > 0 && homeBlock < rotation.daysHome()) {
                        cost += WEIGHT_FRAGMENTATION;
                    }
                    homeBlock = 0;
                    if (fatigue > rotation.daysBase()) {
                        cost += WEIGHT_FATIGUE;
                    }
                } else {
                    homeDays++;
                    fatigue = Math.max(0, fatigue - 1);
                    homeBlock++;
                    if (homeBlock >= rotation.daysHome()) {
                        fatigue = 0;
                    }
                }
            }
            if (homeBlock > 0 && homeBlock < rotation.daysHome()) {
                cost += WEIGHT_FRAGMENTATION;
            }
            double expectedHome = (double) ctx.totalDays() * rotation.daysHome() / rotation.cycleLength();
            double diff = homeDays - expectedHome;
            cost += Math.round(diff * diff * WEIGHT_EQUITY);
            return cost;
        }
    }
}
