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
 * Keeps each person on their rotation and picks the phase that best fits their constraints,
 * their recent streak and the headcount already committed by others.
 * <p>
 * People are placed most-constrained first. Each placement is scored against the daily
 * headcount of everyone placed before them, then folded into it.
 */
@Component
public class RatioStrategy implements SchedulingStrategy {

    private static final Logger logger = LoggerFactory.getLogger(RatioStrategy.class);

    static final int HISTORY_MATCH_BONUS = 500;
    static final int CONSTRAINT_HONORED_BONUS = 1000;
    static final int CONSTRAINT_BROKEN_PENALTY = 5000;

    private final boolean reserveExitDay;

    @Autowired
    public RatioStrategy(RosterSettings settings) {
        this(settings.isReserveExitDay());
    }

    public RatioStrategy(boolean reserveExitDay) {
        this.reserveExitDay = reserveExitDay;
    }

    @Override
    public OptimizationMode mode() {
        return OptimizationMode.RATIO;
    }

    @Override
    public StrategyResult generate(SchedulingContext ctx) {
        ScheduleGrid grid = new ScheduleGrid(ctx.personIds(), ctx.totalDays());
        List<String> warnings = new ArrayList<>();
        int[] headcount = new int[ctx.totalDays()];

        for (Person p : placementOrder(ctx)) {
            RotationConfig rotation = ctx.rotationOf(p.id());
            if (rotation == null || !rotation.isValid()) {
                warnings.add("No usable rotation for " + p.displayName() + "; left at home for the whole period");
                continue;
            }
            Placement placement = place(effectiveRotation(rotation), ctx.constraintsOf(p.id()),
                    ctx.historyOf(p.id()), headcount, ctx.totalDays());
            headcount = commit(headcount, placement.schedule());
            grid.setRow(p.id(), placement.schedule());
            if (placement.flippedDays() > 0) {
                logger.debug("{}: {} base days moved home to honor constraints (offset {})",
                        p.id(), placement.flippedDays(), placement.offset());
            }
        }
        return new StrategyResult(grid, ctx.minStaff(), warnings);
    }

    RotationConfig effectiveRotation(RotationConfig rotation) {
        return reserveExitDay ? rotation.withExitDay() : rotation;
    }

    /** Stable sort: more constraint days first, input order otherwise. */
    static List<Person> placementOrder(SchedulingContext ctx) {
        List<Person> ordered = new ArrayList<>(ctx.people());
        ordered.sort(Comparator.comparingInt((Person p) -> ctx.constraintsOf(p.id()).size()).reversed());
        return ordered;
    }

    /**
     * Picks the best offset for one person against the headcount committed so far.
     * Does not modify {@code committed}.
     */
    static Placement place(RotationConfig rotation,
                           Set<Integer> constraints,
                           PersonHistory history,
                           int[] committed,
                           int totalDays) {
        int cycle = rotation.cycleLength();
        int historyOffset = history == null ? -1 : history.impliedOffset(rotation);

        int bestOffset = 0;
        long bestScore = Long.MIN_VALUE;
        for (int offset = 0; offset < cycle; offset++) {
            long score = scoreOffset(rotation, offset, constraints, historyOffset, committed, totalDays);
            if (score > bestScore) {
                bestScore = score;
                bestOffset = offset;
            }
        }

        boolean[] schedule = new boolean[totalDays];
        for (int d = 0; d < totalDays; d++) {
            schedule[d] = rotation.isBaseDay(d, bestOffset);
        }
        // constraints win over the cycle
        int flipped = 0;
        for (int d : constraints) {
            if (d >= 0 && d < totalDays && schedule[d]) {
                schedule[d] = false;
                flipped++;
            }
        }
        return new Placement(bestOffset, bestScore, schedule, flipped);
    }

    static long scoreOffset(RotationConfig rotation,
                            int offset,
                            Set<Integer> constraints,
                            int historyOffset,
                            int[] committed,
                            int totalDays) {
        long score = 0;
        if (offset == historyOffset) {
            score += HISTORY_MATCH_BONUS;
        }
        for (int d = 0; d < totalDays; d++) {
            boolean base = rotation.isBaseDay(d, offset);
            if (constraints.contains(d)) {
                score += base ? -CONSTRAINT_BROKEN_PENALTY : CONSTRAINT_HONORED_BONUS;
            }
            if (base) {
                long load = committed[d];
                score -= load * load;
            }
        }
        return score;
    }

    static int[] commit(int[] headcount, boolean[] schedule) {
        int[] next = headcount.clone();
        for (int d = 0; d < next.length; d++) {
            if (schedule[d]) next[d]++;
        }
        return next;
    }

    record Placement(int offset, long score, boolean[] schedule, int flippedDays) {
    }
}
