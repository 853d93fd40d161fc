package com.example.roster.roster;

import com.example.roster.config.RosterSettings;
import com.example.roster.person.Person;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.DayOfWeek;

/**
 * Moves exits and entries off the rest day (Saturday by default).
 * <p>
 * An exit on the rest day (base the day before, home on it) moves one day earlier when the
 * day before keeps its floor, otherwise the person stays through the rest day if that day is
 * unconstrained. An entry on the rest day moves one day earlier when that day is
 * unconstrained, otherwise one day later when the rest day keeps its floor.
 * Never assigns base on a constrained day and never takes a day below the floor.
 */
@Component
public class WeekendTransitionAdjuster {

    private static final Logger logger = LoggerFactory.getLogger(WeekendTransitionAdjuster.class);

    private final DayOfWeek restDay;

    @Autowired
    public WeekendTransitionAdjuster(RosterSettings settings) {
        this(settings.getRestDay());
    }

    public WeekendTransitionAdjuster(DayOfWeek restDay) {
        this.restDay = restDay;
    }

    /** Adjusts {@code grid} in place and returns the number of people moved. */
    public int adjust(SchedulingContext ctx, ScheduleGrid grid, int floor) {
        int moved = 0;
        for (int rest = 1; rest < ctx.totalDays(); rest++) {
            if (ctx.dateOf(rest).getDayOfWeek() != restDay) {
                continue;
            }
            int before = rest - 1;
            int after = rest + 1;
            for (Person p : ctx.people()) {
                String pid = p.id();
                boolean baseBefore = grid.isBase(pid, before);
                boolean baseOnRest = grid.isBase(pid, rest);

                if (baseBefore && !baseOnRest) {
                    if (grid.headcount(before) - 1 >= floor) {
                        grid.set(pid, before, false);
                        moved++;
                    } else if (!ctx.isConstrained(pid, rest)) {
                        grid.set(pid, rest, true);
                        moved++;
                    }
                } else if (!baseBefore && baseOnRest) {
                    if (!ctx.isConstrained(pid, before)) {
                        grid.set(pid, before, true);
                        moved++;
                    } else if (grid.headcount(rest) - 1 >= floor) {
                        grid.set(pid, rest, false);
                        if (after < ctx.totalDays() && !ctx.isConstrained(pid, after)) {
                            grid.set(pid, after, true);
                        }
                        moved++;
                    }
                }
            }
        }
        if (moved > 0) {
            logger.debug("Moved {} transition(s) off {}", moved, restDay);
        }
        return moved;
    }
}
