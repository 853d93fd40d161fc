package com.example.roster.roster;

import com.example.roster.person.Person;
import com.example.roster.rotation.RotationConfig;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.example.roster.roster.SchedulingFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

/** 2024-01-01 is a Monday, so day 5 is the first Saturday. */
class WeekendTransitionAdjusterTest {

    private final WeekendTransitionAdjuster adjuster = new WeekendTransitionAdjuster(DayOfWeek.SATURDAY);

    @Test
    void adjust_exitOnRestDayMovesToFriday() {
        List<Person> people = crew(1);
        SchedulingContext ctx = context(7, people, Map.of(), new RotationConfig(5, 2), 0);
        ScheduleGrid grid = gridWithBase(ctx, "p1", range(0, 4));

        int moved = adjuster.adjust(ctx, grid, 0);

        assertThat(moved).isEqualTo(1);
        assertThat(baseDays(grid, "p1")).containsExactly(0, 1, 2, 3);
    }

    @Test
    void adjust_exitStaysThroughRestDayWhenFridayNeedsFloor() {
        List<Person> people = crew(1);
        SchedulingContext ctx = context(7, people, Map.of(), new RotationConfig(5, 2), 0);
        ScheduleGrid grid = gridWithBase(ctx, "p1", range(0, 4));

        adjuster.adjust(ctx, grid, 1);

        assertThat(baseDays(grid, "p1")).containsExactly(0, 1, 2, 3, 4, 5);
    }

    @Test
    void adjust_leavesExitWhenNoSafeMoveExists() {
        List<Person> people = crew(1);
        SchedulingContext ctx = context(7, people, Map.of("p1", Set.of(5)), new RotationConfig(5, 2), 0);
        ScheduleGrid grid = gridWithBase(ctx, "p1", range(0, 4));

        int moved = adjuster.adjust(ctx, grid, 1);

        assertThat(moved).isZero();
        assertThat(baseDays(grid, "p1")).containsExactly(0, 1, 2, 3, 4);
    }

    @Test
    void adjust_entryOnRestDayMovesToFriday() {
        List<Person> people = crew(1);
        SchedulingContext ctx = context(8, people, Map.of(), new RotationConfig(3, 5), 0);
        ScheduleGrid grid = gridWithBase(ctx, "p1", range(5, 7));

        adjuster.adjust(ctx, grid, 0);

        assertThat(baseDays(grid, "p1")).containsExactly(4, 5, 6, 7);
    }

    @Test
    void adjust_entryMovesToSundayWhenFridayIsConstrained() {
        List<Person> people = crew(1);
        SchedulingContext ctx = context(8, people, Map.of("p1", Set.of(4)), new RotationConfig(3, 5), 0);
        ScheduleGrid grid = gridWithBase(ctx, "p1", Set.of(5, 7));

        adjuster.adjust(ctx, grid, 0);

        assertThat(baseDays(grid, "p1")).containsExactly(6, 7);
    }

    private ScheduleGrid gridWithBase(SchedulingContext ctx, String personId, Set<Integer> baseDays) {
        ScheduleGrid grid = new ScheduleGrid(ctx.personIds(), ctx.totalDays());
        baseDays.forEach(d -> grid.set(personId, d, true));
        return grid;
    }
}
