package com.example.roster.roster;

import com.example.roster.person.Person;
import com.example.roster.rotation.PersonHistory;
import com.example.roster.rotation.RotationConfig;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.example.roster.roster.SchedulingFixtures.*;
import static org.assertj.core.api.Assertions.assertThat;

class MinHeadcountStrategyTest {

    private final MinHeadcountStrategy strategy = new MinHeadcountStrategy(new RotationConfig(8, 6), 200, 2);

    @Test
    void generate_ironFloorOverridesConstraintsWhenNeeded() {
        List<Person> people = crew(10);
        Map<String, Set<Integer>> constraints = new HashMap<>();
        for (int i = 1; i <= 9; i++) {
            constraints.put("p" + i, Set.of(3));
        }
        SchedulingContext ctx = context(14, people, constraints, new RotationConfig(8, 6), 6);

        StrategyResult result = strategy.generate(ctx);

        ScheduleGrid grid = result.grid();
        for (int d = 0; d < 14; d++) {
            assertThat(grid.headcount(d)).isGreaterThanOrEqualTo(6);
        }
        long forced = constraints.keySet().stream().filter(pid -> grid.isBase(pid, 3)).count();
        assertThat(forced).isGreaterThanOrEqualTo(5);
        assertThat(result.warnings()).isNotEmpty();
        assertThat(result.warnings()).allMatch(w -> w.contains("2024-01-04"));
    }

    @Test
    void generate_honorsConstraintsWhenFloorIsReachable() {
        List<Person> people = crew(10);
        Map<String, Set<Integer>> constraints = Map.of("p1", range(0, 4), "p7", Set.of(9, 10));
        SchedulingContext ctx = context(21, people, constraints, new RotationConfig(8, 6), 3);

        StrategyResult result = strategy.generate(ctx);

        assertThat(result.warnings()).isEmpty();
        constraints.forEach((pid, days) -> days.forEach(d -> assertThat(result.grid().isBase(pid, d)).isFalse()));
        for (int d = 0; d < 21; d++) {
            assertThat(result.grid().headcount(d)).isGreaterThanOrEqualTo(3);
        }
    }

    @Test
    void generate_floorEqualToCrewKeepsEveryoneOnBase() {
        List<Person> people = crew(2);
        SchedulingContext ctx = context(10, people, Map.of(), new RotationConfig(8, 6), 2);

        ScheduleGrid grid = strategy.generate(ctx).grid();

        assertThat(grid.baseDays("p1")).isEqualTo(10);
        assertThat(grid.baseDays("p2")).isEqualTo(10);
    }

    @Test
    void generate_unreachableFloor_warnsPerDay() {
        List<Person> people = crew(1);
        SchedulingContext ctx = context(3, people, Map.of(), new RotationConfig(8, 6), 2);

        StrategyResult result = strategy.generate(ctx);

        assertThat(result.grid().baseDays("p1")).isEqualTo(3);
        assertThat(result.warnings()).hasSize(3).allMatch(w -> w.contains("only 1 people available"));
    }

    @Test
    void generate_isDeterministic() {
        List<Person> people = crew(7);
        Map<String, Set<Integer>> constraints = Map.of("p2", range(5, 9), "p3", Set.of(0, 1));
        SchedulingContext ctx = context(30, people, constraints, new RotationConfig(8, 6), 4);

        ScheduleGrid first = strategy.generate(ctx).grid();
        ScheduleGrid second = strategy.generate(ctx).grid();

        for (Person p : people) {
            assertThat(second.row(p.id())).containsExactly(first.row(p.id()));
        }
    }

    @Test
    void seed_staggersPeopleAcrossCycle() {
        List<Person> people = crew(7);
        SchedulingContext ctx = context(14, people, Map.of(), new RotationConfig(8, 6), 0);

        ScheduleGrid grid = strategy.seed(ctx);

        for (int d = 0; d < 14; d++) {
            assertThat(grid.headcount(d)).isBetween(3, 5);
        }
    }

    @Test
    void seed_historyContinuesStreak() {
        List<Person> people = crew(1);
        SchedulingContext ctx = context(14, people, Map.of(), new RotationConfig(8, 6), 0,
                Map.of("p1", new PersonHistory(PersonHistory.LastStatus.BASE, 5)), null, null);

        ScheduleGrid grid = strategy.seed(ctx);

        assertThat(baseDays(grid, "p1")).containsExactly(0, 1, 2, 9, 10, 11, 12, 13);
    }

    @Test
    void seed_keepsConstrainedDaysHome() {
        List<Person> people = crew(1);
        SchedulingContext ctx = context(8, people, Map.of("p1", Set.of(1, 2)), new RotationConfig(8, 6), 0);

        ScheduleGrid grid = strategy.seed(ctx);

        assertThat(baseDays(grid, "p1")).containsExactly(0, 3, 4, 5, 6, 7);
    }

    @Test
    void repair_releasesConstrainedPeopleAboveMargin() {
        List<Person> people = crew(6);
        Map<String, Set<Integer>> constraints = Map.of("p1", Set.of(0), "p2", Set.of(0), "p3", Set.of(0));
        SchedulingContext ctx = context(1, people, constraints, new RotationConfig(8, 6), 1);
        ScheduleGrid grid = new ScheduleGrid(ctx.personIds(), 1);
        people.forEach(p -> grid.set(p.id(), 0, true));

        int passes = strategy.repair(ctx, grid, 1);

        assertThat(passes).isEqualTo(2);
        assertThat(grid.headcount(0)).isEqualTo(3);
        assertThat(baseDays(grid, "p1")).isEmpty();
        assertThat(baseDays(grid, "p2")).isEmpty();
        assertThat(baseDays(grid, "p3")).isEmpty();
        assertThat(baseDays(grid, "p4")).containsExactly(0);
    }
}
