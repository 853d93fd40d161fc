package com.example.roster.roster;

import com.example.roster.constraint.Absence;
import com.example.roster.constraint.ConstraintKind;
import com.example.roster.constraint.SchedulingConstraint;
import com.example.roster.exception.RosterConfigurationException;
import com.example.roster.person.Person;
import com.example.roster.rotation.RotationConfig;
import com.example.roster.rotation.TeamRotation;
import com.example.roster.task.SchedulingSegment;
import com.example.roster.task.SegmentFrequency;
import com.example.roster.task.TaskTemplate;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
class RosterServiceTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    @Autowired
    private RosterService rosterService;

    @Test
    void generateRoster_defaultsToRatioMode() {
        RosterGenerationRequest request = RosterGenerationRequest.builder(START, START.plusDays(7))
                .people(List.of(new Person("p1", "Ana", "deck")))
                .customRotation(new RotationConfig(3, 1))
                .build();

        RosterResult result = rosterService.generateRoster(request);

        assertThat(result.stats().totalDays()).isEqualTo(8);
        assertThat(result.roster()).hasSize(8);
        assertThat(result.personStatuses().get("2024-01-04")).containsEntry("p1", DayStatus.HOME);
        assertThat(result.personStatuses().get("2024-01-08")).containsEntry("p1", DayStatus.HOME);
        assertThat(result.stats().avgStaffPerDay()).isEqualTo(0.75);
    }

    @Test
    void generateRoster_skipsInactivePeople() {
        RosterGenerationRequest request = RosterGenerationRequest.builder(START, START.plusDays(13))
                .people(List.of(
                        new Person("p1", "Ana", "deck"),
                        new Person("p2", "Ben", "deck", Collections.emptyMap(), false)))
                .build();

        RosterResult result = rosterService.generateRoster(request);

        assertThat(result.personStatuses().get("2024-01-01")).containsOnlyKeys("p1");
        assertThat(result.roster()).allMatch(entry -> entry.personId().equals("p1"));
    }

    @Test
    void generateRoster_honorsAbsencesAndTeamRotation() {
        RosterGenerationRequest request = RosterGenerationRequest.builder(START, START.plusDays(27))
                .people(List.of(new Person("p1", "Ana", "deck"), new Person("p2", "Ben", "deck")))
                .teamRotations(List.of(new TeamRotation("deck", 7, 7)))
                .absences(List.of(new Absence("p1", START.plusDays(2), START.plusDays(4))))
                .constraints(List.of(new SchedulingConstraint("p2", ConstraintKind.NEVER_ASSIGN,
                        START.plusDays(20), START.plusDays(21))))
                .build();

        RosterResult result = rosterService.generateRoster(request);

        assertThat(result.unfulfilledConstraints()).isEmpty();
        assertThat(result.stats().constraintStats().percentage()).isEqualTo(100);
        assertThat(result.personStatuses().get("2024-01-03")).containsEntry("p1", DayStatus.UNAVAILABLE);
        assertThat(result.personStatuses().get("2024-01-22")).containsEntry("p2", DayStatus.UNAVAILABLE);
    }

    @Test
    void generateRoster_minStaffKeepsFloor() {
        RosterGenerationRequest request = RosterGenerationRequest.builder(START, START.plusDays(13))
                .people(List.of(
                        new Person("p1", "Ana", "deck"),
                        new Person("p2", "Ben", "deck"),
                        new Person("p3", "Cleo", "deck"),
                        new Person("p4", "Dan", "deck")))
                .mode(OptimizationMode.MIN_STAFF)
                .customMinStaff(3)
                .build();

        RosterResult result = rosterService.generateRoster(request);

        result.personStatuses().values().forEach(day ->
                assertThat(day.values().stream().filter(s -> s == DayStatus.BASE).count()).isGreaterThanOrEqualTo(3));
    }

    @Test
    void generateRoster_tasksModeRaisesFloor() {
        TaskTemplate watch = new TaskTemplate("t1", "Watch", List.of(
                new SchedulingSegment("s1", "Bridge", 8, SegmentFrequency.DAILY, 2, 8, true)));
        RosterGenerationRequest request = RosterGenerationRequest.builder(START, START.plusDays(9))
                .people(List.of(
                        new Person("p1", "Ana", "deck"),
                        new Person("p2", "Ben", "deck"),
                        new Person("p3", "Cleo", "deck"),
                        new Person("p4", "Dan", "deck"),
                        new Person("p5", "Eve", "deck"),
                        new Person("p6", "Finn", "deck")))
                .mode(OptimizationMode.TASKS)
                .tasks(List.of(watch))
                .build();

        RosterResult result = rosterService.generateRoster(request);

        result.personStatuses().values().forEach(day ->
                assertThat(day.values().stream().filter(s -> s == DayStatus.BASE).count()).isGreaterThanOrEqualTo(4));
    }

    @Test
    void generateRoster_warnsWhenFloorIsInfeasible() {
        RosterGenerationRequest request = RosterGenerationRequest.builder(START, START.plusDays(3))
                .people(List.of(new Person("p1", "Ana", "deck"), new Person("p2", "Ben", "deck")))
                .customRotation(new RotationConfig(1, 3))
                .mode(OptimizationMode.MIN_STAFF)
                .customMinStaff(3)
                .build();

        RosterResult result = rosterService.generateRoster(request);

        assertThat(result.warnings())
                .anyMatch(w -> w.contains("exceeds the 2 people available"))
                .anyMatch(w -> w.contains("below the required minimum of 3"))
                .anyMatch(w -> w.contains("cannot be reached"));
    }

    @Test
    void generateRoster_endBeforeStart_throws() {
        RosterGenerationRequest request = RosterGenerationRequest.builder(START, START.minusDays(1))
                .people(List.of(new Person("p1", "Ana", "deck")))
                .build();

        assertThatThrownBy(() -> rosterService.generateRoster(request))
                .isInstanceOf(RosterConfigurationException.class)
                .extracting("errorCode")
                .isEqualTo(RosterConfigurationException.INVALID_DATE_RANGE);
    }

    @Test
    void generateRoster_tasksModeWithoutTasks_throws() {
        RosterGenerationRequest request = RosterGenerationRequest.builder(START, START.plusDays(3))
                .people(List.of(new Person("p1", "Ana", "deck")))
                .mode(OptimizationMode.TASKS)
                .build();

        assertThatThrownBy(() -> rosterService.generateRoster(request))
                .isInstanceOf(RosterConfigurationException.class)
                .extracting("errorCode")
                .isEqualTo(RosterConfigurationException.EMPTY_TASK_LIST);
    }

    @Test
    void generateRoster_singleDayHorizon() {
        RosterGenerationRequest request = RosterGenerationRequest.builder(START, START)
                .people(List.of(new Person("p1", "Ana", "deck")))
                .build();

        RosterResult result = rosterService.generateRoster(request);

        assertThat(result.stats().totalDays()).isEqualTo(1);
        assertThat(result.roster()).hasSize(1);
    }
}
