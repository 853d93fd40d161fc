package com.example.roster.roster;

import com.example.roster.person.Person;
import com.example.roster.rotation.PersonHistory;
import com.example.roster.rotation.RotationConfig;
import com.example.roster.task.TaskTemplate;

import java.time.LocalDate;
import java.util.*;

/** Small builders shared by the strategy tests. */
final class SchedulingFixtures {

    static final LocalDate START = LocalDate.of(2024, 1, 1);

    private SchedulingFixtures() {
    }

    static List<Person> crew(int size) {
        List<Person> people = new ArrayList<>();
        for (int i = 1; i <= size; i++) {
            people.add(new Person("p" + i, "Person " + i, "deck"));
        }
        return people;
    }

    static Map<String, RotationConfig> sameRotation(List<Person> people, RotationConfig rotation) {
        Map<String, RotationConfig> rotations = new LinkedHashMap<>();
        for (Person p : people) {
            rotations.put(p.id(), rotation);
        }
        return rotations;
    }

    static SchedulingContext context(int totalDays,
                                     List<Person> people,
                                     Map<String, Set<Integer>> constraints,
                                     RotationConfig rotation,
                                     int minStaff) {
        return new SchedulingContext(START, totalDays, people, constraints, sameRotation(people, rotation),
                minStaff, null, null, null);
    }

    static SchedulingContext context(int totalDays,
                                     List<Person> people,
                                     Map<String, Set<Integer>> constraints,
                                     RotationConfig rotation,
                                     int minStaff,
                                     Map<String, PersonHistory> history,
                                     List<TaskTemplate> tasks,
                                     Long seed) {
        return new SchedulingContext(START, totalDays, people, constraints, sameRotation(people, rotation),
                minStaff, history, tasks, seed);
    }

    static Set<Integer> baseDays(ScheduleGrid grid, String personId) {
        Set<Integer> days = new TreeSet<>();
        for (int d = 0; d < grid.totalDays(); d++) {
            if (grid.isBase(personId, d)) days.add(d);
        }
        return days;
    }

    static Set<Integer> range(int fromInclusive, int toInclusive) {
        Set<Integer> days = new TreeSet<>();
        for (int d = fromInclusive; d <= toInclusive; d++) {
            days.add(d);
        }
        return days;
    }
}
