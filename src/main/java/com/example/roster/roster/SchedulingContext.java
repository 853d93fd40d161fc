package com.example.roster.roster;

import com.example.roster.person.Person;
import com.example.roster.rotation.PersonHistory;
import com.example.roster.rotation.RotationConfig;
import com.example.roster.task.TaskTemplate;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only input for a single run, built fresh from the caller's snapshot.
 */
public record SchedulingContext(
        LocalDate startDate,
        int totalDays,
        List<Person> people,
        Map<String, Set<Integer>> hardConstraints,
        Map<String, RotationConfig> rotations,
        int minStaff,
        Map<String, PersonHistory> history,
        List<TaskTemplate> tasks,
        Long randomSeed) {

    public SchedulingContext {
        people = List.copyOf(people);
        hardConstraints = hardConstraints == null ? Map.of() : Collections.unmodifiableMap(hardConstraints);
        rotations = rotations == null ? Map.of() : Collections.unmodifiableMap(rotations);
        history = history == null ? Map.of() : Collections.unmodifiableMap(history);
        tasks = tasks == null ? List.of() : List.copyOf(tasks);
        minStaff = Math.max(0, minStaff);
    }

    public Set<Integer> constraintsOf(String personId) {
        Set<Integer> days = hardConstraints.get(personId);
        return days == null ? Set.of() : days;
    }

    public boolean isConstrained(String personId, int day) {
        return constraintsOf(personId).contains(day);
    }

    public PersonHistory historyOf(String personId) {
        return history.get(personId);
    }

    public RotationConfig rotationOf(String personId) {
        return rotations.get(personId);
    }

    public LocalDate dateOf(int day) {
        return startDate.plusDays(day);
    }

    public List<String> personIds() {
        return people.stream().map(Person::id).toList();
    }

    public SchedulingContext withMinStaff(int floor) {
        return new SchedulingContext(startDate, totalDays, people, hardConstraints, rotations, floor, history, tasks, randomSeed);
    }
}
