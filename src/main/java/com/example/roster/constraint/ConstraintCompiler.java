package com.example.roster.constraint;

import com.example.roster.config.RosterSettings;
import com.example.roster.person.DayOverride;
import com.example.roster.person.Person;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.*;

/**
 * Turns overrides, constraints, absences and full-day blockages into the set of day indices
 * on which each person may not be assigned to base.
 * <p>
 * Ranges are clamped to the horizon; anything outside it is dropped without error.
 */
@Component
public class ConstraintCompiler {

    private static final Logger logger = LoggerFactory.getLogger(ConstraintCompiler.class);

    private final boolean propagateHomeIntent;

    @Autowired
    public ConstraintCompiler(RosterSettings settings) {
        this(settings.isPropagateHomeIntent());
    }

    public ConstraintCompiler(boolean propagateHomeIntent) {
        this.propagateHomeIntent = propagateHomeIntent;
    }

    public Map<String, Set<Integer>> compile(LocalDate startDate,
                                             int totalDays,
                                             List<Person> people,
                                             List<SchedulingConstraint> constraints,
                                             List<Absence> absences,
                                             List<HourlyBlockage> blockages) {
        Map<String, Set<Integer>> result = new LinkedHashMap<>();
        for (Person p : people) {
            result.put(p.id(), new TreeSet<>());
        }
        if (totalDays <= 0) {
            return result;
        }

        for (Person p : people) {
            addOverrides(result.get(p.id()), p, startDate, totalDays);
        }

        Map<String, String> teamByPerson = new HashMap<>();
        for (Person p : people) {
            teamByPerson.put(p.id(), p.teamId());
        }
        for (SchedulingConstraint c : Optional.ofNullable(constraints).orElse(List.of())) {
            if (c == null || !c.effectiveKind().forbidsBase()) {
                continue;
            }
            if (c.startDate() == null || c.endDate() == null) {
                logger.debug("Skipping constraint without a date range: {}", c);
                continue;
            }
            for (Person p : people) {
                if (c.appliesTo(p.id(), teamByPerson.get(p.id()))) {
                    addRange(result.get(p.id()), c.startDate(), c.endDate(), startDate, totalDays);
                }
            }
        }

        for (Absence a : Optional.ofNullable(absences).orElse(List.of())) {
            if (a == null || !a.isBlocking() || a.startDate() == null || a.endDate() == null) {
                continue;
            }
            Set<Integer> days = result.get(a.personId());
            if (days != null) {
                addRange(days, a.startDate(), a.endDate(), startDate, totalDays);
            }
        }

        for (HourlyBlockage b : Optional.ofNullable(blockages).orElse(List.of())) {
            if (b == null || b.date() == null || !b.isFullDay()) {
                continue;
            }
            Set<Integer> days = result.get(b.personId());
            if (days != null) {
                addRange(days, b.date(), b.date(), startDate, totalDays);
            }
        }

        if (logger.isDebugEnabled()) {
            int total = result.values().stream().mapToInt(Set::size).sum();
            logger.debug("Compiled {} hard constraint days for {} people", total, people.size());
        }
        return result;
    }

    public static int dayIndex(LocalDate date, LocalDate startDate) {
        return (int) ChronoUnit.DAYS.between(startDate, date);
    }

    private void addOverrides(Set<Integer> days, Person person, LocalDate startDate, int totalDays) {
        List<Map.Entry<LocalDate, DayOverride>> manual = person.overrides().entrySet().stream()
                .filter(e -> e.getKey() != null && e.getValue() != null && e.getValue().isManual())
                .sorted(Map.Entry.comparingByKey())
                .toList();

        for (int i = 0; i < manual.size(); i++) {
            LocalDate date = manual.get(i).getKey();
            DayOverride override = manual.get(i).getValue();
            int idx = dayIndex(date, startDate);

            if (!override.isAvailable() && idx >= 0 && idx < totalDays) {
                days.add(idx);
            }

            if (propagateHomeIntent && override.status() != null && override.status().startsHomeIntent()) {
                int stop = totalDays;
                for (int j = i + 1; j < manual.size(); j++) {
                    DayOverride next = manual.get(j).getValue();
                    if (next.status() == null || next.status().endsHomeIntent()) {
                        stop = dayIndex(manual.get(j).getKey(), startDate);
                        break;
                    }
                }
                for (int d = Math.max(0, idx + 1); d < Math.min(stop, totalDays); d++) {
                    days.add(d);
                }
            }
        }
    }

    private void addRange(Set<Integer> days, LocalDate from, LocalDate to, LocalDate startDate, int totalDays) {
        int s = Math.max(0, dayIndex(from, startDate));
        int e = Math.min(totalDays - 1, dayIndex(to, startDate));
        for (int i = s; i <= e; i++) {
            days.add(i);
        }
    }
}
