package com.example.roster.roster;

import com.example.roster.person.Person;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Labels the strategy grid and collects statistics and constraint diagnostics.
 * <p>
 * A home day on a constrained date is labelled unavailable. A base day on a constrained
 * date stays base so callers can see the violation, and is reported as unfulfilled.
 */
@Component
public class RosterFormatter {

    public static final String CONSTRAINT_TYPE = "constraint";
    public static final String UNFULFILLED_REASON =
            "Request to stay off base was not granted because of minimum headcount requirements";

    public RosterResult format(SchedulingContext ctx, ScheduleGrid grid, List<String> warnings) {
        int totalDays = ctx.totalDays();
        List<DailyPresence> roster = new ArrayList<>(totalDays * ctx.people().size());
        Map<String, Map<String, DayStatus>> personStatuses = new LinkedHashMap<>();
        long totalPresence = 0;

        for (int d = 0; d < totalDays; d++) {
            String dateKey = DateKeys.format(ctx.dateOf(d));
            Map<String, DayStatus> day = new LinkedHashMap<>();
            for (Person p : ctx.people()) {
                DayStatus status = label(ctx, grid, p.id(), d);
                day.put(p.id(), status);
                roster.add(DailyPresence.generated(dateKey, p.id(), status));
                if (status == DayStatus.BASE) totalPresence++;
            }
            personStatuses.put(dateKey, day);
        }

        int checked = 0;
        int met = 0;
        List<UnfulfilledConstraint> unfulfilled = new ArrayList<>();
        for (Person p : ctx.people()) {
            for (int d : ctx.constraintsOf(p.id())) {
                checked++;
                if (grid.isBase(p.id(), d)) {
                    unfulfilled.add(new UnfulfilledConstraint(p.id(), p.displayName(),
                            DateKeys.format(ctx.dateOf(d)), CONSTRAINT_TYPE, UNFULFILLED_REASON));
                } else {
                    met++;
                }
            }
        }
        int percentage = checked > 0 ? (int) Math.round(met * 100.0 / checked) : 100;
        double avg = totalDays > 0 ? (double) totalPresence / totalDays : 0.0;

        return new RosterResult(
                List.copyOf(roster),
                Collections.unmodifiableMap(personStatuses),
                new RosterResult.Stats(totalDays, avg, new RosterResult.ConstraintStats(checked, met, percentage)),
                warnings == null ? List.of() : List.copyOf(warnings),
                List.copyOf(unfulfilled));
    }

    static DayStatus label(SchedulingContext ctx, ScheduleGrid grid, String personId, int day) {
        if (grid.isBase(personId, day)) {
            return DayStatus.BASE;
        }
        return ctx.isConstrained(personId, day) ? DayStatus.UNAVAILABLE : DayStatus.HOME;
    }
}
