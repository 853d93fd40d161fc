package com.example.roster.task;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Derives the daily headcount floor implied by round-the-clock task coverage.
 * <p>
 * Each daily or continuous segment needs {@code ceil((duration + rest) / duration * required)}
 * people in rotation: while one crew is on duty, the previous crew is still resting.
 * Weekly and date-specific segments do not add to the floor.
 */
@Component
public class TaskDemandCalculator {

    private static final Logger logger = LoggerFactory.getLogger(TaskDemandCalculator.class);

    public Demand requiredHeadcount(List<TaskTemplate> tasks, LocalDate from, LocalDate to) {
        int total = 0;
        List<String> warnings = new ArrayList<>();
        for (TaskTemplate task : Optional.ofNullable(tasks).orElse(List.of())) {
            if (task == null || !task.overlaps(from, to)) {
                continue;
            }
            for (SchedulingSegment segment : task.segmentList()) {
                if (segment == null || !segment.isRotationWide() || segment.requiredPeople() <= 0) {
                    continue;
                }
                if (segment.durationHours() <= 0) {
                    warnings.add("Segment '" + label(task, segment) + "' has no duration and was ignored when computing the headcount floor");
                    continue;
                }
                int needed = segmentHeadcount(segment);
                logger.debug("Segment {} requires {} people in rotation", label(task, segment), needed);
                total += needed;
            }
        }
        return new Demand(total, warnings);
    }

    public int segmentHeadcount(SchedulingSegment segment) {
        BigDecimal duration = BigDecimal.valueOf(segment.durationHours());
        BigDecimal rest = BigDecimal.valueOf(Math.max(0.0, segment.minRestHoursAfter()));
        BigDecimal scaled = duration.add(rest).multiply(BigDecimal.valueOf(segment.requiredPeople()));
        return scaled.divide(duration, 0, RoundingMode.CEILING).intValueExact();
    }

    private String label(TaskTemplate task, SchedulingSegment segment) {
        String taskName = task.name() != null ? task.name() : task.id();
        String segmentName = segment.name() != null ? segment.name() : segment.id();
        return taskName + "/" + segmentName;
    }

    public record Demand(int minHeadcount, List<String> warnings) {
    }
}
