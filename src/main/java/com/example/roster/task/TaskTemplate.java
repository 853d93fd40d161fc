package com.example.roster.task;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;

public record TaskTemplate(
        String id,
        String name,
        List<SchedulingSegment> segments,
        LocalDate startDate,
        LocalDate endDate) {

    public TaskTemplate(String id, String name, List<SchedulingSegment> segments) {
        this(id, name, segments, null, null);
    }

    public List<SchedulingSegment> segmentList() {
        return segments == null ? Collections.emptyList() : segments;
    }

    /** True when the task's validity window touches {@code [from, to]}; open ends always match. */
    public boolean overlaps(LocalDate from, LocalDate to) {
        if (startDate != null && to != null && startDate.isAfter(to)) {
            return false;
        }
        return endDate == null || from == null || !endDate.isBefore(from);
    }
}
