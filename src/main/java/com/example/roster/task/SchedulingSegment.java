package com.example.roster.task;

/**
 * One staffed slot of a task, e.g. a morning watch.
 *
 * @param continuous true when the segment repeats around the clock
 */
public record SchedulingSegment(
        String id,
        String name,
        double durationHours,
        SegmentFrequency frequency,
        int requiredPeople,
        double minRestHoursAfter,
        boolean continuous) {

    public boolean isRotationWide() {
        return continuous || frequency == SegmentFrequency.DAILY;
    }
}
