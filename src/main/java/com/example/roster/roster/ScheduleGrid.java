package com.example.roster.roster;

import java.util.*;

/**
 * Person x day matrix where {@code true} means on base.
 */
public final class ScheduleGrid {

    private final int totalDays;
    private final Map<String, boolean[]> rows;

    public ScheduleGrid(Collection<String> personIds, int totalDays) {
        this.totalDays = totalDays;
        this.rows = new LinkedHashMap<>();
        for (String id : personIds) {
            rows.put(id, new boolean[totalDays]);
        }
    }

    public int totalDays() {
        return totalDays;
    }

    public Set<String> personIds() {
        return Collections.unmodifiableSet(rows.keySet());
    }

    public boolean isBase(String personId, int day) {
        boolean[] row = rows.get(personId);
        return row != null && day >= 0 && day < totalDays && row[day];
    }

    public void set(String personId, int day, boolean base) {
        boolean[] row = rows.get(personId);
        if (row == null) {
            throw new IllegalArgumentException("Unknown person: " + personId);
        }
        row[day] = base;
    }

    public void setRow(String personId, boolean[] values) {
        if (values.length != totalDays) {
            throw new IllegalArgumentException("Row length " + values.length + " does not match horizon " + totalDays);
        }
        rows.put(personId, values.clone());
    }

    public boolean[] row(String personId) {
        boolean[] row = rows.get(personId);
        return row == null ? new boolean[totalDays] : row.clone();
    }

    public int headcount(int day) {
        int count = 0;
        for (boolean[] row : rows.values()) {
            if (row[day]) count++;
        }
        return count;
    }

    public int baseDays(String personId) {
        boolean[] row = rows.get(personId);
        if (row == null) return 0;
        int count = 0;
        for (boolean b : row) {
            if (b) count++;
        }
        return count;
    }
}
