package com.example.roster.roster;

public record DailyPresence(String date, String personId, DayStatus status, String source) {

    public static final String SOURCE_ALGORITHM = "algorithm";

    public static DailyPresence generated(String date, String personId, DayStatus status) {
        return new DailyPresence(date, personId, status, SOURCE_ALGORITHM);
    }
}
