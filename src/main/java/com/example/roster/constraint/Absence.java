package com.example.roster.constraint;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.LocalDate;
import java.util.Locale;

public record Absence(String personId, LocalDate startDate, LocalDate endDate, Status status, String reason) {

    public enum Status {
        PENDING, APPROVED, REJECTED;

        @JsonValue
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static Status fromCode(String code) {
            if (code == null || code.isBlank()) {
                return null;
            }
            return Status.valueOf(code.trim().toUpperCase(Locale.ROOT));
        }
    }

    public Absence(String personId, LocalDate startDate, LocalDate endDate) {
        this(personId, startDate, endDate, Status.APPROVED, null);
    }

    /** Pending requests block as well; only rejected ones are ignored. */
    public boolean isBlocking() {
        return status != Status.REJECTED;
    }
}
