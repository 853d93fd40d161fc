package com.example.roster.rotation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Streak immediately before the horizon starts: the person was on {@code lastStatus}
 * for {@code consecutiveDays} days up to and including the day before day 0.
 */
public record PersonHistory(LastStatus lastStatus, int consecutiveDays) {

    public enum LastStatus {
        BASE, HOME;

        @JsonValue
        public String code() {
            return name().toLowerCase(Locale.ROOT);
        }

        @JsonCreator
        public static LastStatus fromCode(String code) {
            return code == null ? null : LastStatus.valueOf(code.trim().toUpperCase(Locale.ROOT));
        }
    }

    /**
     * Offset that makes day 0 continue this streak in {@code rotation}, or -1 when the
     * history cannot be placed in that cycle.
     */
    public int impliedOffset(RotationConfig rotation) {
        if (lastStatus == null || consecutiveDays < 1 || rotation.cycleLength() <= 0) {
            return -1;
        }
        int yesterday;
        if (lastStatus == LastStatus.BASE) {
            yesterday = (consecutiveDays - 1) % rotation.daysBase();
        } else {
            if (rotation.daysHome() == 0) {
                return -1;
            }
            yesterday = rotation.daysBase() + (consecutiveDays - 1) % rotation.daysHome();
        }
        return (yesterday + 1) % rotation.cycleLength();
    }
}
