package com.example.roster.exception;

/**
 * Fatal input problem detected before any optimization runs. No partial roster is produced.
 */
public class RosterConfigurationException extends BusinessException {

    public static final String EMPTY_TASK_LIST = "EMPTY_TASK_LIST";
    public static final String MISSING_ROTATION = "MISSING_ROTATION";
    public static final String INVALID_ROTATION = "INVALID_ROTATION";
    public static final String INVALID_DATE_RANGE = "INVALID_DATE_RANGE";

    public RosterConfigurationException(String errorCode, String message, Object... parameters) {
        super(errorCode, message, parameters);
    }
}
