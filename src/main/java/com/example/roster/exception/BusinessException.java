package com.example.roster.exception;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * Domain error with a stable code for clients and the values that triggered it.
 */
public class BusinessException extends RuntimeException {

    private final String errorCode;
    private final Object[] parameters;

    public BusinessException(String errorCode, String message, Object... parameters) {
        super(message);
        this.errorCode = errorCode;
        this.parameters = parameters == null ? new Object[0] : parameters.clone();
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Object[] getParameters() {
        return parameters.clone();
    }

    /** Parameters as a comma-separated string, empty when there are none. */
    public String describeParameters() {
        return Arrays.stream(parameters)
                .map(String::valueOf)
                .collect(Collectors.joining(", "));
    }
}
