package com.example.roster.common;

import java.util.Collections;
import java.util.Map;

/**
 * Envelope for every successful REST response. Run metadata goes in {@code meta}; errors use
 * {@link com.example.roster.exception.GlobalExceptionHandler.ErrorResponse} instead.
 */
public record ApiResponse<T>(boolean success, String message, T data, Map<String, Object> meta) {

    public ApiResponse {
        meta = meta == null ? Collections.emptyMap() : Map.copyOf(meta);
    }

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(true, null, data, null);
    }

    public static <T> ApiResponse<T> success(String message, T data, Map<String, Object> meta) {
        return new ApiResponse<>(true, message, data, meta);
    }
}
