package com.example.seasonroster.common;

import java.util.Collections;
import java.util.Map;

/**
 * Common envelope for API responses: a {@code success} flag, an optional message and the payload.
 */
public record ApiResponse<T>(boolean success, String message, T data, Map<String, Object> meta) {

    public static <T> ApiResponse<T> success(String message, T data, Map<String, Object> meta) {
        return new ApiResponse<>(true, message, data, meta == null ? Collections.emptyMap() : Map.copyOf(meta));
    }
}
