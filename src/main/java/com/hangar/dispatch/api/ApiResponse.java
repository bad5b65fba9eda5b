package com.hangar.dispatch.api;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * JSON envelope for every project endpoint: {@code {"success": true, "data": ...}}
 * or {@code {"success": false, "error": "..."}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
    boolean success,
    T data,
    Integer count,
    String message,
    String error
) {
    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, data, null, null, null);
    }

    public static <T> ApiResponse<T> ok(T data, String message) {
        return new ApiResponse<>(true, data, null, message, null);
    }

    public static <T> ApiResponse<java.util.List<T>> list(java.util.List<T> data) {
        return new ApiResponse<>(true, data, data.size(), null, null);
    }

    public static ApiResponse<Void> message(String message) {
        return new ApiResponse<>(true, null, null, message, null);
    }

    public static ApiResponse<Void> failure(String error) {
        return new ApiResponse<>(false, null, null, null, error);
    }
}
