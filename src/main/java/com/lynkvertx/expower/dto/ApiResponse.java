package com.lynkvertx.expower.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Standard API Response wrapper
 * Every endpoint answers with this envelope, success or failure
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    /** Response status code, mirrors the HTTP status */
    private int code;

    private String message;

    private T data;

    /** ISO 8601 */
    private String timestamp;

    public static <T> ApiResponse<T> success(T data) {
        return success("success", data);
    }

    public static <T> ApiResponse<T> success(String message, T data) {
        return of(200, message, data);
    }

    public static <T> ApiResponse<T> created(String message, T data) {
        return of(201, message, data);
    }

    public static <T> ApiResponse<T> error(int code, String message) {
        return of(code, message, null);
    }

    /**
     * Error response carrying details, e.g. per-field validation messages
     */
    public static <T> ApiResponse<T> error(int code, String message, T data) {
        return of(code, message, data);
    }

    private static <T> ApiResponse<T> of(int code, String message, T data) {
        return ApiResponse.<T>builder()
            .code(code)
            .message(message)
            .data(data)
            .timestamp(Instant.now().toString())
            .build();
    }
}
