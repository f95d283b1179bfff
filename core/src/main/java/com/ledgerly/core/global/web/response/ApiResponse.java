package com.ledgerly.core.global.web.response;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ledgerly.core.global.error.BusinessError;
import com.ledgerly.core.global.error.Result;

/**
 * Uniform envelope for API payloads.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(boolean success, String message, T data, List<String> errors, OffsetDateTime timestamp) {

    public static <T> ApiResponse<T> success(T data) {
        return success(data, null);
    }

    public static <T> ApiResponse<T> success(T data, String message) {
        return new ApiResponse<>(true, message, data, null, now());
    }

    public static <T> ApiResponse<T> error(String message, List<String> errors) {
        return new ApiResponse<>(false, message, null, errors == null ? null : List.copyOf(errors), now());
    }

    public static <T> ApiResponse<T> error(BusinessError error) {
        return error(error.message(), error.allMessages());
    }

    public static <T> ApiResponse<T> of(Result<T> result) {
        return result.isSuccess() ? success(result.value()) : error(result.error());
    }

    static OffsetDateTime now() {
        return OffsetDateTime.now(ZoneOffset.UTC);
    }
}
