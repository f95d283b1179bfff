package com.ledgerly.core.global.web.response;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.ledgerly.core.global.error.BusinessError;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValidationResponse(
        boolean success,
        String message,
        Map<String, List<String>> validationErrors,
        List<String> errors,
        OffsetDateTime timestamp
) {

    private static final String DEFAULT_MESSAGE = "Validation failed";

    public static ValidationResponse of(Map<String, List<String>> validationErrors) {
        return from(BusinessError.validation(validationErrors));
    }

    public static ValidationResponse of(String fieldName, String errorMessage) {
        return from(BusinessError.validation(fieldName, errorMessage));
    }

    public static ValidationResponse from(BusinessError error) {
        return new ValidationResponse(false, DEFAULT_MESSAGE, error.fieldErrors(), error.allMessages(),
                ApiResponse.now());
    }
}
