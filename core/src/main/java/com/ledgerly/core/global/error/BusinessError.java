package com.ledgerly.core.global.error;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Describes a business rule violation as a value rather than an exception.
 *
 * @param kind        taxonomy bucket of the failure
 * @param code        stable machine readable code, upper snake case
 * @param message     human readable detail, never blank
 * @param fieldErrors field name to violation messages; empty unless {@code kind} is {@link ErrorKind#VALIDATION_FAILED}
 */
public record BusinessError(ErrorKind kind, String code, String message, Map<String, List<String>> fieldErrors) {

    public BusinessError {
        if (kind == null) {
            throw new IllegalArgumentException("BusinessError kind must not be null");
        }
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("BusinessError code must not be blank");
        }
        message = (message != null && !message.isBlank()) ? message : kind.defaultMessage();
        fieldErrors = copyOf(fieldErrors);
    }

    public static BusinessError business(String code, String message) {
        return new BusinessError(ErrorKind.BUSINESS, code, message, Map.of());
    }

    public static BusinessError notFound(String entityName, Object key) {
        return new BusinessError(ErrorKind.NOT_FOUND, "NOT_FOUND",
                entityName + " with key '" + key + "' was not found", Map.of());
    }

    public static BusinessError conflict(String entityName, String conflictField, Object conflictValue) {
        return new BusinessError(ErrorKind.CONFLICT, "CONFLICT",
                entityName + " with " + conflictField + " '" + conflictValue + "' already exists", Map.of());
    }

    public static BusinessError validation(Map<String, List<String>> fieldErrors) {
        return new BusinessError(ErrorKind.VALIDATION_FAILED, "VALIDATION_FAILED", null, fieldErrors);
    }

    public static BusinessError validation(String fieldName, String errorMessage) {
        return new BusinessError(ErrorKind.VALIDATION_FAILED, "VALIDATION_FAILED", errorMessage,
                Map.of(fieldName, List.of(errorMessage)));
    }

    public static BusinessError unauthorized(String message) {
        return new BusinessError(ErrorKind.UNAUTHORIZED, "UNAUTHORIZED", message, Map.of());
    }

    /**
     * Flattened field messages in field order, or the top level message when there are none.
     */
    public List<String> allMessages() {
        if (fieldErrors.isEmpty()) {
            return List.of(message);
        }
        List<String> messages = new ArrayList<>();
        fieldErrors.values().forEach(messages::addAll);
        return List.copyOf(messages);
    }

    private static Map<String, List<String>> copyOf(Map<String, List<String>> source) {
        if (source == null || source.isEmpty()) {
            return Map.of();
        }
        Map<String, List<String>> copy = new LinkedHashMap<>();
        source.forEach((field, messages) -> copy.put(field, messages == null ? List.of() : List.copyOf(messages)));
        return Collections.unmodifiableMap(copy);
    }
}
