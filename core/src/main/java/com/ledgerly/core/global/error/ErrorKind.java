package com.ledgerly.core.global.error;

/**
 * {@link #BUSINESS} is the generic bucket; the remaining kinds specialise it.
 */
public enum ErrorKind {
    BUSINESS("Business rule violated"),
    NOT_FOUND("The requested resource was not found"),
    CONFLICT("A conflict occurred with existing data"),
    VALIDATION_FAILED("One or more validation errors occurred"),
    UNAUTHORIZED("Unauthorized access");

    private final String defaultMessage;

    ErrorKind(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
