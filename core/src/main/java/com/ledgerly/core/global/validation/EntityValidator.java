package com.ledgerly.core.global.validation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.ledgerly.core.global.error.BusinessError;
import com.ledgerly.core.global.error.Result;

import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;

/**
 * Runs Bean Validation and reports violations as a {@code VALIDATION_FAILED} {@link Result}
 * instead of throwing {@link jakarta.validation.ConstraintViolationException}.
 */
public class EntityValidator {

    private final Validator validator;

    public EntityValidator(Validator validator) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    public <T> Result<T> validate(T target) {
        Objects.requireNonNull(target, "target must not be null");
        Set<ConstraintViolation<T>> violations = validator.validate(target);
        if (violations.isEmpty()) {
            return Result.success(target);
        }

        List<ConstraintViolation<T>> ordered = new ArrayList<>(violations);
        ordered.sort(Comparator.comparing((ConstraintViolation<T> v) -> v.getPropertyPath().toString())
                .thenComparing(ConstraintViolation::getMessage));

        Map<String, List<String>> fieldErrors = new LinkedHashMap<>();
        for (ConstraintViolation<T> violation : ordered) {
            fieldErrors.computeIfAbsent(violation.getPropertyPath().toString(), key -> new ArrayList<>())
                    .add(violation.getMessage());
        }
        return Result.failure(BusinessError.validation(fieldErrors));
    }
}
