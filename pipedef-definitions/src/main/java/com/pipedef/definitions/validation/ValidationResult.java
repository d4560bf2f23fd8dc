package com.pipedef.definitions.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Result of validating a definition. Collects every error instead of stopping at the first one.
 */
public final class ValidationResult {

    private final boolean valid;
    private final List<String> errors;

    private ValidationResult(boolean valid, List<String> errors) {
        this.valid = valid;
        this.errors = errors != null ? Collections.unmodifiableList(new ArrayList<>(errors)) : List.of();
    }

    public static ValidationResult success() {
        return new ValidationResult(true, List.of());
    }

    public static ValidationResult failure(List<String> errors) {
        return new ValidationResult(false, errors != null ? errors : List.of());
    }

    public static ValidationResult failure(String singleError) {
        return new ValidationResult(false, List.of(Objects.requireNonNull(singleError, "singleError")));
    }

    /** Success when {@code errors} is empty, failure with those errors otherwise. */
    public static ValidationResult of(List<String> errors) {
        return errors == null || errors.isEmpty() ? success() : failure(errors);
    }

    /** Combines both results; valid only when both are valid. */
    public ValidationResult and(ValidationResult other) {
        if (other == null || other.valid) {
            return this;
        }
        if (valid) {
            return other;
        }
        List<String> merged = new ArrayList<>(errors);
        merged.addAll(other.errors);
        return failure(merged);
    }

    public boolean isValid() {
        return valid;
    }

    public List<String> getErrors() {
        return errors;
    }
}
