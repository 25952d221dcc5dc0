package com.panelforge.plan.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of plan-level validation: valid, or the list of violated invariants in the order found.
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

    /** Success when {@code errors} is empty, failure otherwise. */
    public static ValidationResult of(List<String> errors) {
        return errors == null || errors.isEmpty() ? success() : failure(errors);
    }

    public boolean isValid() {
        return valid;
    }

    public List<String> getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return valid ? "ValidationResult{valid}" : "ValidationResult{errors=" + errors + "}";
    }
}
