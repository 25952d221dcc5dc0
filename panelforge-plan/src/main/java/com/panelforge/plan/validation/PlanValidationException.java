package com.panelforge.plan.validation;

/**
 * Thrown when a promotion plan violates a plan-level invariant (grid specification, duplicate
 * positions or ids, unreadable master grid). Raised before any panel work begins, so a caller
 * catching it can rely on no output having been written.
 */
public final class PlanValidationException extends RuntimeException {

    private final ValidationResult validationResult;

    public PlanValidationException(ValidationResult validationResult) {
        this(validationResult, null);
    }

    public PlanValidationException(ValidationResult validationResult, Throwable cause) {
        super(validationResult != null && !validationResult.getErrors().isEmpty()
                ? "Invalid promotion plan: " + String.join("; ", validationResult.getErrors())
                : "Invalid promotion plan", cause);
        this.validationResult = validationResult;
    }

    public ValidationResult getValidationResult() {
        return validationResult;
    }
}
