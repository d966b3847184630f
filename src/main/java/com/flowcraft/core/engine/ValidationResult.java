package com.flowcraft.core.engine;

import java.util.List;

/**
 * Outcome of structural validation. {@code valid} holds exactly when
 * {@code errors} is empty; warnings never affect validity.
 */
public record ValidationResult(boolean valid, List<String> errors, List<String> warnings) {

    public ValidationResult {
        if (valid != errors.isEmpty())
            throw new IllegalArgumentException("valid must be " + errors.isEmpty() + " with " + errors.size()
                    + " errors");
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static ValidationResult of(List<String> errors, List<String> warnings) {
        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }
}
