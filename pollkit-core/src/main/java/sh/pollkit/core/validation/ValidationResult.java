// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.validation;

import java.util.List;

import sh.pollkit.core.error.StructuralViolationException;

/**
 * Verdict of a validator: valid exactly when no rule was violated.
 *
 * @param valid  whether every rule held
 * @param errors violated rules in report order, empty when valid
 */
public record ValidationResult(boolean valid, List<String> errors) {

    private static final ValidationResult OK = new ValidationResult(true, List.of());

    public ValidationResult {
        errors = List.copyOf(errors);
        if (valid != errors.isEmpty()) {
            throw new IllegalArgumentException("valid must be true exactly when errors is empty");
        }
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult of(final List<String> errors) {
        return errors.isEmpty() ? OK : new ValidationResult(false, errors);
    }

    /**
     * Throws when the verdict is negative.
     *
     * @return this result, for chaining
     * @throws StructuralViolationException carrying every error
     */
    public ValidationResult orThrow() {
        return orThrow("payload");
    }

    /**
     * Throws when the verdict is negative, naming what was validated.
     *
     * @param subject what was validated, e.g. {@code "survey definition"}
     * @return this result, for chaining
     * @throws StructuralViolationException carrying every error
     */
    public ValidationResult orThrow(final String subject) {
        if (!valid) {
            throw new StructuralViolationException(subject, errors);
        }
        return this;
    }
}
