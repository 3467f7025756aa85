// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.error;

/**
 * Base runtime exception for all pollkit failures.
 *
 * <p>
 * <strong>Exception Hierarchy:</strong>
 * <pre>
 * PollkitException
 * ├── {@link StructuralViolationException} - a definition or response failed validation
 * ├── {@link UnsupportedValueTypeException} - the canonical encoder met a value it cannot encode
 * ├── {@link DigestInputMismatchException} - bytes handed to the hasher are not a canonical envelope
 * └── {@link PayloadParseException} - JSON input could not be bound to the survey model
 * </pre>
 *
 * <p>
 * Validation itself never throws: it returns a verdict. Only
 * {@link sh.pollkit.core.validation.ValidationResult#orThrow()} turns a rejected
 * verdict into a {@link StructuralViolationException}. The encoder and hasher
 * exceptions signal broken caller contracts and are not expected on validated input.
 *
 * @since 0.1.0
 */
public sealed class PollkitException extends RuntimeException
        permits StructuralViolationException,
        UnsupportedValueTypeException,
        DigestInputMismatchException,
        PayloadParseException {

    public PollkitException(final String message) {
        super(message);
    }

    public PollkitException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
