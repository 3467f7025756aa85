// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.error;

/**
 * Thrown when JSON input cannot be bound to the survey model.
 */
public final class PayloadParseException extends PollkitException {

    public PayloadParseException(final String message) {
        super(message);
    }

    public PayloadParseException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
