// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.error;

/**
 * Thrown when bytes passed to the survey hasher are not a canonical
 * {@code {17: {"surveyDetails": ...}}} envelope.
 */
public final class DigestInputMismatchException extends PollkitException {

    public DigestInputMismatchException(final String message) {
        super(message);
    }

    public DigestInputMismatchException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
