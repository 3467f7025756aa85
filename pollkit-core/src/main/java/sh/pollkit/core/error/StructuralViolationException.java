// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.error;

import java.util.List;

/**
 * Thrown when a caller insists on a valid definition or response and the
 * validator rejected it. Carries every violated rule, in report order.
 */
public final class StructuralViolationException extends PollkitException {

    private final List<String> errors;

    public StructuralViolationException(final String subject, final List<String> errors) {
        super("Invalid " + subject + ":\n" + String.join("\n", errors));
        this.errors = List.copyOf(errors);
    }

    /**
     * Returns the violated rules.
     *
     * @return unmodifiable list of error messages
     */
    public List<String> errors() {
        return errors;
    }
}
