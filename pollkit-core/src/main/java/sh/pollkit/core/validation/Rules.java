// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.validation;

/**
 * Shared checks for the validators.
 */
final class Rules {

    private Rules() {
        // Utility class
    }

    static boolean isBlank(final String value) {
        return value == null || value.isBlank();
    }

    static String prefix(final String label) {
        return label.isEmpty() ? "" : label + ": ";
    }
}
