// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core;

import java.util.regex.Pattern;

/**
 * Scrubs debug output before it reaches a logger. Credential proof
 * {@code signature} and {@code key} values are masked, and anything past
 * {@value #MAX_LOG_LENGTH} characters (long canonical dumps) is cut off.
 */
public final class LogSanitizer {

    static final int MAX_LOG_LENGTH = 2000;

    private static final String TRUNCATION_SUFFIX = "...(truncated)";

    /** Matches "signature":"..." JSON values. */
    private static final Pattern SIGNATURE_PATTERN =
            Pattern.compile("\"signature\"\\s*:\\s*\"[^\"]+\"");

    private static final String SIGNATURE_REPLACEMENT = "\"signature\":\"***[REDACTED]***\"";

    /** Matches "key":"..." JSON values (COSE keys in credential proofs). */
    private static final Pattern KEY_PATTERN =
            Pattern.compile("\"key\"\\s*:\\s*\"[^\"]+\"");

    private static final String KEY_REPLACEMENT = "\"key\":\"***[REDACTED]***\"";

    private LogSanitizer() {}

    public static String sanitize(final String input) {
        if (input == null) {
            return "null";
        }

        String out = input;
        if (out.contains("\"signature\"")) {
            out = SIGNATURE_PATTERN.matcher(out).replaceAll(SIGNATURE_REPLACEMENT);
        }
        if (out.contains("\"key\"")) {
            out = KEY_PATTERN.matcher(out).replaceAll(KEY_REPLACEMENT);
        }
        return out.length() <= MAX_LOG_LENGTH
                ? out
                : out.substring(0, MAX_LOG_LENGTH - TRUNCATION_SUFFIX.length()) + TRUNCATION_SUFFIX;
    }
}
