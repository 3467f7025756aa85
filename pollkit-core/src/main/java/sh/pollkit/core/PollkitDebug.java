// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core;

/**
 * Global toggle for verbose debug logging across pollkit.
 *
 * <p>Thread safety: the individual boolean fields are volatile. The compound
 * check in {@link #isEnabled()} is not atomic, which is acceptable for
 * best-effort logging.
 */
public final class PollkitDebug {

    private static volatile boolean encodingLogging = false;
    private static volatile boolean validationLogging = false;

    private PollkitDebug() {
    }

    /**
     * Checks if any debug logging is enabled.
     *
     * @return true if either encoding or validation logging is enabled
     */
    public static boolean isEnabled() {
        return encodingLogging || validationLogging;
    }

    public static void setEnabled(final boolean enabled) {
        encodingLogging = enabled;
        validationLogging = enabled;
    }

    public static void setEncodingLogging(final boolean enabled) {
        encodingLogging = enabled;
    }

    public static boolean isEncodingLoggingEnabled() {
        return encodingLogging;
    }

    public static void setValidationLogging(final boolean enabled) {
        validationLogging = enabled;
    }

    public static boolean isValidationLoggingEnabled() {
        return validationLogging;
    }
}
