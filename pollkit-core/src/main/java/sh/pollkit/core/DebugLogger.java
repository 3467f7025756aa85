// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Centralized debug logger for canonical encoding and validation traces.
 */
public final class DebugLogger {

    private static final Logger LOG = LoggerFactory.getLogger("sh.pollkit.debug");

    private DebugLogger() {
    }

    public static void logEncoding(final String message, final Object... args) {
        if (!PollkitDebug.isEncodingLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    public static void logValidation(final String message, final Object... args) {
        if (!PollkitDebug.isValidationLoggingEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Generic log method (respects global enabled check).
     */
    public static void log(final String message, final Object... args) {
        if (!PollkitDebug.isEnabled()) {
            return;
        }
        logDirect(message, args);
    }

    /**
     * Always sanitizes: response payloads may carry credential proofs.
     */
    private static void logDirect(final String message, final Object... args) {
        final String formatted = (args == null || args.length == 0) ? message : message.formatted(args);
        LOG.info(LogSanitizer.sanitize(formatted));
    }
}
