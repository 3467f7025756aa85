// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.error;

/**
 * Thrown when the canonical encoder is handed a value outside the supported set
 * (text, integers, lists, maps). Floats, booleans, nulls, cycles and duplicate
 * keys all end up here; nothing is coerced.
 */
public final class UnsupportedValueTypeException extends PollkitException {

    public UnsupportedValueTypeException(final String message) {
        super(message);
    }

    public UnsupportedValueTypeException(final String message, final Throwable cause) {
        super(message, cause);
    }

    /**
     * Value of a type the encoder does not support.
     */
    public static UnsupportedValueTypeException unsupportedType(final String path, final Object value) {
        return new UnsupportedValueTypeException(
            "Unsupported value at '%s': %s".formatted(path, value.getClass().getName()));
    }

    /**
     * Absent value that should have been omitted by the normalizer.
     */
    public static UnsupportedValueTypeException nullValue(final String path) {
        return new UnsupportedValueTypeException("Null value at '%s'".formatted(path));
    }

    /**
     * Container that (directly or indirectly) contains itself.
     */
    public static UnsupportedValueTypeException cyclicReference(final String path) {
        return new UnsupportedValueTypeException("Cyclic reference at '%s'".formatted(path));
    }

    /**
     * Integer outside the signed 64-bit range.
     */
    public static UnsupportedValueTypeException integerOutOfRange(final String path, final Object value) {
        return new UnsupportedValueTypeException(
            "Integer out of 64-bit range at '%s': %s".formatted(path, value));
    }
}
