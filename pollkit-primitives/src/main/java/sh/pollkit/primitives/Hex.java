// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.primitives;

/**
 * Base16 helpers for Cardano identifiers.
 *
 * <p>Transaction ids, survey hashes and key hashes travel as bare lowercase hex.
 * Nothing here emits or accepts a {@code 0x} prefix; such a value is treated as
 * malformed input.
 *
 * @since 0.1.0
 */
public final class Hex {
    private static final String DIGITS = "0123456789abcdef";

    private Hex() {
    }

    /**
     * Encodes bytes as lowercase hex, two digits per byte.
     *
     * @param bytes the bytes to encode
     * @return the hex text
     * @throws IllegalArgumentException if {@code bytes} is {@code null}
     */
    public static String encode(final byte[] bytes) {
        if (bytes == null) {
            throw new IllegalArgumentException("bytes must not be null");
        }
        final StringBuilder out = new StringBuilder(bytes.length << 1);
        for (final byte b : bytes) {
            out.append(DIGITS.charAt((b >> 4) & 0xF)).append(DIGITS.charAt(b & 0xF));
        }
        return out.toString();
    }

    /**
     * Decodes hex text in either case.
     *
     * @param text the hex text, without prefix
     * @return the decoded bytes
     * @throws IllegalArgumentException if {@code text} is {@code null}, has odd
     *                                  length or holds a non-hex character
     */
    public static byte[] decode(final String text) {
        if (text == null) {
            throw new IllegalArgumentException("hex text must not be null");
        }
        if (text.length() % 2 != 0) {
            throw new IllegalArgumentException("odd hex length " + text.length() + ": " + text);
        }
        final byte[] out = new byte[text.length() / 2];
        for (int i = 0; i < out.length; i++) {
            out[i] = (byte) (digit(text, 2 * i) << 4 | digit(text, 2 * i + 1));
        }
        return out;
    }

    /**
     * Returns {@code true} when {@code value} is exactly {@code length} hex digits
     * in either case.
     *
     * @param value  the candidate, may be {@code null}
     * @param length the required number of digits
     * @return whether the value qualifies
     */
    public static boolean isHex(final String value, final int length) {
        if (value == null || value.length() != length) {
            return false;
        }
        for (int i = 0; i < length; i++) {
            if (Character.digit(value.charAt(i), 16) < 0 || value.charAt(i) > 'f') {
                return false;
            }
        }
        return true;
    }

    private static int digit(final String text, final int index) {
        final char c = text.charAt(index);
        final int value = Character.digit(c, 16);
        // Character.digit also accepts full-width digits and letters
        if (value < 0 || c > 'f') {
            throw new IllegalArgumentException("invalid hex character '" + c + "' at " + index + ": " + text);
        }
        return value;
    }
}
