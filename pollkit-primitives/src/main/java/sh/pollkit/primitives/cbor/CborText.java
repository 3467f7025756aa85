// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.primitives.cbor;

import java.util.Objects;

/**
 * CBOR UTF-8 text string (major type 3).
 *
 * @param value the text, never {@code null}
 */
public record CborText(String value) implements CborItem {

    public CborText {
        Objects.requireNonNull(value, "value cannot be null");
    }

    public static CborText of(final String value) {
        return new CborText(value);
    }

    @Override
    public byte[] encode() {
        return Cbor.encodeText(value);
    }
}
