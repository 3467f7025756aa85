// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.primitives.cbor;

/**
 * CBOR integer (major type 0 for non-negative values, 1 for negative values).
 *
 * @param value the signed 64-bit value
 */
public record CborInteger(long value) implements CborItem {

    public static CborInteger of(final long value) {
        return new CborInteger(value);
    }

    @Override
    public byte[] encode() {
        return Cbor.encodeInteger(value);
    }
}
