// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.primitives.cbor;

/**
 * Base sealed interface for the CBOR data items this codec supports.
 *
 * <p>Only the subset needed for deterministic survey metadata is modelled:
 * integers, UTF-8 text, arrays and maps. Byte strings, tags, floats and
 * simple values are rejected by both the encoder and the decoder.
 */
public sealed interface CborItem permits CborInteger, CborText, CborArray, CborMap {
    /**
     * Encodes this item into its canonical CBOR byte representation.
     *
     * @return encoded bytes
     */
    byte[] encode();
}
