// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.primitives.cbor;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Deterministic encoding and strict decoding of CBOR data items.
 *
 * <p>Encoding rules:
 * <ul>
 * <li>Integers, lengths and counts use the shortest head that can hold them.</li>
 * <li>Arrays and maps are always definite-length.</li>
 * <li>Map entries are sorted by the length of their encoded key, ties broken by
 * unsigned byte-wise comparison of the encoded keys. Insertion order is
 * irrelevant.</li>
 * </ul>
 *
 * <p>The decoder only accepts input that this encoder could have produced: a
 * non-minimal head, an indefinite length, a major type outside the supported
 * subset, malformed UTF-8, an out-of-order or repeated map key, or trailing
 * bytes are all rejected. Decoding and re-encoding therefore reproduces the
 * input exactly.
 *
 * @see <a href="https://www.rfc-editor.org/rfc/rfc8949.html#section-4.2">RFC 8949 §4.2</a>
 */
public final class Cbor {

    static final int MAJOR_UNSIGNED = 0;
    static final int MAJOR_NEGATIVE = 1;
    static final int MAJOR_BYTES = 2;
    static final int MAJOR_TEXT = 3;
    static final int MAJOR_ARRAY = 4;
    static final int MAJOR_MAP = 5;

    private static final int MAX_DEPTH = 64;

    /**
     * Orders encoded map keys: shorter first, then unsigned lexicographic.
     */
    public static final Comparator<byte[]> KEY_ORDER = (a, b) -> {
        if (a.length != b.length) {
            return Integer.compare(a.length, b.length);
        }
        return Arrays.compareUnsigned(a, b);
    };

    private Cbor() {
        // Utility class
    }

    /**
     * Encodes the provided item to canonical CBOR bytes.
     *
     * @param item the item to encode
     * @return encoded bytes
     */
    public static byte[] encode(final CborItem item) {
        Objects.requireNonNull(item, "item cannot be null");
        return item.encode();
    }

    /**
     * Encodes a signed 64-bit integer using major type 0 or 1.
     *
     * @param value the value
     * @return encoded bytes
     */
    public static byte[] encodeInteger(final long value) {
        if (value >= 0) {
            return head(MAJOR_UNSIGNED, value);
        }
        // -1 - value never overflows for a negative long
        return head(MAJOR_NEGATIVE, -1L - value);
    }

    /**
     * Encodes a string as CBOR text (UTF-8 payload).
     *
     * @param text the text to encode
     * @return encoded bytes
     */
    public static byte[] encodeText(final String text) {
        Objects.requireNonNull(text, "text cannot be null");
        final byte[] utf8 = text.getBytes(StandardCharsets.UTF_8);
        final byte[] header = head(MAJOR_TEXT, utf8.length);
        final byte[] result = new byte[header.length + utf8.length];
        System.arraycopy(header, 0, result, 0, header.length);
        System.arraycopy(utf8, 0, result, header.length, utf8.length);
        return result;
    }

    /**
     * Encodes a definite-length array, preserving element order.
     *
     * @param items the elements
     * @return encoded bytes
     */
    public static byte[] encodeArray(final List<CborItem> items) {
        Objects.requireNonNull(items, "items cannot be null");

        final int itemCount = items.size();
        final byte[][] encodedItems = new byte[itemCount][];
        int payloadSize = 0;
        for (int i = 0; i < itemCount; i++) {
            final CborItem item = items.get(i);
            Objects.requireNonNull(item, "items cannot contain null values");
            final byte[] encoded = item.encode();
            encodedItems[i] = encoded;
            payloadSize += encoded.length;
        }

        return concat(head(MAJOR_ARRAY, itemCount), encodedItems, payloadSize);
    }

    /**
     * Encodes a definite-length map in canonical key order.
     *
     * @param entries the entries, in any order
     * @return encoded bytes
     * @throws IllegalArgumentException if two entries share the same encoded key
     */
    public static byte[] encodeMap(final List<CborMap.Entry> entries) {
        Objects.requireNonNull(entries, "entries cannot be null");

        final int entryCount = entries.size();
        final EncodedEntry[] encodedEntries = new EncodedEntry[entryCount];
        for (int i = 0; i < entryCount; i++) {
            final CborMap.Entry entry = entries.get(i);
            Objects.requireNonNull(entry, "entries cannot contain null values");
            encodedEntries[i] = new EncodedEntry(entry.key().encode(), entry.value().encode());
        }

        // The sort is the only thing that decides wire order.
        Arrays.sort(encodedEntries, (a, b) -> KEY_ORDER.compare(a.key, b.key));

        final byte[][] parts = new byte[entryCount * 2][];
        int payloadSize = 0;
        for (int i = 0; i < entryCount; i++) {
            if (i > 0 && Arrays.equals(encodedEntries[i - 1].key, encodedEntries[i].key)) {
                throw new IllegalArgumentException("Duplicate CBOR map key");
            }
            parts[i * 2] = encodedEntries[i].key;
            parts[i * 2 + 1] = encodedEntries[i].value;
            payloadSize += encodedEntries[i].key.length + encodedEntries[i].value.length;
        }

        return concat(head(MAJOR_MAP, entryCount), parts, payloadSize);
    }

    /**
     * Decodes canonical CBOR bytes into a {@link CborItem}.
     *
     * @param encoded the encoded bytes
     * @return decoded item
     * @throws IllegalArgumentException if the input is malformed, non-canonical,
     *                                  or uses an unsupported major type
     */
    public static CborItem decode(final byte[] encoded) {
        Objects.requireNonNull(encoded, "encoded cannot be null");
        final DecodeResult result = decode(encoded, 0, 0);
        if (result.consumed != encoded.length) {
            throw new IllegalArgumentException("CBOR data has trailing bytes");
        }
        return result.item;
    }

    /**
     * Decodes canonical CBOR bytes, expecting a map at the root.
     *
     * @param encoded the encoded bytes representing a map
     * @return decoded map
     */
    public static CborMap decodeMap(final byte[] encoded) {
        final CborItem item = decode(encoded);
        if (item instanceof CborMap map) {
            return map;
        }
        throw new IllegalArgumentException("CBOR data is not a map");
    }

    /**
     * Builds the shortest head for the given major type and argument.
     * The argument is interpreted as unsigned.
     */
    static byte[] head(final int majorType, final long argument) {
        final int major = majorType << 5;
        if (argument >= 0 && argument < 24) {
            return new byte[] { (byte) (major | (int) argument) };
        }
        if (argument >= 0 && argument <= 0xFFL) {
            return new byte[] { (byte) (major | 24), (byte) argument };
        }
        if (argument >= 0 && argument <= 0xFFFFL) {
            return new byte[] {
                (byte) (major | 25),
                (byte) (argument >>> 8),
                (byte) argument
            };
        }
        if (argument >= 0 && argument <= 0xFFFFFFFFL) {
            return new byte[] {
                (byte) (major | 26),
                (byte) (argument >>> 24),
                (byte) (argument >>> 16),
                (byte) (argument >>> 8),
                (byte) argument
            };
        }
        final byte[] result = new byte[9];
        result[0] = (byte) (major | 27);
        long tmp = argument;
        for (int i = 8; i >= 1; i--) {
            result[i] = (byte) tmp;
            tmp >>>= 8;
        }
        return result;
    }

    private static byte[] concat(final byte[] header, final byte[][] parts, final int payloadSize) {
        final byte[] result = new byte[header.length + payloadSize];
        System.arraycopy(header, 0, result, 0, header.length);
        int offset = header.length;
        for (final byte[] part : parts) {
            System.arraycopy(part, 0, result, offset, part.length);
            offset += part.length;
        }
        return result;
    }

    /**
     * Core recursive decode entry.
     */
    private static DecodeResult decode(final byte[] data, final int offset, final int depth) {
        if (offset >= data.length) {
            throw new IllegalArgumentException("Invalid CBOR data: offset beyond end");
        }
        if (depth > MAX_DEPTH) {
            throw new IllegalArgumentException("CBOR nesting exceeds " + MAX_DEPTH + " levels");
        }

        final int initial = data[offset] & 0xFF;
        final int majorType = initial >>> 5;
        final Head head = readHead(data, offset);

        switch (majorType) {
            case MAJOR_UNSIGNED -> {
                if (head.argument < 0) {
                    throw new IllegalArgumentException("CBOR integer exceeds signed 64-bit range");
                }
                return new DecodeResult(new CborInteger(head.argument), head.size);
            }
            case MAJOR_NEGATIVE -> {
                if (head.argument < 0) {
                    throw new IllegalArgumentException("CBOR integer exceeds signed 64-bit range");
                }
                return new DecodeResult(new CborInteger(-1L - head.argument), head.size);
            }
            case MAJOR_TEXT -> {
                return decodeText(data, offset, head);
            }
            case MAJOR_ARRAY -> {
                return decodeArray(data, offset, head, depth);
            }
            case MAJOR_MAP -> {
                return decodeMap(data, offset, head, depth);
            }
            default -> throw new IllegalArgumentException("Unsupported CBOR major type: " + majorType);
        }
    }

    private static DecodeResult decodeText(final byte[] data, final int offset, final Head head) {
        final int start = offset + head.size;
        final int length = checkedLength(head.argument, data.length - start, "text");

        final String text;
        try {
            text = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(data, start, length))
                    .toString();
        } catch (CharacterCodingException e) {
            throw new IllegalArgumentException("CBOR text is not valid UTF-8", e);
        }
        return new DecodeResult(new CborText(text), head.size + length);
    }

    private static DecodeResult decodeArray(
            final byte[] data, final int offset, final Head head, final int depth) {

        // Every element takes at least one byte, which bounds the count.
        final int count = checkedLength(head.argument, data.length - offset - head.size, "array");
        final List<CborItem> items = new ArrayList<>(count);

        int currentOffset = offset + head.size;
        for (int i = 0; i < count; i++) {
            final DecodeResult child = decode(data, currentOffset, depth + 1);
            items.add(child.item);
            currentOffset += child.consumed;
        }
        return new DecodeResult(new CborArray(items), currentOffset - offset);
    }

    private static DecodeResult decodeMap(
            final byte[] data, final int offset, final Head head, final int depth) {

        final int count = checkedLength(head.argument, data.length - offset - head.size, "map");
        final List<CborMap.Entry> entries = new ArrayList<>(count);

        int currentOffset = offset + head.size;
        byte[] previousKey = null;
        for (int i = 0; i < count; i++) {
            final int keyStart = currentOffset;
            final DecodeResult key = decode(data, currentOffset, depth + 1);
            currentOffset += key.consumed;

            final byte[] encodedKey = Arrays.copyOfRange(data, keyStart, currentOffset);
            if (previousKey != null && KEY_ORDER.compare(previousKey, encodedKey) >= 0) {
                throw new IllegalArgumentException("CBOR map keys are not in canonical order or repeat");
            }
            previousKey = encodedKey;

            final DecodeResult value = decode(data, currentOffset, depth + 1);
            currentOffset += value.consumed;
            entries.add(new CborMap.Entry(key.item, value.item));
        }
        return new DecodeResult(new CborMap(entries), currentOffset - offset);
    }

    /**
     * Reads a head and rejects any encoding that is not the shortest form.
     * The returned argument is a raw unsigned 64-bit value stored in a long.
     */
    private static Head readHead(final byte[] data, final int offset) {
        final int initial = data[offset] & 0xFF;
        final int info = initial & 0x1F;

        if (info < 24) {
            return new Head(info, 1);
        }
        if (info == 31) {
            throw new IllegalArgumentException("Indefinite-length CBOR items are not supported");
        }
        if (info > 27) {
            throw new IllegalArgumentException("Reserved CBOR additional information: " + info);
        }

        final int argumentSize = 1 << (info - 24);
        if (offset + 1 + argumentSize > data.length) {
            throw new IllegalArgumentException("Truncated CBOR head");
        }

        long argument = 0;
        for (int i = 0; i < argumentSize; i++) {
            argument = (argument << 8) | (data[offset + 1 + i] & 0xFF);
        }

        final boolean minimal = switch (info) {
            case 24 -> argument >= 24;
            case 25 -> argument > 0xFFL;
            case 26 -> argument > 0xFFFFL;
            default -> Long.compareUnsigned(argument, 0xFFFFFFFFL) > 0;
        };
        if (!minimal) {
            throw new IllegalArgumentException("Non-minimal CBOR head encoding");
        }
        return new Head(argument, 1 + argumentSize);
    }

    private static int checkedLength(final long argument, final int available, final String what) {
        if (argument < 0 || argument > available) {
            throw new IllegalArgumentException("Invalid CBOR " + what + " length");
        }
        return (int) argument;
    }

    private record Head(long argument, int size) {
    }

    private record EncodedEntry(byte[] key, byte[] value) {
    }

    private record DecodeResult(CborItem item, int consumed) {
    }
}
