// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.codec;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import sh.pollkit.core.DebugLogger;
import sh.pollkit.core.error.UnsupportedValueTypeException;
import sh.pollkit.primitives.Hex;
import sh.pollkit.primitives.cbor.Cbor;
import sh.pollkit.primitives.cbor.CborArray;
import sh.pollkit.primitives.cbor.CborInteger;
import sh.pollkit.primitives.cbor.CborItem;
import sh.pollkit.primitives.cbor.CborMap;
import sh.pollkit.primitives.cbor.CborText;

/**
 * Converts a normalized value tree into canonical CBOR.
 *
 * <p>Supported values:
 * <ul>
 * <li>{@link String} as a text string</li>
 * <li>{@link Byte}, {@link Short}, {@link Integer}, {@link Long}, and {@link BigInteger}
 * within the signed 64-bit range, as the shortest integer head</li>
 * <li>{@link List} as a definite-length array, order preserved</li>
 * <li>{@link Map} with text or integer keys, as a definite-length map sorted by
 * encoded key (length first, then bytewise)</li>
 * </ul>
 *
 * <p>Anything else, including {@code null}, {@link Boolean} and floating point
 * numbers, raises {@link UnsupportedValueTypeException} naming the path of the
 * offending value. So do containers that contain themselves and maps whose keys
 * collide once encoded (for example {@code 17} as both {@code Integer} and
 * {@code Long}).
 *
 * <p>Equal trees always produce identical bytes, whatever the iteration order of
 * their maps.
 */
public final class CanonicalEncoder {

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private CanonicalEncoder() {
    }

    /**
     * Encodes a value tree.
     *
     * @param tree the tree to encode
     * @return canonical CBOR bytes
     * @throws UnsupportedValueTypeException if the tree holds an unsupported value
     */
    public static byte[] encode(final Object tree) {
        final byte[] encoded = Cbor.encode(toItem(tree));
        DebugLogger.logEncoding("[CANONICAL] %d bytes: %s", encoded.length, Hex.encode(encoded));
        return encoded;
    }

    /**
     * Converts a value tree into its CBOR item form without encoding it.
     *
     * @param tree the tree to convert
     * @return the CBOR item
     * @throws UnsupportedValueTypeException if the tree holds an unsupported value
     */
    public static CborItem toItem(final Object tree) {
        return convert(tree, "$", Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    private static CborItem convert(final Object value, final String path, final Set<Object> visiting) {
        if (value == null) {
            throw UnsupportedValueTypeException.nullValue(path);
        }
        if (value instanceof String text) {
            return CborText.of(text);
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return CborInteger.of(((Number) value).longValue());
        }
        if (value instanceof BigInteger big) {
            if (big.compareTo(LONG_MIN) < 0 || big.compareTo(LONG_MAX) > 0) {
                throw UnsupportedValueTypeException.integerOutOfRange(path, big);
            }
            return CborInteger.of(big.longValueExact());
        }
        if (value instanceof List<?> list) {
            enter(value, path, visiting);
            final List<CborItem> items = new ArrayList<>(list.size());
            for (int i = 0; i < list.size(); i++) {
                items.add(convert(list.get(i), path + "[" + i + "]", visiting));
            }
            visiting.remove(value);
            return CborArray.of(items);
        }
        if (value instanceof Map<?, ?> map) {
            enter(value, path, visiting);
            final CborMap result = convertMap(map, path, visiting);
            visiting.remove(value);
            return result;
        }
        throw UnsupportedValueTypeException.unsupportedType(path, value);
    }

    private static CborMap convertMap(final Map<?, ?> map, final String path, final Set<Object> visiting) {
        final List<CborMap.Entry> entries = new ArrayList<>(map.size());
        final List<byte[]> seenKeys = new ArrayList<>(map.size());
        for (final Map.Entry<?, ?> entry : map.entrySet()) {
            final Object key = entry.getKey();
            final String childPath = childPath(path, key);
            final CborItem keyItem = convertKey(key, path);
            final byte[] encodedKey = keyItem.encode();
            for (final byte[] seen : seenKeys) {
                if (Cbor.KEY_ORDER.compare(seen, encodedKey) == 0) {
                    throw new UnsupportedValueTypeException("Duplicate map key at '%s'".formatted(childPath));
                }
            }
            seenKeys.add(encodedKey);
            entries.add(CborMap.entry(keyItem, convert(entry.getValue(), childPath, visiting)));
        }
        return CborMap.of(entries);
    }

    private static CborItem convertKey(final Object key, final String path) {
        if (key instanceof String || key instanceof Long || key instanceof Integer
                || key instanceof Short || key instanceof Byte || key instanceof BigInteger) {
            return convert(key, path + "<key>", Collections.newSetFromMap(new IdentityHashMap<>()));
        }
        if (key == null) {
            throw UnsupportedValueTypeException.nullValue(path + "<key>");
        }
        throw UnsupportedValueTypeException.unsupportedType(path + "<key>", key);
    }

    private static void enter(final Object container, final String path, final Set<Object> visiting) {
        if (!visiting.add(container)) {
            throw UnsupportedValueTypeException.cyclicReference(path);
        }
    }

    private static String childPath(final String path, final Object key) {
        return key instanceof String ? path + "." + key : path + "[" + key + "]";
    }
}
