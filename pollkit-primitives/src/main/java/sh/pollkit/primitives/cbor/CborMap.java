// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.primitives.cbor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Definite-length CBOR map (major type 5).
 *
 * <p>Entries are held in the order they were supplied. That order never reaches
 * the wire: {@link Cbor#encodeMap(List)} sorts entries by their encoded key bytes
 * before emission, so two maps with the same entries always encode identically.
 * Maps produced by {@link Cbor#decode(byte[])} hold their entries in canonical
 * order.
 */
public record CborMap(List<Entry> entries) implements CborItem {

    /**
     * A single key/value pair.
     *
     * @param key   the map key
     * @param value the mapped value
     */
    public record Entry(CborItem key, CborItem value) {
        public Entry {
            Objects.requireNonNull(key, "key cannot be null");
            Objects.requireNonNull(value, "value cannot be null");
        }
    }

    public CborMap {
        Objects.requireNonNull(entries, "entries cannot be null");
        entries = Collections.unmodifiableList(new ArrayList<>(entries));
        if (entries.contains(null)) {
            throw new IllegalArgumentException("entries cannot contain null values");
        }
    }

    public static CborMap of(final Entry... entries) {
        return new CborMap(Arrays.asList(entries));
    }

    public static CborMap of(final List<Entry> entries) {
        return new CborMap(entries);
    }

    public static Entry entry(final CborItem key, final CborItem value) {
        return new Entry(key, value);
    }

    public static Entry entry(final String key, final CborItem value) {
        return new Entry(new CborText(key), value);
    }

    /**
     * Looks up the value stored under {@code key}.
     *
     * @param key the key to look up
     * @return the value, or {@code null} when the key is absent
     */
    public CborItem get(final CborItem key) {
        for (final Entry entry : entries) {
            if (entry.key().equals(key)) {
                return entry.value();
            }
        }
        return null;
    }

    /**
     * Looks up the value stored under a text key.
     *
     * @param key the text key
     * @return the value, or {@code null} when the key is absent
     */
    public CborItem get(final String key) {
        return get(new CborText(key));
    }

    public int size() {
        return entries.size();
    }

    @Override
    public byte[] encode() {
        return Cbor.encodeMap(entries);
    }
}
