// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.primitives.cbor;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Definite-length CBOR array (major type 4). Element order is significant and
 * preserved exactly.
 */
public record CborArray(List<CborItem> items) implements CborItem {
    /**
     * Constructs a {@link CborArray} with a defensive copy of items.
     *
     * @param items the items to include in the array
     */
    public CborArray {
        Objects.requireNonNull(items, "items cannot be null");
        items = Collections.unmodifiableList(new ArrayList<>(items));
        if (items.contains(null)) {
            throw new IllegalArgumentException("items cannot contain null values");
        }
    }

    public static CborArray of(final CborItem... items) {
        return new CborArray(Arrays.asList(items));
    }

    public static CborArray of(final List<CborItem> items) {
        return new CborArray(items);
    }

    @Override
    public byte[] encode() {
        return Cbor.encodeArray(items);
    }
}
