// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.metadata;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import sh.pollkit.core.SurveyProtocol;

/**
 * Adapts document trees to the limits of Cardano transaction metadata.
 *
 * <p>Metadata text strings are capped at {@value SurveyProtocol#MAX_METADATA_STRING_BYTES}
 * UTF-8 bytes. {@link #prepare(Object)} splits longer strings into arrays of
 * chunks; {@link #restore(Object)} joins them back when reading metadata.
 */
public final class ChainMetadata {

    private static final int MIN_CHUNK_BYTES = 4;

    private ChainMetadata() {
    }

    /**
     * Rewrites a tree for submission.
     * <ul>
     * <li>strings over the limit become arrays of chunks</li>
     * <li>booleans become {@code 1} or {@code 0}</li>
     * <li>non-integral numbers become their decimal text</li>
     * <li>{@code null} map values are dropped; {@code null} list elements become {@code ""}</li>
     * </ul>
     *
     * @param tree the document tree
     * @return a new tree; maps keep their key order
     */
    public static Object prepare(final Object tree) {
        if (tree == null) {
            return "";
        }
        if (tree instanceof String text) {
            final List<String> chunks = chunk(text, SurveyProtocol.MAX_METADATA_STRING_BYTES);
            return chunks.size() == 1 ? chunks.get(0) : chunks;
        }
        if (tree instanceof Boolean flag) {
            return flag ? 1L : 0L;
        }
        if (tree instanceof Long || tree instanceof Integer || tree instanceof Short
                || tree instanceof Byte || tree instanceof BigInteger) {
            return tree;
        }
        if (tree instanceof Number number) {
            return number.toString();
        }
        if (tree instanceof List<?> list) {
            final List<Object> out = new ArrayList<>(list.size());
            for (final Object element : list) {
                out.add(prepare(element));
            }
            return Collections.unmodifiableList(out);
        }
        if (tree instanceof Map<?, ?> map) {
            final Map<Object, Object> out = new LinkedHashMap<>();
            for (final Map.Entry<?, ?> entry : map.entrySet()) {
                if (entry.getValue() != null) {
                    out.put(entry.getKey(), prepare(entry.getValue()));
                }
            }
            return Collections.unmodifiableMap(out);
        }
        return tree.toString();
    }

    /**
     * Reverses chunking on a tree read back from the chain. A list of two or more
     * strings is joined when at least one of them is exactly at the limit; any
     * other list is kept and its elements restored.
     *
     * @param tree the tree as read from chain metadata
     * @return a new tree
     */
    public static Object restore(final Object tree) {
        if (tree instanceof List<?> list) {
            if (looksChunked(list)) {
                final StringBuilder joined = new StringBuilder();
                for (final Object element : list) {
                    joined.append((String) element);
                }
                return joined.toString();
            }
            final List<Object> out = new ArrayList<>(list.size());
            for (final Object element : list) {
                out.add(restore(element));
            }
            return Collections.unmodifiableList(out);
        }
        if (tree instanceof Map<?, ?> map) {
            final Map<Object, Object> out = new LinkedHashMap<>();
            for (final Map.Entry<?, ?> entry : map.entrySet()) {
                out.put(entry.getKey(), restore(entry.getValue()));
            }
            return Collections.unmodifiableMap(out);
        }
        return tree;
    }

    /**
     * Splits text into pieces of at most {@code maxBytes} UTF-8 bytes without
     * splitting a code point.
     *
     * @param text     the text
     * @param maxBytes the byte limit per piece, at least 4
     * @return the pieces in order; a single piece when the text already fits
     */
    public static List<String> chunk(final String text, final int maxBytes) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        if (maxBytes < MIN_CHUNK_BYTES) {
            throw new IllegalArgumentException("maxBytes must be at least " + MIN_CHUNK_BYTES + ": " + maxBytes);
        }
        if (text.getBytes(StandardCharsets.UTF_8).length <= maxBytes) {
            return List.of(text);
        }

        final List<String> chunks = new ArrayList<>();
        int start = 0;
        int bytes = 0;
        int i = 0;
        while (i < text.length()) {
            final int codePoint = text.codePointAt(i);
            final int width = utf8Width(codePoint);
            if (bytes + width > maxBytes) {
                chunks.add(text.substring(start, i));
                start = i;
                bytes = 0;
            }
            bytes += width;
            i += Character.charCount(codePoint);
        }
        chunks.add(text.substring(start));
        return List.copyOf(chunks);
    }

    private static boolean looksChunked(final List<?> list) {
        if (list.size() < 2) {
            return false;
        }
        boolean atLimit = false;
        for (final Object element : list) {
            if (!(element instanceof String text)) {
                return false;
            }
            final int length = text.getBytes(StandardCharsets.UTF_8).length;
            if (length > SurveyProtocol.MAX_METADATA_STRING_BYTES) {
                return false;
            }
            atLimit |= length == SurveyProtocol.MAX_METADATA_STRING_BYTES;
        }
        return atLimit;
    }

    private static int utf8Width(final int codePoint) {
        if (codePoint < 0x80) {
            return 1;
        }
        if (codePoint < 0x800) {
            return 2;
        }
        return codePoint < 0x10000 ? 3 : 4;
    }
}
