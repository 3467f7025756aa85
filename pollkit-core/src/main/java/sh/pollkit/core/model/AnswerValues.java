// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.model;

import java.util.List;

import org.jspecify.annotations.Nullable;

/**
 * The answer value slots shared by a flat {@link Response} and an {@link Answer}.
 * Exactly one slot is expected to be filled.
 */
public interface AnswerValues {

    @Nullable List<Integer> selection();

    @Nullable Long numericValue();

    @Nullable Object customValue();

    /**
     * Counts how many of the three value slots are filled.
     */
    default int valueCount() {
        int count = 0;
        if (selection() != null) {
            count++;
        }
        if (numericValue() != null) {
            count++;
        }
        if (customValue() != null) {
            count++;
        }
        return count;
    }
}
