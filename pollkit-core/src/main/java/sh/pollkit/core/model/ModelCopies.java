// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Defensive copies that keep {@code null} elements, so that the validator can
 * report them instead of the constructor rejecting them.
 */
final class ModelCopies {
    private ModelCopies() {}

    static <T> List<T> list(final List<T> source) {
        return source == null ? null : Collections.unmodifiableList(new ArrayList<>(source));
    }
}
