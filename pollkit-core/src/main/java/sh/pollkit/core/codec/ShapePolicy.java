// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.codec;

/**
 * How the normalizer emits a definition written in the legacy single-question shape.
 * Definitions with a {@code questions} list normalize identically under both.
 */
public enum ShapePolicy {
    /**
     * Lift the legacy question into a one-element {@code questions} list with id
     * {@code q1}. A legacy definition and its one-question equivalent then produce
     * the same tree and the same hash.
     */
    UNIFIED,
    /**
     * Emit the legacy fields directly on the details map, as they were published.
     * Needed to reproduce hashes of surveys published in the legacy shape.
     */
    AS_SUBMITTED
}
