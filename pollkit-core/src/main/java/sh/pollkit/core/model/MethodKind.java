// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.model;

import java.util.Locale;

/**
 * Answer-collection strategy of a question, keyed by its method type URN.
 *
 * <p>Every URN that is not one of the built-in methods resolves to {@link #CUSTOM}.
 * Unknown methods are therefore carried and hashed like any other, with their
 * schema treated as opaque.
 */
public enum MethodKind {
    /** Pick exactly one option. */
    SINGLE_CHOICE("urn:cardano:poll-method:single-choice:v1", "single-choice"),
    /** Pick between one and {@code maxSelections} options. */
    MULTI_SELECT("urn:cardano:poll-method:multi-select:v1", "multi-select"),
    /** Provide an integer within bounds, optionally on a step grid. */
    NUMERIC_RANGE("urn:cardano:poll-method:numeric-range:v1", "numeric-range"),
    /** Caller-defined method described by an external schema. */
    CUSTOM(null, null);

    /** Method type URN of the free-text method offered by the survey tooling. */
    public static final String FREE_TEXT_URN = "urn:cardano:poll-method:custom:v1";

    private final String urn;
    private final String shortName;

    MethodKind(final String urn, final String shortName) {
        this.urn = urn;
        this.shortName = shortName;
    }

    /**
     * Returns the canonical URN of a built-in method.
     *
     * @return the URN, or {@code null} for {@link #CUSTOM}
     */
    public String urn() {
        return urn;
    }

    /**
     * Whether responses to this method carry a {@code selection}.
     */
    public boolean isChoice() {
        return this == SINGLE_CHOICE || this == MULTI_SELECT;
    }

    /**
     * Resolves a method type string. The full URN and the bare short name of a
     * built-in method are both recognised, case-insensitively.
     *
     * @param methodType the method type as written in the payload
     * @return the method kind, {@link #CUSTOM} for anything unrecognised
     */
    public static MethodKind fromMethodType(final String methodType) {
        if (methodType == null) {
            return CUSTOM;
        }
        final String candidate = methodType.trim().toLowerCase(Locale.ROOT);
        for (final MethodKind kind : values()) {
            if (kind.urn != null && (kind.urn.equals(candidate) || kind.shortName.equals(candidate))) {
                return kind;
            }
        }
        return CUSTOM;
    }
}
