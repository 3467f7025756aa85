// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.model;

import java.util.Optional;

/**
 * How each counted voter's response is weighted in a tally.
 */
public enum VoteWeighting {
    /** One unit per counted credential. */
    CREDENTIAL_BASED("CredentialBased"),
    /** Weighted by the voter's stake in ADA. */
    STAKE_BASED("StakeBased");

    private final String wireName;

    VoteWeighting(final String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Looks up a weighting by its metadata spelling (case-sensitive).
     *
     * @param wireName the value from the payload
     * @return the weighting, or empty when the value is not in the fixed set
     */
    public static Optional<VoteWeighting> fromWireName(final String wireName) {
        for (final VoteWeighting weighting : values()) {
            if (weighting.wireName.equals(wireName)) {
                return Optional.of(weighting);
            }
        }
        return Optional.empty();
    }
}
