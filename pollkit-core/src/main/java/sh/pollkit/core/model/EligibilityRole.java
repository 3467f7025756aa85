// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.model;

import java.util.Optional;

/**
 * Governance roles that may be declared eligible to answer a survey.
 */
public enum EligibilityRole {
    DREP("DRep"),
    SPO("SPO"),
    CC("CC"),
    STAKEHOLDER("Stakeholder");

    private final String wireName;

    EligibilityRole(final String wireName) {
        this.wireName = wireName;
    }

    /**
     * Returns the exact spelling used in metadata.
     */
    public String wireName() {
        return wireName;
    }

    /**
     * Looks up a role by its metadata spelling (case-sensitive).
     *
     * @param wireName the value from the payload
     * @return the role, or empty when the value is not in the fixed set
     */
    public static Optional<EligibilityRole> fromWireName(final String wireName) {
        for (final EligibilityRole role : values()) {
            if (role.wireName.equals(wireName)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
