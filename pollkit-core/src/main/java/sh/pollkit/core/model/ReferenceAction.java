// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.model;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Governance action a survey refers to.
 *
 * @param transactionId id of the transaction that submitted the action (64 hex characters)
 * @param actionIndex   index of the action within that transaction
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ReferenceAction(
        @Nullable String transactionId,
        @Nullable Long actionIndex) {

    public static ReferenceAction of(final String transactionId, final long actionIndex) {
        return new ReferenceAction(transactionId, actionIndex);
    }
}
