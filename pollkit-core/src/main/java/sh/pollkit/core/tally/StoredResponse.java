// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.tally;

import java.util.Objects;

import org.jspecify.annotations.Nullable;

import sh.pollkit.core.model.Response;

/**
 * A response as observed on chain, with the data needed to order and attribute it.
 *
 * @param txId               id of the transaction carrying the response
 * @param responseCredential credential that signed the response
 * @param voterAddress       resolved voter address, preferred over the credential as voter key
 * @param response           the response payload
 * @param slot               slot of the including block
 * @param txIndexInBlock     position of the transaction within its block
 * @param identityVerified   {@code false} when the credential could not be verified; such
 *                           responses are not counted. {@code null} means not checked.
 */
public record StoredResponse(
        String txId,
        String responseCredential,
        @Nullable String voterAddress,
        Response response,
        long slot,
        int txIndexInBlock,
        @Nullable Boolean identityVerified) {

    public StoredResponse {
        Objects.requireNonNull(txId, "txId");
        Objects.requireNonNull(responseCredential, "responseCredential");
        Objects.requireNonNull(response, "response");
    }

    public static StoredResponse of(
            final String txId, final String responseCredential, final Response response,
            final long slot, final int txIndexInBlock) {
        return new StoredResponse(txId, responseCredential, null, response, slot, txIndexInBlock, null);
    }

    /**
     * The key identifying the voter: the voter address when known, else the credential.
     */
    public String voterKey() {
        return voterAddress != null ? voterAddress : responseCredential;
    }

    /**
     * Whether the response takes part in tallying.
     */
    public boolean isCountable() {
        return !Boolean.FALSE.equals(identityVerified);
    }
}
