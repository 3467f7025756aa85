// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.crypto;

import java.util.Arrays;
import java.util.Locale;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.pollkit.core.SurveyProtocol;
import sh.pollkit.core.codec.HashEnvelope;
import sh.pollkit.core.codec.ShapePolicy;
import sh.pollkit.core.error.DigestInputMismatchException;
import sh.pollkit.core.model.PollDefinition;
import sh.pollkit.primitives.Hex;
import sh.pollkit.primitives.cbor.Cbor;
import sh.pollkit.primitives.cbor.CborInteger;
import sh.pollkit.primitives.cbor.CborItem;
import sh.pollkit.primitives.cbor.CborMap;
import sh.pollkit.primitives.cbor.CborText;

/**
 * Computes and checks survey hashes.
 *
 * <p>The survey hash is the Blake2b-256 digest of the canonical CBOR encoding of
 * {@code {17: {"surveyDetails": normalize(definition)}}}, written as 64 lowercase
 * hex characters. Responses cite it so that a vote is bound to the exact survey
 * the voter saw.
 */
public final class SurveyHasher {

    private static final Logger LOG = LoggerFactory.getLogger(SurveyHasher.class);

    private SurveyHasher() {
    }

    /**
     * Hashes a definition using the unified shape.
     *
     * @param definition the definition
     * @return 64 lowercase hex characters
     */
    public static String hash(final PollDefinition definition) {
        return hash(definition, ShapePolicy.UNIFIED);
    }

    /**
     * Hashes a definition.
     *
     * @param definition the definition
     * @param policy     how a legacy single-question definition is shaped
     * @return 64 lowercase hex characters
     */
    public static String hash(final PollDefinition definition, final ShapePolicy policy) {
        Objects.requireNonNull(definition, "definition");
        final byte[] canonical = HashEnvelope.canonicalBytes(definition, policy);
        final String hash = Hex.encode(Blake2b256.hash(canonical));
        LOG.debug("Survey hash {} over {} canonical bytes ({})", hash, canonical.length, policy);
        return hash;
    }

    /**
     * Hashes bytes that are already a canonical survey envelope.
     *
     * <p>The bytes are decoded strictly and must be exactly
     * {@code {17: {"surveyDetails": <map>}}} in canonical form. This keeps callers
     * from hashing something that merely looks like a survey.
     *
     * @param canonicalEnvelope encoded envelope
     * @return 64 lowercase hex characters
     * @throws DigestInputMismatchException if the bytes are not a canonical envelope
     */
    public static String digest(final byte[] canonicalEnvelope) {
        Objects.requireNonNull(canonicalEnvelope, "canonicalEnvelope");
        final CborItem decoded;
        try {
            decoded = Cbor.decode(canonicalEnvelope);
        } catch (IllegalArgumentException e) {
            throw new DigestInputMismatchException("Input is not canonical CBOR: " + e.getMessage(), e);
        }
        requireEnvelope(decoded);
        if (!Arrays.equals(Cbor.encode(decoded), canonicalEnvelope)) {
            throw new DigestInputMismatchException("Input does not re-encode to the same bytes");
        }
        return Hex.encode(Blake2b256.hash(canonicalEnvelope));
    }

    /**
     * Checks a claimed survey hash against a definition. Comparison ignores hex
     * case. A legacy single-question definition matches both its unified hash and
     * the hash of its as-submitted shape.
     *
     * @param definition the definition
     * @param expected   the claimed hash, may be {@code null}
     * @return whether the claim matches
     */
    public static boolean verify(final PollDefinition definition, final String expected) {
        Objects.requireNonNull(definition, "definition");
        if (!Hex.isHex(expected, SurveyProtocol.HASH_LENGTH_HEX)) {
            return false;
        }
        final String claimed = expected.toLowerCase(Locale.ROOT);
        if (claimed.equals(hash(definition, ShapePolicy.UNIFIED))) {
            return true;
        }
        return definition.isLegacyShape() && claimed.equals(hash(definition, ShapePolicy.AS_SUBMITTED));
    }

    private static void requireEnvelope(final CborItem decoded) {
        if (!(decoded instanceof CborMap root) || root.size() != 1) {
            throw new DigestInputMismatchException("Envelope must be a map with a single entry");
        }
        final CborItem label = root.entries().get(0).key();
        if (!(label instanceof CborInteger integer) || integer.value() != SurveyProtocol.METADATA_LABEL) {
            throw new DigestInputMismatchException(
                    "Envelope must be keyed by metadata label " + SurveyProtocol.METADATA_LABEL);
        }
        if (!(root.entries().get(0).value() instanceof CborMap body) || body.size() != 1) {
            throw new DigestInputMismatchException("Label 17 must hold a map with a single entry");
        }
        final CborMap.Entry details = body.entries().get(0);
        if (!(details.key() instanceof CborText key) || !SurveyProtocol.SURVEY_DETAILS_KEY.equals(key.value())) {
            throw new DigestInputMismatchException("Label 17 must hold only '" + SurveyProtocol.SURVEY_DETAILS_KEY + "'");
        }
        if (!(details.value() instanceof CborMap)) {
            throw new DigestInputMismatchException("'" + SurveyProtocol.SURVEY_DETAILS_KEY + "' must be a map");
        }
    }
}
