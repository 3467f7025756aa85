// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.codec;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import sh.pollkit.core.SurveyProtocol;
import sh.pollkit.core.model.PollDefinition;

/**
 * Builds the structure whose canonical encoding is hashed to identify a survey:
 * <pre>{@code
 * { 17: { "surveyDetails": <normalized definition> } }
 * }</pre>
 * The human-readable {@code msg} of the published metadata is never part of it,
 * so editing the message does not change the survey hash.
 */
public final class HashEnvelope {

    private HashEnvelope() {
    }

    /**
     * Wraps an already normalized definition.
     *
     * @param normalizedDefinition output of {@link SurveyNormalizer}
     * @return unmodifiable envelope tree
     */
    public static Map<Object, Object> wrap(final Map<String, Object> normalizedDefinition) {
        final Map<Object, Object> details = new LinkedHashMap<>();
        details.put(SurveyProtocol.SURVEY_DETAILS_KEY, normalizedDefinition);
        final Map<Object, Object> envelope = new LinkedHashMap<>();
        envelope.put(SurveyProtocol.METADATA_LABEL, Collections.unmodifiableMap(details));
        return Collections.unmodifiableMap(envelope);
    }

    /**
     * Normalizes a definition and wraps it.
     */
    public static Map<Object, Object> of(final PollDefinition definition, final ShapePolicy policy) {
        return wrap(SurveyNormalizer.normalize(definition, policy));
    }

    /**
     * Canonical bytes of the envelope under {@link ShapePolicy#UNIFIED}.
     *
     * @param definition the definition
     * @return the bytes that are hashed
     */
    public static byte[] canonicalBytes(final PollDefinition definition) {
        return canonicalBytes(definition, ShapePolicy.UNIFIED);
    }

    public static byte[] canonicalBytes(final PollDefinition definition, final ShapePolicy policy) {
        return CanonicalEncoder.encode(of(definition, policy));
    }
}
