// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.metadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import sh.pollkit.core.SurveyProtocol;
import sh.pollkit.core.codec.ShapePolicy;
import sh.pollkit.core.codec.SurveyNormalizer;
import sh.pollkit.core.model.PollDefinition;
import sh.pollkit.core.model.Response;

/**
 * Builds the label 17 metadata documents that are attached to transactions.
 *
 * <p>Unlike the hash envelope these carry the human-readable {@code msg} lines,
 * and a definition keeps the shape it was written in. Pass the result through
 * {@link ChainMetadata#prepare(Object)} before submitting it.
 *
 * <pre>{@code
 * Map<Object, Object> metadata = MetadataEnvelope.forDefinition(poll, List.of("Treasury survey"));
 * String json = PollJson.toJson(metadata);
 * }</pre>
 */
public final class MetadataEnvelope {

    private MetadataEnvelope() {
    }

    /**
     * Builds {@code {17: {msg?, surveyDetails}}}.
     *
     * @param definition the survey
     * @param msg        human-readable lines, omitted when {@code null} or empty
     * @return unmodifiable document tree
     */
    public static Map<Object, Object> forDefinition(final PollDefinition definition, final List<String> msg) {
        Objects.requireNonNull(definition, "definition");
        return wrap(msg, SurveyProtocol.SURVEY_DETAILS_KEY,
                SurveyNormalizer.normalize(definition, ShapePolicy.AS_SUBMITTED));
    }

    /**
     * Builds {@code {17: {msg?, surveyResponse}}}.
     *
     * @param response the response
     * @param msg      human-readable lines, omitted when {@code null} or empty
     * @return unmodifiable document tree
     */
    public static Map<Object, Object> forResponse(final Response response, final List<String> msg) {
        Objects.requireNonNull(response, "response");
        return wrap(msg, SurveyProtocol.SURVEY_RESPONSE_KEY, SurveyNormalizer.normalize(response));
    }

    private static Map<Object, Object> wrap(final List<String> msg, final String key, final Map<String, Object> body) {
        final Map<Object, Object> content = new LinkedHashMap<>();
        if (msg != null && !msg.isEmpty()) {
            content.put(SurveyProtocol.MESSAGE_KEY, List.copyOf(msg));
        }
        content.put(key, body);
        final Map<Object, Object> envelope = new LinkedHashMap<>();
        envelope.put(SurveyProtocol.METADATA_LABEL, Collections.unmodifiableMap(content));
        return Collections.unmodifiableMap(envelope);
    }
}
