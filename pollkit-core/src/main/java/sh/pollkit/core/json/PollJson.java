// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.json;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import sh.pollkit.core.SurveyProtocol;
import sh.pollkit.core.error.PayloadParseException;
import sh.pollkit.core.metadata.ChainMetadata;
import sh.pollkit.core.model.PollDefinition;
import sh.pollkit.core.model.Response;

/**
 * JSON binding for survey payloads, as exchanged with wallets, indexers and the
 * Blockfrost metadata API.
 *
 * <pre>{@code
 * PollDefinition poll = PollJson.parseDefinition(json);
 * DefinitionValidator.validate(poll).orThrow("survey definition");
 * String hash = SurveyHasher.hash(poll);
 * }</pre>
 *
 * <p>Unknown properties are ignored. Floating point numbers are never truncated
 * into integer fields; such input is rejected.
 */
public final class PollJson {
    private static final ObjectMapper MAPPER = createMapper();
    private static final TypeReference<Map<String, Object>> TREE = new TypeReference<>() {
    };

    private PollJson() {}

    /**
     * Parses a bare {@code surveyDetails} object.
     *
     * @param json the JSON text
     * @return the definition
     * @throws PayloadParseException if the JSON is malformed or mistyped
     */
    public static PollDefinition parseDefinition(final String json) {
        return read(json, PollDefinition.class, "survey definition");
    }

    /**
     * Parses a bare {@code surveyResponse} object.
     *
     * @param json the JSON text
     * @return the response
     * @throws PayloadParseException if the JSON is malformed or mistyped
     */
    public static Response parseResponse(final String json) {
        return read(json, Response.class, "survey response");
    }

    /**
     * Parses a full metadata document {@code {"17": {...}}}.
     *
     * @param json the JSON text
     * @return the document content
     * @throws PayloadParseException if the JSON is malformed or has no label 17 object
     */
    public static SurveyPayload parsePayload(final String json) {
        return bindPayload(labelNode(json));
    }

    /**
     * Parses a metadata document as read back from the chain, joining strings that
     * were split into 64-byte chunks on submission.
     *
     * @param json the JSON text
     * @return the document content
     * @throws PayloadParseException if the JSON is malformed or has no label 17 object
     */
    public static SurveyPayload parseChainPayload(final String json) {
        final JsonNode label = labelNode(json);
        final Map<String, Object> tree = MAPPER.convertValue(label, TREE);
        return bindPayload(MAPPER.valueToTree(ChainMetadata.restore(tree)));
    }

    /**
     * Writes any model value or document tree as compact JSON. Map keys are written
     * as strings, so the label {@code 17} becomes {@code "17"}.
     *
     * @param value the value
     * @return JSON text
     * @throws PayloadParseException if the value cannot be serialized
     */
    public static String toJson(final Object value) {
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new PayloadParseException("Cannot write JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static <T> T read(final String json, final Class<T> type, final String what) {
        if (json == null) {
            throw new PayloadParseException("Invalid " + what + " JSON: input is null");
        }
        try {
            return MAPPER.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new PayloadParseException("Invalid " + what + " JSON: " + e.getOriginalMessage(), e);
        }
    }

    private static JsonNode labelNode(final String json) {
        final JsonNode root = read(json, JsonNode.class, "metadata");
        final JsonNode label = root == null ? null : root.get(String.valueOf(SurveyProtocol.METADATA_LABEL));
        if (label == null || !label.isObject()) {
            throw new PayloadParseException(
                    "Metadata document has no object under label " + SurveyProtocol.METADATA_LABEL);
        }
        return label;
    }

    private static SurveyPayload bindPayload(final JsonNode label) {
        final SurveyPayload payload;
        try {
            payload = MAPPER.treeToValue(label, SurveyPayload.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new PayloadParseException("Invalid label " + SurveyProtocol.METADATA_LABEL + " payload: "
                    + e.getMessage(), e);
        }
        if (!payload.isDefinition() && !payload.isResponse()) {
            throw new PayloadParseException("Label " + SurveyProtocol.METADATA_LABEL
                    + " payload holds neither " + SurveyProtocol.SURVEY_DETAILS_KEY
                    + " nor " + SurveyProtocol.SURVEY_RESPONSE_KEY);
        }
        return payload;
    }

    private static ObjectMapper createMapper() {
        return new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(DeserializationFeature.ACCEPT_FLOAT_AS_INT, false)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }
}
