// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.metadata;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import sh.pollkit.core.Polls;
import sh.pollkit.core.codec.ShapePolicy;
import sh.pollkit.core.codec.SurveyNormalizer;
import sh.pollkit.core.json.PollJson;
import sh.pollkit.core.model.Response;

class MetadataEnvelopeTest {

    @Test
    void definitionEnvelopeCarriesMessageFirst() {
        Map<Object, Object> envelope = MetadataEnvelope.forDefinition(Polls.multiQuestion(), List.of("Feedback round"));

        Map<?, ?> body = (Map<?, ?>) envelope.get(17);
        assertEquals(List.of("msg", "surveyDetails"), List.copyOf(body.keySet()));
        assertEquals(List.of("Feedback round"), body.get("msg"));
        assertEquals(SurveyNormalizer.normalize(Polls.multiQuestion()), body.get("surveyDetails"));
    }

    @Test
    void emptyMessageIsOmitted() {
        Map<?, ?> withEmpty = (Map<?, ?>) MetadataEnvelope.forDefinition(Polls.singleChoice(), List.of()).get(17);
        Map<?, ?> withNull = (Map<?, ?>) MetadataEnvelope.forDefinition(Polls.singleChoice(), null).get(17);

        assertEquals(List.of("surveyDetails"), List.copyOf(withEmpty.keySet()));
        assertEquals(withEmpty, withNull);
    }

    @Test
    void legacyDefinitionKeepsItsShape() {
        Map<?, ?> body = (Map<?, ?>) MetadataEnvelope.forDefinition(Polls.legacySingleChoice(), null).get(17);

        assertEquals(SurveyNormalizer.normalize(Polls.legacySingleChoice(), ShapePolicy.AS_SUBMITTED),
                body.get("surveyDetails"));
        assertTrue(((Map<?, ?>) body.get("surveyDetails")).containsKey("question"));
    }

    @Test
    void responseEnvelope() {
        Response response = Response.ofSelection(Polls.SURVEY_TX_ID, Polls.SURVEY_HASH, List.of(1));

        Map<?, ?> body = (Map<?, ?>) MetadataEnvelope.forResponse(response, List.of("My vote")).get(17);

        assertEquals(List.of("msg", "surveyResponse"), List.copyOf(body.keySet()));
        assertEquals(SurveyNormalizer.normalize(response), body.get("surveyResponse"));
    }

    @Test
    void serializesWithStringLabel() {
        String json = PollJson.toJson(MetadataEnvelope.forDefinition(Polls.singleChoice(), List.of("hi")));

        assertTrue(json.startsWith("{\"17\":{\"msg\":[\"hi\"],\"surveyDetails\":{\"specVersion\":\"1.0.0\",\"title\":\"T\""),
                json);
    }
}
