// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.json;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import sh.pollkit.core.Polls;
import sh.pollkit.core.crypto.SurveyHasher;
import sh.pollkit.core.error.PayloadParseException;
import sh.pollkit.core.metadata.ChainMetadata;
import sh.pollkit.core.metadata.MetadataEnvelope;
import sh.pollkit.core.model.MethodKind;
import sh.pollkit.core.model.PollDefinition;
import sh.pollkit.core.model.Question;
import sh.pollkit.core.model.Response;

class PollJsonTest {

    // ═══════════════════════════════════════════════════════════════
    // Definitions
    // ═══════════════════════════════════════════════════════════════

    @Nested
    class Definitions {

        @Test
        void parseDefinition_multiQuestion_bindsEveryField() {
            PollDefinition poll = PollJson.parseDefinition("""
                {
                    "specVersion": "1.0.0",
                    "title": "Budget",
                    "description": "Two questions",
                    "questions": [
                        {"questionId": "q1", "question": "Fund it?", "methodType": "urn:cardano:poll-method:single-choice:v1",
                         "options": ["Yes", "No"]},
                        {"questionId": "q2", "question": "How much?", "methodType": "urn:cardano:poll-method:numeric-range:v1",
                         "numericConstraints": {"minValue": 0, "maxValue": 100, "step": 10}}
                    ],
                    "eligibility": ["DRep"],
                    "voteWeighting": "CredentialBased",
                    "referenceAction": {"transactionId": "%s", "actionIndex": 2},
                    "lifecycle": {"endEpoch": 560}
                }
                """.formatted(Polls.ACTION_TX_ID));

            assertEquals(2, poll.questions().size());
            assertEquals(MethodKind.NUMERIC_RANGE, poll.questions().get(1).methodKind());
            assertEquals(10L, poll.questions().get(1).numericConstraints().step());
            assertEquals(List.of("DRep"), poll.eligibility());
            assertEquals(2L, poll.referenceAction().actionIndex());
            assertEquals(560L, poll.lifecycle().endEpoch());
        }

        @Test
        void parseDefinition_legacyShape() {
            PollDefinition poll = PollJson.parseDefinition("""
                {"specVersion": "1.0.0", "title": "T", "description": "D",
                 "question": "Pick", "methodType": "urn:cardano:poll-method:multi-select:v1",
                 "options": ["A", "B", "C"], "maxSelections": 2}
                """);

            assertTrue(poll.isLegacyShape());
            assertEquals(2, poll.legacyQuestion().maxSelections());
        }

        @Test
        void parseDefinition_ignoresUnknownProperties() {
            PollDefinition poll = PollJson.parseDefinition("""
                {"title": "T", "description": "D", "createdBy": "tooling", "questions": []}
                """);

            assertEquals("T", poll.title());
            assertFalse(poll.hasQuestionList());
        }

        @Test
        void toJson_roundTripsDefinition() {
            PollDefinition poll = Polls.multiQuestion();

            PollDefinition parsed = PollJson.parseDefinition(PollJson.toJson(poll));

            assertEquals(poll, parsed);
            assertEquals(SurveyHasher.hash(poll), SurveyHasher.hash(parsed));
        }

        @Test
        void toJson_omitsAbsentFields() {
            String json = PollJson.toJson(Polls.pickOne());

            assertTrue(json.contains("\"options\":[\"A\",\"B\"]"), json);
            assertFalse(json.contains("maxSelections"), json);
            assertFalse(json.contains("null"), json);
            assertFalse(json.contains("methodKind"), json);
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Responses and payloads
    // ═══════════════════════════════════════════════════════════════

    @Nested
    class Payloads {

        @Test
        void parseResponse_answersForm() {
            Response response = PollJson.parseResponse("""
                {"specVersion": "1.0.0", "surveyTxId": "%s", "surveyHash": "%s",
                 "answers": [{"questionId": "q1", "selection": [0]}, {"questionId": "q3", "customValue": {"text": "ok"}}]}
                """.formatted(Polls.SURVEY_TX_ID, Polls.SURVEY_HASH));

            assertTrue(response.hasAnswers());
            assertEquals(List.of(0), response.answers().get(0).selection());
            assertEquals(Map.of("text", "ok"), response.answers().get(1).customValue());
        }

        @Test
        void parsePayload_definitionDocument() {
            SurveyPayload payload = PollJson.parsePayload("""
                {"17": {"msg": ["Hello"], "surveyDetails": {"title": "T", "description": "D",
                    "questions": [{"questionId": "q1", "question": "Pick one", "methodType": "single-choice",
                                   "options": ["A", "B"]}]}}}
                """);

            assertTrue(payload.isDefinition());
            assertFalse(payload.isResponse());
            assertEquals(List.of("Hello"), payload.msg());
            assertEquals(MethodKind.SINGLE_CHOICE, payload.surveyDetails().questions().get(0).methodKind());
        }

        @Test
        void parsePayload_responseDocument() {
            SurveyPayload payload = PollJson.parsePayload("""
                {"17": {"surveyResponse": {"specVersion": "1.0.0", "surveyTxId": "%s", "surveyHash": "%s",
                    "numericValue": 42}}}
                """.formatted(Polls.SURVEY_TX_ID, Polls.SURVEY_HASH));

            assertTrue(payload.isResponse());
            assertNull(payload.msg());
            assertEquals(42L, payload.surveyResponse().numericValue());
        }

        @Test
        void parsePayload_singleMessageStringBindsAsOneLine() {
            SurveyPayload payload = PollJson.parsePayload("""
                {"17": {"msg": "Hello", "surveyDetails": {"title": "T", "description": "D",
                    "questions": [{"questionId": "q1", "question": "Pick one", "methodType": "single-choice",
                                   "options": ["A", "B"]}]}}}
                """);

            assertEquals(List.of("Hello"), payload.msg());
        }

        @Test
        void parseChainPayload_joinsChunkedStrings() {
            String description = "This survey collects feedback on the treasury withdrawal framework. ".repeat(3);
            PollDefinition poll = PollDefinition.builder()
                    .title("Treasury framework")
                    .description(description)
                    .question(Question.singleChoice("q1", "Adopt?", List.of("Yes", "No")))
                    .build();
            String onChain = PollJson.toJson(ChainMetadata.prepare(MetadataEnvelope.forDefinition(poll, List.of("Vote"))));

            SurveyPayload payload = PollJson.parseChainPayload(onChain);

            assertTrue(onChain.contains("\"description\":[\""), onChain);
            assertEquals(description, payload.surveyDetails().description());
            assertEquals(List.of("Vote"), payload.msg());
            assertEquals(SurveyHasher.hash(poll), SurveyHasher.hash(payload.surveyDetails()));
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // Errors
    // ═══════════════════════════════════════════════════════════════

    @Nested
    class Errors {

        @Test
        void malformedJson_throws() {
            PayloadParseException ex = assertThrows(PayloadParseException.class,
                    () -> PollJson.parseDefinition("{\"title\": "));
            assertTrue(ex.getMessage().startsWith("Invalid survey definition JSON"), ex.getMessage());
        }

        @Test
        void fractionalNumericValue_isNotTruncated() {
            assertThrows(PayloadParseException.class, () -> PollJson.parseResponse("""
                {"specVersion": "1.0.0", "numericValue": 7.5}
                """));
        }

        @Test
        void scalarWhereListExpected_isRejected() {
            assertThrows(PayloadParseException.class, () -> PollJson.parseDefinition("""
                {"title": "T", "description": "D", "question": "Pick", "methodType": "single-choice",
                 "options": "A"}
                """));
            assertThrows(PayloadParseException.class, () -> PollJson.parseDefinition("""
                {"title": "T", "description": "D", "eligibility": "DRep", "questions": []}
                """));
            assertThrows(PayloadParseException.class, () -> PollJson.parseResponse("""
                {"specVersion": "1.0.0", "selection": 2}
                """));
        }

        @Test
        void missingLabel_throws() {
            assertThrows(PayloadParseException.class,
                    () -> PollJson.parsePayload("{\"674\": {\"msg\": [\"hi\"]}}"));
            assertThrows(PayloadParseException.class, () -> PollJson.parsePayload("[]"));
            assertThrows(PayloadParseException.class, () -> PollJson.parsePayload("null"));
        }

        @Test
        void payloadWithoutSurvey_throws() {
            PayloadParseException ex = assertThrows(PayloadParseException.class,
                    () -> PollJson.parsePayload("{\"17\": {\"msg\": [\"hi\"]}}"));
            assertTrue(ex.getMessage().contains("neither"), ex.getMessage());
        }

        @Test
        void nullInput_throws() {
            assertThrows(PayloadParseException.class, () -> PollJson.parseResponse(null));
        }
    }
}
