// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.codec;

import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import sh.pollkit.core.Polls;
import sh.pollkit.core.model.Answer;
import sh.pollkit.core.model.Lifecycle;
import sh.pollkit.core.model.PollDefinition;
import sh.pollkit.core.model.Response;

class SurveyNormalizerTest {

    @Nested
    class Definitions {

        @Test
        void keysFollowDeclarationOrder() {
            Map<String, Object> tree = SurveyNormalizer.normalize(Polls.multiQuestion());

            assertEquals(List.of("specVersion", "title", "description", "questions",
                    "eligibility", "voteWeighting", "referenceAction", "lifecycle"),
                    List.copyOf(tree.keySet()));
        }

        @Test
        void questionNodesCarryOnlyTheirMethodFields() {
            Map<String, Object> tree = SurveyNormalizer.normalize(Polls.multiQuestion());
            List<?> questions = (List<?>) tree.get("questions");

            assertEquals(List.of("questionId", "question", "methodType", "options"),
                    List.copyOf(((Map<?, ?>) questions.get(0)).keySet()));
            assertEquals(List.of("questionId", "question", "methodType", "numericConstraints"),
                    List.copyOf(((Map<?, ?>) questions.get(1)).keySet()));
            assertEquals(List.of("questionId", "question", "methodType",
                    "methodSchemaUri", "hashAlgorithm", "methodSchemaHash"),
                    List.copyOf(((Map<?, ?>) questions.get(2)).keySet()));
        }

        @Test
        void numericConstraintsOmitAbsentStep() {
            Map<String, Object> tree = SurveyNormalizer.normalize(Polls.multiQuestion());
            Map<?, ?> constraints = (Map<?, ?>) ((Map<?, ?>) ((List<?>) tree.get("questions")).get(1))
                    .get("numericConstraints");

            assertEquals(Map.of("minValue", 1L, "maxValue", 5L), constraints);
        }

        @Test
        void absentOptionalFieldsAreOmitted() {
            Map<String, Object> tree = SurveyNormalizer.normalize(Polls.singleChoice());

            assertEquals(List.of("specVersion", "title", "description", "questions"), List.copyOf(tree.keySet()));
            assertFalse(tree.containsValue(null));
        }

        @Test
        void legacyShape_isLiftedUnderUnifiedPolicy() {
            assertEquals(SurveyNormalizer.normalize(Polls.singleChoice()),
                    SurveyNormalizer.normalize(Polls.legacySingleChoice()));
        }

        @Test
        void legacyShape_isKeptUnderAsSubmittedPolicy() {
            Map<String, Object> tree = SurveyNormalizer.normalize(Polls.legacySingleChoice(), ShapePolicy.AS_SUBMITTED);

            assertEquals(List.of("specVersion", "title", "description", "question", "methodType", "options"),
                    List.copyOf(tree.keySet()));
            assertEquals(List.of("A", "B"), tree.get("options"));
        }

        @Test
        void questionList_ignoresLegacyFieldsUnderBothPolicies() {
            PollDefinition poll = new PollDefinition("1.0.0", "T", "D", List.of(Polls.pickOne()),
                    "Stale", "single-choice", List.of("X", "Y"),
                    null, null, null, null, null, null, null, null, null);

            assertEquals(SurveyNormalizer.normalize(Polls.singleChoice()), SurveyNormalizer.normalize(poll));
            assertEquals(SurveyNormalizer.normalize(Polls.singleChoice()),
                    SurveyNormalizer.normalize(poll, ShapePolicy.AS_SUBMITTED));
        }

        @Test
        void lifecycleKeysPassThrough() {
            Map<String, Object> entries = new LinkedHashMap<>();
            entries.put("startSlot", 1000);
            entries.put("endSlot", 2000);
            entries.put("timezone", "UTC");
            PollDefinition poll = PollDefinition.builder()
                    .title("T").description("D").question(Polls.pickOne())
                    .lifecycle(Lifecycle.of(entries))
                    .build();

            Map<?, ?> lifecycle = (Map<?, ?>) SurveyNormalizer.normalize(poll).get("lifecycle");

            assertEquals(List.of("startSlot", "endSlot", "timezone"), List.copyOf(lifecycle.keySet()));
            assertEquals(1000L, lifecycle.get("startSlot"));
        }

        @Test
        void resultIsUnmodifiable() {
            Map<String, Object> tree = SurveyNormalizer.normalize(Polls.singleChoice());

            assertThrows(UnsupportedOperationException.class, () -> tree.put("extra", "x"));
        }
    }

    @Nested
    class Responses {

        @Test
        void flatResponse() {
            Map<String, Object> tree = SurveyNormalizer.normalize(
                    Response.ofSelection(Polls.SURVEY_TX_ID, Polls.SURVEY_HASH, List.of(1)));

            assertEquals(List.of("specVersion", "surveyTxId", "surveyHash", "selection"), List.copyOf(tree.keySet()));
            assertEquals(List.of(1), tree.get("selection"));
        }

        @Test
        void answersResponse() {
            Map<String, Object> tree = SurveyNormalizer.normalize(Response.ofAnswers(Polls.SURVEY_TX_ID,
                    Polls.SURVEY_HASH, List.of(Answer.ofSelection("q1", 0), Answer.ofNumericValue("q2", 4))));

            List<?> answers = (List<?>) tree.get("answers");
            assertEquals(Map.of("questionId", "q1", "selection", List.of(0)), answers.get(0));
            assertEquals(Map.of("questionId", "q2", "numericValue", 4L), answers.get(1));
        }
    }
}
