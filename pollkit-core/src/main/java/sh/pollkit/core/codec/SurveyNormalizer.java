// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.codec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import sh.pollkit.core.model.Answer;
import sh.pollkit.core.model.Lifecycle;
import sh.pollkit.core.model.NumericConstraints;
import sh.pollkit.core.model.PollDefinition;
import sh.pollkit.core.model.Question;
import sh.pollkit.core.model.ReferenceAction;
import sh.pollkit.core.model.Response;

/**
 * Turns survey values into ordered, key-complete trees of maps, lists, strings
 * and integers, ready for {@link CanonicalEncoder}.
 *
 * <p>Rules:
 * <ul>
 * <li>Absent values are omitted; a key is never mapped to {@code null}.</li>
 * <li>Keys appear in declaration order. The encoder reorders map keys anyway, so
 * this order only matters to readers of the tree (and of display JSON).</li>
 * <li>A non-empty {@code questions} list wins over legacy single-question fields.</li>
 * <li>{@code lifecycle} is copied key by key, whatever keys it holds.</li>
 * </ul>
 *
 * <p>Normalization assumes validated input. It does not check method rules or value
 * ranges; that is {@code DefinitionValidator}'s job.
 */
public final class SurveyNormalizer {
    private SurveyNormalizer() {}

    /**
     * Normalizes a definition with {@link ShapePolicy#UNIFIED}.
     *
     * @param definition the definition
     * @return unmodifiable ordered tree
     */
    public static Map<String, Object> normalize(final PollDefinition definition) {
        return normalize(definition, ShapePolicy.UNIFIED);
    }

    /**
     * Normalizes a definition.
     *
     * @param definition the definition
     * @param policy     how to emit the legacy single-question shape
     * @return unmodifiable ordered tree
     */
    public static Map<String, Object> normalize(final PollDefinition definition, final ShapePolicy policy) {
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(policy, "policy");

        final Map<String, Object> node = new LinkedHashMap<>();
        putIfPresent(node, "specVersion", definition.specVersion());
        putIfPresent(node, "title", definition.title());
        putIfPresent(node, "description", definition.description());

        if (definition.hasQuestionList()) {
            node.put("questions", questionNodes(definition.questions()));
        } else if (definition.hasLegacyFields()) {
            final Question legacy = definition.legacyQuestion();
            if (policy == ShapePolicy.UNIFIED) {
                node.put("questions", List.of(questionNode(legacy)));
            } else {
                putIfPresent(node, "question", legacy.question());
                putIfPresent(node, "methodType", legacy.methodType());
                putMethodFields(node, legacy);
            }
        }

        putIfPresent(node, "eligibility", copy(definition.eligibility()));
        putIfPresent(node, "voteWeighting", definition.voteWeighting());
        if (definition.referenceAction() != null) {
            node.put("referenceAction", referenceActionNode(definition.referenceAction()));
        }
        if (definition.lifecycle() != null) {
            node.put("lifecycle", lifecycleNode(definition.lifecycle()));
        }
        return Collections.unmodifiableMap(node);
    }

    /**
     * Normalizes a response for the display envelope.
     *
     * @param response the response
     * @return unmodifiable ordered tree
     */
    public static Map<String, Object> normalize(final Response response) {
        Objects.requireNonNull(response, "response");

        final Map<String, Object> node = new LinkedHashMap<>();
        putIfPresent(node, "specVersion", response.specVersion());
        putIfPresent(node, "surveyTxId", response.surveyTxId());
        putIfPresent(node, "surveyHash", response.surveyHash());
        putIfPresent(node, "selection", copy(response.selection()));
        putIfPresent(node, "numericValue", response.numericValue());
        putIfPresent(node, "customValue", response.customValue());
        if (response.answers() != null) {
            final List<Object> answers = new ArrayList<>(response.answers().size());
            for (final Answer answer : response.answers()) {
                answers.add(answerNode(answer));
            }
            node.put("answers", Collections.unmodifiableList(answers));
        }
        return Collections.unmodifiableMap(node);
    }

    private static List<Object> questionNodes(final List<Question> questions) {
        final List<Object> nodes = new ArrayList<>(questions.size());
        for (final Question question : questions) {
            nodes.add(questionNode(question));
        }
        return Collections.unmodifiableList(nodes);
    }

    private static Map<String, Object> questionNode(final Question question) {
        final Map<String, Object> node = new LinkedHashMap<>();
        putIfPresent(node, "questionId", question.questionId());
        putIfPresent(node, "question", question.question());
        putIfPresent(node, "methodType", question.methodType());
        putMethodFields(node, question);
        return Collections.unmodifiableMap(node);
    }

    private static void putMethodFields(final Map<String, Object> node, final Question question) {
        putIfPresent(node, "options", copy(question.options()));
        putIfPresent(node, "maxSelections", question.maxSelections());
        if (question.numericConstraints() != null) {
            node.put("numericConstraints", numericConstraintsNode(question.numericConstraints()));
        }
        putIfPresent(node, "methodSchemaUri", question.methodSchemaUri());
        putIfPresent(node, "hashAlgorithm", question.hashAlgorithm());
        putIfPresent(node, "methodSchemaHash", question.methodSchemaHash());
    }

    private static Map<String, Object> numericConstraintsNode(final NumericConstraints constraints) {
        final Map<String, Object> node = new LinkedHashMap<>();
        putIfPresent(node, "minValue", constraints.minValue());
        putIfPresent(node, "maxValue", constraints.maxValue());
        putIfPresent(node, "step", constraints.step());
        return Collections.unmodifiableMap(node);
    }

    private static Map<String, Object> referenceActionNode(final ReferenceAction action) {
        final Map<String, Object> node = new LinkedHashMap<>();
        putIfPresent(node, "transactionId", action.transactionId());
        putIfPresent(node, "actionIndex", action.actionIndex());
        return Collections.unmodifiableMap(node);
    }

    private static Map<String, Object> lifecycleNode(final Lifecycle lifecycle) {
        final Map<String, Object> node = new LinkedHashMap<>();
        for (final Map.Entry<String, Object> entry : lifecycle.entries().entrySet()) {
            putIfPresent(node, entry.getKey(), entry.getValue());
        }
        return Collections.unmodifiableMap(node);
    }

    private static Map<String, Object> answerNode(final Answer answer) {
        final Map<String, Object> node = new LinkedHashMap<>();
        putIfPresent(node, "questionId", answer.questionId());
        putIfPresent(node, "selection", copy(answer.selection()));
        putIfPresent(node, "numericValue", answer.numericValue());
        putIfPresent(node, "customValue", answer.customValue());
        return Collections.unmodifiableMap(node);
    }

    private static void putIfPresent(final Map<String, Object> node, final String key, final Object value) {
        if (value != null) {
            node.put(key, value);
        }
    }

    private static <T> List<Object> copy(final List<T> values) {
        return values == null ? null : Collections.unmodifiableList(new ArrayList<>(values));
    }
}
