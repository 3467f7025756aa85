// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.model;

import java.util.List;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import sh.pollkit.core.SurveyProtocol;

/**
 * A single question of a survey.
 *
 * <p>Exactly one method-specific group is expected to be populated, chosen by
 * {@link #methodType()}:
 * <ul>
 * <li>single-choice: {@code options}</li>
 * <li>multi-select: {@code options} and {@code maxSelections}</li>
 * <li>numeric-range: {@code numericConstraints}</li>
 * <li>any other URN: {@code methodSchemaUri}, {@code hashAlgorithm}, {@code methodSchemaHash}</li>
 * </ul>
 * The record itself accepts any combination; {@code DefinitionValidator} enforces
 * the rules.
 *
 * @param questionId         identifier unique within the survey, e.g. {@code q1}
 * @param question           question text
 * @param methodType         method type URN
 * @param options            option labels of a choice question
 * @param maxSelections      selection cap of a multi-select question
 * @param numericConstraints bounds of a numeric-range question
 * @param methodSchemaUri    schema location of a caller-defined method
 * @param hashAlgorithm      digest used for {@code methodSchemaHash}
 * @param methodSchemaHash   digest of the schema document
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Question(
        @Nullable String questionId,
        @Nullable String question,
        @Nullable String methodType,
        @Nullable List<String> options,
        @Nullable Integer maxSelections,
        @Nullable NumericConstraints numericConstraints,
        @Nullable String methodSchemaUri,
        @Nullable String hashAlgorithm,
        @Nullable String methodSchemaHash) {

    public Question {
        options = ModelCopies.list(options);
    }

    public static Question singleChoice(
            final String questionId, final String question, final List<String> options) {
        return new Question(questionId, question, MethodKind.SINGLE_CHOICE.urn(),
                options, null, null, null, null, null);
    }

    public static Question multiSelect(
            final String questionId, final String question, final List<String> options, final int maxSelections) {
        return new Question(questionId, question, MethodKind.MULTI_SELECT.urn(),
                options, maxSelections, null, null, null, null);
    }

    public static Question numericRange(
            final String questionId, final String question, final NumericConstraints constraints) {
        return new Question(questionId, question, MethodKind.NUMERIC_RANGE.urn(),
                null, null, constraints, null, null, null);
    }

    /**
     * Creates a caller-defined question whose schema is hashed with Blake2b-256.
     */
    public static Question custom(
            final String questionId,
            final String question,
            final String methodType,
            final String methodSchemaUri,
            final String methodSchemaHash) {
        return new Question(questionId, question, methodType,
                null, null, null, methodSchemaUri, SurveyProtocol.HASH_ALGORITHM, methodSchemaHash);
    }

    /**
     * Creates a free-text question using the tooling's default custom method.
     */
    public static Question freeText(
            final String questionId,
            final String question,
            final String methodSchemaUri,
            final String methodSchemaHash) {
        return custom(questionId, question, MethodKind.FREE_TEXT_URN, methodSchemaUri, methodSchemaHash);
    }

    /**
     * Returns the method this question dispatches to.
     */
    @JsonIgnore
    public MethodKind methodKind() {
        return MethodKind.fromMethodType(methodType);
    }

    /**
     * Returns a copy of this question with a different id.
     */
    public Question withQuestionId(final String newQuestionId) {
        return new Question(newQuestionId, question, methodType, options, maxSelections,
                numericConstraints, methodSchemaUri, hashAlgorithm, methodSchemaHash);
    }
}
