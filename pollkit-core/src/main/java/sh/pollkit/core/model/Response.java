// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.model;

import java.util.List;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import sh.pollkit.core.SurveyProtocol;

/**
 * A response to a survey ({@code surveyResponse} under metadata label 17).
 *
 * <p>A response to a single-question survey fills exactly one of
 * {@code selection}, {@code numericValue} or {@code customValue}. A response to a
 * multi-question survey leaves those empty and lists one {@link Answer} per
 * answered question instead.
 *
 * @param specVersion  payload spec version
 * @param surveyTxId   id of the transaction that published the survey
 * @param surveyHash   survey hash the responder saw (64 lowercase hex characters)
 * @param selection    chosen option indices
 * @param numericValue chosen numeric value
 * @param customValue  free-form value for caller-defined methods
 * @param answers      per-question answers
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Response(
        @Nullable String specVersion,
        @Nullable String surveyTxId,
        @Nullable String surveyHash,
        @Nullable List<Integer> selection,
        @Nullable Long numericValue,
        @Nullable Object customValue,
        @Nullable List<Answer> answers) implements AnswerValues {

    public Response {
        selection = ModelCopies.list(selection);
        answers = ModelCopies.list(answers);
    }

    public static Response ofSelection(final String surveyTxId, final String surveyHash, final List<Integer> selection) {
        return new Response(SurveyProtocol.SPEC_VERSION, surveyTxId, surveyHash, selection, null, null, null);
    }

    public static Response ofNumericValue(final String surveyTxId, final String surveyHash, final long numericValue) {
        return new Response(SurveyProtocol.SPEC_VERSION, surveyTxId, surveyHash, null, numericValue, null, null);
    }

    public static Response ofCustomValue(final String surveyTxId, final String surveyHash, final Object customValue) {
        return new Response(SurveyProtocol.SPEC_VERSION, surveyTxId, surveyHash, null, null, customValue, null);
    }

    public static Response ofAnswers(final String surveyTxId, final String surveyHash, final List<Answer> answers) {
        return new Response(SurveyProtocol.SPEC_VERSION, surveyTxId, surveyHash, null, null, null, answers);
    }

    /**
     * Whether this response uses the per-question {@code answers} form.
     */
    @JsonIgnore
    public boolean hasAnswers() {
        return answers != null && !answers.isEmpty();
    }
}
