// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.model;

import java.util.List;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Answer to one question of a multi-question survey.
 *
 * @param questionId   id of the answered question
 * @param selection    chosen option indices (choice methods)
 * @param numericValue chosen value (numeric-range)
 * @param customValue  free-form value (caller-defined methods)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Answer(
        @Nullable String questionId,
        @Nullable List<Integer> selection,
        @Nullable Long numericValue,
        @Nullable Object customValue) implements AnswerValues {

    public Answer {
        selection = ModelCopies.list(selection);
    }

    public static Answer ofSelection(final String questionId, final Integer... indices) {
        return new Answer(questionId, List.of(indices), null, null);
    }

    public static Answer ofNumericValue(final String questionId, final long value) {
        return new Answer(questionId, null, value, null);
    }

    public static Answer ofCustomValue(final String questionId, final Object value) {
        return new Answer(questionId, null, null, value);
    }
}
