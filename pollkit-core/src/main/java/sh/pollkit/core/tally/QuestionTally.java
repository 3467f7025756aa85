// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.tally;

import java.util.List;

import org.jspecify.annotations.Nullable;

import sh.pollkit.core.model.MethodKind;

/**
 * Tally of a single question.
 *
 * @param questionId    the question
 * @param method        its method
 * @param answerCount   number of counted voters who answered it
 * @param optionTallies per-option votes, for choice methods
 * @param numericTally  value summary, for numeric-range
 */
public record QuestionTally(
        String questionId,
        MethodKind method,
        long answerCount,
        @Nullable List<OptionTally> optionTallies,
        @Nullable NumericTally numericTally) {
}
