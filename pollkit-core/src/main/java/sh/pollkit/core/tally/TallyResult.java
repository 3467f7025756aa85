// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.tally;

import java.util.List;

import org.jspecify.annotations.Nullable;

import sh.pollkit.core.model.VoteWeighting;

/**
 * Outcome of tallying the responses to one survey.
 *
 * @param surveyTxId        the survey, taken from the responses; empty when there are none
 * @param totalResponses    responses handed in, before filtering and deduplication
 * @param uniqueCredentials voters counted after deduplication
 * @param weighting         weighting applied
 * @param totalWeight       summed weight of the counted voters
 * @param questions         per-question tallies, in question order
 */
public record TallyResult(
        String surveyTxId,
        int totalResponses,
        int uniqueCredentials,
        VoteWeighting weighting,
        double totalWeight,
        List<QuestionTally> questions) {

    public TallyResult {
        questions = List.copyOf(questions);
    }

    /**
     * Looks up the tally of a question.
     *
     * @param questionId the question id
     * @return the tally, or {@code null}
     */
    public @Nullable QuestionTally question(final String questionId) {
        for (final QuestionTally tally : questions) {
            if (tally.questionId().equals(questionId)) {
                return tally;
            }
        }
        return null;
    }
}
