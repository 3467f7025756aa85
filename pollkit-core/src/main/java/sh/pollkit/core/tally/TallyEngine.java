// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.tally;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import sh.pollkit.core.model.Answer;
import sh.pollkit.core.model.AnswerValues;
import sh.pollkit.core.model.MethodKind;
import sh.pollkit.core.model.NumericConstraints;
import sh.pollkit.core.model.PollDefinition;
import sh.pollkit.core.model.Question;
import sh.pollkit.core.model.Response;
import sh.pollkit.core.model.VoteWeighting;

/**
 * Counts the responses to a survey.
 *
 * <ol>
 * <li>Responses whose identity failed verification are dropped.</li>
 * <li>The rest are put in chain order, by slot and then position in block.</li>
 * <li>Each voter's latest response replaces earlier ones.</li>
 * <li>Every remaining voter is weighted and counted per question.</li>
 * </ol>
 *
 * <p>Under {@link VoteWeighting#STAKE_BASED} with a stake map, a voter weighs their
 * stake in ADA (lovelace / 1,000,000), looked up by response transaction id, then
 * credential, then voter address; voters not in the map weigh 0. Without a stake
 * map, and under {@link VoteWeighting#CREDENTIAL_BASED}, every voter weighs 1.
 *
 * <p>Responses are expected to have passed {@code ResponseValidator}. Out-of-range
 * option indices are skipped rather than rejected.
 */
public final class TallyEngine {

    private static final Logger LOG = LoggerFactory.getLogger(TallyEngine.class);

    private static final int MAX_BINS = 10;
    private static final int LOVELACE_DECIMALS = 6;

    private static final Comparator<StoredResponse> CHAIN_ORDER =
            Comparator.comparingLong(StoredResponse::slot).thenComparingInt(StoredResponse::txIndexInBlock);

    private TallyEngine() {
    }

    /**
     * Tallies with the survey's declared weighting and no stake map.
     *
     * @param definition the survey
     * @param responses  observed responses
     * @return the tally
     */
    public static TallyResult tally(final PollDefinition definition, final Collection<StoredResponse> responses) {
        final VoteWeighting weighting = VoteWeighting.fromWireName(definition.voteWeighting())
                .orElse(VoteWeighting.CREDENTIAL_BASED);
        return tally(definition, responses, weighting, null);
    }

    /**
     * Tallies the responses to a survey.
     *
     * @param definition the survey
     * @param responses  observed responses, in any order
     * @param weighting  how voters are weighted
     * @param stakeByKey lovelace per transaction id, credential or voter address; may be {@code null}
     * @return the tally
     */
    public static TallyResult tally(
            final PollDefinition definition,
            final Collection<StoredResponse> responses,
            final VoteWeighting weighting,
            final @Nullable Map<String, BigInteger> stakeByKey) {
        Objects.requireNonNull(definition, "definition");
        Objects.requireNonNull(responses, "responses");
        Objects.requireNonNull(weighting, "weighting");

        final List<StoredResponse> countable = new ArrayList<>(responses.size());
        for (final StoredResponse response : responses) {
            if (response.isCountable()) {
                countable.add(response);
            }
        }
        countable.sort(CHAIN_ORDER);

        final Map<String, StoredResponse> latestByVoter = new LinkedHashMap<>();
        for (final StoredResponse response : countable) {
            latestByVoter.put(response.voterKey(), response);
        }
        final List<StoredResponse> voters = new ArrayList<>(latestByVoter.values());

        final double[] weights = new double[voters.size()];
        double totalWeight = 0;
        for (int i = 0; i < voters.size(); i++) {
            weights[i] = weightOf(voters.get(i), weighting, stakeByKey);
            totalWeight += weights[i];
        }

        final List<Question> questions = definition.effectiveQuestions();
        final List<QuestionTally> questionTallies = new ArrayList<>(questions.size());
        for (int q = 0; q < questions.size(); q++) {
            final Question question = questions.get(q);
            if (question != null) {
                final String id = question.questionId() != null ? question.questionId() : "questions[" + q + "]";
                questionTallies.add(tallyQuestion(id, question, questions.size() == 1, voters, weights));
            }
        }

        final TallyResult result = new TallyResult(
                surveyTxIdOf(countable, responses),
                responses.size(),
                voters.size(),
                weighting,
                totalWeight,
                questionTallies);
        LOG.debug("Tallied survey {}: {} responses, {} voters, total weight {} ({})",
                result.surveyTxId(), result.totalResponses(), result.uniqueCredentials(), totalWeight, weighting);
        return result;
    }

    private static QuestionTally tallyQuestion(
            final String id,
            final Question question,
            final boolean onlyQuestion,
            final List<StoredResponse> voters,
            final double[] weights) {
        final MethodKind method = question.methodKind();
        final List<OptionTally> options = new ArrayList<>();
        if (method.isChoice() && question.options() != null) {
            for (int i = 0; i < question.options().size(); i++) {
                options.add(new OptionTally(i, question.options().get(i), 0, 0));
            }
        }
        final List<Long> values = new ArrayList<>();
        long answered = 0;

        for (int v = 0; v < voters.size(); v++) {
            final AnswerValues answer = answerFor(voters.get(v).response(), id, onlyQuestion);
            if (answer == null || answer.valueCount() == 0) {
                continue;
            }
            answered++;
            if (method.isChoice() && answer.selection() != null) {
                for (final Integer index : answer.selection()) {
                    if (index != null && index >= 0 && index < options.size()) {
                        options.set(index, options.get(index).add(weights[v]));
                    }
                }
            } else if (method == MethodKind.NUMERIC_RANGE && answer.numericValue() != null) {
                values.add(answer.numericValue());
            }
        }

        return switch (method) {
            case SINGLE_CHOICE, MULTI_SELECT -> new QuestionTally(id, method, answered, List.copyOf(options), null);
            case NUMERIC_RANGE -> new QuestionTally(id, method, answered, null,
                    numericTally(values, question.numericConstraints()));
            case CUSTOM -> new QuestionTally(id, method, answered, null, null);
        };
    }

    private static @Nullable AnswerValues answerFor(
            final Response response, final String questionId, final boolean onlyQuestion) {
        if (response.hasAnswers()) {
            for (final Answer answer : response.answers()) {
                if (answer != null && questionId.equals(answer.questionId())) {
                    return answer;
                }
            }
            return null;
        }
        return onlyQuestion ? response : null;
    }

    static NumericTally numericTally(final List<Long> values, final @Nullable NumericConstraints constraints) {
        if (values.isEmpty()) {
            return NumericTally.EMPTY;
        }
        final List<Long> sorted = new ArrayList<>(values);
        sorted.sort(null);
        final int n = sorted.size();

        double sum = 0;
        for (final long value : values) {
            sum += value;
        }
        final double median = n % 2 == 0
                ? (sorted.get(n / 2 - 1) + (double) sorted.get(n / 2)) / 2
                : sorted.get(n / 2);

        return new NumericTally(values, sum / n, median, sorted.get(0), sorted.get(n - 1),
                histogram(values, constraints));
    }

    private static List<HistogramBin> histogram(final List<Long> values, final @Nullable NumericConstraints constraints) {
        if (constraints == null || constraints.minValue() == null || constraints.maxValue() == null) {
            return List.of();
        }
        final long min = constraints.minValue();
        final long max = constraints.maxValue();
        final double range = (double) max - min;
        if (range < 0) {
            return List.of();
        }
        final int binCount = (int) Math.min(MAX_BINS, range + 1);
        final double binSize = range / binCount;

        final List<HistogramBin> bins = new ArrayList<>(binCount);
        for (int i = 0; i < binCount; i++) {
            final boolean last = i == binCount - 1;
            final double lo = min + i * binSize;
            final double hi = last ? max : min + (i + 1) * binSize;
            long count = 0;
            for (final long value : values) {
                if (value >= lo && (last ? value <= hi : value < hi)) {
                    count++;
                }
            }
            bins.add(new HistogramBin(Math.round(lo) + "-" + Math.round(hi), count));
        }
        return List.copyOf(bins);
    }

    private static double weightOf(
            final StoredResponse response,
            final VoteWeighting weighting,
            final @Nullable Map<String, BigInteger> stakeByKey) {
        if (weighting != VoteWeighting.STAKE_BASED || stakeByKey == null) {
            return 1;
        }
        BigInteger lovelace = stakeByKey.get(response.txId());
        if (lovelace == null) {
            lovelace = stakeByKey.get(response.responseCredential());
        }
        if (lovelace == null && response.voterAddress() != null) {
            lovelace = stakeByKey.get(response.voterAddress());
        }
        return lovelace == null ? 0 : new BigDecimal(lovelace).movePointLeft(LOVELACE_DECIMALS).doubleValue();
    }

    private static String surveyTxIdOf(final List<StoredResponse> countable, final Collection<StoredResponse> all) {
        final Collection<StoredResponse> source = countable.isEmpty() ? all : countable;
        for (final StoredResponse response : source) {
            if (response.response().surveyTxId() != null) {
                return response.response().surveyTxId();
            }
        }
        return "";
    }
}
