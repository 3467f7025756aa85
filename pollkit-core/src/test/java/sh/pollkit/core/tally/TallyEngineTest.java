// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.tally;

import static org.junit.jupiter.api.Assertions.*;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import sh.pollkit.core.Polls;
import sh.pollkit.core.model.Answer;
import sh.pollkit.core.model.MethodKind;
import sh.pollkit.core.model.PollDefinition;
import sh.pollkit.core.model.Response;
import sh.pollkit.core.model.VoteWeighting;

class TallyEngineTest {

    private static StoredResponse choice(String txId, String credential, long slot, int txIndex, Integer... selection) {
        return StoredResponse.of(txId, credential,
                Response.ofSelection(Polls.SURVEY_TX_ID, Polls.SURVEY_HASH, List.of(selection)), slot, txIndex);
    }

    private static StoredResponse numeric(String txId, String credential, long slot, long value) {
        return StoredResponse.of(txId, credential,
                Response.ofNumericValue(Polls.SURVEY_TX_ID, Polls.SURVEY_HASH, value), slot, 0);
    }

    private static long[] counts(QuestionTally tally) {
        return tally.optionTallies().stream().mapToLong(OptionTally::count).toArray();
    }

    @Nested
    class Deduplication {

        @Test
        void latestResponsePerVoterWins() {
            List<StoredResponse> responses = List.of(
                    choice("tx3", "alice", 30, 0, 1),
                    choice("tx1", "alice", 10, 0, 0),
                    choice("tx2", "bob", 20, 0, 0));

            TallyResult result = TallyEngine.tally(Polls.singleChoice(), responses);

            assertEquals(3, result.totalResponses());
            assertEquals(2, result.uniqueCredentials());
            assertArrayEquals(new long[] {1, 1}, counts(result.question("q1")));
        }

        @Test
        void positionInBlockBreaksSlotTies() {
            List<StoredResponse> responses = List.of(
                    choice("txB", "alice", 10, 5, 1),
                    choice("txA", "alice", 10, 2, 0));

            TallyResult result = TallyEngine.tally(Polls.singleChoice(), responses);

            assertArrayEquals(new long[] {0, 1}, counts(result.question("q1")));
        }

        @Test
        void voterAddressGroupsCredentials() {
            Response yes = Response.ofSelection(Polls.SURVEY_TX_ID, Polls.SURVEY_HASH, List.of(0));
            Response no = Response.ofSelection(Polls.SURVEY_TX_ID, Polls.SURVEY_HASH, List.of(1));
            List<StoredResponse> responses = List.of(
                    new StoredResponse("tx1", "cred-1", "stake1u8abc", yes, 10, 0, null),
                    new StoredResponse("tx2", "cred-2", "stake1u8abc", no, 11, 0, null));

            TallyResult result = TallyEngine.tally(Polls.singleChoice(), responses);

            assertEquals(1, result.uniqueCredentials());
            assertArrayEquals(new long[] {0, 1}, counts(result.question("q1")));
        }

        @Test
        void unverifiedResponsesAreNotCounted() {
            Response yes = Response.ofSelection(Polls.SURVEY_TX_ID, Polls.SURVEY_HASH, List.of(0));
            List<StoredResponse> responses = List.of(
                    new StoredResponse("tx1", "alice", null, yes, 10, 0, true),
                    new StoredResponse("tx2", "mallory", null, yes, 11, 0, false),
                    new StoredResponse("tx3", "alice", null,
                            Response.ofSelection(Polls.SURVEY_TX_ID, Polls.SURVEY_HASH, List.of(1)), 12, 0, false));

            TallyResult result = TallyEngine.tally(Polls.singleChoice(), responses);

            assertEquals(3, result.totalResponses());
            assertEquals(1, result.uniqueCredentials());
            assertArrayEquals(new long[] {1, 0}, counts(result.question("q1")));
        }
    }

    @Nested
    class Weighting {

        private final List<StoredResponse> responses = List.of(
                choice("tx1", "alice", 10, 0, 0),
                choice("tx2", "bob", 11, 0, 1),
                choice("tx3", "carol", 12, 0, 1));

        @Test
        void credentialBased_weighsEveryVoterOne() {
            TallyResult result = TallyEngine.tally(Polls.singleChoice(), responses,
                    VoteWeighting.CREDENTIAL_BASED, Map.of("tx1", BigInteger.valueOf(9_000_000)));

            assertEquals(3.0, result.totalWeight());
            assertEquals(2.0, result.question("q1").optionTallies().get(1).weight());
        }

        @Test
        void stakeBased_looksUpTxThenCredential() {
            Map<String, BigInteger> stake = Map.of(
                    "tx1", BigInteger.valueOf(5_000_000),
                    "bob", BigInteger.valueOf(2_500_000));

            TallyResult result = TallyEngine.tally(Polls.singleChoice(), responses, VoteWeighting.STAKE_BASED, stake);
            List<OptionTally> options = result.question("q1").optionTallies();

            assertEquals(5.0, options.get(0).weight());
            assertEquals(2.5, options.get(1).weight());
            assertEquals(2, options.get(1).count());
            assertEquals(7.5, result.totalWeight());
        }

        @Test
        void stakeBased_fallsBackToVoterAddress() {
            Response yes = Response.ofSelection(Polls.SURVEY_TX_ID, Polls.SURVEY_HASH, List.of(0));
            StoredResponse byAddress = new StoredResponse("tx9", "cred-9", "stake1u9xyz", yes, 1, 0, null);

            TallyResult result = TallyEngine.tally(Polls.singleChoice(), List.of(byAddress), VoteWeighting.STAKE_BASED,
                    Map.of("stake1u9xyz", BigInteger.valueOf(1_234_567)));

            assertEquals(1.234567, result.totalWeight(), 1e-9);
        }

        @Test
        void stakeBased_withoutStakeMap_weighsOne() {
            TallyResult result = TallyEngine.tally(Polls.singleChoice(), responses, VoteWeighting.STAKE_BASED, null);

            assertEquals(3.0, result.totalWeight());
            assertEquals(VoteWeighting.STAKE_BASED, result.weighting());
        }

        @Test
        void declaredWeightingIsUsedByDefault() {
            TallyResult result = TallyEngine.tally(Polls.multiQuestion(), List.of());

            assertEquals(VoteWeighting.STAKE_BASED, result.weighting());
            assertEquals(VoteWeighting.CREDENTIAL_BASED, TallyEngine.tally(Polls.singleChoice(), List.of()).weighting());
        }
    }

    @Nested
    class Methods {

        @Test
        void multiSelectCountsEverySelectedOption() {
            List<StoredResponse> responses = List.of(
                    choice("tx1", "alice", 1, 0, 0, 2),
                    choice("tx2", "bob", 2, 0, 2));

            QuestionTally tally = TallyEngine.tally(Polls.multiSelect(), responses).question("q1");

            assertEquals(MethodKind.MULTI_SELECT, tally.method());
            assertEquals(2, tally.answerCount());
            assertArrayEquals(new long[] {1, 0, 2}, counts(tally));
            assertEquals("C", tally.optionTallies().get(2).label());
        }

        @Test
        void outOfRangeIndicesAreSkipped() {
            QuestionTally tally = TallyEngine.tally(Polls.singleChoice(), List.of(choice("tx1", "alice", 1, 0, 5)))
                    .question("q1");

            assertArrayEquals(new long[] {0, 0}, counts(tally));
        }

        @Test
        void numericSummaryAndHistogram() {
            List<StoredResponse> responses = List.of(
                    numeric("tx1", "a", 1, 0),
                    numeric("tx2", "b", 2, 3),
                    numeric("tx3", "c", 3, 9),
                    numeric("tx4", "d", 4, 6));

            NumericTally tally = TallyEngine.tally(Polls.numericRange(), responses).question("q1").numericTally();

            assertEquals(List.of(0L, 3L, 9L, 6L), tally.values());
            assertEquals(4.5, tally.mean());
            assertEquals(4.5, tally.median());
            assertEquals(0, tally.min());
            assertEquals(9, tally.max());
            assertEquals(10, tally.bins().size());
            assertEquals(new HistogramBin("0-1", 1), tally.bins().get(0));
            assertEquals(new HistogramBin("3-4", 1), tally.bins().get(3));
            assertEquals(new HistogramBin("9-10", 1), tally.bins().get(9));
            assertEquals(4, tally.bins().stream().mapToLong(HistogramBin::count).sum());
        }

        @Test
        void narrowRangeUsesFewerBins() {
            List<StoredResponse> responses = List.of(
                    numeric("tx1", "a", 1, 1),
                    numeric("tx2", "b", 2, 5),
                    numeric("tx3", "c", 3, 5));
            PollDefinition poll = PollDefinition.builder().title("T").description("D")
                    .question(Polls.multiQuestion().findQuestion("q2").withQuestionId("q1"))
                    .build();

            NumericTally tally = TallyEngine.tally(poll, responses).question("q1").numericTally();

            assertEquals(5.0, tally.median());
            assertEquals(List.of("1-2", "2-3", "3-3", "3-4", "4-5"),
                    tally.bins().stream().map(HistogramBin::range).toList());
            assertEquals(2, tally.bins().get(4).count());
        }

        @Test
        void noNumericAnswers_givesEmptySummary() {
            NumericTally tally = TallyEngine.tally(Polls.numericRange(), List.of()).question("q1").numericTally();

            assertTrue(tally.values().isEmpty());
            assertTrue(tally.bins().isEmpty());
            assertEquals(0.0, tally.mean());
        }
    }

    @Nested
    class MultiQuestion {

        @Test
        void answersAreTalliedPerQuestion() {
            List<StoredResponse> responses = List.of(
                    StoredResponse.of("tx1", "alice", Response.ofAnswers(Polls.SURVEY_TX_ID, Polls.SURVEY_HASH, List.of(
                            Answer.ofSelection("q1", 0),
                            Answer.ofNumericValue("q2", 4),
                            Answer.ofCustomValue("q3", "Clear"))), 1, 0),
                    StoredResponse.of("tx2", "bob", Response.ofAnswers(Polls.SURVEY_TX_ID, Polls.SURVEY_HASH, List.of(
                            Answer.ofSelection("q1", 2),
                            Answer.ofNumericValue("q2", 2))), 2, 0));

            TallyResult result = TallyEngine.tally(Polls.multiQuestion(), responses,
                    VoteWeighting.CREDENTIAL_BASED, null);

            assertEquals(Polls.SURVEY_TX_ID, result.surveyTxId());
            assertEquals(List.of("q1", "q2", "q3"),
                    result.questions().stream().map(QuestionTally::questionId).toList());
            assertArrayEquals(new long[] {1, 0, 1}, counts(result.question("q1")));
            assertEquals(3.0, result.question("q2").numericTally().mean());
            assertEquals(1, result.question("q3").answerCount());
            assertNull(result.question("q3").optionTallies());
            assertNull(result.question("q9"));
        }

        @Test
        void flatResponsesDoNotAnswerMultiQuestionPolls() {
            TallyResult result = TallyEngine.tally(Polls.multiQuestion(),
                    List.of(choice("tx1", "alice", 1, 0, 0)), VoteWeighting.CREDENTIAL_BASED, null);

            assertEquals(1, result.uniqueCredentials());
            assertEquals(0, result.question("q1").answerCount());
        }

        @Test
        void noResponses() {
            TallyResult result = TallyEngine.tally(Polls.multiQuestion(), List.of());

            assertEquals("", result.surveyTxId());
            assertEquals(0, result.uniqueCredentials());
            assertEquals(0.0, result.totalWeight());
        }
    }
}
