// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.tally;

/**
 * Votes for one option of a choice question.
 *
 * @param index  option index
 * @param label  option label
 * @param count  number of voters who selected the option
 * @param weight summed weight of those voters
 */
public record OptionTally(int index, String label, long count, double weight) {

    OptionTally add(final double voterWeight) {
        return new OptionTally(index, label, count + 1, weight + voterWeight);
    }
}
