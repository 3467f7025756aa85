// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.tally;

import java.util.List;

/**
 * Summary of the values given to a numeric-range question. All statistics are
 * {@code 0} and the lists empty when nobody answered.
 *
 * @param values values in tally order
 * @param mean   arithmetic mean
 * @param median median; the mean of the two middle values for an even count
 * @param min    smallest value
 * @param max    largest value
 * @param bins   histogram over the question's range, at most 10 bins
 */
public record NumericTally(
        List<Long> values,
        double mean,
        double median,
        long min,
        long max,
        List<HistogramBin> bins) {

    static final NumericTally EMPTY = new NumericTally(List.of(), 0, 0, 0, 0, List.of());

    public NumericTally {
        values = List.copyOf(values);
        bins = List.copyOf(bins);
    }
}
