// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.tally;

/**
 * One histogram bucket of a numeric tally.
 *
 * @param range label {@code "lo-hi"} with both bounds rounded
 * @param count number of values in the bucket
 */
public record HistogramBin(String range, long count) {
}
