// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.model;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Bounds of a numeric-range question.
 *
 * <p>Components are boxed so that a payload missing a bound can be represented
 * and reported by the validator.
 *
 * @param minValue inclusive lower bound
 * @param maxValue inclusive upper bound
 * @param step     optional grid spacing measured from {@code minValue}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NumericConstraints(
        @Nullable Long minValue,
        @Nullable Long maxValue,
        @Nullable Long step) {

    public static NumericConstraints of(final long minValue, final long maxValue) {
        return new NumericConstraints(minValue, maxValue, null);
    }

    public static NumericConstraints of(final long minValue, final long maxValue, final long step) {
        return new NumericConstraints(minValue, maxValue, step);
    }
}
