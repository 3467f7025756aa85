// SPDX-License-Identifier: MIT OR Apache-2.0
package sh.pollkit.core.model;

import java.math.BigInteger;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.jspecify.annotations.Nullable;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Voting window of a survey, carried as an ordered key/value mapping.
 *
 * <p>Current payloads hold {@code endEpoch}; older ones hold {@code startSlot} and
 * {@code endSlot}. Keys are kept opaque so that every historical and future shape
 * survives normalization without this class knowing it. Entries with a
 * {@code null} value are dropped on construction, and integral numbers are
 * widened to {@link Long}. Other values are kept as given for the validator to
 * judge.
 */
public final class Lifecycle {

    public static final String END_EPOCH = "endEpoch";
    public static final String START_SLOT = "startSlot";
    public static final String END_SLOT = "endSlot";

    private final Map<String, Object> entries;

    private Lifecycle(final Map<String, Object> entries) {
        this.entries = entries;
    }

    /**
     * Creates a lifecycle from arbitrary entries, preserving their order.
     *
     * @param entries the entries
     * @return the lifecycle
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Lifecycle of(final Map<String, ?> entries) {
        Objects.requireNonNull(entries, "entries");
        final Map<String, Object> copy = new LinkedHashMap<>();
        for (final Map.Entry<String, ?> entry : entries.entrySet()) {
            if (entry.getValue() != null) {
                copy.put(entry.getKey(), widen(entry.getValue()));
            }
        }
        return new Lifecycle(Collections.unmodifiableMap(copy));
    }

    public static Lifecycle endingAt(final long endEpoch) {
        final Map<String, Object> entries = new LinkedHashMap<>();
        entries.put(END_EPOCH, endEpoch);
        return of(entries);
    }

    public static Lifecycle slots(final long startSlot, final long endSlot) {
        final Map<String, Object> entries = new LinkedHashMap<>();
        entries.put(START_SLOT, startSlot);
        entries.put(END_SLOT, endSlot);
        return of(entries);
    }

    /**
     * Returns all entries in their original order.
     */
    @JsonValue
    public Map<String, Object> entries() {
        return entries;
    }

    /**
     * Returns the end epoch when it is present as an integer.
     */
    public @Nullable Long endEpoch() {
        final Object value = entries.get(END_EPOCH);
        return value instanceof Long epoch ? epoch : null;
    }

    /**
     * A survey expires once the current epoch has passed its end epoch.
     * Lifecycles without an end epoch never expire.
     *
     * @param currentEpoch the chain's current epoch
     * @return whether voting is closed
     */
    public boolean isExpired(final long currentEpoch) {
        final Long end = endEpoch();
        return end != null && currentEpoch > end;
    }

    private static Object widen(final Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big && big.bitLength() < 64) {
            return big.longValue();
        }
        return value;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Lifecycle other)) {
            return false;
        }
        return entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "Lifecycle" + entries;
    }
}
