package org.Aayush.market.graph;

import org.Aayush.market.model.PreferenceList;

import java.util.OptionalInt;

/**
 * Pointer advancement shared by the trading-cycle mechanisms.
 *
 * <p>A holder's pointer into its preference list only moves forward: entries skipped as
 * unavailable are never revisited, which bounds total advancement by the sum of list lengths.</p>
 */
public final class PointerGraphBuilder {

    private PointerGraphBuilder() {
    }

    /**
     * Decides whether a holder may currently point at a candidate.
     */
    @FunctionalInterface
    public interface Availability {
        boolean isAvailable(int holder, int candidate);
    }

    /**
     * Advances {@code nextRank[holder]} to the first available candidate and returns it.
     * The pointer is left on the returned candidate. Empty means the list is exhausted and
     * the holder prefers to remain unmatched.
     *
     * @param preferences holder's preference list.
     * @param nextRank per-holder pointer array, mutated in place.
     * @param holder holder id.
     * @param availability live availability predicate.
     * @return best available candidate, or empty.
     */
    public static OptionalInt advance(
            PreferenceList preferences,
            int[] nextRank,
            int holder,
            Availability availability
    ) {
        while (nextRank[holder] < preferences.size()) {
            int candidate = preferences.get(nextRank[holder]);
            if (availability.isAvailable(holder, candidate)) {
                return OptionalInt.of(candidate);
            }
            nextRank[holder]++;
        }
        return OptionalInt.empty();
    }
}
