package org.Aayush.market.model;

import it.unimi.dsi.fastutil.ints.IntOpenHashSet;

import java.util.Arrays;
import java.util.OptionalInt;

/**
 * Immutable ordered list of acceptable candidates held by one market participant.
 *
 * <p>Candidate ids are 0-based indices into the opposite side. The "remain unmatched"
 * cut-off sits directly after the last entry: everything listed is acceptable, anything
 * not listed is not.</p>
 */
public final class PreferenceList {
    /** Wire-format marker for "prefer to remain unmatched". */
    public static final int UNMATCHED_MARKER = 0;

    private static final PreferenceList EMPTY = new PreferenceList(new int[0]);

    private final int[] candidates;

    private PreferenceList(int[] candidates) {
        this.candidates = candidates;
    }

    /**
     * Creates a list from 0-based candidate ids, most preferred first.
     *
     * @param candidates acceptable candidates in preference order.
     * @return immutable preference list.
     * @throws IllegalArgumentException on negative or duplicate ids.
     */
    public static PreferenceList of(int... candidates) {
        if (candidates == null || candidates.length == 0) {
            return EMPTY;
        }
        int[] copy = candidates.clone();
        IntOpenHashSet seen = new IntOpenHashSet(copy.length);
        for (int candidate : copy) {
            if (candidate < 0) {
                throw new IllegalArgumentException("candidate id must be >= 0: " + candidate);
            }
            if (!seen.add(candidate)) {
                throw new IllegalArgumentException("duplicate candidate id in preference list: " + candidate);
            }
        }
        return new PreferenceList(copy);
    }

    /**
     * Parses the wire format: 1-based ids with {@code 0} marking "prefer unmatched".
     * Entries after the first marker are unacceptable and are dropped.
     *
     * @param wireEntries 1-based entries, optionally containing the marker.
     * @return immutable preference list with 0-based ids.
     */
    public static PreferenceList parse(int... wireEntries) {
        if (wireEntries == null) {
            return EMPTY;
        }
        int cut = wireEntries.length;
        for (int i = 0; i < wireEntries.length; i++) {
            if (wireEntries[i] == UNMATCHED_MARKER) {
                cut = i;
                break;
            }
        }
        int[] zeroBased = new int[cut];
        for (int i = 0; i < cut; i++) {
            zeroBased[i] = wireEntries[i] - 1;
        }
        return of(zeroBased);
    }

    /**
     * Returns the shared empty list (nothing acceptable).
     */
    public static PreferenceList empty() {
        return EMPTY;
    }

    /**
     * Number of acceptable candidates.
     */
    public int size() {
        return candidates.length;
    }

    public boolean isEmpty() {
        return candidates.length == 0;
    }

    /**
     * Returns the candidate at a 0-based position without bounds translation.
     *
     * @throws IndexOutOfBoundsException when position is outside the list.
     */
    public int get(int position) {
        if (position < 0 || position >= candidates.length) {
            throw new IndexOutOfBoundsException("preference position out of bounds: " + position);
        }
        return candidates[position];
    }

    /**
     * Returns the candidate at a 0-based position, or empty once the list is exhausted
     * (the holder then prefers to remain unmatched).
     */
    public OptionalInt at(int position) {
        if (position < 0) {
            throw new IndexOutOfBoundsException("preference position out of bounds: " + position);
        }
        return position < candidates.length ? OptionalInt.of(candidates[position]) : OptionalInt.empty();
    }

    /**
     * Largest candidate id referenced, or {@code -1} for an empty list.
     */
    public int maxCandidate() {
        int max = -1;
        for (int candidate : candidates) {
            max = Math.max(max, candidate);
        }
        return max;
    }

    /**
     * Returns a defensive copy of the candidate ids.
     */
    public int[] toIntArray() {
        return candidates.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PreferenceList)) {
            return false;
        }
        return Arrays.equals(candidates, ((PreferenceList) o).candidates);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(candidates);
    }

    @Override
    public String toString() {
        return "PreferenceList" + Arrays.toString(candidates);
    }
}
