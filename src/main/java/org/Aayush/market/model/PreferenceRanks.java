package org.Aayush.market.model;

import java.util.Arrays;

/**
 * Constant-time rank lookup built from a {@link PreferenceList}.
 *
 * <p>Rank 1 is the most preferred candidate. Remaining unmatched ranks at
 * {@code size + 1}; candidates absent from the list rank at {@code size + 2}
 * and are therefore unacceptable.</p>
 */
public final class PreferenceRanks {
    private final int[] ranks;
    private final int unmatchedRank;

    private PreferenceRanks(int[] ranks, int unmatchedRank) {
        this.ranks = ranks;
        this.unmatchedRank = unmatchedRank;
    }

    /**
     * Indexes a preference list over a candidate side of the given size.
     *
     * @param preferences holder's preference list.
     * @param candidateCount size of the candidate side.
     * @return rank lookup.
     * @throws IllegalArgumentException when the list names a candidate outside the side.
     */
    public static PreferenceRanks index(PreferenceList preferences, int candidateCount) {
        if (candidateCount < 0) {
            throw new IllegalArgumentException("candidateCount must be >= 0");
        }
        if (preferences.maxCandidate() >= candidateCount) {
            throw new IllegalArgumentException(
                    "preference list references candidate " + preferences.maxCandidate()
                            + " outside side of size " + candidateCount
            );
        }
        int unmatchedRank = preferences.size() + 1;
        int[] ranks = new int[candidateCount];
        Arrays.fill(ranks, unmatchedRank + 1);
        for (int i = 0; i < preferences.size(); i++) {
            ranks[preferences.get(i)] = i + 1;
        }
        return new PreferenceRanks(ranks, unmatchedRank);
    }

    public int rankOf(int candidate) {
        return ranks[candidate];
    }

    public int unmatchedRank() {
        return unmatchedRank;
    }

    /**
     * Whether the holder prefers this candidate to remaining unmatched.
     */
    public boolean isAcceptable(int candidate) {
        return ranks[candidate] < unmatchedRank;
    }

    /**
     * Whether candidate {@code a} is strictly preferred to candidate {@code b}.
     */
    public boolean prefers(int a, int b) {
        return ranks[a] < ranks[b];
    }

    public int candidateCount() {
        return ranks.length;
    }
}
