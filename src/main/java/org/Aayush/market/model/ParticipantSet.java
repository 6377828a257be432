package org.Aayush.market.model;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One side of a matching market: its members' capacities and preference lists.
 *
 * <p>Members are identified by dense 0-based ids. Instances are immutable; mechanisms
 * copy capacities into their own round state before mutating them.</p>
 */
public final class ParticipantSet {
    private final int[] capacities;
    private final List<PreferenceList> preferences;

    private ParticipantSet(int[] capacities, List<PreferenceList> preferences) {
        this.capacities = capacities;
        this.preferences = preferences;
    }

    /**
     * Creates a side with explicit capacities and preference lists.
     *
     * @param capacities per-member capacity, each {@code >= 0}.
     * @param preferences per-member preference list, same length as capacities.
     * @return immutable participant set.
     */
    public static ParticipantSet of(int[] capacities, List<PreferenceList> preferences) {
        Objects.requireNonNull(capacities, "capacities");
        Objects.requireNonNull(preferences, "preferences");
        if (capacities.length != preferences.size()) {
            throw new IllegalArgumentException(
                    "capacities (" + capacities.length + ") and preferences (" + preferences.size()
                            + ") must have the same length"
            );
        }
        for (int i = 0; i < capacities.length; i++) {
            if (capacities[i] < 0) {
                throw new IllegalArgumentException("capacity of member " + i + " must be >= 0");
            }
        }
        List<PreferenceList> copy = new ArrayList<>(preferences.size());
        for (PreferenceList list : preferences) {
            copy.add(Objects.requireNonNull(list, "preference list"));
        }
        return new ParticipantSet(capacities.clone(), Collections.unmodifiableList(copy));
    }

    /**
     * Creates a side in which every member has capacity one.
     */
    public static ParticipantSet withUnitCapacity(List<PreferenceList> preferences) {
        int[] capacities = new int[preferences.size()];
        Arrays.fill(capacities, 1);
        return of(capacities, preferences);
    }

    /**
     * Creates a side whose members hold no preferences (objects of a one-sided market).
     */
    public static ParticipantSet withoutPreferences(int[] capacities) {
        return of(capacities, Collections.nCopies(capacities.length, PreferenceList.empty()));
    }

    /**
     * Creates a preference-free side of unit-capacity members.
     */
    public static ParticipantSet units(int size) {
        int[] capacities = new int[size];
        Arrays.fill(capacities, 1);
        return withoutPreferences(capacities);
    }

    public int size() {
        return capacities.length;
    }

    public int capacity(int member) {
        return capacities[member];
    }

    /**
     * Returns a defensive copy of all capacities.
     */
    public int[] capacities() {
        return capacities.clone();
    }

    public PreferenceList preferences(int member) {
        return preferences.get(member);
    }

    public List<PreferenceList> preferences() {
        return preferences;
    }

    /**
     * Whether every member has exactly the given capacity.
     */
    public boolean allCapacitiesEqual(int capacity) {
        for (int value : capacities) {
            if (value != capacity) {
                return false;
            }
        }
        return true;
    }

    /**
     * Sum of all preference-list lengths.
     */
    public long totalPreferenceLength() {
        long total = 0;
        for (PreferenceList list : preferences) {
            total += list.size();
        }
        return total;
    }

    /**
     * Indexes every member's preference list against a candidate side.
     */
    public PreferenceRanks[] rankAll(int candidateCount) {
        PreferenceRanks[] ranks = new PreferenceRanks[size()];
        for (int i = 0; i < ranks.length; i++) {
            ranks[i] = PreferenceRanks.index(preferences.get(i), candidateCount);
        }
        return ranks;
    }

    void requirePreferencesWithin(int candidateCount, String sideName) {
        for (int i = 0; i < preferences.size(); i++) {
            int max = preferences.get(i).maxCandidate();
            if (max >= candidateCount) {
                throw new DimensionMismatchException(
                        DimensionMismatchException.REASON_PREFERENCE_OUT_OF_RANGE,
                        sideName + " " + i + " ranks candidate " + max
                                + " but the opposite side has only " + candidateCount + " members"
                );
            }
        }
    }
}
