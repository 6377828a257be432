package org.Aayush.market.model;

import java.util.Objects;

/**
 * Two-sided market where both sides hold preferences over each other
 * (students over schools, schools over students).
 */
public final class TwoSidedMarket {
    private final ParticipantSet students;
    private final ParticipantSet schools;

    /**
     * Creates a market after checking that every preference id lies inside the opposite side.
     *
     * @throws DimensionMismatchException when a preference references a missing member.
     */
    public TwoSidedMarket(ParticipantSet students, ParticipantSet schools) {
        this.students = Objects.requireNonNull(students, "students");
        this.schools = Objects.requireNonNull(schools, "schools");
        students.requirePreferencesWithin(schools.size(), "student");
        schools.requirePreferencesWithin(students.size(), "school");
    }

    public ParticipantSet students() {
        return students;
    }

    public ParticipantSet schools() {
        return schools;
    }

    /**
     * Returns the participant set playing the given side.
     */
    public ParticipantSet side(MarketSide side) {
        return side == MarketSide.STUDENTS ? students : schools;
    }

    /**
     * Returns the participant set opposite the given side.
     */
    public ParticipantSet opposite(MarketSide side) {
        return side == MarketSide.STUDENTS ? schools : students;
    }
}
