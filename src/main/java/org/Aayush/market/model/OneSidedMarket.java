package org.Aayush.market.model;

import java.util.List;
import java.util.Objects;

/**
 * One-sided market: agents rank objects, objects hold no preferences.
 */
public final class OneSidedMarket {
    private final ParticipantSet agents;
    private final ParticipantSet objects;

    /**
     * @throws DimensionMismatchException when an agent ranks a missing object.
     */
    public OneSidedMarket(ParticipantSet agents, ParticipantSet objects) {
        this.agents = Objects.requireNonNull(agents, "agents");
        this.objects = Objects.requireNonNull(objects, "objects");
        agents.requirePreferencesWithin(objects.size(), "agent");
    }

    /**
     * Creates a unit-capacity market from agent preference lists over {@code objectCount} objects.
     */
    public static OneSidedMarket unitMarket(List<PreferenceList> agentPreferences, int objectCount) {
        return new OneSidedMarket(ParticipantSet.withUnitCapacity(agentPreferences), ParticipantSet.units(objectCount));
    }

    public ParticipantSet agents() {
        return agents;
    }

    public ParticipantSet objects() {
        return objects;
    }
}
