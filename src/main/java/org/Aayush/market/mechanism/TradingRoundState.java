package org.Aayush.market.mechanism;

import org.Aayush.market.model.ParticipantSet;

/**
 * Mutable state threaded through the rounds of two-sided top trading cycles.
 *
 * <p>Vacancies only decrease and preference pointers only advance. A participant is
 * active while its vacancy is positive; retiring it zeroes the vacancy.</p>
 */
public final class TradingRoundState {
    private final int[] agentVacancy;
    private final int[] objectVacancy;
    private final int[] nextObjectRank;
    private final int[] nextAgentRank;
    private int agentsRemaining;
    private int objectsRemaining;

    TradingRoundState(ParticipantSet agents, ParticipantSet objects) {
        this.agentVacancy = agents.capacities();
        this.objectVacancy = objects.capacities();
        this.nextObjectRank = new int[agents.size()];
        this.nextAgentRank = new int[objects.size()];
        this.agentsRemaining = countPositive(agentVacancy);
        this.objectsRemaining = countPositive(objectVacancy);
    }

    /**
     * Whether another round can still pair someone.
     */
    public boolean hasActiveParticipants() {
        return agentsRemaining > 0 && objectsRemaining > 0;
    }

    public boolean isAgentActive(int agent) {
        return agentVacancy[agent] > 0;
    }

    public boolean isObjectActive(int object) {
        return objectVacancy[object] > 0;
    }

    public int agentVacancy(int agent) {
        return agentVacancy[agent];
    }

    public int objectVacancy(int object) {
        return objectVacancy[object];
    }

    public int nextObjectRank(int agent) {
        return nextObjectRank[agent];
    }

    public int nextAgentRank(int object) {
        return nextAgentRank[object];
    }

    public int agentsRemaining() {
        return agentsRemaining;
    }

    public int objectsRemaining() {
        return objectsRemaining;
    }

    int[] nextObjectRanks() {
        return nextObjectRank;
    }

    int[] nextAgentRanks() {
        return nextAgentRank;
    }

    /**
     * Removes an agent whose preferences are exhausted.
     */
    void retireAgent(int agent) {
        if (agentVacancy[agent] > 0) {
            agentVacancy[agent] = 0;
            agentsRemaining--;
        }
    }

    /**
     * Removes an object whose preferences are exhausted.
     */
    void retireObject(int object) {
        if (objectVacancy[object] > 0) {
            objectVacancy[object] = 0;
            objectsRemaining--;
        }
    }

    /**
     * Applies one committed pair: both vacancies drop by one and the agent's pointer moves
     * past the object it just received. The object was pointing at the next agent of the
     * cycle, so its pointer stays put; agents it already holds are skipped when it next points.
     */
    void commit(int agent, int object) {
        if (agentVacancy[agent] <= 0 || objectVacancy[object] <= 0) {
            throw new IllegalStateException("commit on inactive pair: agent " + agent + ", object " + object);
        }
        nextObjectRank[agent]++;
        if (--agentVacancy[agent] == 0) {
            agentsRemaining--;
        }
        if (--objectVacancy[object] == 0) {
            objectsRemaining--;
        }
    }

    private static int countPositive(int[] values) {
        int count = 0;
        for (int value : values) {
            if (value > 0) {
                count++;
            }
        }
        return count;
    }
}
