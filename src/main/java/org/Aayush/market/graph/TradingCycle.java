package org.Aayush.market.graph;

import java.util.Arrays;

/**
 * One cycle of a pointer graph, oriented to start at an agent.
 *
 * <p>{@code agents[i]} points at {@code objects[i]}, which points at {@code agents[i + 1]}
 * (wrapping around). Resolving the cycle assigns {@code objects[i]} to {@code agents[i]}.</p>
 *
 * @param agents agent ids in cycle order.
 * @param objects object ids in cycle order.
 */
public record TradingCycle(int[] agents, int[] objects) {

    public TradingCycle {
        if (agents.length != objects.length || agents.length == 0) {
            throw new IllegalArgumentException("cycle must alternate agents and objects");
        }
    }

    /**
     * Number of agent-object pairs the cycle resolves.
     */
    public int pairCount() {
        return agents.length;
    }

    public int agentAt(int index) {
        return agents[index];
    }

    public int objectAt(int index) {
        return objects[index];
    }

    @Override
    public String toString() {
        return "TradingCycle{agents=" + Arrays.toString(agents) + ", objects=" + Arrays.toString(objects) + "}";
    }
}
