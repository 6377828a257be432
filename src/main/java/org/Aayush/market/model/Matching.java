package org.Aayush.market.model;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

import java.util.Arrays;
import java.util.OptionalInt;

/**
 * Capacity-bounded agent/object assignment relation.
 *
 * <p>Pairs are committed monotonically: once recorded, a pair is never revised.
 * Every commit checks that neither party exceeds its capacity. For two-sided markets
 * agents are students and objects are schools, whichever side played which role.</p>
 */
public final class Matching {
    private final int[] agentCapacities;
    private final int[] objectCapacities;
    private final IntList[] objectsByAgent;
    private final IntList[] agentsByObject;
    private int pairCount;

    /**
     * Creates an empty matching bounded by the given capacities.
     */
    public Matching(int[] agentCapacities, int[] objectCapacities) {
        this.agentCapacities = agentCapacities.clone();
        this.objectCapacities = objectCapacities.clone();
        this.objectsByAgent = new IntList[agentCapacities.length];
        this.agentsByObject = new IntList[objectCapacities.length];
        for (int a = 0; a < objectsByAgent.length; a++) {
            objectsByAgent[a] = new IntArrayList(Math.min(agentCapacities[a], 4));
        }
        for (int o = 0; o < agentsByObject.length; o++) {
            agentsByObject[o] = new IntArrayList(Math.min(objectCapacities[o], 4));
        }
    }

    /**
     * Creates an empty matching bounded by the capacities of two participant sets.
     */
    public static Matching between(ParticipantSet agents, ParticipantSet objects) {
        return new Matching(agents.capacities(), objects.capacities());
    }

    /**
     * Commits one agent-object pair.
     *
     * @throws IllegalStateException when the pair already exists or a capacity would be exceeded.
     */
    public void record(int agent, int object) {
        if (objectsByAgent[agent].contains(object)) {
            throw new IllegalStateException("pair already recorded: agent " + agent + ", object " + object);
        }
        if (objectsByAgent[agent].size() >= agentCapacities[agent]) {
            throw new IllegalStateException("agent " + agent + " is at capacity " + agentCapacities[agent]);
        }
        if (agentsByObject[object].size() >= objectCapacities[object]) {
            throw new IllegalStateException("object " + object + " is at capacity " + objectCapacities[object]);
        }
        objectsByAgent[agent].add(object);
        agentsByObject[object].add(agent);
        pairCount++;
    }

    public int agentCount() {
        return objectsByAgent.length;
    }

    public int objectCount() {
        return agentsByObject.length;
    }

    /**
     * Total number of committed pairs.
     */
    public int pairCount() {
        return pairCount;
    }

    public boolean isMatched(int agent, int object) {
        return objectsByAgent[agent].contains(object);
    }

    /**
     * Objects assigned to an agent, in commit order.
     */
    public IntList objectsOf(int agent) {
        return IntLists.unmodifiable(objectsByAgent[agent]);
    }

    /**
     * Agents assigned to an object, in commit order.
     */
    public IntList agentsOf(int object) {
        return IntLists.unmodifiable(agentsByObject[object]);
    }

    /**
     * First object assigned to the agent, or empty when unmatched.
     */
    public OptionalInt objectOf(int agent) {
        IntList objects = objectsByAgent[agent];
        return objects.isEmpty() ? OptionalInt.empty() : OptionalInt.of(objects.getInt(0));
    }

    /**
     * First agent assigned to the object, or empty when unmatched.
     */
    public OptionalInt agentOf(int object) {
        IntList agents = agentsByObject[object];
        return agents.isEmpty() ? OptionalInt.empty() : OptionalInt.of(agents.getInt(0));
    }

    public int agentCapacity(int agent) {
        return agentCapacities[agent];
    }

    public int objectCapacity(int object) {
        return objectCapacities[object];
    }

    /**
     * Returns the relation with agent and object roles swapped.
     */
    public Matching transpose() {
        Matching transposed = new Matching(objectCapacities, agentCapacities);
        for (int a = 0; a < objectsByAgent.length; a++) {
            IntList objects = objectsByAgent[a];
            for (int i = 0; i < objects.size(); i++) {
                transposed.record(objects.getInt(i), a);
            }
        }
        return transposed;
    }

    /**
     * Exports the relation as an {@code object x agent} boolean matrix.
     */
    public boolean[][] toObjectAgentMatrix() {
        boolean[][] matrix = new boolean[agentsByObject.length][objectsByAgent.length];
        for (int o = 0; o < agentsByObject.length; o++) {
            IntList agents = agentsByObject[o];
            for (int i = 0; i < agents.size(); i++) {
                matrix[o][agents.getInt(i)] = true;
            }
        }
        return matrix;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Matching)) {
            return false;
        }
        Matching other = (Matching) o;
        return Arrays.equals(agentCapacities, other.agentCapacities)
                && Arrays.equals(objectCapacities, other.objectCapacities)
                && Arrays.deepEquals(toObjectAgentMatrix(), other.toObjectAgentMatrix());
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(agentCapacities) + Arrays.deepHashCode(toObjectAgentMatrix());
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Matching{");
        boolean first = true;
        for (int a = 0; a < objectsByAgent.length; a++) {
            if (objectsByAgent[a].isEmpty()) {
                continue;
            }
            if (!first) {
                sb.append(", ");
            }
            sb.append(a).append("->").append(objectsByAgent[a]);
            first = false;
        }
        return sb.append('}').toString();
    }
}
