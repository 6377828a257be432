package org.Aayush.market.graph;

import java.util.Arrays;
import java.util.OptionalInt;

/**
 * Functional directed graph over agent and object nodes used by one trading round.
 *
 * <p>Node ids {@code 0..agentCount-1} are agents and {@code agentCount..agentCount+objectCount-1}
 * are objects. Every node has at most one outgoing edge. Edges only run agent to object or
 * object to agent; a node that exited (self-pointing) has no edge.</p>
 */
public final class PointerGraph {
    static final int NO_SUCCESSOR = -1;

    private final int agentCount;
    private final int objectCount;
    private final int[] successors;
    private int edgeCount;

    public PointerGraph(int agentCount, int objectCount) {
        if (agentCount < 0 || objectCount < 0) {
            throw new IllegalArgumentException("node counts must be >= 0");
        }
        this.agentCount = agentCount;
        this.objectCount = objectCount;
        this.successors = new int[agentCount + objectCount];
        Arrays.fill(successors, NO_SUCCESSOR);
    }

    /**
     * Drops every edge so the graph can be rebuilt for the next round.
     */
    public void clear() {
        Arrays.fill(successors, NO_SUCCESSOR);
        edgeCount = 0;
    }

    /**
     * Records the edge agent to object.
     */
    public void pointAgent(int agent, int object) {
        checkAgent(agent);
        checkObject(object);
        setSuccessor(agent, objectNode(object));
    }

    /**
     * Records the edge object to agent.
     */
    public void pointObject(int object, int agent) {
        checkObject(object);
        checkAgent(agent);
        setSuccessor(objectNode(object), agent);
    }

    /**
     * Object the agent points at, or empty when it has no edge this round.
     */
    public OptionalInt agentTarget(int agent) {
        checkAgent(agent);
        int next = successors[agent];
        return next == NO_SUCCESSOR ? OptionalInt.empty() : OptionalInt.of(next - agentCount);
    }

    /**
     * Agent the object points at, or empty when it has no edge this round.
     */
    public OptionalInt objectTarget(int object) {
        checkObject(object);
        int next = successors[objectNode(object)];
        return next == NO_SUCCESSOR ? OptionalInt.empty() : OptionalInt.of(next);
    }

    public int agentCount() {
        return agentCount;
    }

    public int objectCount() {
        return objectCount;
    }

    public int nodeCount() {
        return successors.length;
    }

    public int edgeCount() {
        return edgeCount;
    }

    int successor(int node) {
        return successors[node];
    }

    boolean isAgentNode(int node) {
        return node < agentCount;
    }

    int objectNode(int object) {
        return agentCount + object;
    }

    int objectOfNode(int node) {
        return node - agentCount;
    }

    private void setSuccessor(int node, int next) {
        if (successors[node] != NO_SUCCESSOR) {
            throw new IllegalStateException("node " + node + " already has an outgoing edge");
        }
        successors[node] = next;
        edgeCount++;
    }

    private void checkAgent(int agent) {
        if (agent < 0 || agent >= agentCount) {
            throw new IndexOutOfBoundsException("agent out of bounds: " + agent);
        }
    }

    private void checkObject(int object) {
        if (object < 0 || object >= objectCount) {
            throw new IndexOutOfBoundsException("object out of bounds: " + object);
        }
    }
}
