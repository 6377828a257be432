package org.Aayush.market.model;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import it.unimi.dsi.fastutil.ints.IntList;
import it.unimi.dsi.fastutil.ints.IntLists;

/**
 * Initial agent-object possession relation for one-sided markets.
 *
 * <p>The container only checks that ids fit its declared dimensions. Degree constraints
 * (at most one owner per object, one object per agent) are validated by the mechanism
 * that consumes it, so malformed relations surface as {@link OwnershipIntegrityException}
 * at the mechanism boundary.</p>
 */
public final class Ownership {
    private final int numAgents;
    private final int numObjects;
    private final IntList[] ownersByObject;
    private final IntList[] objectsByAgent;

    private Ownership(int numAgents, int numObjects) {
        if (numAgents < 0 || numObjects < 0) {
            throw new IllegalArgumentException("ownership dimensions must be >= 0");
        }
        this.numAgents = numAgents;
        this.numObjects = numObjects;
        this.ownersByObject = new IntList[numObjects];
        this.objectsByAgent = new IntList[numAgents];
        for (int o = 0; o < numObjects; o++) {
            ownersByObject[o] = new IntArrayList(1);
        }
        for (int a = 0; a < numAgents; a++) {
            objectsByAgent[a] = new IntArrayList(1);
        }
    }

    /**
     * Relation in which no object has an owner.
     */
    public static Ownership empty(int numAgents, int numObjects) {
        return new Ownership(numAgents, numObjects);
    }

    /**
     * Builds the relation from an {@code agent x object} boolean matrix.
     */
    public static Ownership fromMatrix(int numAgents, int numObjects, boolean[][] agentByObject) {
        if (agentByObject.length != numAgents) {
            throw new IllegalArgumentException("matrix has " + agentByObject.length + " rows, expected " + numAgents);
        }
        Builder builder = builder(numAgents, numObjects);
        for (int a = 0; a < numAgents; a++) {
            if (agentByObject[a].length != numObjects) {
                throw new IllegalArgumentException("matrix row " + a + " has " + agentByObject[a].length
                        + " columns, expected " + numObjects);
            }
            for (int o = 0; o < numObjects; o++) {
                if (agentByObject[a][o]) {
                    builder.own(a, o);
                }
            }
        }
        return builder.build();
    }

    public static Builder builder(int numAgents, int numObjects) {
        return new Builder(numAgents, numObjects);
    }

    public int numAgents() {
        return numAgents;
    }

    public int numObjects() {
        return numObjects;
    }

    /**
     * Declared owners of an object, in insertion order.
     */
    public IntList ownersOf(int object) {
        return IntLists.unmodifiable(ownersByObject[object]);
    }

    /**
     * Objects declared as owned by an agent, in insertion order.
     */
    public IntList possessionsOf(int agent) {
        return IntLists.unmodifiable(objectsByAgent[agent]);
    }

    /**
     * Accumulates agent-object ownership pairs.
     */
    public static final class Builder {
        private final Ownership ownership;
        private boolean built;

        private Builder(int numAgents, int numObjects) {
            this.ownership = new Ownership(numAgents, numObjects);
        }

        /**
         * Declares that {@code agent} owns {@code object}. Repeated pairs are ignored.
         */
        public Builder own(int agent, int object) {
            if (built) {
                throw new IllegalStateException("builder already consumed");
            }
            if (agent < 0 || agent >= ownership.numAgents) {
                throw new IllegalArgumentException("agent out of range: " + agent);
            }
            if (object < 0 || object >= ownership.numObjects) {
                throw new IllegalArgumentException("object out of range: " + object);
            }
            if (!ownership.ownersByObject[object].contains(agent)) {
                ownership.ownersByObject[object].add(agent);
                ownership.objectsByAgent[agent].add(object);
            }
            return this;
        }

        public Ownership build() {
            built = true;
            return ownership;
        }
    }
}
