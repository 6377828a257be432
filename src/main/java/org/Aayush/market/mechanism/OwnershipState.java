package org.Aayush.market.mechanism;

import org.Aayush.market.model.Ownership;

import java.util.Arrays;
import java.util.OptionalInt;

/**
 * Current possession relation of a one-sided trading run.
 *
 * <p>Each object has at most one owner and each agent possesses at most one object at
 * every point, including between the individual transfers of one cycle.</p>
 */
public final class OwnershipState {
    private static final int NONE = -1;

    private final int[] ownerOfObject;
    private final int[] possessionOfAgent;

    private OwnershipState(int numAgents, int numObjects) {
        this.ownerOfObject = new int[numObjects];
        this.possessionOfAgent = new int[numAgents];
        Arrays.fill(ownerOfObject, NONE);
        Arrays.fill(possessionOfAgent, NONE);
    }

    /**
     * Seeds the state from a validated initial ownership relation.
     */
    static OwnershipState seed(Ownership ownership) {
        OwnershipState state = new OwnershipState(ownership.numAgents(), ownership.numObjects());
        for (int o = 0; o < ownership.numObjects(); o++) {
            if (!ownership.ownersOf(o).isEmpty()) {
                int owner = ownership.ownersOf(o).getInt(0);
                state.ownerOfObject[o] = owner;
                state.possessionOfAgent[owner] = o;
            }
        }
        return state;
    }

    /**
     * Current owner of an object, or empty when unowned.
     */
    public OptionalInt ownerOf(int object) {
        int owner = ownerOfObject[object];
        return owner == NONE ? OptionalInt.empty() : OptionalInt.of(owner);
    }

    /**
     * Object currently possessed by an agent, or empty.
     */
    public OptionalInt possessionOf(int agent) {
        int object = possessionOfAgent[agent];
        return object == NONE ? OptionalInt.empty() : OptionalInt.of(object);
    }

    public int agentCount() {
        return possessionOfAgent.length;
    }

    public int objectCount() {
        return ownerOfObject.length;
    }

    /**
     * Hands {@code object} to {@code agent}. The agent's previous possession becomes unowned
     * and the object's previous owner loses it in the same step.
     */
    void transfer(int agent, int object) {
        int previousPossession = possessionOfAgent[agent];
        if (previousPossession != NONE && ownerOfObject[previousPossession] == agent) {
            ownerOfObject[previousPossession] = NONE;
        }
        int previousOwner = ownerOfObject[object];
        if (previousOwner != NONE && previousOwner != agent) {
            possessionOfAgent[previousOwner] = NONE;
        }
        possessionOfAgent[agent] = object;
        ownerOfObject[object] = agent;
    }
}
