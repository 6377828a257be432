package org.Aayush.market.model;

import java.util.Arrays;

/**
 * Fixed processing order over agents used by one-sided top trading cycles.
 * Every agent id {@code 0..size-1} appears exactly once.
 */
public final class Priority {
    private final int[] order;

    private Priority(int[] order) {
        this.order = order;
    }

    /**
     * Creates a priority from an explicit order of 0-based agent ids.
     *
     * @throws IllegalArgumentException when the order is not a permutation.
     */
    public static Priority of(int... order) {
        int[] copy = order.clone();
        boolean[] seen = new boolean[copy.length];
        for (int agent : copy) {
            if (agent < 0 || agent >= copy.length) {
                throw new IllegalArgumentException("priority entry out of range: " + agent);
            }
            if (seen[agent]) {
                throw new IllegalArgumentException("agent appears twice in priority: " + agent);
            }
            seen[agent] = true;
        }
        return new Priority(copy);
    }

    /**
     * Identity order {@code 0, 1, ..., size-1}.
     */
    public static Priority identity(int size) {
        int[] order = new int[size];
        for (int i = 0; i < size; i++) {
            order[i] = i;
        }
        return new Priority(order);
    }

    public int size() {
        return order.length;
    }

    /**
     * Agent processed at the given step.
     */
    public int agentAt(int step) {
        return order[step];
    }

    public int[] toIntArray() {
        return order.clone();
    }

    @Override
    public String toString() {
        return "Priority" + Arrays.toString(order);
    }
}
