package org.Aayush.market.mechanism;

import org.Aayush.market.graph.PointerGraph;
import org.Aayush.market.graph.TradingCycle;

import java.util.List;

/**
 * Observer of trading-cycle rounds.
 *
 * <p>Callbacks run synchronously on the mechanism thread. Arguments are live views of
 * mechanism state and are only valid for the duration of the callback.</p>
 */
public interface RoundListener {
    /** Listener that ignores every callback. */
    RoundListener NONE = new RoundListener() {
    };

    /**
     * Called once per round after cycles are found and before any of them is committed.
     *
     * @param round 1-based round number.
     * @param graph the round's pointer graph.
     * @param cycles cycles about to be committed.
     */
    default void onCyclesResolved(int round, PointerGraph graph, List<TradingCycle> cycles) {
    }

    /**
     * Called by the one-sided mechanism after a round's ownership transfers are applied.
     *
     * @param round 1-based round number.
     * @param priorAgent agent whose priority step the round belongs to.
     * @param ownership current ownership state.
     */
    default void onOwnershipUpdated(int round, int priorAgent, OwnershipState ownership) {
    }
}
