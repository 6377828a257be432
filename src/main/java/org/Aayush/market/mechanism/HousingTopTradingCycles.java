package org.Aayush.market.mechanism;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.market.graph.CycleResolver;
import org.Aayush.market.graph.PointerGraph;
import org.Aayush.market.graph.PointerGraphBuilder;
import org.Aayush.market.graph.TradingCycle;
import org.Aayush.market.model.DimensionMismatchException;
import org.Aayush.market.model.MarketConfigurationException;
import org.Aayush.market.model.Matching;
import org.Aayush.market.model.OneSidedMarket;
import org.Aayush.market.model.Ownership;
import org.Aayush.market.model.OwnershipIntegrityException;
import org.Aayush.market.model.ParticipantSet;
import org.Aayush.market.model.Priority;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Top trading cycles for one-sided markets (house allocation with existing tenants).
 *
 * <p>The priority order is walked exactly once. Each step runs one round: agents point at
 * their best object still available, owned objects point at their owner and unowned objects
 * point at the step's priority agent. Every cycle of that graph is committed, so one step may
 * satisfy several agents, including agents later in the priority order. Agents that never
 * trade keep their initial endowment.</p>
 *
 * <p>All capacities must be one.</p>
 */
@Slf4j
public final class HousingTopTradingCycles {
    private final RoundListener listener;

    public HousingTopTradingCycles() {
        this(RoundListener.NONE);
    }

    public HousingTopTradingCycles(RoundListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Runs the mechanism for a market without existing tenants (every object starts unowned).
     */
    public TopTradingCyclesResult match(OneSidedMarket market, Priority priority) {
        Objects.requireNonNull(market, "market");
        return match(market, priority, Ownership.empty(market.agents().size(), market.objects().size()));
    }

    /**
     * Runs the mechanism with an initial ownership relation.
     *
     * @param market one-sided market with unit capacities.
     * @param priority processing order over agents.
     * @param ownership initial ownership; at most one owner per object and one object per agent.
     * @return agent x object matching and run statistics.
     * @throws MarketConfigurationException when a capacity differs from one.
     * @throws OwnershipIntegrityException when the ownership relation is malformed.
     * @throws DimensionMismatchException when ownership or priority sizes disagree with the market.
     */
    public TopTradingCyclesResult match(OneSidedMarket market, Priority priority, Ownership ownership) {
        Objects.requireNonNull(market, "market");
        Objects.requireNonNull(priority, "priority");
        Objects.requireNonNull(ownership, "ownership");
        validate(market, priority, ownership);

        ParticipantSet agents = market.agents();
        int agentCount = agents.size();
        int objectCount = market.objects().size();

        OwnershipState ownershipState = OwnershipState.seed(ownership);
        boolean[] agentActive = new boolean[agentCount];
        boolean[] objectActive = new boolean[objectCount];
        Arrays.fill(agentActive, true);
        Arrays.fill(objectActive, true);
        int[] nextObjectRank = new int[agentCount];

        PointerGraph graph = new PointerGraph(agentCount, objectCount);
        CycleResolver resolver = new CycleResolver();
        int cyclesCommitted = 0;

        for (int step = 0; step < priority.size(); step++) {
            int round = step + 1;
            int priorAgent = priority.agentAt(step);
            graph.clear();

            for (int a = 0; a < agentCount; a++) {
                if (!agentActive[a]) {
                    continue;
                }
                OptionalInt target = PointerGraphBuilder.advance(
                        agents.preferences(a),
                        nextObjectRank,
                        a,
                        (agent, object) -> objectActive[object]
                );
                if (target.isPresent()) {
                    graph.pointAgent(a, target.getAsInt());
                } else {
                    agentActive[a] = false;
                }
            }

            for (int o = 0; o < objectCount; o++) {
                if (objectActive[o]) {
                    graph.pointObject(o, ownershipState.ownerOf(o).orElse(priorAgent));
                }
            }

            List<TradingCycle> cycles = resolver.resolve(graph);
            listener.onCyclesResolved(round, graph, cycles);
            for (TradingCycle cycle : cycles) {
                for (int i = 0; i < cycle.pairCount(); i++) {
                    int agent = cycle.agentAt(i);
                    int object = cycle.objectAt(i);
                    ownershipState.transfer(agent, object);
                    agentActive[agent] = false;
                    objectActive[object] = false;
                }
            }
            cyclesCommitted += cycles.size();
            listener.onOwnershipUpdated(round, priorAgent, ownershipState);
            log.debug("Housing TTC step {} (priority agent {}): {} cycles", round, priorAgent, cycles.size());
        }

        Matching matching = Matching.between(agents, market.objects());
        for (int a = 0; a < agentCount; a++) {
            OptionalInt possession = ownershipState.possessionOf(a);
            if (possession.isPresent()) {
                matching.record(a, possession.getAsInt());
            }
        }
        log.debug("Housing TTC finished after {} steps with {} pairs", priority.size(), matching.pairCount());
        return new TopTradingCyclesResult(matching, priority.size(), cyclesCommitted);
    }

    private static void validate(OneSidedMarket market, Priority priority, Ownership ownership) {
        if (!market.agents().allCapacitiesEqual(1) || !market.objects().allCapacitiesEqual(1)) {
            throw new MarketConfigurationException(
                    MarketConfigurationException.REASON_CAPACITY_NOT_UNIT,
                    "all agent and object capacities must be 1"
            );
        }
        for (int o = 0; o < ownership.numObjects(); o++) {
            if (ownership.ownersOf(o).size() > 1) {
                throw new OwnershipIntegrityException(
                        OwnershipIntegrityException.REASON_MULTIPLE_OWNERS,
                        "object " + o + " has " + ownership.ownersOf(o).size() + " owners"
                );
            }
        }
        for (int a = 0; a < ownership.numAgents(); a++) {
            if (ownership.possessionsOf(a).size() > 1) {
                throw new OwnershipIntegrityException(
                        OwnershipIntegrityException.REASON_MULTIPLE_POSSESSIONS,
                        "agent " + a + " owns " + ownership.possessionsOf(a).size() + " objects"
                );
            }
        }
        if (ownership.numAgents() != market.agents().size()) {
            throw new DimensionMismatchException(
                    DimensionMismatchException.REASON_OWNERSHIP_AGENTS,
                    "ownership declares " + ownership.numAgents() + " agents, market has " + market.agents().size()
            );
        }
        if (ownership.numObjects() != market.objects().size()) {
            throw new DimensionMismatchException(
                    DimensionMismatchException.REASON_OWNERSHIP_OBJECTS,
                    "ownership declares " + ownership.numObjects() + " objects, market has " + market.objects().size()
            );
        }
        if (priority.size() != market.agents().size()) {
            throw new DimensionMismatchException(
                    DimensionMismatchException.REASON_PRIORITY_SIZE,
                    "priority covers " + priority.size() + " agents, market has " + market.agents().size()
            );
        }
    }
}
