package org.Aayush.market.mechanism;

import lombok.extern.slf4j.Slf4j;
import org.Aayush.market.graph.CycleResolver;
import org.Aayush.market.graph.PointerGraph;
import org.Aayush.market.graph.PointerGraphBuilder;
import org.Aayush.market.graph.TradingCycle;
import org.Aayush.market.model.AcceptabilityTable;
import org.Aayush.market.model.MarketSide;
import org.Aayush.market.model.Matching;
import org.Aayush.market.model.ParticipantSet;
import org.Aayush.market.model.TwoSidedMarket;

import java.util.List;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * Top trading cycles for two-sided markets (school choice).
 *
 * <p>The side chosen as agents receives a Pareto-efficient matching. Each round every
 * active agent points at its best object that still has a vacancy and accepts it, every
 * active object points at its best agent that still has a vacancy, and every cycle of the
 * resulting graph is committed. Rounds continue while at least one agent and one object
 * remain active.</p>
 */
@Slf4j
public final class TwoSidedTopTradingCycles {
    private final RoundListener listener;

    public TwoSidedTopTradingCycles() {
        this(RoundListener.NONE);
    }

    public TwoSidedTopTradingCycles(RoundListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Runs TTC with students as agents.
     */
    public TopTradingCyclesResult match(TwoSidedMarket market) {
        return match(market, MarketSide.STUDENTS);
    }

    /**
     * Runs TTC with the given side as agents.
     *
     * @param market two-sided market.
     * @param agentSide side whose preferences drive agent pointers.
     * @return students x schools matching and run statistics.
     */
    public TopTradingCyclesResult match(TwoSidedMarket market, MarketSide agentSide) {
        Objects.requireNonNull(market, "market");
        Objects.requireNonNull(agentSide, "agentSide");
        ParticipantSet agents = market.side(agentSide);
        ParticipantSet objects = market.opposite(agentSide);
        boolean studentsAreAgents = agentSide == MarketSide.STUDENTS;

        AcceptabilityTable acceptability = AcceptabilityTable.fromPreferences(objects, agents.size());
        TradingRoundState state = new TradingRoundState(agents, objects);
        Matching matching = Matching.between(market.students(), market.schools());
        PointerGraph graph = new PointerGraph(agents.size(), objects.size());
        CycleResolver resolver = new CycleResolver();
        PairLookup alreadyPaired = studentsAreAgents
                ? (object, agent) -> matching.isMatched(agent, object)
                : (object, agent) -> matching.isMatched(object, agent);

        int rounds = 0;
        int cyclesCommitted = 0;
        while (state.hasActiveParticipants()) {
            rounds++;
            graph.clear();
            pointAgents(agents, acceptability, state, graph);
            pointObjects(objects, state, alreadyPaired, graph);

            List<TradingCycle> cycles = resolver.resolve(graph);
            listener.onCyclesResolved(rounds, graph, cycles);
            for (TradingCycle cycle : cycles) {
                for (int i = 0; i < cycle.pairCount(); i++) {
                    int agent = cycle.agentAt(i);
                    int object = cycle.objectAt(i);
                    if (studentsAreAgents) {
                        matching.record(agent, object);
                    } else {
                        matching.record(object, agent);
                    }
                    state.commit(agent, object);
                }
            }
            cyclesCommitted += cycles.size();
            log.debug("TTC round {}: {} edges, {} cycles, {} agents / {} objects active",
                    rounds, graph.edgeCount(), cycles.size(), state.agentsRemaining(), state.objectsRemaining());
        }

        log.debug("TTC finished after {} rounds with {} pairs (agents={})", rounds, matching.pairCount(), agentSide);
        return new TopTradingCyclesResult(matching, rounds, cyclesCommitted);
    }

    private static void pointAgents(
            ParticipantSet agents,
            AcceptabilityTable acceptability,
            TradingRoundState state,
            PointerGraph graph
    ) {
        for (int a = 0; a < agents.size(); a++) {
            if (!state.isAgentActive(a)) {
                continue;
            }
            OptionalInt target = PointerGraphBuilder.advance(
                    agents.preferences(a),
                    state.nextObjectRanks(),
                    a,
                    (agent, object) -> state.isObjectActive(object) && acceptability.isAcceptable(agent, object)
            );
            if (target.isPresent()) {
                graph.pointAgent(a, target.getAsInt());
            } else {
                state.retireAgent(a);
            }
        }
    }

    private static void pointObjects(
            ParticipantSet objects,
            TradingRoundState state,
            PairLookup alreadyPaired,
            PointerGraph graph
    ) {
        for (int o = 0; o < objects.size(); o++) {
            if (!state.isObjectActive(o)) {
                continue;
            }
            OptionalInt target = PointerGraphBuilder.advance(
                    objects.preferences(o),
                    state.nextAgentRanks(),
                    o,
                    (object, agent) -> state.isAgentActive(agent) && !alreadyPaired.isPaired(object, agent)
            );
            if (target.isPresent()) {
                graph.pointObject(o, target.getAsInt());
            } else {
                state.retireObject(o);
            }
        }
    }

    @FunctionalInterface
    private interface PairLookup {
        boolean isPaired(int object, int agent);
    }
}
