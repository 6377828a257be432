package org.Aayush.market.graph;

import it.unimi.dsi.fastutil.ints.IntArrayList;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Linear-time cycle finder for {@link PointerGraph}.
 *
 * <p>Out-degree is at most one, so every cycle is simple and vertex-disjoint from the
 * others. Each unvisited node starts a walk that stamps nodes with the walk id; reaching a
 * node stamped by the same walk closes a cycle. Nodes on tails that run into an exited
 * node or an earlier walk are never reported.</p>
 *
 * <p>Instances reuse their stamp buffer and are not thread-safe.</p>
 */
public final class CycleResolver {
    private int[] stamps = new int[0];

    /**
     * Finds all cycles, each rotated to start at an agent node.
     * Cycles are returned in the order their walks were started (ascending node id).
     *
     * @param graph pointer graph of the current round.
     * @return vertex-disjoint trading cycles.
     */
    public List<TradingCycle> resolve(PointerGraph graph) {
        int nodeCount = graph.nodeCount();
        if (stamps.length < nodeCount) {
            stamps = new int[nodeCount];
        } else {
            Arrays.fill(stamps, 0, nodeCount, 0);
        }

        List<TradingCycle> cycles = new ArrayList<>();
        int walk = 0;
        for (int start = 0; start < nodeCount; start++) {
            if (stamps[start] != 0) {
                continue;
            }
            walk++;
            int node = start;
            while (node != PointerGraph.NO_SUCCESSOR && stamps[node] == 0) {
                stamps[node] = walk;
                node = graph.successor(node);
            }
            if (node != PointerGraph.NO_SUCCESSOR && stamps[node] == walk) {
                cycles.add(extract(graph, node));
            }
        }
        return cycles;
    }

    private static TradingCycle extract(PointerGraph graph, int entry) {
        int first = graph.isAgentNode(entry) ? entry : graph.successor(entry);
        IntArrayList agents = new IntArrayList();
        IntArrayList objects = new IntArrayList();
        int node = first;
        do {
            int objectNode = graph.successor(node);
            if (!graph.isAgentNode(node) || graph.isAgentNode(objectNode)) {
                throw new IllegalStateException("pointer graph edges must alternate agents and objects");
            }
            agents.add(node);
            objects.add(graph.objectOfNode(objectNode));
            node = graph.successor(objectNode);
        } while (node != first);
        return new TradingCycle(agents.toIntArray(), objects.toIntArray());
    }
}
