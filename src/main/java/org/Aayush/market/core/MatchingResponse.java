package org.Aayush.market.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Client-facing allocation result in external-id space.
 *
 * <p>Assignments are keyed by student (two-sided) or tenant (housing) id, in declaration
 * order; every declared agent has an entry, empty when unmatched.</p>
 */
@Value
@Builder
public class MatchingResponse {
    /** Mechanism that produced the allocation. */
    MechanismType mechanism;
    /** Agent id to assigned object ids. */
    @Singular
    Map<String, List<String>> assignments;
    /** Agents left without any assignment. */
    @Singular
    List<String> unmatchedAgents;
    /** Objects left without any assignment. */
    @Singular
    List<String> unmatchedObjects;
    /** TTC rounds or DA passes executed. */
    int rounds;
    /** DA proposals made; zero for TTC. */
    long proposals;
}
