package org.Aayush.market.mechanism;

import lombok.Value;
import org.Aayush.market.model.Matching;

/**
 * Outcome of a deferred acceptance run.
 */
@Value
public class DeferredAcceptanceResult {
    /** Stable matching oriented students x schools. */
    Matching matching;
    /** Total proposals made; never exceeds the sum of proposer list lengths. */
    long proposals;
    /** Number of passes over the proposer side. */
    int passes;
}
