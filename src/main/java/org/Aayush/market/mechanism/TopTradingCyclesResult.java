package org.Aayush.market.mechanism;

import lombok.Value;
import org.Aayush.market.model.Matching;

/**
 * Outcome of a top-trading-cycles run.
 */
@Value
public class TopTradingCyclesResult {
    /** Final matching; students x schools for two-sided markets. */
    Matching matching;
    /** Number of rounds executed. */
    int rounds;
    /** Number of cycles committed across all rounds. */
    int cyclesCommitted;
}
