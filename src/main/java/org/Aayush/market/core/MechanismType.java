package org.Aayush.market.core;

/**
 * Allocation mechanism selector used by {@link MatchingCore}.
 */
public enum MechanismType {
    DEFERRED_ACCEPTANCE,
    TOP_TRADING_CYCLES
}
