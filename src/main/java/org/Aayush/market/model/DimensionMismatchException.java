package org.Aayush.market.model;

/**
 * Thrown when an auxiliary structure's declared size disagrees with the market it is
 * used with, or when a preference entry points outside the opposite side.
 */
public final class DimensionMismatchException extends MarketConfigurationException {
    public static final String REASON_OWNERSHIP_AGENTS = "M0_OWNERSHIP_AGENT_COUNT_MISMATCH";
    public static final String REASON_OWNERSHIP_OBJECTS = "M0_OWNERSHIP_OBJECT_COUNT_MISMATCH";
    public static final String REASON_PRIORITY_SIZE = "M0_PRIORITY_SIZE_MISMATCH";
    public static final String REASON_PREFERENCE_OUT_OF_RANGE = "M0_PREFERENCE_OUT_OF_RANGE";

    public DimensionMismatchException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
