package org.Aayush.market.model;

/**
 * Thrown when an initial ownership relation gives an object more than one owner
 * or an agent more than one object.
 */
public final class OwnershipIntegrityException extends MarketConfigurationException {
    public static final String REASON_MULTIPLE_OWNERS = "M0_OBJECT_HAS_MULTIPLE_OWNERS";
    public static final String REASON_MULTIPLE_POSSESSIONS = "M0_AGENT_OWNS_MULTIPLE_OBJECTS";

    public OwnershipIntegrityException(String reasonCode, String message) {
        super(reasonCode, message);
    }
}
