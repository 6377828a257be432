package org.Aayush.market.model;

import lombok.Getter;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Thrown when market inputs violate a mechanism precondition.
 *
 * <p>Raised eagerly during input validation, before any mechanism state is built.
 * Messages are prefixed with the deterministic reason code.</p>
 */
@Getter
@Accessors(fluent = true)
public class MarketConfigurationException extends RuntimeException {
    public static final String REASON_CAPACITY_NOT_UNIT = "M0_CAPACITY_NOT_UNIT";
    public static final String REASON_PROPOSER_CAPACITY_EXCEEDED = "M0_PROPOSER_CAPACITY_EXCEEDED";

    private final String reasonCode;

    /**
     * Creates a reason-coded configuration failure.
     *
     * @param reasonCode deterministic reason code.
     * @param message descriptive message.
     */
    public MarketConfigurationException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = requireReasonCode(reasonCode);
    }

    private static String formatMessage(String reasonCode, String message) {
        return "[" + requireReasonCode(reasonCode) + "] " + Objects.requireNonNull(message, "message");
    }

    private static String requireReasonCode(String reasonCode) {
        String code = Objects.requireNonNull(reasonCode, "reasonCode");
        if (code.isBlank()) {
            throw new IllegalArgumentException("reasonCode must be non-blank");
        }
        return code;
    }
}
