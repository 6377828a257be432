package org.Aayush.market.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One market participant in external-id space.
 *
 * <p>Preferences list acceptable counterparts, most preferred first. Anything not listed
 * is unacceptable.</p>
 */
@Value
@Builder
public class ParticipantDeclaration {
    /** Client-facing participant id. */
    String externalId;
    /** Number of seats; {@code null} applies {@link MatchingDefaults#defaultCapacity()}. */
    Integer capacity;
    /** Acceptable counterparts in preference order, by external id. */
    @Singular
    List<String> preferences;
}
