package org.Aayush.market.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.Aayush.market.model.MarketSide;

import java.util.List;

/**
 * Client-facing two-sided (school choice) matching request.
 *
 * <p>Participants are declared in external-id space; declaration order fixes internal ids
 * and therefore the deterministic processing order.</p>
 */
@Value
@Builder
public class TwoSidedMatchingRequest {
    /** Student side declarations. */
    @Singular
    List<ParticipantDeclaration> students;
    /** School side declarations. */
    @Singular
    List<ParticipantDeclaration> schools;
    /** Mechanism to run. */
    MechanismType mechanism;
    /** Proposing side (DA) or agent side (TTC); {@code null} applies the configured default. */
    MarketSide favoredSide;
}
