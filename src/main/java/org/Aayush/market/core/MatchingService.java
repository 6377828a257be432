package org.Aayush.market.core;

/**
 * Public allocation service contract.
 *
 * <p>Implementations validate requests eagerly and throw reason-coded runtime exceptions
 * for contract failures.</p>
 */
public interface MatchingService {
    /**
     * Executes one two-sided matching request.
     *
     * @param request school choice request.
     * @return allocation keyed by student id.
     */
    MatchingResponse matchTwoSided(TwoSidedMatchingRequest request);

    /**
     * Executes one house allocation request.
     *
     * @param request housing request.
     * @return allocation keyed by tenant id.
     */
    MatchingResponse allocateHousing(HousingAllocationRequest request);
}
