package org.Aayush.market.core;

import it.unimi.dsi.fastutil.ints.IntList;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.core.id.IDMapper;
import org.Aayush.market.mechanism.DeferredAcceptance;
import org.Aayush.market.mechanism.DeferredAcceptanceResult;
import org.Aayush.market.mechanism.HousingTopTradingCycles;
import org.Aayush.market.mechanism.RoundListener;
import org.Aayush.market.mechanism.TopTradingCyclesResult;
import org.Aayush.market.mechanism.TwoSidedTopTradingCycles;
import org.Aayush.market.model.MarketConfigurationException;
import org.Aayush.market.model.MarketSide;
import org.Aayush.market.model.Matching;
import org.Aayush.market.model.OneSidedMarket;
import org.Aayush.market.model.Ownership;
import org.Aayush.market.model.ParticipantSet;
import org.Aayush.market.model.PreferenceList;
import org.Aayush.market.model.Priority;
import org.Aayush.market.model.TwoSidedMarket;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Main allocation entry point in external-id space.
 *
 * <p>Execution flow:</p>
 * <ul>
 * <li>Validate required request fields.</li>
 * <li>Map declared external ids to dense internal ids in declaration order.</li>
 * <li>Translate preferences, capacities, endowments and priority into market model types.</li>
 * <li>Run the selected mechanism.</li>
 * <li>Wrap model configuration failures into {@link MatchingCoreException} with stable reason codes.</li>
 * <li>Map the internal matching back to external ids.</li>
 * </ul>
 *
 * <p>Holds no per-request state and is safe to share across threads, provided the
 * configured {@link RoundListener} is.</p>
 */
@Slf4j
public final class MatchingCore implements MatchingService {
    public static final String REASON_REQUEST_REQUIRED = "M1_REQUEST_REQUIRED";
    public static final String REASON_MECHANISM_REQUIRED = "M1_MECHANISM_REQUIRED";
    public static final String REASON_DECLARATION_REQUIRED = "M1_DECLARATION_REQUIRED";
    public static final String REASON_INVALID_EXTERNAL_ID = "M1_INVALID_EXTERNAL_ID";
    public static final String REASON_UNKNOWN_EXTERNAL_ID = "M1_UNKNOWN_EXTERNAL_ID";
    public static final String REASON_INVALID_CAPACITY = "M1_INVALID_CAPACITY";
    public static final String REASON_INVALID_PREFERENCES = "M1_INVALID_PREFERENCES";
    public static final String REASON_INVALID_PRIORITY = "M1_INVALID_PRIORITY";
    public static final String REASON_MARKET_CONFIGURATION_INVALID = "M1_MARKET_CONFIGURATION_INVALID";

    private final MatchingDefaults defaults;
    private final DeferredAcceptance deferredAcceptance;
    private final TwoSidedTopTradingCycles twoSidedTradingCycles;
    private final HousingTopTradingCycles housingTradingCycles;

    /**
     * Creates the matching facade.
     *
     * @param defaults optional request defaults; system-property defaults when null.
     * @param roundListener optional trading-round observer.
     */
    @Builder
    public MatchingCore(MatchingDefaults defaults, RoundListener roundListener) {
        this.defaults = defaults == null ? MatchingDefaults.defaults() : defaults;
        RoundListener listener = roundListener == null ? RoundListener.NONE : roundListener;
        this.deferredAcceptance = new DeferredAcceptance();
        this.twoSidedTradingCycles = new TwoSidedTopTradingCycles(listener);
        this.housingTradingCycles = new HousingTopTradingCycles(listener);
    }

    /**
     * Executes one school choice request.
     *
     * @throws MatchingCoreException when request contracts or market preconditions fail.
     */
    @Override
    public MatchingResponse matchTwoSided(TwoSidedMatchingRequest request) {
        if (request == null) {
            throw new MatchingCoreException(REASON_REQUEST_REQUIRED, "two-sided request must be provided");
        }
        if (request.getMechanism() == null) {
            throw new MatchingCoreException(REASON_MECHANISM_REQUIRED, "mechanism must be provided");
        }
        MarketSide favoredSide = request.getFavoredSide() == null ? defaults.favoredSide() : request.getFavoredSide();

        IDMapper studentIds = mapIds(request.getStudents(), "student");
        IDMapper schoolIds = mapIds(request.getSchools(), "school");
        ParticipantSet students = toParticipantSet(request.getStudents(), schoolIds, defaults.defaultCapacity());
        ParticipantSet schools = toParticipantSet(request.getSchools(), studentIds, defaults.defaultCapacity());

        MatchingResponse.MatchingResponseBuilder builder = MatchingResponse.builder()
                .mechanism(request.getMechanism());
        Matching matching;
        try {
            TwoSidedMarket market = new TwoSidedMarket(students, schools);
            switch (request.getMechanism()) {
                case DEFERRED_ACCEPTANCE -> {
                    DeferredAcceptanceResult result = deferredAcceptance.match(market, favoredSide);
                    matching = result.getMatching();
                    builder.rounds(result.getPasses()).proposals(result.getProposals());
                }
                case TOP_TRADING_CYCLES -> {
                    TopTradingCyclesResult result = twoSidedTradingCycles.match(market, favoredSide);
                    matching = result.getMatching();
                    builder.rounds(result.getRounds());
                }
                default -> throw new MatchingCoreException(
                        REASON_MECHANISM_REQUIRED,
                        "unsupported mechanism: " + request.getMechanism()
                );
            }
        } catch (MarketConfigurationException ex) {
            throw new MatchingCoreException(
                    REASON_MARKET_CONFIGURATION_INVALID,
                    ex.reasonCode() + ": " + ex.getMessage(),
                    ex
            );
        }

        MatchingResponse response = toResponse(builder, matching, studentIds, schoolIds);
        log.info("{} matched {} of {} students (favored side {})",
                request.getMechanism(), matching.pairCount(), students.size(), favoredSide);
        return response;
    }

    /**
     * Executes one house allocation request with top trading cycles.
     *
     * @throws MatchingCoreException when request contracts or market preconditions fail.
     */
    @Override
    public MatchingResponse allocateHousing(HousingAllocationRequest request) {
        if (request == null) {
            throw new MatchingCoreException(REASON_REQUEST_REQUIRED, "housing request must be provided");
        }
        IDMapper tenantIds = mapIds(request.getTenants(), "tenant");
        IDMapper houseIds;
        try {
            houseIds = IDMapper.fromOrdered(request.getHouses());
        } catch (IllegalArgumentException ex) {
            throw new MatchingCoreException(REASON_INVALID_EXTERNAL_ID, "house ids: " + ex.getMessage(), ex);
        }

        ParticipantSet tenants = toParticipantSet(request.getTenants(), houseIds, 1);
        ParticipantSet houses = ParticipantSet.units(houseIds.size());
        Ownership ownership = toOwnership(request.getEndowments(), tenantIds, houseIds);
        Priority priority = toPriority(request.getPriority(), tenantIds);

        TopTradingCyclesResult result;
        try {
            OneSidedMarket market = new OneSidedMarket(tenants, houses);
            result = housingTradingCycles.match(market, priority, ownership);
        } catch (MarketConfigurationException ex) {
            throw new MatchingCoreException(
                    REASON_MARKET_CONFIGURATION_INVALID,
                    ex.reasonCode() + ": " + ex.getMessage(),
                    ex
            );
        }

        MatchingResponse.MatchingResponseBuilder builder = MatchingResponse.builder()
                .mechanism(MechanismType.TOP_TRADING_CYCLES)
                .rounds(result.getRounds());
        MatchingResponse response = toResponse(builder, result.getMatching(), tenantIds, houseIds);
        log.info("Housing TTC housed {} of {} tenants ({} endowments)",
                result.getMatching().pairCount(), tenants.size(), request.getEndowments().size());
        return response;
    }

    private static IDMapper mapIds(List<ParticipantDeclaration> declarations, String sideName) {
        List<String> ids = new ArrayList<>(declarations.size());
        for (ParticipantDeclaration declaration : declarations) {
            if (declaration == null) {
                throw new MatchingCoreException(REASON_DECLARATION_REQUIRED, sideName + " declaration must be non-null");
            }
            ids.add(declaration.getExternalId());
        }
        try {
            return IDMapper.fromOrdered(ids);
        } catch (IllegalArgumentException ex) {
            throw new MatchingCoreException(REASON_INVALID_EXTERNAL_ID, sideName + " ids: " + ex.getMessage(), ex);
        }
    }

    private static ParticipantSet toParticipantSet(
            List<ParticipantDeclaration> declarations,
            IDMapper counterparts,
            int defaultCapacity
    ) {
        int[] capacities = new int[declarations.size()];
        List<PreferenceList> preferences = new ArrayList<>(declarations.size());
        for (int i = 0; i < declarations.size(); i++) {
            ParticipantDeclaration declaration = declarations.get(i);
            Integer capacity = declaration.getCapacity();
            capacities[i] = capacity == null ? defaultCapacity : capacity;
            if (capacities[i] < 0) {
                throw new MatchingCoreException(
                        REASON_INVALID_CAPACITY,
                        "capacity of " + declaration.getExternalId() + " must be >= 0"
                );
            }
            preferences.add(toPreferenceList(declaration, counterparts));
        }
        return ParticipantSet.of(capacities, preferences);
    }

    private static PreferenceList toPreferenceList(ParticipantDeclaration declaration, IDMapper counterparts) {
        List<String> ranked = declaration.getPreferences();
        int[] candidates = new int[ranked.size()];
        for (int i = 0; i < candidates.length; i++) {
            candidates[i] = toInternal(counterparts, ranked.get(i), declaration.getExternalId());
        }
        try {
            return PreferenceList.of(candidates);
        } catch (IllegalArgumentException ex) {
            throw new MatchingCoreException(
                    REASON_INVALID_PREFERENCES,
                    "preferences of " + declaration.getExternalId() + ": " + ex.getMessage(),
                    ex
            );
        }
    }

    private static Ownership toOwnership(Map<String, String> endowments, IDMapper tenantIds, IDMapper houseIds) {
        Ownership.Builder builder = Ownership.builder(tenantIds.size(), houseIds.size());
        for (Map.Entry<String, String> endowment : endowments.entrySet()) {
            builder.own(
                    toInternal(tenantIds, endowment.getKey(), "endowments"),
                    toInternal(houseIds, endowment.getValue(), endowment.getKey())
            );
        }
        return builder.build();
    }

    private static Priority toPriority(List<String> priority, IDMapper tenantIds) {
        if (priority.isEmpty()) {
            return Priority.identity(tenantIds.size());
        }
        int[] order = new int[priority.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = toInternal(tenantIds, priority.get(i), "priority");
        }
        try {
            return Priority.of(order);
        } catch (IllegalArgumentException ex) {
            throw new MatchingCoreException(REASON_INVALID_PRIORITY, ex.getMessage(), ex);
        }
    }

    private static int toInternal(IDMapper mapper, String externalId, String referencedBy) {
        try {
            return mapper.toInternal(externalId);
        } catch (IDMapper.UnknownIDException ex) {
            throw new MatchingCoreException(
                    REASON_UNKNOWN_EXTERNAL_ID,
                    "unknown id '" + externalId + "' referenced by " + referencedBy,
                    ex
            );
        }
    }

    private static MatchingResponse toResponse(
            MatchingResponse.MatchingResponseBuilder builder,
            Matching matching,
            IDMapper agentIds,
            IDMapper objectIds
    ) {
        Objects.requireNonNull(matching, "matching");
        for (int a = 0; a < matching.agentCount(); a++) {
            IntList objects = matching.objectsOf(a);
            List<String> assigned = new ArrayList<>(objects.size());
            for (int i = 0; i < objects.size(); i++) {
                assigned.add(objectIds.toExternal(objects.getInt(i)));
            }
            builder.assignment(agentIds.toExternal(a), List.copyOf(assigned));
            if (assigned.isEmpty()) {
                builder.unmatchedAgent(agentIds.toExternal(a));
            }
        }
        for (int o = 0; o < matching.objectCount(); o++) {
            if (matching.agentsOf(o).isEmpty()) {
                builder.unmatchedObject(objectIds.toExternal(o));
            }
        }
        return builder.build();
    }
}
