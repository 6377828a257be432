package org.Aayush.market.core;

import org.Aayush.market.graph.PointerGraph;
import org.Aayush.market.graph.TradingCycle;
import org.Aayush.market.mechanism.RoundListener;
import org.Aayush.market.model.MarketConfigurationException;
import org.Aayush.market.model.MarketSide;
import org.Aayush.market.model.OwnershipIntegrityException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("MatchingCore Tests")
class MatchingCoreTest {

    private final MatchingCore core = MatchingCore.builder()
            .defaults(MatchingDefaults.of(1, MarketSide.STUDENTS))
            .build();

    @Nested
    @DisplayName("1. School Choice")
    class SchoolChoiceTests {

        @Test
        @DisplayName("Students propose by default and each gets a first choice")
        void testStudentProposingDeferredAcceptance() {
            MatchingResponse response = core.matchTwoSided(crossedMarket(MechanismType.DEFERRED_ACCEPTANCE, null));

            assertEquals(MechanismType.DEFERRED_ACCEPTANCE, response.getMechanism());
            assertEquals(List.of("north"), response.getAssignments().get("ana"));
            assertEquals(List.of("south"), response.getAssignments().get("ben"));
            assertEquals(1, response.getRounds());
            assertEquals(2L, response.getProposals());
            assertTrue(response.getUnmatchedAgents().isEmpty());
            assertTrue(response.getUnmatchedObjects().isEmpty());
        }

        @Test
        @DisplayName("Schools proposing yields the school-optimal matching")
        void testSchoolProposingDeferredAcceptance() {
            MatchingResponse response = core.matchTwoSided(
                    crossedMarket(MechanismType.DEFERRED_ACCEPTANCE, MarketSide.SCHOOLS)
            );

            assertEquals(List.of("south"), response.getAssignments().get("ana"));
            assertEquals(List.of("north"), response.getAssignments().get("ben"));
        }

        @Test
        @DisplayName("Configured favored side applies when the request leaves it unset")
        void testConfiguredFavoredSide() {
            MatchingCore schoolsFirst = MatchingCore.builder()
                    .defaults(MatchingDefaults.of(1, MarketSide.SCHOOLS))
                    .build();

            MatchingResponse response = schoolsFirst.matchTwoSided(
                    crossedMarket(MechanismType.DEFERRED_ACCEPTANCE, null)
            );

            assertEquals(List.of("north"), response.getAssignments().get("ben"));
        }

        @Test
        @DisplayName("Top trading cycles trades both students into their first choice in one round")
        void testTopTradingCycles() {
            List<Integer> cycleCounts = new ArrayList<>();
            RoundListener listener = new RoundListener() {
                @Override
                public void onCyclesResolved(int round, PointerGraph graph, List<TradingCycle> cycles) {
                    cycleCounts.add(cycles.size());
                }
            };
            MatchingCore observed = MatchingCore.builder()
                    .defaults(MatchingDefaults.of(1, MarketSide.STUDENTS))
                    .roundListener(listener)
                    .build();

            MatchingResponse response = observed.matchTwoSided(crossedMarket(MechanismType.TOP_TRADING_CYCLES, null));

            assertEquals(List.of("north"), response.getAssignments().get("ana"));
            assertEquals(List.of("south"), response.getAssignments().get("ben"));
            assertEquals(1, response.getRounds());
            assertEquals(0L, response.getProposals());
            assertEquals(List.of(1), cycleCounts);
        }

        @Test
        @DisplayName("Default capacity seats several students at one school")
        void testDefaultCapacity() {
            MatchingCore roomy = MatchingCore.builder()
                    .defaults(MatchingDefaults.of(2, MarketSide.STUDENTS))
                    .build();
            TwoSidedMatchingRequest request = TwoSidedMatchingRequest.builder()
                    .student(declare("s1", "central"))
                    .student(declare("s2", "central"))
                    .school(declare("central", "s1", "s2"))
                    .mechanism(MechanismType.TOP_TRADING_CYCLES)
                    .build();

            MatchingResponse response = roomy.matchTwoSided(request);

            assertEquals(List.of("central"), response.getAssignments().get("s1"));
            assertEquals(List.of("central"), response.getAssignments().get("s2"));
        }

        @Test
        @DisplayName("Unacceptable students stay unmatched and are reported")
        void testUnmatchedReported() {
            TwoSidedMatchingRequest request = TwoSidedMatchingRequest.builder()
                    .student(declare("s1", "central"))
                    .student(declare("s2", "central"))
                    .school(declare("central", "s1"))
                    .school(declare("empty"))
                    .mechanism(MechanismType.DEFERRED_ACCEPTANCE)
                    .build();

            MatchingResponse response = core.matchTwoSided(request);

            assertEquals(List.of(), response.getAssignments().get("s2"));
            assertEquals(List.of("s2"), response.getUnmatchedAgents());
            assertEquals(List.of("empty"), response.getUnmatchedObjects());
            assertEquals(List.of("s1", "s2"), new ArrayList<>(response.getAssignments().keySet()));
        }
    }

    @Nested
    @DisplayName("2. Housing")
    class HousingTests {

        @Test
        @DisplayName("Endowed tenants swap houses")
        void testSwap() {
            MatchingResponse response = core.allocateHousing(swapRequest().build());

            assertEquals(MechanismType.TOP_TRADING_CYCLES, response.getMechanism());
            assertEquals(List.of("house-B"), response.getAssignments().get("t1"));
            assertEquals(List.of("house-A"), response.getAssignments().get("t2"));
            assertEquals(2, response.getRounds());
        }

        @Test
        @DisplayName("Without endowments the priority order decides")
        void testPriorityOrder() {
            HousingAllocationRequest request = HousingAllocationRequest.builder()
                    .tenant(declare("t1", "house-A"))
                    .tenant(declare("t2", "house-A"))
                    .house("house-A")
                    .priorityTenant("t2")
                    .priorityTenant("t1")
                    .build();

            MatchingResponse response = core.allocateHousing(request);

            assertEquals(List.of("house-A"), response.getAssignments().get("t2"));
            assertEquals(List.of("t1"), response.getUnmatchedAgents());
        }

        @Test
        @DisplayName("Shared endowment surfaces as a market configuration failure")
        void testSharedEndowment() {
            HousingAllocationRequest request = HousingAllocationRequest.builder()
                    .tenant(declare("t1", "house-A"))
                    .tenant(declare("t2", "house-A"))
                    .house("house-A")
                    .endowment("t1", "house-A")
                    .endowment("t2", "house-A")
                    .build();

            MatchingCoreException ex = assertThrows(MatchingCoreException.class, () -> core.allocateHousing(request));

            assertEquals(MatchingCore.REASON_MARKET_CONFIGURATION_INVALID, ex.getReasonCode());
            OwnershipIntegrityException cause = assertInstanceOf(OwnershipIntegrityException.class, ex.getCause());
            assertEquals(OwnershipIntegrityException.REASON_MULTIPLE_OWNERS, cause.reasonCode());
        }

        @Test
        @DisplayName("Tenant capacity other than one is rejected")
        void testTenantCapacity() {
            HousingAllocationRequest request = HousingAllocationRequest.builder()
                    .tenant(ParticipantDeclaration.builder().externalId("t1").capacity(2).preference("house-A").build())
                    .house("house-A")
                    .build();

            MatchingCoreException ex = assertThrows(MatchingCoreException.class, () -> core.allocateHousing(request));

            assertEquals(MatchingCore.REASON_MARKET_CONFIGURATION_INVALID, ex.getReasonCode());
            assertInstanceOf(MarketConfigurationException.class, ex.getCause());
        }

        @Test
        @DisplayName("Repeated tenant in priority is rejected")
        void testInvalidPriority() {
            HousingAllocationRequest request = swapRequest()
                    .priorityTenant("t1")
                    .priorityTenant("t1")
                    .build();

            MatchingCoreException ex = assertThrows(MatchingCoreException.class, () -> core.allocateHousing(request));
            assertEquals(MatchingCore.REASON_INVALID_PRIORITY, ex.getReasonCode());
        }

        @Test
        @DisplayName("Endowment naming an undeclared house is rejected")
        void testUnknownHouse() {
            HousingAllocationRequest request = HousingAllocationRequest.builder()
                    .tenant(declare("t1", "house-A"))
                    .house("house-A")
                    .endowment("t1", "house-Z")
                    .build();

            MatchingCoreException ex = assertThrows(MatchingCoreException.class, () -> core.allocateHousing(request));
            assertEquals(MatchingCore.REASON_UNKNOWN_EXTERNAL_ID, ex.getReasonCode());
        }

        private HousingAllocationRequest.HousingAllocationRequestBuilder swapRequest() {
            return HousingAllocationRequest.builder()
                    .tenant(declare("t1", "house-B", "house-A"))
                    .tenant(declare("t2", "house-A", "house-B"))
                    .house("house-A")
                    .house("house-B")
                    .endowment("t1", "house-A")
                    .endowment("t2", "house-B");
        }
    }

    @Nested
    @DisplayName("3. Request Validation")
    class ValidationTests {

        @Test
        @DisplayName("Validation: requests must be non-null")
        void testRequestRequired() {
            MatchingCoreException twoSided = assertThrows(MatchingCoreException.class, () -> core.matchTwoSided(null));
            MatchingCoreException housing = assertThrows(MatchingCoreException.class, () -> core.allocateHousing(null));

            assertEquals(MatchingCore.REASON_REQUEST_REQUIRED, twoSided.getReasonCode());
            assertEquals(MatchingCore.REASON_REQUEST_REQUIRED, housing.getReasonCode());
        }

        @Test
        @DisplayName("Validation: mechanism must be specified")
        void testMechanismRequired() {
            MatchingCoreException ex = assertThrows(
                    MatchingCoreException.class,
                    () -> core.matchTwoSided(crossedMarket(null, null))
            );
            assertEquals(MatchingCore.REASON_MECHANISM_REQUIRED, ex.getReasonCode());
        }

        @Test
        @DisplayName("Validation: duplicate external ids are rejected")
        void testDuplicateId() {
            TwoSidedMatchingRequest request = TwoSidedMatchingRequest.builder()
                    .student(declare("s1", "central"))
                    .student(declare("s1", "central"))
                    .school(declare("central", "s1"))
                    .mechanism(MechanismType.DEFERRED_ACCEPTANCE)
                    .build();

            MatchingCoreException ex = assertThrows(MatchingCoreException.class, () -> core.matchTwoSided(request));
            assertEquals(MatchingCore.REASON_INVALID_EXTERNAL_ID, ex.getReasonCode());
        }

        @Test
        @DisplayName("Validation: preferences must name declared counterparts")
        void testUnknownPreference() {
            TwoSidedMatchingRequest request = TwoSidedMatchingRequest.builder()
                    .student(declare("s1", "nowhere"))
                    .school(declare("central", "s1"))
                    .mechanism(MechanismType.DEFERRED_ACCEPTANCE)
                    .build();

            MatchingCoreException ex = assertThrows(MatchingCoreException.class, () -> core.matchTwoSided(request));
            assertEquals(MatchingCore.REASON_UNKNOWN_EXTERNAL_ID, ex.getReasonCode());
        }

        @Test
        @DisplayName("Validation: repeated preference entries are rejected")
        void testRepeatedPreference() {
            TwoSidedMatchingRequest request = TwoSidedMatchingRequest.builder()
                    .student(declare("s1", "central", "central"))
                    .school(declare("central", "s1"))
                    .mechanism(MechanismType.DEFERRED_ACCEPTANCE)
                    .build();

            MatchingCoreException ex = assertThrows(MatchingCoreException.class, () -> core.matchTwoSided(request));
            assertEquals(MatchingCore.REASON_INVALID_PREFERENCES, ex.getReasonCode());
        }

        @Test
        @DisplayName("Validation: negative capacity is rejected")
        void testNegativeCapacity() {
            TwoSidedMatchingRequest request = TwoSidedMatchingRequest.builder()
                    .student(declare("s1", "central"))
                    .school(ParticipantDeclaration.builder().externalId("central").capacity(-1).preference("s1").build())
                    .mechanism(MechanismType.DEFERRED_ACCEPTANCE)
                    .build();

            MatchingCoreException ex = assertThrows(MatchingCoreException.class, () -> core.matchTwoSided(request));
            assertEquals(MatchingCore.REASON_INVALID_CAPACITY, ex.getReasonCode());
        }

        @Test
        @DisplayName("Validation: multi-seat proposers are wrapped with their model reason")
        void testProposerCapacityWrapped() {
            TwoSidedMatchingRequest request = TwoSidedMatchingRequest.builder()
                    .student(declare("s1", "central"))
                    .school(ParticipantDeclaration.builder().externalId("central").capacity(2).preference("s1").build())
                    .mechanism(MechanismType.DEFERRED_ACCEPTANCE)
                    .favoredSide(MarketSide.SCHOOLS)
                    .build();

            MatchingCoreException ex = assertThrows(MatchingCoreException.class, () -> core.matchTwoSided(request));

            assertEquals(MatchingCore.REASON_MARKET_CONFIGURATION_INVALID, ex.getReasonCode());
            MarketConfigurationException cause = assertInstanceOf(MarketConfigurationException.class, ex.getCause());
            assertEquals(MarketConfigurationException.REASON_PROPOSER_CAPACITY_EXCEEDED, cause.reasonCode());
        }
    }

    private static TwoSidedMatchingRequest crossedMarket(MechanismType mechanism, MarketSide favoredSide) {
        return TwoSidedMatchingRequest.builder()
                .student(declare("ana", "north", "south"))
                .student(declare("ben", "south", "north"))
                .school(declare("north", "ben", "ana"))
                .school(declare("south", "ana", "ben"))
                .mechanism(mechanism)
                .favoredSide(favoredSide)
                .build();
    }

    private static ParticipantDeclaration declare(String id, String... preferences) {
        ParticipantDeclaration.ParticipantDeclarationBuilder builder = ParticipantDeclaration.builder().externalId(id);
        for (String preference : preferences) {
            builder.preference(preference);
        }
        return builder.build();
    }
}
