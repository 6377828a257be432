package org.Aayush.app;

import org.Aayush.market.core.HousingAllocationRequest;
import org.Aayush.market.core.MatchingCore;
import org.Aayush.market.core.MatchingResponse;
import org.Aayush.market.core.MechanismType;
import org.Aayush.market.core.ParticipantDeclaration;
import org.Aayush.market.core.TwoSidedMatchingRequest;

/**
 * Minimal application entry point used for local smoke runs.
 */
public class Main {
    /**
     * Runs a small school choice market and a two-tenant house swap and prints the results.
     *
     * @param args command-line arguments (unused).
     */
    public static void main(String[] args) {
        MatchingCore core = MatchingCore.builder().build();

        TwoSidedMatchingRequest schoolChoice = TwoSidedMatchingRequest.builder()
                .student(declare("ana", "north", "south"))
                .student(declare("ben", "south", "north"))
                .school(declare("north", "ben", "ana"))
                .school(declare("south", "ana", "ben"))
                .mechanism(MechanismType.DEFERRED_ACCEPTANCE)
                .build();
        print("school choice (DA)", core.matchTwoSided(schoolChoice));

        HousingAllocationRequest swap = HousingAllocationRequest.builder()
                .tenant(declare("tenant-1", "house-B", "house-A"))
                .tenant(declare("tenant-2", "house-A", "house-B"))
                .house("house-A")
                .house("house-B")
                .endowment("tenant-1", "house-A")
                .endowment("tenant-2", "house-B")
                .build();
        print("house swap (TTC)", core.allocateHousing(swap));
    }

    private static ParticipantDeclaration declare(String id, String... preferences) {
        ParticipantDeclaration.ParticipantDeclarationBuilder builder = ParticipantDeclaration.builder().externalId(id);
        for (String preference : preferences) {
            builder.preference(preference);
        }
        return builder.build();
    }

    private static void print(String title, MatchingResponse response) {
        System.out.println(title + ": " + response.getMechanism() + " in " + response.getRounds() + " rounds");
        response.getAssignments().forEach((agent, objects) -> System.out.println("  " + agent + " = " + objects));
    }
}
