package org.Aayush.market.core;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Client-facing one-sided house allocation request, solved by top trading cycles.
 */
@Value
@Builder
public class HousingAllocationRequest {
    /** Tenants with preferences over house ids. Capacity must be unset or 1. */
    @Singular
    List<ParticipantDeclaration> tenants;
    /** House ids. */
    @Singular("house")
    List<String> houses;
    /** Initial endowments: tenant id to the house it currently occupies. */
    @Singular
    Map<String, String> endowments;
    /** Processing order over tenant ids; empty means declaration order. */
    @Singular("priorityTenant")
    List<String> priority;
}
