package org.Aayush.market.mechanism;

import org.Aayush.market.model.ParticipantSet;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("TradingRoundState Tests")
class TradingRoundStateTest {

    private static TradingRoundState state(int[] agentCapacities, int[] objectCapacities) {
        return new TradingRoundState(
                ParticipantSet.withoutPreferences(agentCapacities),
                ParticipantSet.withoutPreferences(objectCapacities)
        );
    }

    @Test
    @DisplayName("Zero-capacity members never count as remaining")
    void testRemainingIgnoresZeroCapacity() {
        TradingRoundState state = state(new int[]{0, 2}, new int[]{0});

        assertEquals(1, state.agentsRemaining());
        assertEquals(0, state.objectsRemaining());
        assertFalse(state.hasActiveParticipants());
    }

    @Test
    @DisplayName("Commit decrements vacancies and moves only the agent pointer")
    void testCommit() {
        TradingRoundState state = state(new int[]{2}, new int[]{1});

        state.commit(0, 0);

        assertEquals(1, state.agentVacancy(0));
        assertEquals(0, state.objectVacancy(0));
        assertEquals(1, state.nextObjectRank(0));
        assertEquals(0, state.nextAgentRank(0));
        assertTrue(state.isAgentActive(0));
        assertFalse(state.isObjectActive(0));
        assertEquals(0, state.objectsRemaining());
    }

    @Test
    @DisplayName("Commit on an exhausted party is rejected")
    void testCommitOnInactive() {
        TradingRoundState state = state(new int[]{1}, new int[]{1});
        state.retireObject(0);

        assertThrows(IllegalStateException.class, () -> state.commit(0, 0));
    }

    @Test
    @DisplayName("Retiring twice only counts once")
    void testRetireIdempotent() {
        TradingRoundState state = state(new int[]{1, 1}, new int[]{1});

        state.retireAgent(0);
        state.retireAgent(0);

        assertEquals(1, state.agentsRemaining());
        assertEquals(0, state.agentVacancy(0));
    }
}
