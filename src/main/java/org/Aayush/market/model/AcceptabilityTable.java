package org.Aayush.market.model;

/**
 * {@code agent x object} table answering whether an object accepts an agent.
 * An object accepts exactly the agents listed in its preference list.
 */
public final class AcceptabilityTable {
    private final boolean[][] accepts;

    private AcceptabilityTable(boolean[][] accepts) {
        this.accepts = accepts;
    }

    /**
     * Derives the table from the objects' declared preference lists.
     *
     * @param objects object side whose lists name acceptable agents.
     * @param agentCount number of agents.
     */
    public static AcceptabilityTable fromPreferences(ParticipantSet objects, int agentCount) {
        boolean[][] accepts = new boolean[agentCount][objects.size()];
        for (int o = 0; o < objects.size(); o++) {
            PreferenceList list = objects.preferences(o);
            for (int i = 0; i < list.size(); i++) {
                accepts[list.get(i)][o] = true;
            }
        }
        return new AcceptabilityTable(accepts);
    }

    public boolean isAcceptable(int agent, int object) {
        return accepts[agent][object];
    }
}
