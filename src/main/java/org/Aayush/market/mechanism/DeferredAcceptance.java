package org.Aayush.market.mechanism;

import it.unimi.dsi.fastutil.ints.IntArrayList;
import lombok.extern.slf4j.Slf4j;
import org.Aayush.market.model.MarketConfigurationException;
import org.Aayush.market.model.MarketSide;
import org.Aayush.market.model.Matching;
import org.Aayush.market.model.ParticipantSet;
import org.Aayush.market.model.PreferenceList;
import org.Aayush.market.model.PreferenceRanks;
import org.Aayush.market.model.TwoSidedMarket;

import java.util.Objects;

/**
 * Gale-Shapley deferred acceptance.
 *
 * <p>Proposers hold at most one seat. Respondents hold up to their capacity and keep the
 * best proposers seen so far, displacing their worst held proposer when a better one
 * arrives. The result is stable and proposer-optimal among stable matchings.</p>
 */
@Slf4j
public final class DeferredAcceptance {

    /**
     * Runs deferred acceptance with students proposing.
     */
    public DeferredAcceptanceResult match(TwoSidedMarket market) {
        return match(market, MarketSide.STUDENTS);
    }

    /**
     * Runs deferred acceptance with the given side proposing.
     *
     * @param market two-sided market.
     * @param proposingSide side that proposes.
     * @return students x schools matching and run statistics.
     * @throws MarketConfigurationException when a proposer capacity exceeds one.
     */
    public DeferredAcceptanceResult match(TwoSidedMarket market, MarketSide proposingSide) {
        Objects.requireNonNull(market, "market");
        Objects.requireNonNull(proposingSide, "proposingSide");
        ParticipantSet proposers = market.side(proposingSide);
        ParticipantSet respondents = market.opposite(proposingSide);
        for (int p = 0; p < proposers.size(); p++) {
            if (proposers.capacity(p) > 1) {
                throw new MarketConfigurationException(
                        MarketConfigurationException.REASON_PROPOSER_CAPACITY_EXCEEDED,
                        "proposer " + p + " has capacity " + proposers.capacity(p) + "; proposers hold at most one seat"
                );
            }
        }

        int proposerCount = proposers.size();
        int respondentCount = respondents.size();
        PreferenceRanks[] respondentRanks = respondents.rankAll(proposerCount);

        boolean[] single = new boolean[proposerCount];
        int[] nextRespondent = new int[proposerCount];
        IntArrayList[] held = new IntArrayList[respondentCount];
        for (int r = 0; r < respondentCount; r++) {
            held[r] = new IntArrayList(Math.min(respondents.capacity(r), 4));
        }
        int singles = 0;
        for (int p = 0; p < proposerCount; p++) {
            if (proposers.capacity(p) > 0) {
                single[p] = true;
                singles++;
            }
        }

        long proposals = 0;
        int passes = 0;
        while (singles > 0) {
            passes++;
            for (int p = 0; p < proposerCount; p++) {
                if (!single[p]) {
                    continue;
                }
                PreferenceList list = proposers.preferences(p);
                if (nextRespondent[p] >= list.size()) {
                    // exhausted: prefers remaining unmatched
                    single[p] = false;
                    singles--;
                    continue;
                }
                int r = list.get(nextRespondent[p]++);
                proposals++;
                PreferenceRanks ranks = respondentRanks[r];
                if (!ranks.isAcceptable(p)) {
                    continue;
                }
                IntArrayList seats = held[r];
                if (seats.size() < respondents.capacity(r)) {
                    seats.add(p);
                    single[p] = false;
                    singles--;
                    continue;
                }
                int worstIndex = worstHeld(seats, ranks);
                if (worstIndex >= 0 && ranks.prefers(p, seats.getInt(worstIndex))) {
                    int displaced = seats.set(worstIndex, p);
                    single[p] = false;
                    single[displaced] = true;
                }
            }
            log.debug("DA pass {}: {} proposals so far, {} single", passes, proposals, singles);
        }

        Matching matching = Matching.between(market.students(), market.schools());
        boolean studentsPropose = proposingSide == MarketSide.STUDENTS;
        for (int r = 0; r < respondentCount; r++) {
            IntArrayList seats = held[r];
            for (int i = 0; i < seats.size(); i++) {
                if (studentsPropose) {
                    matching.record(seats.getInt(i), r);
                } else {
                    matching.record(r, seats.getInt(i));
                }
            }
        }
        log.debug("DA finished after {} passes, {} proposals, {} pairs", passes, proposals, matching.pairCount());
        return new DeferredAcceptanceResult(matching, proposals, passes);
    }

    private static int worstHeld(IntArrayList seats, PreferenceRanks ranks) {
        int worstIndex = -1;
        int worstRank = Integer.MIN_VALUE;
        for (int i = 0; i < seats.size(); i++) {
            int rank = ranks.rankOf(seats.getInt(i));
            if (rank > worstRank) {
                worstRank = rank;
                worstIndex = i;
            }
        }
        return worstIndex;
    }
}
