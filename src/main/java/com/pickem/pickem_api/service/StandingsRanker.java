package com.pickem.pickem_api.service;

import com.pickem.pickem_api.model.PlayerStanding;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Leaderboard ranking. Pure function of its input, safe to call from any thread.
 *
 * Order (all descending):
 *   1. correct picks
 *   2. pick percentage
 *   3. total picks
 *
 * Ranks use standard competition ranking: rows equal on correct picks and
 * percentage share the rank of the first row of their block and are all
 * marked tied; the next row's rank is its 1-based position (1, 1, 3, ...).
 * Total picks only orders rows inside a block.
 */
public final class StandingsRanker {

    public static final Comparator<PlayerStanding> RANKING_ORDER =
            Comparator.comparingInt(PlayerStanding::correctPicks)
                    .thenComparingDouble(PlayerStanding::pickPercentage)
                    .thenComparingInt(PlayerStanding::totalPicks)
                    .reversed();

    private StandingsRanker() {}

    /**
     * Sort and rank. Any rank/tied values already on the input are ignored,
     * so ranking a ranked list gives the same result.
     *
     * @throws InvariantViolationException if any row has impossible counts
     */
    public static List<PlayerStanding> rank(List<PlayerStanding> standings) {
        StandingsValidator.validateStandings(standings);

        // Sort first: tie detection only looks at the previous row, which
        // requires every tie block to be contiguous.
        List<PlayerStanding> sorted = new ArrayList<>(standings);
        sorted.sort(RANKING_ORDER);

        int size = sorted.size();
        int[] ranks = new int[size];
        boolean[] tied = new boolean[size];

        for (int i = 0; i < size; i++) {
            if (i > 0 && sharesRank(sorted.get(i), sorted.get(i - 1))) {
                ranks[i] = ranks[i - 1];
                tied[i] = true;
                tied[i - 1] = true;
            } else {
                ranks[i] = i + 1;
            }
        }

        List<PlayerStanding> ranked = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            ranked.add(sorted.get(i).withRank(ranks[i], tied[i]));
        }
        return List.copyOf(ranked);
    }

    /** Two rows tie when they agree on correct picks and pick percentage. */
    public static boolean sharesRank(PlayerStanding a, PlayerStanding b) {
        return a.correctPicks() == b.correctPicks()
                && Double.compare(a.pickPercentage(), b.pickPercentage()) == 0;
    }
}
