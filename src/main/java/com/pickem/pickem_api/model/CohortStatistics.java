package com.pickem.pickem_api.model;

import java.util.List;
import java.util.Optional;

/**
 * Aggregate figures over a finished ranking.
 *
 * leader is the first rank-1 row in ranked order; with co-leaders that is the
 * one the tertiary sort key (total picks) put first. Empty when nobody plays.
 */
public record CohortStatistics(Optional<PlayerStanding> leader,
                               double averageCorrectPicks,
                               int participantCount) {

    public static final CohortStatistics EMPTY = new CohortStatistics(Optional.empty(), 0.0, 0);

    /**
     * @param ranked output of StandingsRanker.rank, in ranked order
     */
    public static CohortStatistics of(List<PlayerStanding> ranked) {
        if (ranked.isEmpty()) {
            return EMPTY;
        }

        Optional<PlayerStanding> leader = ranked.stream()
                .filter(s -> s.rank() == 1)
                .findFirst();

        double average = ranked.stream()
                .mapToInt(PlayerStanding::correctPicks)
                .average()
                .orElse(0.0);

        return new CohortStatistics(leader, average, ranked.size());
    }
}
