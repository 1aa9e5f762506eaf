package com.pickem.pickem_api.model;

import java.util.UUID;

/**
 * One row of a leaderboard. Immutable: ranking produces new instances.
 *
 * rank is 0 until the row has been through StandingsRanker; afterwards it is
 * 1-based and shared by every row of a tie block, all of which have tied = true.
 */
public record PlayerStanding(
        UUID userId,
        String firstName,
        String lastName,
        String displayName,
        int totalPicks,
        int correctPicks,
        double pickPercentage,
        int rank,
        boolean tied
) {

    public static final int UNRANKED = 0;

    public static PlayerStanding unranked(ParticipantRecord participant,
                                          int totalPicks, int correctPicks, double pickPercentage) {
        return new PlayerStanding(
                participant.userId(),
                participant.firstName(),
                participant.lastName(),
                participant.displayName(),
                totalPicks, correctPicks, pickPercentage,
                UNRANKED, false);
    }

    public PlayerStanding withRank(int newRank, boolean newTied) {
        return new PlayerStanding(userId, firstName, lastName, displayName,
                totalPicks, correctPicks, pickPercentage, newRank, newTied);
    }

    public int getIncorrectPicks() { return totalPicks - correctPicks; }
}
