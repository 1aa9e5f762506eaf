package com.pickem.pickem_api.service;

import com.pickem.pickem_api.model.ParticipantRecord;
import com.pickem.pickem_api.model.PickSummary;
import com.pickem.pickem_api.model.PlayerStanding;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * Boundary checks for standings input. Stateless.
 *
 * Structural problems (missing records or ids) are upstream faults and raise
 * {@link UpstreamFetchException}; bad counts raise {@link InvariantViolationException}.
 * Nothing is clamped.
 */
public final class StandingsValidator {

    private StandingsValidator() {}

    // =========================================================================
    // Participants
    // =========================================================================

    public static void validateParticipants(List<ParticipantRecord> participants) {
        if (participants == null) {
            throw new UpstreamFetchException("Participant list is missing.");
        }
        Set<UUID> seen = new HashSet<>();
        for (ParticipantRecord participant : participants) {
            if (participant == null || participant.userId() == null) {
                throw new UpstreamFetchException("Participant record without a user id.");
            }
            if (!seen.add(participant.userId())) {
                throw new InvariantViolationException(
                        "User " + participant.userId() + " is listed more than once in the game.");
            }
        }
    }

    // =========================================================================
    // Pick summaries
    // =========================================================================

    public static void validateSummaries(List<PickSummary> summaries) {
        if (summaries == null) {
            throw new UpstreamFetchException("Pick summary list is missing.");
        }
        for (PickSummary summary : summaries) {
            if (summary == null || summary.userId() == null) {
                throw new UpstreamFetchException("Pick summary without a user id.");
            }
            requireValidCounts(summary.userId(), summary.totalPicks(),
                    summary.correctPicks(), summary.pickPercentage());
        }
    }

    // =========================================================================
    // Standings (checked again by the ranker before it sorts anything)
    // =========================================================================

    public static void validateStandings(List<PlayerStanding> standings) {
        for (PlayerStanding standing : standings) {
            requireValidCounts(standing.userId(), standing.totalPicks(),
                    standing.correctPicks(), standing.pickPercentage());
        }
    }

    private static void requireValidCounts(UUID userId, int totalPicks, int correctPicks,
                                           double pickPercentage) {
        if (totalPicks < 0 || correctPicks < 0) {
            throw new InvariantViolationException(
                    "Negative pick count for user " + userId
                            + " (total=" + totalPicks + ", correct=" + correctPicks + ").");
        }
        if (correctPicks > totalPicks) {
            throw new InvariantViolationException(
                    "User " + userId + " has more correct picks than picks ("
                            + correctPicks + " > " + totalPicks + ").");
        }
        if (Double.isNaN(pickPercentage) || pickPercentage < 0.0 || pickPercentage > 100.0) {
            throw new InvariantViolationException(
                    "Pick percentage out of range for user " + userId + ": " + pickPercentage);
        }
    }
}
