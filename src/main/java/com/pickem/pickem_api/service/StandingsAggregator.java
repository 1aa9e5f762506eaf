package com.pickem.pickem_api.service;

import com.pickem.pickem_api.model.ParticipantRecord;
import com.pickem.pickem_api.model.PickSummary;
import com.pickem.pickem_api.model.PlayerStanding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Merges game participants with their pick summaries. Pure: no I/O, no state.
 *
 * Output has exactly one unranked row per participant, in participant order.
 * A participant with no summary gets zeros; a summary for someone who is not
 * a participant is ignored. If the source sends two summaries for one user,
 * the first one wins.
 */
public final class StandingsAggregator {

    private static final Logger log = LoggerFactory.getLogger(StandingsAggregator.class);

    private StandingsAggregator() {}

    public static List<PlayerStanding> aggregate(List<ParticipantRecord> participants,
                                                 List<PickSummary> summaries) {
        Map<UUID, PickSummary> byUser = new HashMap<>();
        for (PickSummary summary : summaries) {
            PickSummary existing = byUser.putIfAbsent(summary.userId(), summary);
            if (existing != null) {
                log.warn("Duplicate pick summary for user {}; keeping the first one.", summary.userId());
            }
        }

        return participants.stream()
                .map(p -> {
                    PickSummary summary = byUser.get(p.userId());
                    if (summary == null) {
                        return PlayerStanding.unranked(p, 0, 0, 0.0);
                    }
                    return PlayerStanding.unranked(p,
                            summary.totalPicks(), summary.correctPicks(), summary.pickPercentage());
                })
                .toList();
    }
}
