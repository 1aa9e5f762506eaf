package com.pickem.pickem_api.service;

import com.pickem.pickem_api.model.PickSummary;
import com.pickem.pickem_api.repository.PickRepository;
import com.pickem.pickem_api.repository.PickTally;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Reads per-participant pick tallies and turns them into {@link PickSummary} rows.
 * Every current participant of the game gets a row; users outside the game never do.
 */
@Service
public class PickSummaryService {
    private static final Logger log = LoggerFactory.getLogger(PickSummaryService.class);

    private final PickRepository pickRepository;
    private final int percentageScale;

    public PickSummaryService(PickRepository pickRepository,
                              @Value("${pickem.picks.percentage-scale:2}") int percentageScale) {
        if (percentageScale < 0) {
            throw new IllegalArgumentException("pickem.picks.percentage-scale must not be negative.");
        }
        this.pickRepository = pickRepository;
        this.percentageScale = percentageScale;
    }

    // =========================================================================
    // Season to date
    // =========================================================================

    /**
     * Summary over a season, either every week or weeks 1..throughWeek.
     *
     * @param throughWeek last week to include, or null for the whole season
     */
    public List<PickSummary> getSeasonSummary(UUID gameId, UUID seasonId, Integer throughWeek) {
        if (throughWeek == null) {
            return load(() -> pickRepository.tallyBySeason(gameId, seasonId),
                    "game " + gameId + ", season " + seasonId);
        }
        return load(() -> pickRepository.tallyBySeasonThroughWeek(gameId, seasonId, throughWeek),
                "game " + gameId + ", season " + seasonId + ", through week " + throughWeek);
    }

    // =========================================================================
    // Single week
    // =========================================================================

    public List<PickSummary> getWeekSummary(UUID gameId, UUID seasonId, int week) {
        return load(() -> pickRepository.tallyByWeek(gameId, seasonId, week),
                "game " + gameId + ", season " + seasonId + ", week " + week);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private List<PickSummary> load(Supplier<List<PickTally>> query, String scope) {
        List<PickTally> tallies;
        try {
            tallies = query.get();
        } catch (DataAccessException e) {
            log.error("Failed to load pick tallies for {}", scope, e);
            throw new UpstreamFetchException("Could not load pick summary for " + scope + ".", e);
        }
        log.debug("Loaded {} pick tallies for {}", tallies.size(), scope);

        return tallies.stream()
                .map(this::toSummary)
                .toList();
    }

    private PickSummary toSummary(PickTally tally) {
        if (tally.userId() == null || tally.totalPicks() == null || tally.correctPicks() == null) {
            throw new UpstreamFetchException("Malformed pick tally: " + tally);
        }
        try {
            return PickSummary.fromCounts(
                    tally.userId(),
                    Math.toIntExact(tally.totalPicks()),
                    Math.toIntExact(tally.correctPicks()),
                    percentageScale);
        } catch (ArithmeticException e) {
            throw new UpstreamFetchException("Pick tally out of range: " + tally, e);
        }
    }
}
