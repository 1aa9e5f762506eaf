package com.pickem.pickem_api.service;

import com.pickem.pickem_api.model.CohortStatistics;
import com.pickem.pickem_api.model.ParticipantRecord;
import com.pickem.pickem_api.model.PickSummary;
import com.pickem.pickem_api.model.PlayerStanding;
import com.pickem.pickem_api.repository.GameParticipantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Builds the leaderboard for one (game, season, week) view.
 *
 * Flow:
 * 1. Load participants and the season-to-date pick summary.
 * 2. Validate both (nothing is ranked on partial or impossible data).
 * 3. Merge into one row per participant (StandingsAggregator).
 * 4. Sort and assign ranks (StandingsRanker).
 * 5. Compute cohort statistics over the ranked list.
 *
 * Holds no per-request state, so concurrent requests need no coordination.
 */
@Service
public class StandingsService {
    private static final Logger log = LoggerFactory.getLogger(StandingsService.class);

    /** Summary endpoint order: best percentage first, then most correct. */
    public static final Comparator<PlayerStanding> SUMMARY_ORDER =
            Comparator.comparingDouble(PlayerStanding::pickPercentage)
                    .thenComparingInt(PlayerStanding::correctPicks)
                    .reversed();

    private final GameParticipantRepository participantRepository;
    private final PickSummaryService pickSummaryService;

    public StandingsService(GameParticipantRepository participantRepository,
                            PickSummaryService pickSummaryService) {
        this.participantRepository = participantRepository;
        this.pickSummaryService = pickSummaryService;
    }

    // =========================================================================
    // Standings
    // =========================================================================

    /**
     * @param throughWeek last week counted, or null for the whole season
     * @throws IllegalArgumentException     if throughWeek is below 1
     * @throws UpstreamFetchException       if participants or picks cannot be loaded
     * @throws InvariantViolationException  if the loaded data cannot be ranked
     */
    // Not @Transactional: an unreachable database must fail inside the repository
    // call, where it is mapped to UpstreamFetchException.
    public StandingsResult getStandings(UUID gameId, UUID seasonId, Integer throughWeek) {
        requireIds(gameId, seasonId);
        if (throughWeek != null && throughWeek < 1) {
            throw new IllegalArgumentException("Week must be 1 or greater.");
        }
        log.info("Computing standings for game {} season {} through week {}",
                gameId, seasonId, throughWeek != null ? throughWeek : "all");

        List<ParticipantRecord> participants = loadParticipants(gameId);
        List<PickSummary> summaries = pickSummaryService.getSeasonSummary(gameId, seasonId, throughWeek);

        try {
            StandingsValidator.validateParticipants(participants);
            StandingsValidator.validateSummaries(summaries);
        } catch (InvariantViolationException e) {
            log.warn("Refusing to rank game {} season {}: {}", gameId, seasonId, e.getMessage());
            throw e;
        }

        List<PlayerStanding> standings = StandingsRanker.rank(
                StandingsAggregator.aggregate(participants, summaries));
        CohortStatistics cohort = CohortStatistics.of(standings);

        log.debug("Ranked {} players for game {} ({} summaries, leader={})",
                standings.size(), gameId, summaries.size(),
                cohort.leader().map(PlayerStanding::displayName).orElse("none"));

        return new StandingsResult(gameId, seasonId, throughWeek, standings, cohort);
    }

    // =========================================================================
    // Raw pick summary
    // =========================================================================

    /**
     * One row per participant with names and counts, best percentage first.
     * Rows are not ranked: rank is 0 and tied is false on every row.
     *
     * @param week a single week, or null for the whole season
     */
    public List<PlayerStanding> getPicksSummary(UUID gameId, UUID seasonId, Integer week) {
        requireIds(gameId, seasonId);
        if (week != null && week < 1) {
            throw new IllegalArgumentException("Week must be 1 or greater.");
        }
        log.info("Loading pick summary for game {} season {} week {}",
                gameId, seasonId, week != null ? week : "all");

        List<ParticipantRecord> participants = loadParticipants(gameId);
        List<PickSummary> summaries = week == null
                ? pickSummaryService.getSeasonSummary(gameId, seasonId, null)
                : pickSummaryService.getWeekSummary(gameId, seasonId, week);
        StandingsValidator.validateParticipants(participants);
        StandingsValidator.validateSummaries(summaries);

        List<PlayerStanding> rows = new ArrayList<>(
                StandingsAggregator.aggregate(participants, summaries));
        rows.sort(SUMMARY_ORDER);
        return List.copyOf(rows);
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private List<ParticipantRecord> loadParticipants(UUID gameId) {
        try {
            return participantRepository.findParticipantRecordsByGameId(gameId);
        } catch (DataAccessException e) {
            log.error("Failed to load participants for game {}", gameId, e);
            throw new UpstreamFetchException("Could not load participants for game " + gameId + ".", e);
        }
    }

    private static void requireIds(UUID gameId, UUID seasonId) {
        if (gameId == null) {
            throw new IllegalArgumentException("Game id is required.");
        }
        if (seasonId == null) {
            throw new IllegalArgumentException("Season id is required.");
        }
    }

    // =========================================================================
    // Result DTO
    // =========================================================================

    public record StandingsResult(
            UUID gameId,
            UUID seasonId,
            Integer throughWeek,
            List<PlayerStanding> standings,
            CohortStatistics cohort
    ) {}
}
