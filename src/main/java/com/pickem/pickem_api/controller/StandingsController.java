package com.pickem.pickem_api.controller;

import com.pickem.pickem_api.model.CohortStatistics;
import com.pickem.pickem_api.model.PlayerStanding;
import com.pickem.pickem_api.service.InvariantViolationException;
import com.pickem.pickem_api.service.StandingsService;
import com.pickem.pickem_api.service.StandingsService.StandingsResult;
import com.pickem.pickem_api.service.UpstreamFetchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api")
@CrossOrigin(origins = "*")
public class StandingsController {
    private static final Logger log = LoggerFactory.getLogger(StandingsController.class);

    private final StandingsService standingsService;

    public StandingsController(StandingsService standingsService) {
        this.standingsService = standingsService;
    }

    // =========================================================================
    // Standings (season to date)
    // =========================================================================

    /**
     * GET /api/games/{gameId}/standings?seasonId=...&week=7
     */
    @GetMapping("/games/{gameId}/standings")
    public ResponseEntity<?> getStandings(
            @PathVariable UUID gameId,
            @RequestParam UUID seasonId,
            @RequestParam(required = false) Integer week) {
        try {
            StandingsResult result = standingsService.getStandings(gameId, seasonId, week);
            return ResponseEntity.ok(StandingsResponse.from(result));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
        } catch (InvariantViolationException e) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(new ErrorResponse(e.getMessage()));
        } catch (UpstreamFetchException e) {
            log.warn("Standings unavailable for game {}: {}", gameId, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(new ErrorResponse("Failed to load standings: " + e.getMessage()));
        }
    }

    // =========================================================================
    // Pick summary
    // =========================================================================

    /**
     * GET /api/picks/game/{gameId}/summary?seasonId=...&week=3
     * Without week: the whole season.
     */
    @GetMapping("/picks/game/{gameId}/summary")
    public ResponseEntity<?> getPicksSummary(
            @PathVariable UUID gameId,
            @RequestParam UUID seasonId,
            @RequestParam(required = false) Integer week) {
        try {
            List<PlayerStanding> rows = standingsService.getPicksSummary(gameId, seasonId, week);
            return ResponseEntity.ok(new PicksSummaryResponse(
                    rows.stream().map(SummaryRowDTO::from).toList()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(new ErrorResponse(e.getMessage()));
        } catch (InvariantViolationException e) {
            return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(new ErrorResponse(e.getMessage()));
        } catch (UpstreamFetchException e) {
            log.warn("Pick summary unavailable for game {}: {}", gameId, e.getMessage());
            return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                    .body(new ErrorResponse("Failed to load picks summary: " + e.getMessage()));
        }
    }

    // =========================================================================
    // Request binding errors (missing seasonId, malformed UUID or week)
    // =========================================================================

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParameter(MissingServletRequestParameterException e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("Missing required parameter: " + e.getParameterName()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException e) {
        return ResponseEntity.badRequest()
                .body(new ErrorResponse("Invalid value for " + e.getName() + ": " + e.getValue()));
    }

    // =========================================================================
    // DTOs
    // Serialized snake_case (spring.jackson.property-naming-strategy).
    // =========================================================================

    public record StandingsResponse(
            UUID gameId,
            UUID seasonId,
            Integer throughWeek,     // null = whole season
            List<StandingDTO> standings,
            CohortDTO cohort
    ) {
        static StandingsResponse from(StandingsResult result) {
            return new StandingsResponse(
                    result.gameId(),
                    result.seasonId(),
                    result.throughWeek(),
                    result.standings().stream().map(StandingDTO::from).toList(),
                    CohortDTO.from(result.cohort()));
        }
    }

    public record StandingDTO(
            UUID userId,
            String firstName, String lastName, String displayName,
            int totalPicks, int correctPicks, int incorrectPicks,
            double pickPercentage,
            int rank, boolean tied
    ) {
        static StandingDTO from(PlayerStanding s) {
            return new StandingDTO(
                    s.userId(),
                    s.firstName(), s.lastName(), s.displayName(),
                    s.totalPicks(), s.correctPicks(), s.getIncorrectPicks(),
                    s.pickPercentage(),
                    s.rank(), s.tied());
        }
    }

    public record CohortDTO(
            StandingDTO leader,      // null when nobody is in the game
            double averageCorrectPicks,
            int participantCount
    ) {
        static CohortDTO from(CohortStatistics cohort) {
            return new CohortDTO(
                    cohort.leader().map(StandingDTO::from).orElse(null),
                    cohort.averageCorrectPicks(),
                    cohort.participantCount());
        }
    }

    public record SummaryRowDTO(
            UUID userId,
            String firstName, String lastName, String displayName,
            int totalPicks, int correctPicks,
            double pickPercentage
    ) {
        static SummaryRowDTO from(PlayerStanding s) {
            return new SummaryRowDTO(
                    s.userId(),
                    s.firstName(), s.lastName(), s.displayName(),
                    s.totalPicks(), s.correctPicks(),
                    s.pickPercentage());
        }
    }

    public record PicksSummaryResponse(List<SummaryRowDTO> summary) {}

    public record ErrorResponse(String error) {}
}
