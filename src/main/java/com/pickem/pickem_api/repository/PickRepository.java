package com.pickem.pickem_api.repository;

import com.pickem.pickem_api.model.Pick;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface PickRepository extends JpaRepository<Pick, UUID> {

    // =========================================================================
    // Per-participant tallies (input to standings)
    // One row per current participant, zeros when they have no picks in range.
    // Picks by users who are not in the game are never counted.
    // Every pick counts towards the total; only is_correct = true counts as correct.
    // =========================================================================

    /** Whole season. */
    @Query("""
        SELECT new com.pickem.pickem_api.repository.PickTally(
            u.id,
            COUNT(p.id),
            SUM(CASE WHEN p.correct = true THEN 1L ELSE 0L END))
        FROM GameParticipant gp
        JOIN gp.user u
        LEFT JOIN Pick p ON p.userId = u.id
            AND p.gameId = gp.gameId
            AND p.seasonId = :seasonId
        WHERE gp.gameId = :gameId
        GROUP BY u.id
        """)
    List<PickTally> tallyBySeason(@Param("gameId") UUID gameId,
                                  @Param("seasonId") UUID seasonId);

    /** Season to date: every week up to and including {@code throughWeek}. */
    @Query("""
        SELECT new com.pickem.pickem_api.repository.PickTally(
            u.id,
            COUNT(p.id),
            SUM(CASE WHEN p.correct = true THEN 1L ELSE 0L END))
        FROM GameParticipant gp
        JOIN gp.user u
        LEFT JOIN Pick p ON p.userId = u.id
            AND p.gameId = gp.gameId
            AND p.seasonId = :seasonId
            AND p.week <= :throughWeek
        WHERE gp.gameId = :gameId
        GROUP BY u.id
        """)
    List<PickTally> tallyBySeasonThroughWeek(@Param("gameId") UUID gameId,
                                             @Param("seasonId") UUID seasonId,
                                             @Param("throughWeek") int throughWeek);

    /** A single week. */
    @Query("""
        SELECT new com.pickem.pickem_api.repository.PickTally(
            u.id,
            COUNT(p.id),
            SUM(CASE WHEN p.correct = true THEN 1L ELSE 0L END))
        FROM GameParticipant gp
        JOIN gp.user u
        LEFT JOIN Pick p ON p.userId = u.id
            AND p.gameId = gp.gameId
            AND p.seasonId = :seasonId
            AND p.week = :week
        WHERE gp.gameId = :gameId
        GROUP BY u.id
        """)
    List<PickTally> tallyByWeek(@Param("gameId") UUID gameId,
                                @Param("seasonId") UUID seasonId,
                                @Param("week") int week);
}
