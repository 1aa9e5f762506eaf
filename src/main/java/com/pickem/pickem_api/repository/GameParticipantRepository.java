package com.pickem.pickem_api.repository;

import com.pickem.pickem_api.model.GameParticipant;
import com.pickem.pickem_api.model.ParticipantRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.UUID;

public interface GameParticipantRepository extends JpaRepository<GameParticipant, UUID> {

    /**
     * Everyone in a game with their names, in join order.
     * Feeds the standings aggregation directly.
     */
    @Query("""
        SELECT new com.pickem.pickem_api.model.ParticipantRecord(
            u.id, u.firstName, u.lastName, u.displayName)
        FROM GameParticipant gp
        JOIN gp.user u
        WHERE gp.gameId = :gameId
        ORDER BY gp.createdAt ASC
        """)
    List<ParticipantRecord> findParticipantRecordsByGameId(@Param("gameId") UUID gameId);
}
