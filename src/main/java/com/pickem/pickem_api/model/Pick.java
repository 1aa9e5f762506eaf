package com.pickem.pickem_api.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One user's prediction for one matchup in one week.
 *
 * Picks are written by the pick-entry flow and scored by the pick calculator
 * once the matchup is final. {@code correct} stays null until then; an
 * unscored pick still counts towards a player's total.
 */
@Entity
@Table(name = "picks",
        uniqueConstraints = @UniqueConstraint(columnNames = {"game_id", "user_id", "matchup_id"}),
        indexes = @Index(name = "idx_picks_game_season", columnList = "game_id, season_id, week"))
public class Pick {

    @Getter
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Getter
    @Column(name = "game_id", nullable = false)
    private UUID gameId;

    @Getter
    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Getter
    @Column(name = "season_id", nullable = false)
    private UUID seasonId;

    @Getter
    @Column(nullable = false)
    private int week;

    @Getter
    @Column(name = "matchup_id", nullable = false)
    private String matchupId;

    @Getter
    @Column(name = "selected_team_id", nullable = false)
    private String selectedTeamId;

    // null = not scored yet
    @Getter @Setter
    @Column(name = "is_correct")
    private Boolean correct;

    @Getter
    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    // Constructors
    public Pick() {}

    public Pick(UUID gameId, UUID userId, UUID seasonId, int week,
                String matchupId, String selectedTeamId) {
        this.gameId = gameId;
        this.userId = userId;
        this.seasonId = seasonId;
        this.week = week;
        this.matchupId = matchupId;
        this.selectedTeamId = selectedTeamId;
    }
}
