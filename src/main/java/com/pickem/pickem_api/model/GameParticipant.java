package com.pickem.pickem_api.model;

import jakarta.persistence.*;
import lombok.Getter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Membership of one user in one pick'em game.
 * Standings list participants in the order they joined.
 */
@Getter
@Entity
@Table(name = "game_participants",
        uniqueConstraints = @UniqueConstraint(columnNames = {"game_id", "user_id"}))
public class GameParticipant {

    public static final String ROLE_OWNER = "owner";
    public static final String ROLE_PLAYER = "player";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "game_id", nullable = false)
    private UUID gameId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "user_id", nullable = false)
    private User user;

    // owner or player
    @Column(nullable = false, length = 20)
    private String role = ROLE_PLAYER;

    @CreationTimestamp
    @Column(updatable = false)
    private LocalDateTime createdAt;

    // Constructors
    public GameParticipant() {}

    public GameParticipant(UUID gameId, User user, String role) {
        this.gameId = gameId;
        this.user = user;
        this.role = role;
    }
}
