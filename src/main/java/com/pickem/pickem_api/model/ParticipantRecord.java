package com.pickem.pickem_api.model;

import java.util.UUID;

/**
 * A player in a game, as supplied by the membership side.
 * Built straight from a JPQL constructor expression.
 */
public record ParticipantRecord(UUID userId, String firstName, String lastName, String displayName) {}
