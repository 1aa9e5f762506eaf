package com.pickem.pickem_api.repository;

import java.util.UUID;

/**
 * Raw per-user counts from the picks table. Boxed because JPQL aggregates
 * come back as Long.
 */
public record PickTally(UUID userId, Long totalPicks, Long correctPicks) {}
