package com.pickem.pickem_api.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.UUID;

/**
 * Per-user pick accuracy for a game and season, summed over the weeks asked for.
 *
 * pickPercentage = correctPicks / totalPicks * 100, or 0 when nothing was picked.
 */
public record PickSummary(UUID userId, int totalPicks, int correctPicks, double pickPercentage) {

    /**
     * Derive the summary from raw counts, rounding the percentage half-up to
     * {@code scale} decimal places. Counts are taken as given; validation
     * happens before ranking.
     */
    public static PickSummary fromCounts(UUID userId, int totalPicks, int correctPicks, int scale) {
        return new PickSummary(userId, totalPicks, correctPicks,
                percentage(correctPicks, totalPicks, scale));
    }

    public static double percentage(int correctPicks, int totalPicks, int scale) {
        if (totalPicks == 0) return 0.0;
        return BigDecimal.valueOf(correctPicks)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(totalPicks), scale, RoundingMode.HALF_UP)
                .doubleValue();
    }
}
