package com.pickem.util;

import com.pickem.pickem_api.model.PlayerStanding;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Test-scoped brute-force rank computation.
 * Used to cross-check the production StandingsRanker.
 *
 * A player's rank is 1 + the number of players strictly ahead on
 * (correct picks, pick percentage). Total picks never affects rank.
 *
 * IMPORTANT: must agree with com.pickem.pickem_api.service.StandingsRanker.
 * If the ranking rules change, update this too.
 */
public class CompetitionRanks {

    public static Map<UUID, Integer> expectedRanks(List<PlayerStanding> standings) {
        Map<UUID, Integer> ranks = new HashMap<>();
        for (PlayerStanding s : standings) {
            int ahead = 0;
            for (PlayerStanding other : standings) {
                if (isAhead(other, s)) ahead++;
            }
            ranks.put(s.userId(), ahead + 1);
        }
        return ranks;
    }

    public static Map<UUID, Boolean> expectedTied(List<PlayerStanding> standings) {
        Map<UUID, Boolean> tied = new HashMap<>();
        for (PlayerStanding s : standings) {
            boolean hasTwin = false;
            for (PlayerStanding other : standings) {
                if (other != s
                        && other.correctPicks() == s.correctPicks()
                        && other.pickPercentage() == s.pickPercentage()) {
                    hasTwin = true;
                    break;
                }
            }
            tied.put(s.userId(), hasTwin);
        }
        return tied;
    }

    private static boolean isAhead(PlayerStanding a, PlayerStanding b) {
        if (a.correctPicks() != b.correctPicks()) return a.correctPicks() > b.correctPicks();
        return a.pickPercentage() > b.pickPercentage();
    }
}
