package com.pickem.pickem_api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pickem.pickem_api.model.GameParticipant;
import com.pickem.pickem_api.model.Pick;
import com.pickem.pickem_api.model.User;
import com.pickem.pickem_api.repository.GameParticipantRepository;
import com.pickem.pickem_api.repository.PickRepository;
import com.pickem.pickem_api.repository.UserRepository;
import org.junit.jupiter.api.*;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static com.pickem.util.TestFixtures.newUser;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Phase 2 - Integration Tests (standings and pick summary over HTTP)
 */
class StandingsIntegrationTest extends BaseIntegrationTest {

    @Autowired private UserRepository userRepository;
    @Autowired private GameParticipantRepository participantRepository;
    @Autowired private PickRepository pickRepository;
    @Autowired private ObjectMapper objectMapper;

    private UUID gameId;
    private UUID seasonId;
    private User alice;
    private User bob;
    private User carol;
    private User dave;
    private User erin;

    /**
     * Seeds one game with four participants:
     * <ul>
     *   <li>alice: week 1 3/3, week 2 1/3</li>
     *   <li>bob: week 1 2/3, week 2 2/3</li>
     *   <li>carol: week 1 1/2, week 2 one unscored pick</li>
     *   <li>dave: no picks</li>
     * </ul>
     * Plus a stray pick for another game and a pick by erin, who is not a
     * participant; neither may ever be counted.
     */
    @BeforeEach
    void seedGame() {
        gameId = UUID.randomUUID();
        seasonId = UUID.randomUUID();

        alice = join(GameParticipant.ROLE_OWNER, "Alice");
        bob = join(GameParticipant.ROLE_PLAYER, "Bob");
        carol = join(GameParticipant.ROLE_PLAYER, "Carol");
        dave = join(GameParticipant.ROLE_PLAYER, "Dave");

        picks(alice, 1, true, true, true);
        picks(alice, 2, true, false, false);
        picks(bob, 1, true, true, false);
        picks(bob, 2, true, true, false);
        picks(carol, 1, true, false);
        picks(carol, 2, (Boolean) null);

        pickRepository.save(scored(new Pick(UUID.randomUUID(), alice.getId(), seasonId, 1,
                "other-game", "team-1"), true));

        erin = userRepository.save(newUser("Erin"));
        pickRepository.save(scored(new Pick(gameId, erin.getId(), seasonId, 2,
                "w2-m0", "team-0"), true));
    }

    // =========================================================================
    // 4.1 - Standings
    // =========================================================================

    @Nested
    @DisplayName("4.1 - Standings")
    class Standings {

        @Test
        @DisplayName("standings_wholeSeason_tiesOnCorrectAndPercentage")
        void standings_wholeSeason_tiesOnCorrectAndPercentage() throws Exception {
            JsonNode body = getJson("/api/games/" + gameId + "/standings?seasonId=" + seasonId);

            JsonNode rows = body.get("standings");
            assertEquals(4, rows.size());

            // alice and bob: 4/6 each
            assertRow(rows.get(0), 4, 6, 1, true);
            assertRow(rows.get(1), 4, 6, 1, true);
            // carol: 1 correct of 3 picks, the unscored one counts towards total
            assertRow(rows.get(2), 1, 3, 3, false);
            assertEquals("Carol", rows.get(2).get("display_name").asText());
            assertEquals(33.33, rows.get(2).get("pick_percentage").asDouble(), 1e-9);
            // dave joined but never picked
            assertRow(rows.get(3), 0, 0, 4, false);
            assertEquals(dave.getId().toString(), rows.get(3).get("user_id").asText());

            JsonNode cohort = body.get("cohort");
            assertEquals(4, cohort.get("participant_count").asInt());
            assertEquals(2.25, cohort.get("average_correct_picks").asDouble(), 1e-9);
            assertEquals(rows.get(0).get("user_id"), cohort.get("leader").get("user_id"));
            assertTrue(body.get("through_week").isNull());
        }

        @Test
        @DisplayName("standings_throughWeek_onlyCountsEarlierWeeks")
        void standings_throughWeek_onlyCountsEarlierWeeks() throws Exception {
            JsonNode body = getJson("/api/games/" + gameId + "/standings?seasonId=" + seasonId + "&week=1");

            JsonNode rows = body.get("standings");
            assertEquals(alice.getId().toString(), rows.get(0).get("user_id").asText());
            assertRow(rows.get(0), 3, 3, 1, false);
            assertRow(rows.get(1), 2, 3, 2, false);
            assertRow(rows.get(2), 1, 2, 3, false);
            assertEquals(1, rows.get(2).get("incorrect_picks").asInt());
            assertRow(rows.get(3), 0, 0, 4, false);
            assertEquals(1, body.get("through_week").asInt());
        }

        @Test
        @DisplayName("standings_unknownGame_returnsEmptyStandings")
        void standings_unknownGame_returnsEmptyStandings() throws Exception {
            JsonNode body = getJson("/api/games/" + UUID.randomUUID() + "/standings?seasonId=" + seasonId);

            assertEquals(0, body.get("standings").size());
            assertTrue(body.get("cohort").get("leader").isNull());
            assertEquals(0, body.get("cohort").get("participant_count").asInt());
        }

        @Test
        @DisplayName("standings_badArguments_return400")
        void standings_badArguments_return400() {
            assertEquals(400, httpGet("/api/games/" + gameId + "/standings?seasonId=" + seasonId + "&week=0")
                    .getStatusCode().value());
            ResponseEntity<String> missing = httpGet("/api/games/" + gameId + "/standings");
            assertEquals(400, missing.getStatusCode().value());
            assertTrue(missing.getBody().contains("\"error\":\"Missing required parameter: seasonId\""));
            assertEquals(400, httpGet("/api/games/not-a-uuid/standings?seasonId=" + seasonId)
                    .getStatusCode().value());
        }
    }

    // =========================================================================
    // 4.2 - Pick Summary
    // =========================================================================

    @Nested
    @DisplayName("4.2 - Pick Summary")
    class PickSummaryEndpoint {

        @Test
        @DisplayName("summary_singleWeek_onePerParticipant_orderedByPercentage")
        void summary_singleWeek_onePerParticipant_orderedByPercentage() throws Exception {
            JsonNode rows = getJson("/api/picks/game/" + gameId + "/summary?seasonId=" + seasonId + "&week=2")
                    .get("summary");

            assertEquals(4, rows.size());
            assertEquals(bob.getId().toString(), rows.get(0).get("user_id").asText());
            assertEquals("Bob", rows.get(0).get("first_name").asText());
            assertEquals(66.67, rows.get(0).get("pick_percentage").asDouble(), 1e-9);
            assertEquals(alice.getId().toString(), rows.get(1).get("user_id").asText());

            // carol (0 of 1) and dave (no picks) share 0%
            Map<String, JsonNode> tail = new HashMap<>();
            tail.put(rows.get(2).get("user_id").asText(), rows.get(2));
            tail.put(rows.get(3).get("user_id").asText(), rows.get(3));
            assertEquals(1, tail.get(carol.getId().toString()).get("total_picks").asInt());
            JsonNode idle = tail.get(dave.getId().toString());
            assertEquals("Dave", idle.get("display_name").asText());
            assertEquals(0, idle.get("total_picks").asInt());
            assertEquals(0.0, idle.get("pick_percentage").asDouble());
        }

        @Test
        @DisplayName("summary_wholeSeason_excludesOtherGamesAndNonParticipants")
        void summary_wholeSeason_excludesOtherGamesAndNonParticipants() throws Exception {
            JsonNode rows = getJson("/api/picks/game/" + gameId + "/summary?seasonId=" + seasonId)
                    .get("summary");

            assertEquals(4, rows.size());
            for (JsonNode row : rows) {
                assertNotEquals(erin.getId().toString(), row.get("user_id").asText());
                if (row.get("user_id").asText().equals(alice.getId().toString())) {
                    assertEquals(6, row.get("total_picks").asInt());
                    assertEquals(4, row.get("correct_picks").asInt());
                }
            }
        }

        @Test
        @DisplayName("summary_malformedSeasonId_returns400WithErrorBody")
        void summary_malformedSeasonId_returns400WithErrorBody() throws Exception {
            ResponseEntity<String> response = httpGet("/api/picks/game/" + gameId + "/summary?seasonId=abc");

            assertEquals(400, response.getStatusCode().value());
            assertEquals("Invalid value for seasonId: abc",
                    objectMapper.readTree(response.getBody()).get("error").asText());
        }
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private User join(String role, String displayName) {
        User user = userRepository.save(newUser(displayName));
        participantRepository.save(new GameParticipant(gameId, user, role));
        return user;
    }

    private void picks(User user, int week, Boolean... outcomes) {
        for (int i = 0; i < outcomes.length; i++) {
            Pick pick = new Pick(gameId, user.getId(), seasonId, week,
                    "w" + week + "-m" + i, "team-" + i);
            pickRepository.save(scored(pick, outcomes[i]));
        }
    }

    private static Pick scored(Pick pick, Boolean correct) {
        pick.setCorrect(correct);
        return pick;
    }

    private JsonNode getJson(String path) throws Exception {
        ResponseEntity<String> response = httpGet(path);
        assertEquals(200, response.getStatusCode().value(), response.getBody());
        return objectMapper.readTree(response.getBody());
    }

    private static void assertRow(JsonNode row, int correct, int total, int rank, boolean tied) {
        assertEquals(correct, row.get("correct_picks").asInt());
        assertEquals(total, row.get("total_picks").asInt());
        assertEquals(rank, row.get("rank").asInt());
        assertEquals(tied, row.get("tied").asBoolean());
    }
}
