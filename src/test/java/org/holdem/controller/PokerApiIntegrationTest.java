package org.holdem.controller;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.holdem.security.JwtUtil;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full stack over HTTP: JWT filter, controllers, table workers and the
 * error advice.
 */
@SpringBootTest
@AutoConfigureMockMvc
class PokerApiIntegrationTest {

    @Autowired
    private MockMvc mvc;

    @Autowired
    private JwtUtil jwt;

    @Autowired
    private ObjectMapper mapper;

    private String bearer(String player) {
        return "Bearer " + jwt.generateToken(player);
    }

    private JsonNode json(MvcResult res) throws Exception {
        return mapper.readTree(res.getResponse().getContentAsString());
    }

    private long createTable(String creator) throws Exception {
        MvcResult res = mvc.perform(post("/api/poker/table")
                        .header("Authorization", bearer(creator))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"IT table\",\"maxSeats\":2,\"smallBlind\":10,\"bigBlind\":20}"))
                .andExpect(status().isOk())
                .andReturn();
        return json(res).get("id").asLong();
    }

    private int sit(long tableId, String player) throws Exception {
        MvcResult res = mvc.perform(post("/api/poker/table/" + tableId + "/sit")
                        .header("Authorization", bearer(player))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"displayName\":\"" + player + "\",\"buyIn\":1000}"))
                .andExpect(status().isOk())
                .andReturn();
        return json(res).get("seat").asInt();
    }

    // ---------------- security ----------------

    @Test
    void lobby_isPublic() throws Exception {
        mvc.perform(get("/api/poker/tables"))
                .andExpect(status().isOk());
    }

    @Test
    void createTable_withoutToken_is401() throws Exception {
        mvc.perform(post("/api/poker/table")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void createTable_withForgedToken_is401() throws Exception {
        mvc.perform(post("/api/poker/table")
                        .header("Authorization", "Bearer not.a.token")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isUnauthorized());
    }

    // ---------------- play ----------------

    @Test
    void headsUp_outOfTurnIsRejected_thenLegalCallAdvancesVersion() throws Exception {
        long id = createTable("alice");
        int aliceSeat = sit(id, "alice");
        sit(id, "bob");

        JsonNode snap = json(mvc.perform(get("/api/poker/table/" + id + "/snapshot"))
                .andExpect(status().isOk())
                .andReturn());
        assertThat(snap.get("phase").asText()).isEqualTo("PRE_FLOP");
        long version = snap.get("version").asLong();

        String actor = snap.get("currentActorIndex").asInt() == aliceSeat ? "alice" : "bob";
        String waiting = actor.equals("alice") ? "bob" : "alice";

        mvc.perform(post("/api/poker/table/" + id + "/action")
                        .header("Authorization", bearer(waiting))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"CALL\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.reason").value("OUT_OF_TURN"));

        MvcResult called = mvc.perform(post("/api/poker/table/" + id + "/action")
                        .header("Authorization", bearer(actor))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"type\":\"CALL\"}"))
                .andExpect(status().isOk())
                .andReturn();
        assertThat(json(called).get("version").asLong()).isGreaterThan(version);

        // the old version is gone: 409 carries the fresh snapshot
        mvc.perform(get("/api/poker/table/" + id + "/snapshot").param("version", Long.toString(version)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.version").value(version + 1));
    }

    @Test
    void view_showsOnlyOwnHoleCards() throws Exception {
        long id = createTable("carol");
        sit(id, "carol");
        sit(id, "dave");

        mvc.perform(get("/api/poker/table/" + id + "/view").header("Authorization", bearer("carol")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.playerId").value("carol"))
                .andExpect(jsonPath("$.holeCards.length()").value(2));
    }

    @Test
    void action_missingType_is400() throws Exception {
        long id = createTable("erin");

        mvc.perform(post("/api/poker/table/" + id + "/action")
                        .header("Authorization", bearer("erin"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void close_byStranger_is409() throws Exception {
        long id = createTable("frank");

        mvc.perform(delete("/api/poker/table/" + id).header("Authorization", bearer("grace")))
                .andExpect(status().isConflict());
        mvc.perform(delete("/api/poker/table/" + id).header("Authorization", bearer("frank")))
                .andExpect(status().isOk());
    }

    @Test
    void unknownTable_is404() throws Exception {
        mvc.perform(get("/api/poker/table/999999/snapshot"))
                .andExpect(status().isNotFound());
    }
}
