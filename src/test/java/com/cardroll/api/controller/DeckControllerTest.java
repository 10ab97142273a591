package com.cardroll.api.controller;

import com.cardroll.api.ApiHeaders;
import com.cardroll.collection.CollectionService;
import com.cardroll.roll.RollEngine;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.hamcrest.Matchers.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Integration tests for deck validation and the active deck, starting from rolled cards.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class DeckControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private RollEngine rollEngine;

    @Autowired
    private CollectionService collectionService;

    @Autowired
    private ObjectMapper objectMapper;

    private String playerId;
    private List<String> ownedIds;

    @BeforeEach
    void setUp() {
        playerId = "player-" + UUID.randomUUID();
        collectionService.addRolledCards(rollEngine.roll(playerId, "basic", 10));
        ownedIds = new ArrayList<>(collectionService.getOwnedCardIds(playerId));
    }

    @Test
    void testOwnedDeckIsValid() throws Exception {
        mockMvc.perform(post("/decks/validate")
                .header(ApiHeaders.PLAYER_ID, playerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(deckJson(ownedIds)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.valid").value(true))
            .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void testUnownedCardIsReported() throws Exception {
        // cosmic cards cannot come out of a basic pack
        List<String> cards = new ArrayList<>(ownedIds);
        cards.add("big-bang");

        mockMvc.perform(post("/decks/validate")
                .header(ApiHeaders.PLAYER_ID, playerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(deckJson(cards)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.valid").value(false))
            .andExpect(jsonPath("$.error").value("UNOWNED_CARD"))
            .andExpect(jsonPath("$.message", containsString("big-bang")));
    }

    @Test
    void testTooManyCopiesIsReported() throws Exception {
        mockMvc.perform(post("/decks/validate")
                .header(ApiHeaders.PLAYER_ID, playerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(deckJson(Collections.nCopies(5, ownedIds.get(0)))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.error").value("DUPLICATE_LIMIT"));
    }

    @Test
    void testOversizedDeckIsReported() throws Exception {
        mockMvc.perform(post("/decks/validate")
                .header(ApiHeaders.PLAYER_ID, playerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(deckJson(Collections.nCopies(31, "big-bang"))))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.error").value("DECK_SIZE"));
    }

    @Test
    void testMissingCardListIsBadRequest() throws Exception {
        mockMvc.perform(post("/decks/validate")
                .header(ApiHeaders.PLAYER_ID, playerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void testNullCardIdIsBadRequest() throws Exception {
        mockMvc.perform(post("/decks/validate")
                .header(ApiHeaders.PLAYER_ID, playerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"cardIds\":[null]}"))
            .andExpect(status().isBadRequest());

        mockMvc.perform(put("/decks/active")
                .header(ApiHeaders.PLAYER_ID, playerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"cardIds\":[\"\"]}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void testActivateAndFetchDeck() throws Exception {
        mockMvc.perform(get("/decks/active").header(ApiHeaders.PLAYER_ID, playerId))
            .andExpect(status().isNotFound());

        mockMvc.perform(put("/decks/active")
                .header(ApiHeaders.PLAYER_ID, playerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(deckJson(ownedIds)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.size").value(ownedIds.size()))
            .andExpect(jsonPath("$.totalCost", greaterThan(0)));

        mockMvc.perform(get("/decks/active").header(ApiHeaders.PLAYER_ID, playerId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.cardIds", hasSize(ownedIds.size())))
            .andExpect(jsonPath("$.cardIds[0]").value(ownedIds.get(0)));
    }

    @Test
    void testInvalidDeckIsNotActivated() throws Exception {
        mockMvc.perform(put("/decks/active")
                .header(ApiHeaders.PLAYER_ID, playerId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(deckJson(List.of("big-bang"))))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.kind").value("UNOWNED_CARD"));

        mockMvc.perform(get("/decks/active").header(ApiHeaders.PLAYER_ID, playerId))
            .andExpect(status().isNotFound());
    }

    @Test
    void testCollectionListsRolledCards() throws Exception {
        mockMvc.perform(get("/collection").header(ApiHeaders.PLAYER_ID, playerId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$", hasSize(ownedIds.size())))
            .andExpect(jsonPath("$[0].playerId").value(playerId));
    }

    private String deckJson(List<String> cardIds) throws Exception {
        return objectMapper.writeValueAsString(Map.of("cardIds", cardIds));
    }
}
