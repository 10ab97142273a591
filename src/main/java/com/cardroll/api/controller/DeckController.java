package com.cardroll.api.controller;

import com.cardroll.api.ApiHeaders;
import com.cardroll.api.dto.ActiveDeckResponse;
import com.cardroll.api.dto.DeckRequest;
import com.cardroll.api.dto.DeckValidationResponse;
import com.cardroll.deck.ActiveDeck;
import com.cardroll.deck.DeckService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API for deck validation and the active deck.
 */
@RestController
@RequestMapping("/decks")
@RequiredArgsConstructor
@Tag(name = "Decks", description = "Deck building API")
public class DeckController {

    private final DeckService deckService;

    @PostMapping("/validate")
    @Operation(summary = "Validate a deck against the caller's collection")
    public ResponseEntity<DeckValidationResponse> validate(@RequestHeader(ApiHeaders.PLAYER_ID) String playerId,
                                                           @Valid @RequestBody DeckRequest request) {
        return ResponseEntity.ok(DeckValidationResponse.from(
            deckService.validate(playerId, request.getCardIds())));
    }

    @PutMapping("/active")
    @Operation(summary = "Replace the caller's active deck with a valid deck")
    public ResponseEntity<ActiveDeckResponse> setActiveDeck(@RequestHeader(ApiHeaders.PLAYER_ID) String playerId,
                                                            @Valid @RequestBody DeckRequest request) {
        ActiveDeck deck = deckService.setActiveDeck(playerId, request.getCardIds());
        return ResponseEntity.ok(toResponse(deck));
    }

    @GetMapping("/active")
    @Operation(summary = "Get the caller's active deck")
    public ResponseEntity<ActiveDeckResponse> getActiveDeck(@RequestHeader(ApiHeaders.PLAYER_ID) String playerId) {
        return deckService.getActiveDeck(playerId)
            .map(deck -> ResponseEntity.ok(toResponse(deck)))
            .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private ActiveDeckResponse toResponse(ActiveDeck deck) {
        return new ActiveDeckResponse(
            deck.getCardIds(),
            deck.getCardIds().size(),
            deckService.totalCost(deck.getCardIds()));
    }
}
