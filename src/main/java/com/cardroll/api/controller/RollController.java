package com.cardroll.api.controller;

import com.cardroll.api.ApiHeaders;
import com.cardroll.api.dto.RollCardsRequest;
import com.cardroll.api.dto.RollResponse;
import com.cardroll.collection.CollectionService;
import com.cardroll.pity.PityState;
import com.cardroll.pity.PityTracker;
import com.cardroll.roll.RollEngine;
import com.cardroll.roll.RollResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.transaction.TransactionException;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * REST API for rolling cards.
 */
@RestController
@RequestMapping("/cards")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Rolls", description = "Card roll API")
public class RollController {

    private final RollEngine rollEngine;
    private final CollectionService collectionService;
    private final PityTracker pityTracker;

    @PostMapping("/roll")
    @Operation(summary = "Roll cards from a pack",
        description = "Returns 503 with the rolled cards when the pity counters or the collection could not be saved yet")
    public ResponseEntity<RollResponse> roll(@RequestHeader(ApiHeaders.PLAYER_ID) String playerId,
                                             @Valid @RequestBody RollCardsRequest request) {
        RollResult result = rollEngine.roll(playerId, request.getPackType(), request.getCount());
        RollResponse response = RollResponse.from(result);

        // The cards are already rolled: a failed write is retried, never reported as a failed roll.
        try {
            collectionService.addRolledCards(result);
        } catch (DataAccessException | TransactionException e) {
            log.warn("Collection write for player {} failed after roll: {}", playerId, e.getMessage());
            collectionService.queueForRetry(result);
            response.setPersistencePending(true);
        }

        HttpStatus status = response.isPersistencePending() ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(status).body(response);
    }

    @GetMapping("/pity")
    @Operation(summary = "Get the caller's pity counters per pack type")
    public ResponseEntity<Map<String, PityState>> getPity(@RequestHeader(ApiHeaders.PLAYER_ID) String playerId) {
        return ResponseEntity.ok(pityTracker.snapshot(playerId));
    }
}
