package com.cardroll.api.controller;

import com.cardroll.api.ApiHeaders;
import com.cardroll.collection.CollectionService;
import com.cardroll.collection.OwnedCard;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * REST API for the caller's card collection.
 */
@RestController
@RequestMapping("/collection")
@RequiredArgsConstructor
@Tag(name = "Collection", description = "Player collection API")
public class CollectionController {

    private final CollectionService collectionService;

    @GetMapping
    @Operation(summary = "List the cards the caller owns")
    public ResponseEntity<List<OwnedCard>> getCollection(@RequestHeader(ApiHeaders.PLAYER_ID) String playerId) {
        return ResponseEntity.ok(collectionService.getCollection(playerId));
    }
}
