package com.cardroll.api.controller;

import com.cardroll.api.dto.CardPageResponse;
import com.cardroll.api.dto.CatalogStatsResponse;
import com.cardroll.catalog.Card;
import com.cardroll.catalog.CardCatalog;
import com.cardroll.catalog.CardType;
import com.cardroll.catalog.Rarity;
import com.cardroll.common.exception.ValidationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API for browsing the card catalog.
 */
@RestController
@RequestMapping("/cards")
@RequiredArgsConstructor
@Tag(name = "Cards", description = "Card catalog API")
public class CardController {

    private static final int MAX_PAGE_SIZE = 100;

    private final CardCatalog cardCatalog;

    @GetMapping
    @Operation(summary = "List catalog cards with optional filters")
    public ResponseEntity<CardPageResponse> getCards(@RequestParam(required = false) String rarity,
                                                     @RequestParam(required = false) String type,
                                                     @RequestParam(required = false) String search,
                                                     @RequestParam(defaultValue = "1") int page,
                                                     @RequestParam(defaultValue = "20") int limit) {
        if (page < 1 || limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new ValidationException(
                String.format("Page must be at least 1 and limit between 1 and %d", MAX_PAGE_SIZE));
        }
        Rarity rarityFilter = rarity == null ? null : Rarity.fromId(rarity)
            .orElseThrow(() -> new ValidationException("Unknown rarity: " + rarity));
        CardType typeFilter = type == null ? null : CardType.fromId(type)
            .orElseThrow(() -> new ValidationException("Unknown card type: " + type));

        List<Card> matching = cardCatalog.search(rarityFilter, typeFilter, search);
        return ResponseEntity.ok(CardPageResponse.of(matching, page, limit));
    }

    @GetMapping("/stats")
    @Operation(summary = "Get catalog card counts by rarity and type")
    public ResponseEntity<CatalogStatsResponse> getStats() {
        return ResponseEntity.ok(new CatalogStatsResponse(
            cardCatalog.size(), cardCatalog.countByRarity(), cardCatalog.countByType()));
    }

    @GetMapping("/{cardId}")
    @Operation(summary = "Get card details")
    public ResponseEntity<Card> getCard(@PathVariable String cardId) {
        return ResponseEntity.ok(cardCatalog.getById(cardId));
    }
}
