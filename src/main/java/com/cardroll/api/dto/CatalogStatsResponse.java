package com.cardroll.api.dto;

import com.cardroll.catalog.CardType;
import com.cardroll.catalog.Rarity;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Catalog card counts.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CatalogStatsResponse {

    private int total;
    private Map<Rarity, Long> byRarity;
    private Map<CardType, Long> byType;
}
