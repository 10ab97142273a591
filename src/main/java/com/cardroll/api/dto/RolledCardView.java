package com.cardroll.api.dto;

import com.cardroll.catalog.Rarity;
import com.cardroll.roll.RolledCard;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A rolled card as returned to the player.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RolledCardView {

    private String id;
    private String name;
    private Rarity rarity;
    private boolean forced;

    public static RolledCardView from(RolledCard rolled) {
        return new RolledCardView(
            rolled.getCard().getId(),
            rolled.getCard().getName(),
            rolled.getCard().getRarity(),
            rolled.isForced());
    }
}
