package com.cardroll.roll;

import com.cardroll.catalog.Card;
import lombok.Value;

/**
 * One slot of a roll: the resolved card and whether its rarity was forced by pity.
 */
@Value
public class RolledCard {
    Card card;
    boolean forced;
}
