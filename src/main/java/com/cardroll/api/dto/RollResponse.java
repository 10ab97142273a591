package com.cardroll.api.dto;

import com.cardroll.roll.RollResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Response to a roll request.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RollResponse {

    private List<RolledCardView> cards;
    private String packType;
    private int count;
    private int pityCounter;
    private long totalValue;
    private boolean persistencePending;

    public static RollResponse from(RollResult result) {
        return RollResponse.builder()
            .cards(result.getCards().stream().map(RolledCardView::from).collect(Collectors.toList()))
            .packType(result.getPackType())
            .count(result.getCount())
            .pityCounter(result.getPityCounter())
            .totalValue(result.getTotalValue())
            .persistencePending(result.isPersistencePending())
            .build();
    }
}
