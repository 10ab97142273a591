package com.cardroll.api.dto;

import com.cardroll.catalog.Card;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of catalog cards.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CardPageResponse {

    private List<Card> cards;
    private Pagination pagination;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Pagination {
        private int page;
        private int limit;
        private int total;
        private int totalPages;
        private boolean hasNext;
        private boolean hasPrev;
    }

    public static CardPageResponse of(List<Card> matching, int page, int limit) {
        int total = matching.size();
        int totalPages = (total + limit - 1) / limit;
        int from = Math.min((page - 1) * limit, total);
        int to = Math.min(from + limit, total);
        return new CardPageResponse(
            List.copyOf(matching.subList(from, to)),
            new Pagination(page, limit, total, totalPages, page < totalPages, page > 1));
    }
}
