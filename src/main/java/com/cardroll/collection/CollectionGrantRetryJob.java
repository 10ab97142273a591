package com.cardroll.collection;

import com.cardroll.roll.RollResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.TransactionException;

import java.util.List;

/**
 * Background retry of collection writes that failed after the cards were handed out.
 *
 * Rolls are never dropped: a roll that still cannot be stored goes back into the queue.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CollectionGrantRetryJob {

    private final CollectionService collectionService;

    @Scheduled(fixedDelayString = "${card-roll.pity.retry-interval:PT5S}")
    public void retryPendingGrants() {
        List<RollResult> pending = collectionService.drainPendingGrants();
        if (pending.isEmpty()) {
            return;
        }

        int stored = 0;
        for (RollResult result : pending) {
            try {
                collectionService.addRolledCards(result);
                stored++;
            } catch (DataAccessException | TransactionException e) {
                log.warn("Collection write for player {} failed again: {}", result.getPlayerId(), e.getMessage());
                collectionService.queueForRetry(result);
            }
        }
        log.info("Stored {} of {} pending collection writes", stored, pending.size());
    }
}
