package com.cardroll.pity;

import com.cardroll.config.CardRollProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Background retry of pity saves that failed after a roll was already handed out.
 *
 * Players whose saves keep failing are reported with an error log line and a
 * {@link PityReconciliationRequiredEvent} so operators can reconcile the stored counters.
 * Also evicts the cached counters of idle players.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PityPersistenceRetryJob {

    private final PityTracker pityTracker;
    private final CardRollProperties properties;
    private final ApplicationEventPublisher eventPublisher;

    @Scheduled(fixedDelayString = "${card-roll.pity.retry-interval:PT5S}")
    public void retryPendingSaves() {
        if (pityTracker.pendingSaveCount() == 0) {
            return;
        }

        log.debug("Retrying {} pending pity saves", pityTracker.pendingSaveCount());
        List<PityReconciliationRequiredEvent> exhausted =
            pityTracker.retryPendingSaves(properties.getPity().getMaxRetryAttempts());

        for (PityReconciliationRequiredEvent event : exhausted) {
            log.error("Pity state for player {} could not be persisted after {} attempts, reconciliation required: {}",
                event.getPlayerId(), event.getAttempts(), event.getUnsavedStates());
            eventPublisher.publishEvent(event);
        }
    }

    @Scheduled(fixedDelayString = "${card-roll.pity.eviction-interval:PT1M}")
    public void evictIdlePlayers() {
        pityTracker.evictIdle(properties.getPity().getIdleEviction());
    }
}
