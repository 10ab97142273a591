package com.cardroll.pity;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * {@link PityStore} backed by the {@code pity_counters} table.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaPityStore implements PityStore {

    private final PityCounterRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Map<String, PityState> load(String playerId) {
        Map<String, PityState> states = new HashMap<>();
        for (PityCounter row : repository.findByPlayerId(playerId)) {
            states.put(row.getPackTypeName(), row.toState());
        }
        return states;
    }

    @Override
    @Transactional
    public void save(String playerId, Map<String, PityState> states) {
        Map<String, PityCounter> existing = repository.findByPlayerId(playerId).stream()
            .collect(Collectors.toMap(PityCounter::getPackTypeName, Function.identity()));

        List<PityCounter> rows = states.entrySet().stream()
            .map(entry -> {
                PityCounter row = existing.get(entry.getKey());
                if (row == null) {
                    return new PityCounter(playerId, entry.getKey(), entry.getValue());
                }
                row.apply(entry.getValue());
                return row;
            })
            .collect(Collectors.toList());

        repository.saveAll(rows);
        log.debug("Persisted {} pity counters for player {}", rows.size(), playerId);
    }
}
