package com.cardroll.catalog;

import com.cardroll.common.exception.ConfigurationException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads card definitions from a JSON resource holding an array of {@link CardDefinition}.
 */
@Slf4j
@RequiredArgsConstructor
public class CardCatalogLoader {

    private final ObjectMapper objectMapper;

    public List<Card> load(Resource resource) {
        if (!resource.exists()) {
            throw new ConfigurationException("Card catalog resource not found: " + resource.getDescription());
        }

        try (InputStream in = resource.getInputStream()) {
            List<CardDefinition> definitions = objectMapper.readValue(in, new TypeReference<List<CardDefinition>>() {});
            List<Card> cards = definitions.stream()
                .map(CardDefinition::toCard)
                .collect(Collectors.toList());
            log.info("Loaded {} card definitions from {}", cards.size(), resource.getDescription());
            return cards;
        } catch (IOException e) {
            throw new ConfigurationException("Unable to read card catalog from " + resource.getDescription(), e);
        }
    }
}
