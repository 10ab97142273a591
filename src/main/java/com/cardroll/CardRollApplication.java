package com.cardroll;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for the Card Roll Engine.
 *
 * The engine turns a player's roll request into a weighted, pity-guaranteed
 * sequence of cards and validates the decks players assemble from their collection.
 * Authentication, card authoring and combat stay outside of this service.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class CardRollApplication {

    public static void main(String[] args) {
        SpringApplication.run(CardRollApplication.class, args);
    }
}
