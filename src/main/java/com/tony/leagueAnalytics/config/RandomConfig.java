package com.tony.leagueAnalytics.config;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.SynchronizedRandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@Slf4j
public class RandomConfig {

    /**
     * Source aléatoire unique des simulations Monte Carlo.
     * Synchronisée : le bean est partagé entre invocations concurrentes.
     */
    @Bean
    RandomGenerator randomGenerator(PredictionProperties properties) {
        Long seed = properties.getRandomSeed();
        if (seed != null) {
            log.info("🎲 Générateur Monte Carlo initialisé avec la graine {}", seed);
            return new SynchronizedRandomGenerator(new Well19937c(seed));
        }
        return new SynchronizedRandomGenerator(new Well19937c());
    }
}
