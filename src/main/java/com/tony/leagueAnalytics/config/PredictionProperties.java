package com.tony.leagueAnalytics.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "prediction")
@Validated
@Data
public class PredictionProperties {
    // --- Modèle de frame (logistique) ---
    private double homeAdvantage = 0.2;

    // Conversion win% -> échelle de force : (pct - 0.5) * strengthScale
    private double strengthScale = 4.0;

    // --- Estimation de force ---
    @Min(1)
    private int priorBlendMatches = 10;

    // Joueur sans historique : légèrement sous la moyenne, pondéré comme 6 "pseudo-frames"
    @DecimalMin("0.0") @DecimalMax("1.0")
    private double unknownPlayerPrior = 0.45;
    @DecimalMin("0.0")
    private double unknownPlayerWeight = 6.0;

    // --- Monte Carlo ---
    @Min(1)
    private int framesPerMatch = 10;
    @Min(1)
    private int seasonSimulationRuns = 1000;
    @Min(1)
    private int matchSimulationRuns = 5000;

    // Null = graine aléatoire (entropie système)
    private Long randomSeed;
}
