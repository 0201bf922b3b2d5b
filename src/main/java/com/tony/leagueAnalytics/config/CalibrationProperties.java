package com.tony.leagueAnalytics.config;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@ConfigurationProperties(prefix = "calibration")
@Validated
@Data
public class CalibrationProperties {

    // --- Solveur itératif ---
    @Min(1)
    private int solverIterations = 20;
    @DecimalMin("0.0") @DecimalMax("1.0")
    private double damping = 0.5;

    // Frames minimum dans CHAQUE contexte pour qu'un joueur-pont compte
    @Min(1)
    private int minGamesPerContext = 3;

    // --- Confiance ---
    @Min(1)
    private int bridgePlayersForFullConfidence = 10;
    private double confidenceFloor = 0.3;

    // Seuil de similarité des liens d'identité inter-ligues
    @DecimalMin("0.0") @DecimalMax("1.0")
    private double minMatchConfidence = 0.85;

    // --- Table de repli par palier de division ---
    // offset = (multiplicateur - 1.0) * tierOffsetScale
    private double tierOffsetScale = 50.0;
    private double defaultTierMultiplier = 0.5;
    private Map<String, Double> tierMultipliers = defaultTiers();

    private static Map<String, Double> defaultTiers() {
        Map<String, Double> tiers = new LinkedHashMap<>();
        tiers.put("PREM", 1.0);
        tiers.put("SD1", 0.92);
        tiers.put("D1", 0.85);
        tiers.put("WD1", 0.88);
        tiers.put("SD2", 0.78);
        tiers.put("D2", 0.72);
        tiers.put("WD2", 0.75);
        tiers.put("D3", 0.62);
        tiers.put("D4", 0.55);
        tiers.put("D5", 0.48);
        tiers.put("D6", 0.42);
        tiers.put("D7", 0.38);
        return tiers;
    }
}
