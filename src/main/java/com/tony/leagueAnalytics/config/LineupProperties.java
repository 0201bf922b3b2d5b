package com.tony.leagueAnalytics.config;

import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Configuration
@ConfigurationProperties(prefix = "lineup")
@Validated
@Data
public class LineupProperties {
    // Une feuille de match = 2 sets de 5 joueurs
    public static final int SET_SIZE = 5;
    public static final int LINEUP_SIZE = SET_SIZE * 2;

    @Min(1)
    private int minGames = 3;

    // --- Pondérations du score composite ---
    private double formWeight = 0.3;
    private int formLast8MinGames = 6;
    private double headToHeadWeight = 5.0;
    private double venueWeight = 0.2;
    private int venueMinGames = 3;

    // Biais set 1 - set 2 (en points de %) au-delà duquel l'adversaire est "front-loaded"
    private double setBiasThreshold = 5.0;

    @Min(1)
    private int opponentRecentMatches = 3;

    // En dessous, on retombe sur la force d'équipe pour la probabilité de victoire
    private int minRatedPlayers = 5;

    @Min(0)
    private int defaultAlternatives = 3;
    private int maxSwapAttempts = 20;
}
