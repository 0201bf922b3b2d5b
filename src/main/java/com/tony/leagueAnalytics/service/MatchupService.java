package com.tony.leagueAnalytics.service;

import com.tony.leagueAnalytics.config.PredictionProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Modèle de frame : logistique de l'écart de force, avantage du terrain inclus.
 */
@Service
@RequiredArgsConstructor
public class MatchupService {

    private final PredictionProperties properties;

    /**
     * P(l'équipe à domicile gagne une frame) = 1 / (1 + e^-(home + HOME_ADV - away)).
     */
    public double frameWinProbability(double homeStrength, double awayStrength) {
        double diff = homeStrength + properties.getHomeAdvantage() - awayStrength;
        return 1.0 / (1.0 + Math.exp(-diff));
    }

    /**
     * Win% (0-100) vers l'échelle de force : 50% = 0.
     */
    public double winPctToStrength(double pct) {
        return (pct / 100.0 - 0.5) * properties.getStrengthScale();
    }
}
