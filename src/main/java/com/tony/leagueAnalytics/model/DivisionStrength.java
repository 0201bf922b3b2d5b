package com.tony.leagueAnalytics.model;

/**
 * offset en points de % : correction ajoutée à un win% obtenu dans la division.
 * Négatif = on y gagne plus facilement, positif = division plus relevée.
 */
public record DivisionStrength(String division, String leagueId, double offset, double confidence,
                               int bridgePlayerCount, int sampleSize) {
}
