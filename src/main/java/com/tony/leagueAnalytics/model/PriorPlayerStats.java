package com.tony.leagueAnalytics.model;

/**
 * Agrégat de la saison précédente (winRate entre 0 et 1).
 */
public record PriorPlayerStats(double rating, double winRate, int played) {
}
