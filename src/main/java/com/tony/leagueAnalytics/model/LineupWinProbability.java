package com.tony.leagueAnalytics.model;

/**
 * Probabilités (0-1) vues de MON équipe.
 */
public record LineupWinProbability(double win, double draw, double loss,
                                   double expectedFor, double expectedAgainst,
                                   double confidence, boolean fallback) {
}
