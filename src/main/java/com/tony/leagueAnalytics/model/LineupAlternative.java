package com.tony.leagueAnalytics.model;

/**
 * Variante à un échange près. probabilityDiff = P(victoire optimale) - P(victoire variante).
 */
public record LineupAlternative(int rank, OptimizedLineup lineup, String playerIn, String playerOut,
                                double probabilityDiff) {
}
