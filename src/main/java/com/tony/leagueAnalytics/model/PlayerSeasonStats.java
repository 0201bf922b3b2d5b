package com.tony.leagueAnalytics.model;

import com.tony.leagueAnalytics.util.BayesianStats;

/**
 * Stats d'un joueur pour UNE équipe dans UNE division (winPct en %).
 * Un même joueur peut en avoir plusieurs par saison : c'est ce qui fait les joueurs-ponts.
 */
public record PlayerSeasonStats(String team, String division, int played, int won, double winPct,
                                int breakAndDishFor, int breakAndDishAgainst, int forfeits, boolean cup) {

    public static PlayerSeasonStats of(String team, String division, int played, int won) {
        return new PlayerSeasonStats(team, division, played, won, BayesianStats.rawPct(won, played), 0, 0, 0, false);
    }

    public double adjustedPct() {
        return BayesianStats.adjustedPct(won, played);
    }
}
