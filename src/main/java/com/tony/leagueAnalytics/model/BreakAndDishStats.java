package com.tony.leagueAnalytics.model;

/**
 * Break-and-dish d'un joueur ou d'une équipe (sommés sur ses contextes de la division).
 */
public record BreakAndDishStats(String subject, int played, int breakAndDishFor, int breakAndDishAgainst,
                                int forfeits) {

    public double forPerGame() {
        return played > 0 ? (double) breakAndDishFor / played : 0.0;
    }

    public double againstPerGame() {
        return played > 0 ? (double) breakAndDishAgainst / played : 0.0;
    }

    public int net() {
        return breakAndDishFor - breakAndDishAgainst;
    }

    /** Part des break-and-dish du match réalisés par ce sujet, 0.5 sans données. */
    public double efficiency() {
        int total = breakAndDishFor + breakAndDishAgainst;
        return total > 0 ? (double) breakAndDishFor / total : 0.5;
    }

    public double forfeitRate() {
        return played > 0 ? (double) forfeits / played : 0.0;
    }
}
