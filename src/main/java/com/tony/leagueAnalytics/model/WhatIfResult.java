package com.tony.leagueAnalytics.model;

/**
 * Résultat hypothétique saisi par l'utilisateur, injecté avant la simulation.
 */
public record WhatIfResult(String homeTeam, String awayTeam, int homeScore, int awayScore) {

    public String key() {
        return homeTeam + ":" + awayTeam;
    }

    public MatchScore score() {
        return new MatchScore(homeScore, awayScore);
    }
}
