package com.tony.leagueAnalytics.model;

public record StandingEntry(String team, int played, int won, int drawn, int lost,
                            int framesFor, int framesAgainst, int points) {

    public int difference() {
        return framesFor - framesAgainst;
    }
}
