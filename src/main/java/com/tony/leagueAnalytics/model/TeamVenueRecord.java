package com.tony.leagueAnalytics.model;

public record TeamVenueRecord(int played, int won, int drawn, int lost, int framesFor, int framesAgainst) {

    public double winPct() {
        return played > 0 ? (double) won / played * 100.0 : 0.0;
    }
}
