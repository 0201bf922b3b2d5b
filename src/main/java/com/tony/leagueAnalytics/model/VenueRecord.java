package com.tony.leagueAnalytics.model;

public record VenueRecord(int played, int won, double pct) {

    public static VenueRecord of(int played, int won) {
        return new VenueRecord(played, won, played > 0 ? (double) won / played * 100.0 : 0.0);
    }
}
