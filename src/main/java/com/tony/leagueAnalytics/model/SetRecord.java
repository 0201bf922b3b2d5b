package com.tony.leagueAnalytics.model;

public record SetRecord(int played, int won, double pct) {

    public static SetRecord of(int played, int won) {
        return new SetRecord(played, won, played > 0 ? (double) won / played * 100.0 : 0.0);
    }
}
