package com.tony.leagueAnalytics.model;

public record BridgeContext(String leagueId, String division, String team, int played, int won, double winPct) {

    public static BridgeContext of(String leagueId, PlayerSeasonStats stats) {
        return new BridgeContext(leagueId, stats.division(), stats.team(), stats.played(), stats.won(), stats.winPct());
    }
}
