package com.tony.leagueAnalytics.model;

public record RatedPlayer(String name, int played, double winPct, double adjustedPct) {
}
