package com.tony.leagueAnalytics.model;

public record PlayerAppearance(String player, int appearances, int teamMatches, double rate,
                               AppearanceCategory category) {
}
