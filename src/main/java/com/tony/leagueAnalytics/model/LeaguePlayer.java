package com.tony.leagueAnalytics.model;

import java.util.List;

public record LeaguePlayer(String name, Double priorRating, List<String> teams,
                           Double totalPct, Integer totalPlayed, Double adjustedPct) {

    public LeaguePlayer {
        teams = teams == null ? List.of() : List.copyOf(teams);
    }
}
