package com.tony.leagueAnalytics.model;

import java.util.List;

public record PredictedLineup(String team, List<String> players, int matchesConsidered) {

    public PredictedLineup {
        players = players == null ? List.of() : List.copyOf(players);
    }

    public boolean isEmpty() {
        return players.isEmpty();
    }
}
