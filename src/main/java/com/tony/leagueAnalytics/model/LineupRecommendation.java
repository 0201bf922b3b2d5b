package com.tony.leagueAnalytics.model;

import java.util.List;

public record LineupRecommendation(OptimizedLineup optimal, List<ScoredPlayer> scoredPlayers,
                                   List<LineupAlternative> alternatives, List<String> insights) {

    public LineupRecommendation {
        scoredPlayers = scoredPlayers == null ? List.of() : List.copyOf(scoredPlayers);
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
        insights = insights == null ? List.of() : List.copyOf(insights);
    }
}
