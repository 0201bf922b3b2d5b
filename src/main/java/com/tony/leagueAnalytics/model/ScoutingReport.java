package com.tony.leagueAnalytics.model;

import lombok.Builder;
import lombok.Singular;

import java.util.List;

@Builder(toBuilder = true)
public record ScoutingReport(String team,
                             String division,
                             List<MatchOutcome> form,
                             TeamHomeAwaySplit homeAway,
                             SetPerformance setPerformance,
                             BreakAndDishStats breakAndDish,
                             PredictedLineup predictedLineup,
                             List<PlayerAppearance> appearances,
                             List<RatedPlayer> strongestPlayers,
                             List<RatedPlayer> weakestPlayers,
                             double forfeitRate,
                             @Singular List<String> keyFacts) {
}
