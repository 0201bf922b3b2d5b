package com.tony.leagueAnalytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MatchPrediction {
    // 1N2 (0-1)
    private double homeWinProbability;
    private double drawProbability;
    private double awayWinProbability;

    // Espérance de frames
    private double expectedHomeFrames;
    private double expectedAwayFrames;

    // Scores les plus fréquents
    @Builder.Default
    private List<ScoreLine> topScores = new ArrayList<>();
}
