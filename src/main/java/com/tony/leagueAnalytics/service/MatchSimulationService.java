package com.tony.leagueAnalytics.service;

import com.tony.leagueAnalytics.config.PredictionProperties;
import com.tony.leagueAnalytics.model.MatchPrediction;
import com.tony.leagueAnalytics.model.MatchScore;
import com.tony.leagueAnalytics.model.ScoreLine;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.random.RandomGenerator;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class MatchSimulationService {

    private static final int TOP_SCORES = 5;

    private final PredictionProperties properties;
    private final RandomGenerator random;

    /**
     * Un match = framesPerMatch tirages de Bernoulli indépendants à p.
     */
    public MatchScore simulateFrames(double homeFrameProbability) {
        int home = 0;
        int frames = properties.getFramesPerMatch();
        for (int i = 0; i < frames; i++) {
            if (random.nextDouble() < homeFrameProbability) home++;
        }
        return new MatchScore(home, frames - home);
    }

    /**
     * Monte Carlo d'un match isolé : 1N2, espérance de frames et scores les plus fréquents.
     */
    public MatchPrediction predictMatch(double homeFrameProbability) {
        int runs = properties.getMatchSimulationRuns();
        int homeWins = 0;
        int draws = 0;
        int awayWins = 0;
        Map<String, Integer> scores = new HashMap<>();

        for (int i = 0; i < runs; i++) {
            MatchScore score = simulateFrames(homeFrameProbability);
            if (score.homeFrames() > score.awayFrames()) homeWins++;
            else if (score.homeFrames() == score.awayFrames()) draws++;
            else awayWins++;
            scores.merge(score.label(), 1, Integer::sum);
        }

        List<ScoreLine> topScores = new ArrayList<>();
        scores.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue().reversed())
                .limit(TOP_SCORES)
                .forEach(e -> topScores.add(new ScoreLine(e.getKey(), (double) e.getValue() / runs)));

        int frames = properties.getFramesPerMatch();
        return MatchPrediction.builder()
                .homeWinProbability((double) homeWins / runs)
                .drawProbability((double) draws / runs)
                .awayWinProbability((double) awayWins / runs)
                .expectedHomeFrames(homeFrameProbability * frames)
                .expectedAwayFrames((1 - homeFrameProbability) * frames)
                .topScores(topScores)
                .build();
    }
}
