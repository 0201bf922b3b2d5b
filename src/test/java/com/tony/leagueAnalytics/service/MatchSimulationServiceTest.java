package com.tony.leagueAnalytics.service;

import com.tony.leagueAnalytics.TestFixtures;
import com.tony.leagueAnalytics.config.PredictionProperties;
import com.tony.leagueAnalytics.model.MatchPrediction;
import com.tony.leagueAnalytics.model.MatchScore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class MatchSimulationServiceTest {

    private MatchSimulationService matchSimulation;

    @BeforeEach
    void setUp() {
        PredictionProperties properties = TestFixtures.predictionProperties();
        properties.setMatchSimulationRuns(20000);
        matchSimulation = new MatchSimulationService(properties, TestFixtures.seededRandom());
    }

    @Test
    @DisplayName("Un match compte toujours 10 frames")
    void matchShouldAlwaysHaveTenFrames() {
        for (int i = 0; i < 100; i++) {
            MatchScore score = matchSimulation.simulateFrames(0.6);
            assertThat(score.homeFrames() + score.awayFrames()).isEqualTo(10);
        }
    }

    @Test
    @DisplayName("Probabilités extrêmes : score certain")
    void extremeProbabilitiesShouldBeDeterministic() {
        assertThat(matchSimulation.simulateFrames(1.0)).isEqualTo(new MatchScore(10, 0));
        assertThat(matchSimulation.simulateFrames(0.0)).isEqualTo(new MatchScore(0, 10));
    }

    @Test
    @DisplayName("Le 1N2 somme à 1 et le 5-5 est le score le plus fréquent à 50%")
    void evenMatchShouldFavourDrawScore() {
        MatchPrediction prediction = matchSimulation.predictMatch(0.5);

        double total = prediction.getHomeWinProbability() + prediction.getDrawProbability()
                + prediction.getAwayWinProbability();
        assertThat(total).isCloseTo(1.0, within(1e-9));
        assertThat(prediction.getExpectedHomeFrames()).isCloseTo(5.0, within(1e-9));
        assertThat(prediction.getTopScores()).hasSize(5);
        assertThat(prediction.getTopScores().get(0).score()).isEqualTo("5-5");
        // P(5-5) théorique = 0.246
        assertThat(prediction.getDrawProbability()).isCloseTo(0.246, within(0.02));
    }

    @Test
    @DisplayName("Une équipe favorite gagne plus souvent qu'elle ne perd")
    void favouriteShouldWinMoreOften() {
        MatchPrediction prediction = matchSimulation.predictMatch(0.65);

        assertThat(prediction.getHomeWinProbability()).isGreaterThan(prediction.getAwayWinProbability());
        assertThat(prediction.getExpectedHomeFrames()).isCloseTo(6.5, within(1e-9));
    }
}
