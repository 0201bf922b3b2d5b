package com.tony.leagueAnalytics.service;

import com.tony.leagueAnalytics.TestFixtures;
import com.tony.leagueAnalytics.model.Fixture;
import com.tony.leagueAnalytics.model.LeagueSnapshot;
import com.tony.leagueAnalytics.model.SimulationResult;
import com.tony.leagueAnalytics.model.SquadOverride;
import com.tony.leagueAnalytics.model.StandingEntry;
import com.tony.leagueAnalytics.model.WhatIfResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class SeasonSimulationServiceTest {

    private TestFixtures.Services services;
    private LeagueSnapshot league;

    @BeforeEach
    void setUp() {
        services = TestFixtures.services();
        league = TestFixtures.league();
    }

    @Test
    @DisplayName("La distribution des positions de chaque équipe somme à 1")
    void positionDistributionShouldSumToOne() {
        List<SimulationResult> results = services.seasonSimulation.simulateDivision("D1", league, null, null, null);

        assertThat(results).hasSize(4);
        for (SimulationResult r : results) {
            assertThat(r.getPositionProbabilities()).hasSize(4);
            double total = r.getPositionProbabilities().stream().mapToDouble(Double::doubleValue).sum();
            assertThat(total).isCloseTo(1.0, within(1e-9));
            assertThat(r.getAveragePoints()).isGreaterThanOrEqualTo(r.getCurrentPoints());
        }
    }

    @Test
    @DisplayName("Chaque position est occupée par exactement une équipe à chaque run")
    void eachPositionShouldBeFilledOnce() {
        List<SimulationResult> results = services.seasonSimulation.simulateDivision("D1", league, null, null, null);

        for (int pos = 0; pos < 4; pos++) {
            int position = pos;
            double total = results.stream().mapToDouble(r -> r.getPositionProbabilities().get(position)).sum();
            assertThat(total).isCloseTo(1.0, within(1e-9));
        }
        assertThat(results.stream().mapToDouble(SimulationResult::getTitleProbability).sum()).isCloseTo(1.0, within(1e-9));
    }

    @Test
    @DisplayName("À graine égale, renforcer une équipe ne fait jamais baisser ses points moyens")
    void strongerTeamShouldNotScoreFewerPoints() {
        List<StandingEntry> standings = services.standings.calculateStandings("D1", league);
        List<Fixture> fixtures = services.standings.remainingFixtures("D1", league);

        Map<String, Double> base = new HashMap<>(Map.of("Alpha", 0.0, "Bravo", 0.0, "Charlie", 0.0, "Delta", 0.0));
        Map<String, Double> boosted = new HashMap<>(base);
        boosted.put("Bravo", 1.5);

        double basePoints = averagePoints(TestFixtures.services().seasonSimulation
                .simulate(TestFixtures.TEAMS, base, standings, fixtures, null), "Bravo");
        double boostedPoints = averagePoints(TestFixtures.services().seasonSimulation
                .simulate(TestFixtures.TEAMS, boosted, standings, fixtures, null), "Bravo");

        assertThat(boostedPoints).isGreaterThan(basePoints);
    }

    @Test
    @DisplayName("Des what-if sur tous les matchs restants rendent la simulation déterministe")
    void whatIfsShouldReplaceSimulatedFixtures() {
        List<WhatIfResult> whatIfs = List.of(
                new WhatIfResult("Alpha", "Charlie", 10, 0),
                new WhatIfResult("Bravo", "Delta", 5, 5),
                new WhatIfResult("Charlie", "Alpha", 0, 10),
                new WhatIfResult("Delta", "Bravo", 0, 10));

        List<SimulationResult> results = services.seasonSimulation.simulateDivision("D1", league, null, null, whatIfs);

        SimulationResult alpha = result(results, "Alpha");
        assertThat(alpha.getAveragePoints()).isEqualTo(5 + 2 + 3);
        assertThat(alpha.getTitleProbability()).isEqualTo(1.0);

        SimulationResult bravo = result(results, "Bravo");
        assertThat(bravo.getAveragePoints()).isEqualTo(0 + 1 + 3);
        assertThat(result(results, "Delta").getAveragePoints()).isEqualTo(1 + 1);
        assertThat(result(results, "Charlie").getAveragePoints()).isEqualTo(4);
    }

    @Test
    @DisplayName("Un what-if impliquant une équipe hors division est ignoré")
    void whatIfWithForeignTeamShouldBeIgnored() {
        List<StandingEntry> standings = services.standings.calculateStandings("D1", league);
        Map<String, Double> strengths = Map.of("Alpha", 0.0, "Bravo", 0.0, "Charlie", 0.0, "Delta", 0.0);

        List<SimulationResult> results = services.seasonSimulation.simulate(TestFixtures.TEAMS, strengths, standings,
                List.of(), List.of(new WhatIfResult("Alpha", "Zulu", 10, 0)));

        assertThat(result(results, "Alpha").getAveragePoints()).isEqualTo(5);
    }

    @Test
    @DisplayName("Les matchs impliquant une équipe hors division ne sont pas simulés")
    void fixturesWithForeignTeamShouldBeSkipped() {
        List<StandingEntry> standings = services.standings.calculateStandings("D1", league);
        Map<String, Double> strengths = Map.of("Alpha", 0.0, "Bravo", 0.0, "Charlie", 0.0, "Delta", 0.0);

        List<SimulationResult> results = services.seasonSimulation.simulate(TestFixtures.TEAMS, strengths, standings,
                List.of(Fixture.of("Alpha", "Zulu", "D1", "15-09-2025")), null);

        assertThat(result(results, "Alpha").getAveragePoints()).isEqualTo(5);
    }

    @Test
    @DisplayName("Une recrue de haut niveau améliore les perspectives de son équipe")
    void squadOverrideShouldShiftStrength() {
        Map<String, SquadOverride> overrides = Map.of("Bravo", new SquadOverride(List.of("A1", "A2"), List.of("B9", "B10")));

        Map<String, Double> adjustments = services.squadStrength.strengthAdjustments("D1", overrides, null, league);

        assertThat(adjustments).containsOnlyKeys("Bravo");
        assertThat(adjustments.get("Bravo")).isPositive();
        assertThat(services.seasonSimulation.simulateDivision("D1", league, overrides, null, null)).hasSize(4);
    }

    @Test
    @DisplayName("Une division inconnue donne une simulation vide")
    void unknownDivisionShouldGiveEmptyResult() {
        assertThat(services.seasonSimulation.simulateDivision("D9", league, null, null, null)).isEmpty();
    }

    private double averagePoints(List<SimulationResult> results, String team) {
        return result(results, team).getAveragePoints();
    }

    private SimulationResult result(List<SimulationResult> results, String team) {
        return results.stream().filter(r -> r.getTeam().equals(team)).findFirst().orElseThrow();
    }
}
