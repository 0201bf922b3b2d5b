package com.tony.leagueAnalytics.service;

import com.tony.leagueAnalytics.config.PredictionProperties;
import com.tony.leagueAnalytics.model.Division;
import com.tony.leagueAnalytics.model.Fixture;
import com.tony.leagueAnalytics.model.LeagueSnapshot;
import com.tony.leagueAnalytics.model.MatchScore;
import com.tony.leagueAnalytics.model.SimulationResult;
import com.tony.leagueAnalytics.model.SquadOverride;
import com.tony.leagueAnalytics.model.StandingEntry;
import com.tony.leagueAnalytics.model.WhatIfResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Monte Carlo de fin de saison : chaque run rejoue les matchs restants frame par frame.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SeasonSimulationService {

    private final StandingsService standingsService;
    private final StrengthEstimatorService strengthEstimator;
    private final SquadStrengthService squadStrengthService;
    private final MatchupService matchupService;
    private final MatchSimulationService matchSimulation;
    private final PredictionProperties properties;

    /**
     * Point d'entrée "division" : forces (+ mercato), classement actuel et matchs restants.
     * Division inconnue = liste vide.
     */
    public List<SimulationResult> simulateDivision(String divisionCode, LeagueSnapshot snapshot,
                                                   Map<String, SquadOverride> squadOverrides, Integer squadTopN,
                                                   List<WhatIfResult> whatIfs) {
        Division division = snapshot.divisions().get(divisionCode);
        if (division == null) {
            log.warn("⚠️ Division inconnue : {}", divisionCode);
            return List.of();
        }

        Map<String, Double> strengths = strengthEstimator.calculateTeamStrengths(divisionCode, snapshot);
        squadStrengthService.strengthAdjustments(divisionCode, squadOverrides, squadTopN, snapshot)
                .forEach((team, adj) -> strengths.computeIfPresent(team, (t, s) -> s + adj));

        List<StandingEntry> standings = standingsService.calculateStandings(divisionCode, snapshot);
        List<Fixture> fixtures = standingsService.remainingFixtures(divisionCode, snapshot);

        return simulate(division.teams(), strengths, standings, fixtures, whatIfs);
    }

    public List<SimulationResult> simulate(List<String> teams, Map<String, Double> strengths,
                                           List<StandingEntry> currentStandings, List<Fixture> fixtures,
                                           List<WhatIfResult> whatIfs) {
        if (teams.isEmpty()) return List.of();

        int runs = properties.getSeasonSimulationRuns();
        int n = teams.size();
        Set<String> divisionTeams = new HashSet<>(teams);

        Map<String, StandingEntry> current = new HashMap<>();
        currentStandings.forEach(s -> current.put(s.team(), s));

        List<WhatIfResult> validWhatIfs = whatIfs == null ? List.of() : whatIfs.stream()
                .filter(w -> divisionTeams.contains(w.homeTeam()) && divisionTeams.contains(w.awayTeam()))
                .toList();
        Set<String> whatIfKeys = new HashSet<>();
        validWhatIfs.forEach(w -> whatIfKeys.add(w.key()));

        // La probabilité de frame ne dépend que des forces : on la calcule une fois par match
        List<PricedFixture> toSimulate = new ArrayList<>();
        for (Fixture f : fixtures) {
            if (!divisionTeams.contains(f.homeTeam()) || !divisionTeams.contains(f.awayTeam())) continue;
            if (whatIfKeys.contains(f.key())) continue;
            toSimulate.add(new PricedFixture(f, matchupService.frameWinProbability(
                    strengths.getOrDefault(f.homeTeam(), 0.0), strengths.getOrDefault(f.awayTeam(), 0.0))));
        }

        Map<String, Tracker> trackers = new LinkedHashMap<>();
        teams.forEach(t -> trackers.put(t, new Tracker(n)));

        for (int run = 0; run < runs; run++) {
            Map<String, SimRow> table = new HashMap<>();
            for (String t : teams) {
                StandingEntry s = current.get(t);
                table.put(t, s == null ? new SimRow(t, 0, 0, 0) : new SimRow(t, s.points(), s.framesFor(), s.framesAgainst()));
            }

            for (WhatIfResult w : validWhatIfs) {
                apply(table, w.homeTeam(), w.awayTeam(), w.score());
            }
            for (PricedFixture pf : toSimulate) {
                apply(table, pf.fixture().homeTeam(), pf.fixture().awayTeam(), matchSimulation.simulateFrames(pf.homeFrameProbability()));
            }

            List<SimRow> ranked = new ArrayList<>();
            teams.forEach(t -> ranked.add(table.get(t)));
            ranked.sort(Comparator.comparingInt(SimRow::points).reversed()
                    .thenComparing(Comparator.comparingInt(SimRow::difference).reversed()));

            for (int pos = 0; pos < ranked.size(); pos++) {
                SimRow row = ranked.get(pos);
                Tracker tracker = trackers.get(row.team);
                tracker.positions[pos]++;
                tracker.totalPoints += row.points;
            }
        }

        List<SimulationResult> results = new ArrayList<>();
        trackers.forEach((team, t) -> results.add(toResult(team, t, current.get(team), runs, n)));
        results.sort(Comparator.comparingDouble(SimulationResult::getAveragePoints).reversed());

        log.info("🎲 Simulation terminée : {} runs, {} équipes, {} matchs simulés, {} what-if",
                runs, n, toSimulate.size(), validWhatIfs.size());
        return results;
    }

    private SimulationResult toResult(String team, Tracker t, StandingEntry current, int runs, int n) {
        List<Double> distribution = new ArrayList<>();
        for (int count : t.positions) distribution.add((double) count / runs);

        int bottom2 = t.positions[n - 1] + (n >= 2 ? t.positions[n - 2] : 0);
        int top2 = t.positions[0] + (n >= 2 ? t.positions[1] : 0);

        return SimulationResult.builder()
                .team(team)
                .currentPoints(current != null ? current.points() : 0)
                .averagePoints((double) t.totalPoints / runs)
                .titleProbability((double) t.positions[0] / runs)
                .top2Probability((double) top2 / runs)
                .bottom2Probability((double) bottom2 / runs)
                .positionProbabilities(distribution)
                .build();
    }

    private void apply(Map<String, SimRow> table, String home, String away, MatchScore score) {
        SimRow h = table.get(home);
        SimRow a = table.get(away);
        h.framesFor += score.homeFrames();
        h.framesAgainst += score.awayFrames();
        a.framesFor += score.awayFrames();
        a.framesAgainst += score.homeFrames();
        h.points += score.homePoints();
        a.points += score.awayPoints();
    }

    private record PricedFixture(Fixture fixture, double homeFrameProbability) {
    }

    private static final class SimRow {
        final String team;
        int points;
        int framesFor;
        int framesAgainst;

        SimRow(String team, int points, int framesFor, int framesAgainst) {
            this.team = team;
            this.points = points;
            this.framesFor = framesFor;
            this.framesAgainst = framesAgainst;
        }

        int points() {
            return points;
        }

        int difference() {
            return framesFor - framesAgainst;
        }
    }

    private static final class Tracker {
        final int[] positions;
        long totalPoints;

        Tracker(int teams) {
            this.positions = new int[teams];
        }
    }
}
