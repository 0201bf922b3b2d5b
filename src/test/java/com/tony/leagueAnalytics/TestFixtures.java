package com.tony.leagueAnalytics;

import com.tony.leagueAnalytics.config.CalibrationProperties;
import com.tony.leagueAnalytics.config.LineupProperties;
import com.tony.leagueAnalytics.config.PredictionProperties;
import com.tony.leagueAnalytics.model.Division;
import com.tony.leagueAnalytics.model.Fixture;
import com.tony.leagueAnalytics.model.Frame;
import com.tony.leagueAnalytics.model.FrameRecord;
import com.tony.leagueAnalytics.model.LeagueSnapshot;
import com.tony.leagueAnalytics.model.MatchResult;
import com.tony.leagueAnalytics.model.PlayerSeason;
import com.tony.leagueAnalytics.model.PlayerSeasonStats;
import com.tony.leagueAnalytics.model.Side;
import com.tony.leagueAnalytics.service.AdjustedRatingService;
import com.tony.leagueAnalytics.service.BacktestingService;
import com.tony.leagueAnalytics.service.BridgePlayerService;
import com.tony.leagueAnalytics.service.CalibrationOrchestrator;
import com.tony.leagueAnalytics.service.DivisionStrengthService;
import com.tony.leagueAnalytics.service.LeagueStrengthService;
import com.tony.leagueAnalytics.service.LineupInsightService;
import com.tony.leagueAnalytics.service.LineupOptimizerService;
import com.tony.leagueAnalytics.service.MatchSimulationService;
import com.tony.leagueAnalytics.service.MatchupService;
import com.tony.leagueAnalytics.service.OffsetSolver;
import com.tony.leagueAnalytics.service.PlayerAnalyticsService;
import com.tony.leagueAnalytics.service.PlayerStatsService;
import com.tony.leagueAnalytics.service.SeasonSimulationService;
import com.tony.leagueAnalytics.service.SquadStrengthService;
import com.tony.leagueAnalytics.service.StandingsService;
import com.tony.leagueAnalytics.service.StrengthEstimatorService;
import com.tony.leagueAnalytics.service.TeamAnalyticsService;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.IntPredicate;

/**
 * Jeu de données commun : une division "D1" de 4 équipes, 4 matchs joués avec leurs feuilles
 * frame par frame, et 4 matchs restant à jouer.
 *
 * <pre>
 * 01-09-2025  Alpha 7-3 Bravo     Charlie 5-5 Delta
 * 08-09-2025  Bravo 4-6 Charlie   Delta 2-8 Alpha
 * </pre>
 * Charlie gagne tous ses sets 1 : c'est l'adversaire "front-loaded" du jeu de données.
 */
public final class TestFixtures {

    public static final String DIVISION = "D1";
    public static final List<String> TEAMS = List.of("Alpha", "Bravo", "Charlie", "Delta");
    public static final long SEED = 42L;

    private TestFixtures() {
    }

    public static RandomGenerator seededRandom() {
        return new Well19937c(SEED);
    }

    public static PredictionProperties predictionProperties() {
        PredictionProperties properties = new PredictionProperties();
        properties.setSeasonSimulationRuns(500);
        properties.setMatchSimulationRuns(2000);
        return properties;
    }

    /** Joueurs d'une équipe : préfixe + 1..n (ex: "A1".."A12"). */
    public static List<String> players(String prefix, int count) {
        List<String> names = new ArrayList<>();
        for (int i = 1; i <= count; i++) names.add(prefix + i);
        return names;
    }

    /**
     * Feuille de match : le joueur k de chaque équipe dispute la frame k.
     * homeWins dit, pour chaque numéro de frame, si l'équipe à domicile l'emporte.
     */
    public static FrameRecord frameRecord(String matchId, String home, String away, String date, IntPredicate homeWins) {
        String homePrefix = home.substring(0, 1);
        String awayPrefix = away.substring(0, 1);
        List<Frame> frames = new ArrayList<>();
        for (int k = 1; k <= 10; k++) {
            frames.add(new Frame(k, homePrefix + k, awayPrefix + k, homeWins.test(k) ? Side.HOME : Side.AWAY, false));
        }
        return FrameRecord.of(matchId, home, away, date, frames);
    }

    public static List<FrameRecord> divisionFrames() {
        return List.of(
                frameRecord("m1", "Alpha", "Bravo", "01-09-2025", k -> k <= 7),
                frameRecord("m2", "Charlie", "Delta", "01-09-2025", k -> k <= 5),
                frameRecord("m3", "Bravo", "Charlie", "08-09-2025", k -> k >= 7),
                frameRecord("m4", "Delta", "Alpha", "08-09-2025", k -> k >= 9));
    }

    public static List<MatchResult> divisionResults() {
        return List.of(
                MatchResult.of("Alpha", "Bravo", 7, 3, DIVISION, "01-09-2025"),
                MatchResult.of("Charlie", "Delta", 5, 5, DIVISION, "01-09-2025"),
                MatchResult.of("Bravo", "Charlie", 4, 6, DIVISION, "08-09-2025"),
                MatchResult.of("Delta", "Alpha", 2, 8, DIVISION, "08-09-2025"));
    }

    public static List<Fixture> divisionFixtures() {
        return List.of(
                // Déjà joué (date du dernier résultat ou avant) : ignoré
                Fixture.of("Alpha", "Bravo", DIVISION, "01-09-2025"),
                Fixture.of("Alpha", "Charlie", DIVISION, "15-09-2025"),
                Fixture.of("Bravo", "Delta", DIVISION, "15-09-2025"),
                Fixture.of("Charlie", "Alpha", DIVISION, "22-09-2025"),
                Fixture.of("Delta", "Bravo", DIVISION, "22-09-2025"));
    }

    /**
     * Alpha : A1..A12, A1 gagne 10/10 puis chacun une victoire de moins ; A12 n'a joué que 2 frames.
     * Les autres équipes : 10 joueurs à 5/10.
     */
    public static Map<String, PlayerSeason> currentPlayers() {
        Map<String, PlayerSeason> players = new LinkedHashMap<>();
        for (int i = 1; i <= 11; i++) {
            String name = "A" + i;
            players.put(name, PlayerSeason.of(name, PlayerSeasonStats.of("Alpha", DIVISION, 10, Math.max(0, 11 - i))));
        }
        players.put("A12", PlayerSeason.of("A12", PlayerSeasonStats.of("Alpha", DIVISION, 2, 1)));

        for (String team : List.of("Bravo", "Charlie", "Delta")) {
            for (String name : players(team.substring(0, 1), 10)) {
                players.put(name, PlayerSeason.of(name, PlayerSeasonStats.of(team, DIVISION, 10, 5)));
            }
        }
        return players;
    }

    public static Map<String, List<String>> rosters() {
        Map<String, List<String>> rosters = new LinkedHashMap<>();
        rosters.put(LeagueSnapshot.rosterKey(DIVISION, "Alpha"), players("A", 12));
        for (String team : List.of("Bravo", "Charlie", "Delta")) {
            rosters.put(LeagueSnapshot.rosterKey(DIVISION, team), players(team.substring(0, 1), 10));
        }
        return rosters;
    }

    public static LeagueSnapshot league() {
        return LeagueSnapshot.builder()
                .divisions(Map.of(DIVISION, new Division(DIVISION, "Division 1", TEAMS)))
                .results(divisionResults())
                .fixtures(divisionFixtures())
                .frames(divisionFrames())
                .priorPlayers(Map.of())
                .currentPlayers(currentPlayers())
                .rosters(rosters())
                .build();
    }

    public static Services services() {
        return services(predictionProperties(), new LineupProperties(), new CalibrationProperties(), seededRandom());
    }

    public static Services services(PredictionProperties prediction, LineupProperties lineup,
                                    CalibrationProperties calibration, RandomGenerator random) {
        return new Services(prediction, lineup, calibration, random);
    }

    /**
     * Câblage manuel des services, dans l'ordre de leurs dépendances (sans contexte Spring).
     */
    public static final class Services {
        public final StandingsService standings;
        public final StrengthEstimatorService strengthEstimator;
        public final MatchupService matchup;
        public final MatchSimulationService matchSimulation;
        public final PlayerStatsService playerStats;
        public final SquadStrengthService squadStrength;
        public final SeasonSimulationService seasonSimulation;
        public final PlayerAnalyticsService playerAnalytics;
        public final LineupInsightService lineupInsight;
        public final TeamAnalyticsService teamAnalytics;
        public final LineupOptimizerService lineupOptimizer;
        public final OffsetSolver offsetSolver;
        public final BridgePlayerService bridgePlayers;
        public final DivisionStrengthService divisionStrength;
        public final LeagueStrengthService leagueStrength;
        public final AdjustedRatingService adjustedRating;
        public final CalibrationOrchestrator calibration;
        public final BacktestingService backtesting;

        private Services(PredictionProperties prediction, LineupProperties lineup,
                         CalibrationProperties calibrationProperties, RandomGenerator random) {
            standings = new StandingsService();
            strengthEstimator = new StrengthEstimatorService(standings, prediction);
            matchup = new MatchupService(prediction);
            matchSimulation = new MatchSimulationService(prediction, random);
            playerStats = new PlayerStatsService(standings);
            squadStrength = new SquadStrengthService(playerStats, prediction);
            seasonSimulation = new SeasonSimulationService(standings, strengthEstimator, squadStrength, matchup,
                    matchSimulation, prediction);
            playerAnalytics = new PlayerAnalyticsService(lineup);
            lineupInsight = new LineupInsightService(playerAnalytics, lineup);
            teamAnalytics = new TeamAnalyticsService(standings, playerStats, lineupInsight, lineup);
            lineupOptimizer = new LineupOptimizerService(playerStats, playerAnalytics, teamAnalytics, standings,
                    strengthEstimator, matchup, matchSimulation, lineupInsight, lineup, prediction);
            offsetSolver = new OffsetSolver(calibrationProperties);
            bridgePlayers = new BridgePlayerService(calibrationProperties);
            divisionStrength = new DivisionStrengthService(offsetSolver, calibrationProperties);
            leagueStrength = new LeagueStrengthService(divisionStrength, offsetSolver, calibrationProperties);
            adjustedRating = new AdjustedRatingService(calibrationProperties);
            calibration = new CalibrationOrchestrator(bridgePlayers, leagueStrength, adjustedRating);
            backtesting = new BacktestingService(strengthEstimator, matchup, matchSimulation);
        }
    }
}
