package com.tony.leagueAnalytics.service;

import com.tony.leagueAnalytics.config.CalibrationProperties;
import com.tony.leagueAnalytics.model.AdjustedRating;
import com.tony.leagueAnalytics.model.AdjustmentBreakdown;
import com.tony.leagueAnalytics.model.Division;
import com.tony.leagueAnalytics.model.DivisionStrength;
import com.tony.leagueAnalytics.model.LeagueSnapshot;
import com.tony.leagueAnalytics.model.LeagueStrength;
import com.tony.leagueAnalytics.model.PlayerSeason;
import com.tony.leagueAnalytics.model.PlayerSeasonStats;
import com.tony.leagueAnalytics.util.BayesianStats;
import lombok.RequiredArgsConstructor;
import org.apache.commons.math3.stat.StatUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
public class AdjustedRatingService {

    private static final double EMPTY_POOL_MEAN = 50.0;

    private final CalibrationProperties properties;

    /**
     * Note ajustée d'un joueur dans une division, toutes ses équipes de la division cumulées.
     * Null sans stats de championnat dans cette division.
     * z-score calculé sur les joueurs de la division, percentile sur toute la ligue.
     */
    public AdjustedRating playerRating(String player, String leagueId, String divisionCode,
                                       LeagueSnapshot snapshot, Map<String, LeagueStrength> strengths) {
        PlayerSeason season = snapshot.currentPlayers().get(player);
        if (season == null) return null;

        int[] totals = divisionTotals(season, divisionCode);
        if (totals[1] == 0) return null;

        double raw = BayesianStats.rawPct(totals[0], totals[1]);
        double bayesian = BayesianStats.adjustedPct(totals[0], totals[1]);
        double[] divisionPool = divisionPlayerPool(divisionCode, snapshot);
        double[] leaguePool = leaguePlayerPool(snapshot);

        return build(player, leagueId, divisionCode, raw, bayesian, divisionPool, leaguePool, strengths);
    }

    /**
     * Note ajustée d'une équipe : agrégat des frames de championnat de tous ses joueurs.
     * Null si aucun joueur n'a joué pour elle.
     */
    public AdjustedRating teamRating(String team, String leagueId, String divisionCode,
                                     LeagueSnapshot snapshot, Map<String, LeagueStrength> strengths) {
        int[] totals = teamTotals(team, snapshot);
        if (totals[1] == 0) return null;

        double raw = BayesianStats.rawPct(totals[0], totals[1]);
        double bayesian = BayesianStats.adjustedPct(totals[0], totals[1]);
        double[] divisionTeams = divisionTeamPool(divisionCode, snapshot);

        return build(team, leagueId, divisionCode, raw, bayesian, divisionTeams, divisionTeams, strengths);
    }

    /**
     * Percentile global (rang / n x 100) sur les notes ajustées de toutes les ligues, par clé "ligue:division:sujet".
     */
    public Map<String, Double> globalPercentiles(List<AdjustedRating> ratings) {
        List<AdjustedRating> sorted = new ArrayList<>(ratings);
        sorted.sort(Comparator.comparingDouble(AdjustedRating::adjustedPct));

        Map<String, Double> percentiles = new LinkedHashMap<>();
        for (int i = 0; i < sorted.size(); i++) {
            percentiles.put(sorted.get(i).key(), (double) (i + 1) / sorted.size() * 100.0);
        }
        return percentiles;
    }

    private AdjustedRating build(String subject, String leagueId, String divisionCode, double raw, double bayesian,
                                 double[] zPool, double[] percentilePool, Map<String, LeagueStrength> strengths) {
        LeagueStrength league = strengths != null ? strengths.get(leagueId) : null;
        DivisionStrength division = league != null ? league.division(divisionCode) : null;

        double divisionOffset = division != null ? division.offset() : 0.0;
        double leagueOffset = league != null ? league.offset() : 0.0;
        AdjustmentBreakdown breakdown = new AdjustmentBreakdown(divisionOffset, leagueOffset);

        double confidence = Math.min(division != null ? division.confidence() : 0.0,
                league != null ? league.confidence() : 0.0);

        return AdjustedRating.builder()
                .subject(subject)
                .leagueId(leagueId)
                .division(divisionCode)
                .rawPct(raw)
                .bayesianPct(bayesian)
                .adjustedPct(bayesian + breakdown.total())
                .zScore(zScore(bayesian, zPool))
                .leaguePercentile(percentile(bayesian, percentilePool))
                .confidence(confidence)
                .breakdown(breakdown)
                .build();
    }

    /**
     * Écart-type de population. Pool vide : moyenne 50, écart-type 1 ; écart-type nul ramené à 1.
     */
    static double zScore(double value, double[] pool) {
        if (pool.length == 0) return value - EMPTY_POOL_MEAN;
        double mean = StatUtils.mean(pool);
        double sd = Math.sqrt(StatUtils.populationVariance(pool, mean));
        if (sd == 0) sd = 1.0;
        return (value - mean) / sd;
    }

    /**
     * Part du pool strictement inférieure à la valeur (en %), 50 sur un pool vide.
     */
    static double percentile(double value, double[] pool) {
        if (pool.length == 0) return 50.0;
        long below = Arrays.stream(pool).filter(v -> v < value).count();
        return (double) below / pool.length * 100.0;
    }

    private double[] divisionPlayerPool(String divisionCode, LeagueSnapshot snapshot) {
        List<Double> pcts = new ArrayList<>();
        for (PlayerSeason season : snapshot.currentPlayers().values()) {
            int[] totals = divisionTotals(season, divisionCode);
            if (totals[1] >= properties.getMinGamesPerContext()) {
                pcts.add(BayesianStats.adjustedPct(totals[0], totals[1]));
            }
        }
        return toArray(pcts);
    }

    private double[] leaguePlayerPool(LeagueSnapshot snapshot) {
        List<Double> pcts = new ArrayList<>();
        for (PlayerSeason season : snapshot.currentPlayers().values()) {
            PlayerSeason.PlayerTotals total = season.total();
            if (total.played() >= properties.getMinGamesPerContext()) {
                pcts.add(total.adjustedPct());
            }
        }
        return toArray(pcts);
    }

    private double[] divisionTeamPool(String divisionCode, LeagueSnapshot snapshot) {
        Division division = snapshot.divisions().get(divisionCode);
        if (division == null) return new double[0];

        List<Double> rates = new ArrayList<>();
        for (String team : division.teams()) {
            int[] totals = teamTotals(team, snapshot);
            if (totals[1] >= properties.getMinGamesPerContext()) {
                rates.add(BayesianStats.adjustedPct(totals[0], totals[1]));
            }
        }
        return toArray(rates);
    }

    // {victoires, frames} hors coupe
    private static int[] divisionTotals(PlayerSeason season, String divisionCode) {
        int won = 0;
        int played = 0;
        for (PlayerSeasonStats c : season.leagueContexts()) {
            if (divisionCode.equals(c.division())) {
                won += c.won();
                played += c.played();
            }
        }
        return new int[]{won, played};
    }

    private int[] teamTotals(String team, LeagueSnapshot snapshot) {
        int won = 0;
        int played = 0;
        for (PlayerSeason season : snapshot.currentPlayers().values()) {
            for (PlayerSeasonStats c : season.leagueContexts()) {
                if (team.equals(c.team())) {
                    won += c.won();
                    played += c.played();
                }
            }
        }
        return new int[]{won, played};
    }

    private static double[] toArray(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
