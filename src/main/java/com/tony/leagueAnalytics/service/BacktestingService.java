package com.tony.leagueAnalytics.service;

import com.tony.leagueAnalytics.model.BacktestReport;
import com.tony.leagueAnalytics.model.CalibrationBucket;
import com.tony.leagueAnalytics.model.ConfidenceBand;
import com.tony.leagueAnalytics.model.LeagueSnapshot;
import com.tony.leagueAnalytics.model.MatchPrediction;
import com.tony.leagueAnalytics.model.MatchResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Rejoue la saison d'une division : chaque résultat est prédit avec les seuls résultats antérieurs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BacktestingService {

    private static final double MIN_PROBABILITY = 1e-15;
    private static final double LOW_BAND = 0.5;
    private static final double HIGH_BAND = 0.65;

    private final StrengthEstimatorService strengthEstimator;
    private final MatchupService matchupService;
    private final MatchSimulationService matchSimulation;

    public BacktestReport run(String divisionCode, LeagueSnapshot snapshot) {
        if (!snapshot.divisions().containsKey(divisionCode)) return BacktestReport.empty(divisionCode);

        List<MatchResult> played = snapshot.results().stream()
                .filter(r -> divisionCode.equals(r.division()))
                .sorted(Comparator.comparing(MatchResult::date))
                .toList();
        if (played.isEmpty()) {
            log.warn("Aucun match terminé trouvé pour {}", divisionCode);
            return BacktestReport.empty(divisionCode);
        }

        double totalBrier = 0;
        double totalLogLoss = 0;
        int correct = 0;
        List<Outcome> outcomes = new ArrayList<>();
        List<CalibrationData> calibration = new ArrayList<>();

        for (MatchResult m : played) {
            // Isolation temporelle : uniquement les résultats strictement antérieurs
            List<MatchResult> history = snapshot.results().stream()
                    .filter(r -> r.date().isBefore(m.date()))
                    .toList();
            Map<String, Double> strengths = strengthEstimator.calculateTeamStrengths(divisionCode,
                    snapshot.toBuilder().results(history).build());

            double p = matchupService.frameWinProbability(strengths.getOrDefault(m.homeTeam(), 0.0),
                    strengths.getOrDefault(m.awayTeam(), 0.0));
            MatchPrediction pred = matchSimulation.predictMatch(p);

            double[] probs = {pred.getHomeWinProbability(), pred.getDrawProbability(), pred.getAwayWinProbability()};
            int actual = m.homeScore() > m.awayScore() ? 0 : m.homeScore() == m.awayScore() ? 1 : 2;

            totalBrier += brierScore(probs, actual);
            totalLogLoss += -Math.log(Math.max(probs[actual], MIN_PROBABILITY));

            int predicted = argMax(probs);
            boolean hit = predicted == actual;
            if (hit) correct++;
            outcomes.add(new Outcome(probs[predicted], hit));

            for (int i = 0; i < probs.length; i++) {
                calibration.add(new CalibrationData(probs[i], i == actual ? 1.0 : 0.0));
            }
        }

        int count = played.size();
        BacktestReport report = new BacktestReport(divisionCode, count, totalBrier / count, totalLogLoss / count,
                (double) correct / count, confidenceBands(outcomes), calibrationBuckets(calibration));

        log.info("📊 Backtest {} : {} matchs, Brier {}, Log-Loss {}, précision {}", divisionCode, count,
                String.format("%.4f", report.brierScore()), String.format("%.4f", report.logLoss()),
                String.format("%.1f%%", report.accuracy() * 100));
        return report;
    }

    // Moyenne des écarts au carré sur les 3 issues
    private double brierScore(double[] probs, int actual) {
        double sum = 0;
        for (int i = 0; i < probs.length; i++) {
            double o = i == actual ? 1.0 : 0.0;
            sum += Math.pow(probs[i] - o, 2);
        }
        return sum / probs.length;
    }

    private int argMax(double[] probs) {
        int best = 0;
        for (int i = 1; i < probs.length; i++) {
            if (probs[i] > probs[best]) best = i;
        }
        return best;
    }

    private List<ConfidenceBand> confidenceBands(List<Outcome> outcomes) {
        List<ConfidenceBand> bands = new ArrayList<>();
        bands.add(band("<50%", outcomes.stream().filter(o -> o.confidence < LOW_BAND).toList()));
        bands.add(band("50-65%", outcomes.stream().filter(o -> o.confidence >= LOW_BAND && o.confidence < HIGH_BAND).toList()));
        bands.add(band(">=65%", outcomes.stream().filter(o -> o.confidence >= HIGH_BAND).toList()));
        return bands;
    }

    private ConfidenceBand band(String label, List<Outcome> outcomes) {
        int correct = (int) outcomes.stream().filter(Outcome::correct).count();
        return new ConfidenceBand(label, outcomes.size(), correct,
                outcomes.isEmpty() ? 0.0 : (double) correct / outcomes.size());
    }

    /**
     * Tranches de 10% : probabilité moyenne annoncée vs fréquence observée.
     */
    private List<CalibrationBucket> calibrationBuckets(List<CalibrationData> data) {
        List<CalibrationBucket> buckets = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            double lower = i / 10.0;
            double upper = (i + 1) / 10.0;
            boolean last = i == 9;

            List<CalibrationData> bin = data.stream()
                    .filter(d -> d.predicted >= lower && (d.predicted < upper || (last && d.predicted <= upper)))
                    .toList();
            if (bin.isEmpty()) continue;

            double avgPredicted = bin.stream().mapToDouble(CalibrationData::predicted).average().orElse(0.0);
            double actualFreq = bin.stream().mapToDouble(CalibrationData::actual).average().orElse(0.0);
            buckets.add(new CalibrationBucket(lower, upper, bin.size(), avgPredicted, actualFreq));
        }
        return buckets;
    }

    private record CalibrationData(double predicted, double actual) {
    }

    private record Outcome(double confidence, boolean correct) {
    }
}
