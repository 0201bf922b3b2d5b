package com.tony.leagueAnalytics.service;

import com.tony.leagueAnalytics.config.CalibrationProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Solveur d'offsets par moyennes itératives amorties, sur un graphe de comparaisons
 * creux (et possiblement non connexe). Les offsets sont recentrés sur 0 à chaque passe.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OffsetSolver {

    private final CalibrationProperties properties;

    /**
     * @param ids         contextes à caler (divisions ou ligues)
     * @param differences écarts de win% observés par paire
     * @return offset par contexte, somme nulle. Tout à 0 sans données.
     */
    public Map<String, Double> solve(List<String> ids, PairDifferences differences) {
        Map<String, Double> offsets = new LinkedHashMap<>();
        ids.forEach(id -> offsets.put(id, 0.0));
        if (ids.isEmpty() || differences.isEmpty()) return offsets;

        double damping = properties.getDamping();
        for (int iter = 0; iter < properties.getSolverIterations(); iter++) {
            Map<String, Double> target = new LinkedHashMap<>();
            Map<String, Integer> counts = new LinkedHashMap<>();
            ids.forEach(id -> {
                target.put(id, 0.0);
                counts.put(id, 0);
            });

            differences.averages().forEach((pair, avgDiff) -> {
                if (!target.containsKey(pair.first()) || !target.containsKey(pair.second())) return;
                // On gagne plus dans "first" : on le corrige vers le bas, "second" vers le haut
                target.merge(pair.first(), -avgDiff / 2, Double::sum);
                target.merge(pair.second(), avgDiff / 2, Double::sum);
                counts.merge(pair.first(), 1, Integer::sum);
                counts.merge(pair.second(), 1, Integer::sum);
            });

            for (String id : ids) {
                int count = counts.get(id);
                if (count > 0) {
                    offsets.put(id, offsets.get(id) * damping + (target.get(id) / count) * (1 - damping));
                }
            }
            recenter(offsets);
            log.debug("🔧 Itération {} : {}", iter + 1, offsets);
        }
        return offsets;
    }

    static void recenter(Map<String, Double> offsets) {
        if (offsets.isEmpty()) return;
        double mean = offsets.values().stream().mapToDouble(Double::doubleValue).sum() / offsets.size();
        offsets.replaceAll((id, v) -> v - mean);
    }

    /**
     * Paire non ordonnée de contextes, toujours stockée dans l'ordre alphabétique.
     */
    public record Pair(String first, String second) {

        public static Pair of(String a, String b) {
            return a.compareTo(b) <= 0 ? new Pair(a, b) : new Pair(b, a);
        }
    }

    /**
     * Écarts observés par paire, orientés "first - second" quel que soit l'ordre d'ajout.
     */
    public static final class PairDifferences {

        private final Map<Pair, List<Double>> observations = new LinkedHashMap<>();

        /**
         * Enregistre pctA - pctB pondéré par la confiance du rapprochement. Ignoré si a == b.
         */
        public void add(String a, double pctA, String b, double pctB, double weight) {
            if (a.equals(b)) return;
            Pair pair = Pair.of(a, b);
            double diff = pair.first().equals(a) ? pctA - pctB : pctB - pctA;
            observations.computeIfAbsent(pair, k -> new ArrayList<>()).add(diff * weight);
        }

        public boolean isEmpty() {
            return observations.isEmpty();
        }

        public int pairCount() {
            return observations.size();
        }

        public Map<Pair, Double> averages() {
            Map<Pair, Double> averages = new LinkedHashMap<>();
            observations.forEach((pair, diffs) ->
                    averages.put(pair, diffs.stream().mapToDouble(Double::doubleValue).average().orElse(0.0)));
            return averages;
        }
    }
}
