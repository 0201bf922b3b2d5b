package com.tony.leagueAnalytics.service;

import com.tony.leagueAnalytics.config.CalibrationProperties;
import com.tony.leagueAnalytics.model.BridgeContext;
import com.tony.leagueAnalytics.model.BridgePlayer;
import com.tony.leagueAnalytics.model.Division;
import com.tony.leagueAnalytics.model.DivisionStrength;
import com.tony.leagueAnalytics.model.LeagueSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Calage des divisions d'une ligue grâce aux joueurs-ponts.
 * Offset = correction ajoutée à un win% obtenu dans la division : négatif là où l'on gagne
 * plus facilement, positif là où c'est plus dur.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DivisionStrengthService {

    private static final Pattern SUPER_DIVISION = Pattern.compile("super\\s+division\\s+(\\d+)");
    private static final Pattern WOMENS_DIVISION = Pattern.compile("women'?s\\s+division\\s+(\\d+)");
    private static final Pattern DIVISION = Pattern.compile("division\\s+(\\d+)");

    private final OffsetSolver solver;
    private final CalibrationProperties properties;

    public List<DivisionStrength> calculate(String leagueId, LeagueSnapshot snapshot, List<BridgePlayer> bridgePlayers) {
        List<String> codes = new ArrayList<>(snapshot.divisions().keySet());
        if (codes.isEmpty()) return List.of();

        OffsetSolver.PairDifferences differences = new OffsetSolver.PairDifferences();
        int usable = 0;
        int samples = 0;

        for (Map.Entry<List<BridgeContext>, Double> bp : distinctPlayers(leagueId, bridgePlayers).entrySet()) {
            List<BridgeContext> contexts = bp.getKey().stream()
                    .filter(c -> c.played() >= properties.getMinGamesPerContext())
                    .toList();
            Set<String> divisions = new HashSet<>();
            contexts.forEach(c -> divisions.add(c.division()));
            if (divisions.size() < 2) continue;
            usable++;

            for (int i = 0; i < contexts.size(); i++) {
                for (int j = i + 1; j < contexts.size(); j++) {
                    BridgeContext a = contexts.get(i);
                    BridgeContext b = contexts.get(j);
                    if (a.division().equals(b.division())) continue;
                    differences.add(a.division(), a.winPct(), b.division(), b.winPct(), bp.getValue());
                    samples += a.played() + b.played();
                }
            }
        }

        Map<String, Double> solved = solver.solve(codes, differences);
        double confidence = Math.min(1.0, (double) usable / properties.getBridgePlayersForFullConfidence());

        if (usable == 0) {
            log.warn("⚠️ Aucun joueur-pont exploitable dans {} : table de repli par palier", leagueId);
        }

        Map<String, Double> offsets = new LinkedHashMap<>();
        for (String code : codes) {
            double tierOffset = tierOffset(code, snapshot.divisions().get(code));
            double offset = solved.get(code);
            if (confidence < properties.getConfidenceFloor()) {
                offset = tierOffset;
            } else if (confidence < 1.0) {
                offset = confidence * offset + (1 - confidence) * tierOffset;
            }
            offsets.put(code, offset);
        }
        OffsetSolver.recenter(offsets);

        List<DivisionStrength> strengths = new ArrayList<>();
        for (String code : codes) {
            strengths.add(new DivisionStrength(code, leagueId, offsets.get(code), confidence, usable, samples));
        }

        log.info("📊 Divisions calées pour {} : {} joueurs-ponts, confiance {}", leagueId, usable, confidence);
        return strengths;
    }

    /**
     * Un même joueur peut revenir deux fois (pont interne et pont inter-ligues) avec les mêmes
     * contextes dans la ligue : une seule entrée par jeu de contextes, meilleure confiance retenue.
     */
    static Map<List<BridgeContext>, Double> distinctPlayers(String leagueId, List<BridgePlayer> bridgePlayers) {
        Map<List<BridgeContext>, Double> distinct = new LinkedHashMap<>();
        for (BridgePlayer bp : bridgePlayers) {
            List<BridgeContext> contexts = bp.contextsIn(leagueId);
            if (contexts.isEmpty()) continue;
            distinct.merge(contexts, bp.matchConfidence(), Math::max);
        }
        return distinct;
    }

    /**
     * Offset de repli : (multiplicateur du palier - 1) x échelle.
     */
    double tierOffset(String code, Division division) {
        return (tierMultiplier(code, division) - 1.0) * properties.getTierOffsetScale();
    }

    /**
     * Palier retrouvé par le code de division, sinon par son nom ("Premier", "Division 2"...).
     */
    double tierMultiplier(String code, Division division) {
        Double byCode = lookupTier(code);
        if (byCode != null) return byCode;

        String tier = division != null ? tierFromName(division.name()) : null;
        Double byName = tier != null ? lookupTier(tier) : null;
        return byName != null ? byName : properties.getDefaultTierMultiplier();
    }

    static String tierFromName(String name) {
        if (name == null) return null;
        String n = name.toLowerCase(Locale.ROOT);
        if (n.contains("premier")) return "PREM";

        Matcher m = SUPER_DIVISION.matcher(n);
        if (m.find()) return "SD" + m.group(1);
        m = WOMENS_DIVISION.matcher(n);
        if (m.find()) return "WD" + m.group(1);
        m = DIVISION.matcher(n);
        if (m.find()) return "D" + m.group(1);
        return null;
    }

    private Double lookupTier(String key) {
        if (key == null) return null;
        for (Map.Entry<String, Double> e : properties.getTierMultipliers().entrySet()) {
            if (e.getKey().equalsIgnoreCase(key)) return e.getValue();
        }
        return null;
    }
}
