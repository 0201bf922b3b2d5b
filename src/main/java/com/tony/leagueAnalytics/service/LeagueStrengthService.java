package com.tony.leagueAnalytics.service;

import com.tony.leagueAnalytics.config.CalibrationProperties;
import com.tony.leagueAnalytics.model.BridgeContext;
import com.tony.leagueAnalytics.model.BridgePlayer;
import com.tony.leagueAnalytics.model.DivisionStrength;
import com.tony.leagueAnalytics.model.LeagueSnapshot;
import com.tony.leagueAnalytics.model.LeagueStrength;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Calage inter-ligues : les effets de division sont retirés avant de comparer les ligues.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LeagueStrengthService {

    private final DivisionStrengthService divisionStrengthService;
    private final OffsetSolver solver;
    private final CalibrationProperties properties;

    public Map<String, LeagueStrength> calculate(Map<String, LeagueSnapshot> leagues, List<BridgePlayer> bridgePlayers) {
        Map<String, LeagueStrength> result = new LinkedHashMap<>();
        if (leagues.isEmpty()) return result;

        // 1. Calage des divisions de chaque ligue
        Map<String, List<DivisionStrength>> divisions = new LinkedHashMap<>();
        leagues.forEach((id, snapshot) -> divisions.put(id, divisionStrengthService.calculate(id, snapshot, bridgePlayers)));

        // 2. Écarts entre ligues sur les win% normalisés
        OffsetSolver.PairDifferences differences = new OffsetSolver.PairDifferences();
        int crossLeague = 0;

        for (BridgePlayer bp : bridgePlayers) {
            Map<String, List<BridgeContext>> byLeague = new LinkedHashMap<>();
            bp.contexts().forEach(c -> byLeague.computeIfAbsent(c.leagueId(), k -> new ArrayList<>()).add(c));
            if (byLeague.size() < 2) continue;
            crossLeague++;

            List<String> ids = new ArrayList<>(byLeague.keySet());
            for (int i = 0; i < ids.size(); i++) {
                for (int j = i + 1; j < ids.size(); j++) {
                    Double normA = normalizedRating(byLeague.get(ids.get(i)), divisions.get(ids.get(i)));
                    Double normB = normalizedRating(byLeague.get(ids.get(j)), divisions.get(ids.get(j)));
                    if (normA == null || normB == null) continue;
                    differences.add(ids.get(i), normA, ids.get(j), normB, bp.matchConfidence());
                }
            }
        }

        // 3. Résolution
        List<String> leagueIds = new ArrayList<>(leagues.keySet());
        Map<String, Double> offsets = solver.solve(leagueIds, differences);
        double confidence = Math.min(1.0, (double) crossLeague / properties.getBridgePlayersForFullConfidence());

        for (String id : leagueIds) {
            result.put(id, new LeagueStrength(id, offsets.get(id), confidence, crossLeague, divisions.get(id)));
        }

        log.info("🌍 {} ligues calées ({} joueurs-ponts inter-ligues, confiance {})", leagueIds.size(), crossLeague, confidence);
        return result;
    }

    /**
     * Win% moyen du joueur dans une ligue, corrigé de l'offset de chaque division,
     * pondéré par frames jouées (contextes d'au moins minGamesPerContext frames).
     */
    Double normalizedRating(List<BridgeContext> contexts, List<DivisionStrength> divisions) {
        double weighted = 0;
        int games = 0;
        for (BridgeContext c : contexts) {
            if (c.played() < properties.getMinGamesPerContext()) continue;
            weighted += (c.winPct() + divisionOffset(divisions, c.division())) * c.played();
            games += c.played();
        }
        return games == 0 ? null : weighted / games;
    }

    private double divisionOffset(List<DivisionStrength> divisions, String code) {
        if (divisions == null) return 0.0;
        return divisions.stream()
                .filter(d -> d.division().equals(code))
                .mapToDouble(DivisionStrength::offset)
                .findFirst()
                .orElse(0.0);
    }
}
