package com.tony.leagueAnalytics.service;

import com.tony.leagueAnalytics.config.PredictionProperties;
import com.tony.leagueAnalytics.model.Division;
import com.tony.leagueAnalytics.model.EffectivePct;
import com.tony.leagueAnalytics.model.LeagueSnapshot;
import com.tony.leagueAnalytics.model.SquadOverride;
import com.tony.leagueAnalytics.model.TeamPlayer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Mercato hypothétique : impact d'ajouts / retraits de joueurs sur la force d'une équipe.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SquadStrengthService {

    private final PlayerStatsService playerStatsService;
    private final PredictionProperties properties;

    /**
     * Moyenne des win% bayésiens effectifs (en %), pondérée par frames jouées.
     * topN null ou <= 0 = tout l'effectif. Null si aucun joueur noté.
     */
    public Double squadStrength(String team, Integer topN, LeagueSnapshot snapshot) {
        List<TeamPlayer> players = playerStatsService.teamPlayers(team, snapshot);
        if (players.isEmpty()) return null;
        return weightedStrength(players, topN);
    }

    public Double modifiedSquadStrength(String team, SquadOverride override, Integer topN, LeagueSnapshot snapshot) {
        if (override == null) return squadStrength(team, topN, snapshot);

        Set<String> removed = new HashSet<>(override.removed());
        List<TeamPlayer> players = new ArrayList<>(playerStatsService.teamPlayers(team, snapshot).stream()
                .filter(p -> !removed.contains(p.name()))
                .toList());
        override.added().forEach(name -> players.add(playerStatsService.externalPlayer(name, snapshot)));

        return weightedStrength(players, topN);
    }

    /**
     * Ajustement de force par équipe modifiée : (modifiée - originale) ramenée à l'échelle de force.
     */
    public Map<String, Double> strengthAdjustments(String divisionCode, Map<String, SquadOverride> overrides,
                                                   Integer topN, LeagueSnapshot snapshot) {
        Map<String, Double> adjustments = new LinkedHashMap<>();
        Division division = snapshot.divisions().get(divisionCode);
        if (division == null || overrides == null || overrides.isEmpty()) return adjustments;

        for (String team : division.teams()) {
            SquadOverride override = overrides.get(team);
            if (override == null) continue;

            Double original = squadStrength(team, topN, snapshot);
            Double modified = modifiedSquadStrength(team, override, topN, snapshot);
            if (original != null && modified != null) {
                double adj = (modified - original) / 100.0 * properties.getStrengthScale();
                adjustments.put(team, adj);
                log.debug("🔁 Effectif modifié pour {} : {} -> {} (ajustement {})", team, original, modified, adj);
            }
        }
        return adjustments;
    }

    private Double weightedStrength(List<TeamPlayer> players, Integer topN) {
        List<TeamPlayer> pool = (topN != null && topN > 0) ? playerStatsService.topPlayers(players, topN) : players;

        double totalWeight = 0;
        double weightedPct = 0;
        for (TeamPlayer p : pool) {
            EffectivePct e = playerStatsService.effectivePct(p);
            if (e != null) {
                weightedPct += e.adjustedPct() * e.weight();
                totalWeight += e.weight();
            }
        }
        return totalWeight == 0 ? null : weightedPct / totalWeight;
    }
}
