package com.tony.leagueAnalytics.service;

import com.tony.leagueAnalytics.config.PredictionProperties;
import com.tony.leagueAnalytics.model.LeagueSnapshot;
import com.tony.leagueAnalytics.model.PriorPlayerStats;
import com.tony.leagueAnalytics.model.StandingEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
public class StrengthEstimatorService {

    private final StandingsService standingsService;
    private final PredictionProperties properties;

    /**
     * Force de chaque équipe d'une division (échelle symétrique, 0 = moyenne).
     * Force actuelle = différence de frames par match, mélangée avec une force "a priori"
     * (saison précédente des joueurs) tant que l'équipe a moins de priorBlendMatches matchs.
     */
    public Map<String, Double> calculateTeamStrengths(String divisionCode, LeagueSnapshot snapshot) {
        List<StandingEntry> standings = standingsService.calculateStandings(divisionCode, snapshot);
        Map<String, Double> strengths = new LinkedHashMap<>();

        for (StandingEntry s : standings) {
            double current = currentStrength(s);
            double blendWeight = Math.min(1.0, (double) s.played() / properties.getPriorBlendMatches());

            if (blendWeight < 1.0) {
                double prior = priorTeamStrength(s.team(), divisionCode, snapshot);
                strengths.put(s.team(), (1 - blendWeight) * prior + blendWeight * current);
            } else {
                strengths.put(s.team(), current);
            }
        }

        log.debug("💪 Forces calculées pour {} : {}", divisionCode, strengths);
        return strengths;
    }

    double currentStrength(StandingEntry s) {
        if (s.played() == 0) return 0.0;
        return ((double) s.difference() / s.played() / properties.getFramesPerMatch()) * 2;
    }

    /**
     * Moyenne des win% de la saison précédente des joueurs liés à l'équipe (effectif + joueurs
     * ayant joué pour elle cette saison), pondérée par les frames jouées.
     * Un inconnu compte pour unknownPlayerPrior sur unknownPlayerWeight pseudo-frames.
     */
    public double priorTeamStrength(String team, String divisionCode, LeagueSnapshot snapshot) {
        Set<String> players = new LinkedHashSet<>(snapshot.roster(divisionCode, team));
        snapshot.currentPlayers().forEach((name, season) -> {
            if (season.contextFor(team).isPresent()) players.add(name);
        });

        double totalWeight = 0.0;
        double weightedPct = 0.0;
        for (String name : players) {
            PriorPlayerStats prior = snapshot.priorPlayers().get(name);
            if (prior != null && prior.played() > 0) {
                totalWeight += prior.played();
                weightedPct += prior.winRate() * prior.played();
            } else {
                totalWeight += properties.getUnknownPlayerWeight();
                weightedPct += properties.getUnknownPlayerPrior() * properties.getUnknownPlayerWeight();
            }
        }

        if (totalWeight == 0) return 0.0;
        return (weightedPct / totalWeight - 0.5) * properties.getStrengthScale();
    }
}
