package com.tony.leagueAnalytics.service;

import com.tony.leagueAnalytics.model.AdjustedRating;
import com.tony.leagueAnalytics.model.BridgePlayer;
import com.tony.leagueAnalytics.model.CalibrationResult;
import com.tony.leagueAnalytics.model.LeagueSnapshot;
import com.tony.leagueAnalytics.model.LeagueStrength;
import com.tony.leagueAnalytics.model.PlayerIdentity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Chaîne complète de calage : joueurs-ponts -> divisions -> ligues -> notes ajustées.
 * Tout est recalculé de zéro à chaque appel.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CalibrationOrchestrator {

    private final BridgePlayerService bridgePlayerService;
    private final LeagueStrengthService leagueStrengthService;
    private final AdjustedRatingService adjustedRatingService;

    public CalibrationResult calibrate(Map<String, LeagueSnapshot> leagues, Map<String, PlayerIdentity> identities) {
        log.info("🔄 Calage de {} ligues...", leagues.size());

        List<BridgePlayer> bridges = bridgePlayerService.findAll(leagues, identities);
        Map<String, LeagueStrength> strengths = leagueStrengthService.calculate(leagues, bridges);

        log.info("✅ Calage terminé : {} joueurs-ponts, {} ligues", bridges.size(), strengths.size());
        return new CalibrationResult(bridges, strengths);
    }

    public AdjustedRating ratePlayer(String player, String leagueId, String divisionCode,
                                     Map<String, LeagueSnapshot> leagues, CalibrationResult calibration) {
        LeagueSnapshot snapshot = leagues.get(leagueId);
        if (snapshot == null) return null;
        return adjustedRatingService.playerRating(player, leagueId, divisionCode, snapshot, calibration.leagues());
    }

    public AdjustedRating rateTeam(String team, String leagueId, String divisionCode,
                                   Map<String, LeagueSnapshot> leagues, CalibrationResult calibration) {
        LeagueSnapshot snapshot = leagues.get(leagueId);
        if (snapshot == null) return null;
        return adjustedRatingService.teamRating(team, leagueId, divisionCode, snapshot, calibration.leagues());
    }

    /**
     * Note ajustée de chaque joueur dans chacune de ses divisions de championnat, toutes ligues confondues.
     */
    public List<AdjustedRating> rateAllPlayers(Map<String, LeagueSnapshot> leagues, CalibrationResult calibration) {
        List<AdjustedRating> ratings = new ArrayList<>();
        leagues.forEach((leagueId, snapshot) -> snapshot.currentPlayers().forEach((name, season) -> {
            Set<String> divisions = new LinkedHashSet<>();
            season.leagueContexts().forEach(c -> divisions.add(c.division()));
            for (String division : divisions) {
                AdjustedRating rating = adjustedRatingService.playerRating(name, leagueId, division, snapshot,
                        calibration.leagues());
                if (rating != null) ratings.add(rating);
            }
        }));
        return ratings;
    }

    public Map<String, Double> globalPercentiles(List<AdjustedRating> ratings) {
        return adjustedRatingService.globalPercentiles(ratings);
    }
}
