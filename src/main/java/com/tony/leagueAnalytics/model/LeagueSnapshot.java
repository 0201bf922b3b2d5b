package com.tony.leagueAnalytics.model;

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Photographie complète d'une ligue, passée explicitement à chaque calcul.
 * Aucune donnée "par défaut" n'existe ailleurs.
 *
 * @param rosters clé "division:équipe" vers la liste des joueurs inscrits
 */
@Builder(toBuilder = true)
public record LeagueSnapshot(Map<String, Division> divisions,
                             List<MatchResult> results,
                             List<Fixture> fixtures,
                             List<FrameRecord> frames,
                             Map<String, PriorPlayerStats> priorPlayers,
                             Map<String, PlayerSeason> currentPlayers,
                             Map<String, List<String>> rosters) {

    public LeagueSnapshot {
        divisions = copy(divisions);
        results = results == null ? List.of() : List.copyOf(results);
        fixtures = fixtures == null ? List.of() : List.copyOf(fixtures);
        frames = frames == null ? List.of() : List.copyOf(frames);
        priorPlayers = copy(priorPlayers);
        currentPlayers = copy(currentPlayers);
        rosters = copy(rosters);
    }

    public static String rosterKey(String division, String team) {
        return division + ":" + team;
    }

    public List<String> roster(String division, String team) {
        return rosters.getOrDefault(rosterKey(division, team), List.of());
    }

    private static <V> Map<String, V> copy(Map<String, V> source) {
        return source == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }
}
