package com.tony.leagueAnalytics.model;

import com.tony.leagueAnalytics.util.BayesianStats;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Saison en cours d'un joueur : un contexte par équipe/division.
 */
public record PlayerSeason(String name, List<PlayerSeasonStats> contexts) {

    public PlayerSeason {
        Objects.requireNonNull(name, "name");
        contexts = contexts == null ? List.of() : List.copyOf(contexts);
    }

    public static PlayerSeason of(String name, PlayerSeasonStats... contexts) {
        return new PlayerSeason(name, List.of(contexts));
    }

    public Optional<PlayerSeasonStats> contextFor(String team) {
        return contexts.stream().filter(c -> team.equals(c.team())).findFirst();
    }

    /** Contextes de championnat (hors coupe). */
    public List<PlayerSeasonStats> leagueContexts() {
        return contexts.stream().filter(c -> !c.cup()).toList();
    }

    /** Agrégat hors coupe. */
    public PlayerTotals total() {
        int played = 0;
        int won = 0;
        for (PlayerSeasonStats c : leagueContexts()) {
            played += c.played();
            won += c.won();
        }
        return new PlayerTotals(played, won, BayesianStats.rawPct(won, played));
    }

    public record PlayerTotals(int played, int won, double winPct) {
        public double adjustedPct() {
            return BayesianStats.adjustedPct(won, played);
        }
    }
}
