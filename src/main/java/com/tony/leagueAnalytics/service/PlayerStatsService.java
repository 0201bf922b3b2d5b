package com.tony.leagueAnalytics.service;

import com.tony.leagueAnalytics.model.EffectivePct;
import com.tony.leagueAnalytics.model.LeaguePlayer;
import com.tony.leagueAnalytics.model.LeagueSnapshot;
import com.tony.leagueAnalytics.model.PlayerSeason;
import com.tony.leagueAnalytics.model.PlayerSeasonStats;
import com.tony.leagueAnalytics.model.PriorPlayerStats;
import com.tony.leagueAnalytics.model.TeamPlayer;
import com.tony.leagueAnalytics.util.BayesianStats;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Service
@RequiredArgsConstructor
public class PlayerStatsService {

    // Frames minimum sur la saison en cours avant de préférer ces stats à la saison précédente
    static final int MIN_CURRENT_GAMES = 3;

    private static final Comparator<TeamPlayer> BY_EFFECTIVE_PCT = (a, b) -> {
        EffectivePct ea = effectivePctOf(a);
        EffectivePct eb = effectivePctOf(b);
        if (ea == null && eb == null) return 0;
        if (ea == null) return 1;
        if (eb == null) return -1;
        return Double.compare(eb.adjustedPct(), ea.adjustedPct());
    };

    private final StandingsService standingsService;

    /**
     * Effectif inscrit + joueurs ayant joué pour l'équipe cette saison,
     * triés par win% effectif (les joueurs sans stats à la fin).
     */
    public List<TeamPlayer> teamPlayers(String team, LeagueSnapshot snapshot) {
        String division = standingsService.divisionOf(team, snapshot);
        if (division == null) return List.of();

        List<String> roster = snapshot.roster(division, team);
        Set<String> names = new LinkedHashSet<>(roster);
        snapshot.currentPlayers().forEach((name, season) -> {
            if (season.contextFor(team).isPresent()) names.add(name);
        });

        List<TeamPlayer> players = new ArrayList<>();
        for (String name : names) {
            PlayerSeason season = snapshot.currentPlayers().get(name);
            PlayerSeasonStats current = season != null ? season.contextFor(team).orElse(null) : null;
            players.add(new TeamPlayer(name, snapshot.priorPlayers().get(name), current, roster.contains(name)));
        }
        players.sort(BY_EFFECTIVE_PCT);
        return players;
    }

    /**
     * Joueur hors équipe (ex: recrue hypothétique) : on retient son contexte le plus joué.
     */
    public TeamPlayer externalPlayer(String name, LeagueSnapshot snapshot) {
        PlayerSeason season = snapshot.currentPlayers().get(name);
        PlayerSeasonStats best = season == null ? null : season.contexts().stream()
                .max(Comparator.comparingInt(PlayerSeasonStats::played))
                .orElse(null);
        return new TeamPlayer(name, snapshot.priorPlayers().get(name), best, false);
    }

    public EffectivePct effectivePct(TeamPlayer player) {
        return effectivePctOf(player);
    }

    /**
     * Saison en cours si au moins 3 frames, sinon saison précédente, sinon null.
     */
    static EffectivePct effectivePctOf(TeamPlayer player) {
        PlayerSeasonStats current = player.current();
        if (current != null && current.played() >= MIN_CURRENT_GAMES) {
            return new EffectivePct(current.winPct(), current.adjustedPct(), current.played(), current.won(),
                    EffectivePct.Source.CURRENT);
        }
        PriorPlayerStats prior = player.prior();
        if (prior != null && prior.played() > 0) {
            int wins = (int) Math.round(prior.winRate() * prior.played());
            return new EffectivePct(prior.winRate() * 100.0, BayesianStats.adjustedPct(wins, prior.played()),
                    prior.played(), wins, EffectivePct.Source.PRIOR);
        }
        return null;
    }

    /**
     * Les N meilleurs joueurs notés (win% bayésien décroissant).
     */
    public List<TeamPlayer> topPlayers(List<TeamPlayer> players, int n) {
        return players.stream()
                .filter(p -> effectivePctOf(p) != null)
                .sorted(BY_EFFECTIVE_PCT)
                .limit(n)
                .toList();
    }

    /**
     * Tous les joueurs connus de la ligue (saison précédente et/ou en cours).
     */
    public List<LeaguePlayer> leaguePlayers(LeagueSnapshot snapshot) {
        Set<String> names = new LinkedHashSet<>(snapshot.priorPlayers().keySet());
        names.addAll(snapshot.currentPlayers().keySet());

        return names.stream()
                .map(name -> {
                    PriorPlayerStats prior = snapshot.priorPlayers().get(name);
                    PlayerSeason season = snapshot.currentPlayers().get(name);
                    PlayerSeason.PlayerTotals total = season != null ? season.total() : null;
                    return new LeaguePlayer(name,
                            prior != null ? prior.rating() : null,
                            season != null ? season.contexts().stream().map(PlayerSeasonStats::team).toList() : List.of(),
                            total != null ? total.winPct() : null,
                            total != null ? total.played() : null,
                            total != null ? total.adjustedPct() : null);
                })
                .sorted(Comparator.comparingDouble((LeaguePlayer p) -> p.adjustedPct() != null ? p.adjustedPct() : 0.0)
                        .reversed())
                .toList();
    }
}
