package com.tony.leagueAnalytics.service;

import com.tony.leagueAnalytics.config.LineupProperties;
import com.tony.leagueAnalytics.model.AppearanceCategory;
import com.tony.leagueAnalytics.model.BreakAndDishStats;
import com.tony.leagueAnalytics.model.Frame;
import com.tony.leagueAnalytics.model.FrameRecord;
import com.tony.leagueAnalytics.model.LeagueSnapshot;
import com.tony.leagueAnalytics.model.MatchOutcome;
import com.tony.leagueAnalytics.model.MatchResult;
import com.tony.leagueAnalytics.model.PlayerAppearance;
import com.tony.leagueAnalytics.model.PlayerSeason;
import com.tony.leagueAnalytics.model.PlayerSeasonStats;
import com.tony.leagueAnalytics.model.PredictedLineup;
import com.tony.leagueAnalytics.model.RatedPlayer;
import com.tony.leagueAnalytics.model.ScoutingReport;
import com.tony.leagueAnalytics.model.SetPerformance;
import com.tony.leagueAnalytics.model.SetRecord;
import com.tony.leagueAnalytics.model.TeamHomeAwaySplit;
import com.tony.leagueAnalytics.model.TeamPlayer;
import com.tony.leagueAnalytics.model.TeamResult;
import com.tony.leagueAnalytics.model.TeamVenueRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
public class TeamAnalyticsService {

    private static final int SET_BOUNDARY_FRAME = 5;
    private static final int FORM_MATCHES = 5;
    private static final int HIGHLIGHTED_PLAYERS = 3;
    private static final double CORE_RATE = 0.75;
    private static final double ROTATION_RATE = 0.4;

    private final StandingsService standingsService;
    private final PlayerStatsService playerStatsService;
    private final LineupInsightService insightService;
    private final LineupProperties lineupProperties;

    /**
     * Set 1 = frames 1-5, set 2 = frames 6-10. Null sans feuille de match.
     */
    public SetPerformance setPerformance(String team, List<FrameRecord> frames) {
        int set1Played = 0, set1Won = 0, set2Played = 0, set2Won = 0;

        for (FrameRecord match : frames) {
            if (!match.involves(team)) continue;
            for (Frame f : match.frames()) {
                boolean won = PlayerAnalyticsService.teamWon(match, f, team);
                if (f.frameNumber() <= SET_BOUNDARY_FRAME) {
                    set1Played++;
                    if (won) set1Won++;
                } else {
                    set2Played++;
                    if (won) set2Won++;
                }
            }
        }

        if (set1Played == 0 && set2Played == 0) return null;
        SetRecord set1 = SetRecord.of(set1Played, set1Won);
        SetRecord set2 = SetRecord.of(set2Played, set2Won);
        return new SetPerformance(team, set1, set2, set1.pct() - set2.pct());
    }

    public TeamHomeAwaySplit homeAwaySplit(String team, List<MatchResult> results) {
        VenueTally home = new VenueTally();
        VenueTally away = new VenueTally();
        for (MatchResult r : results) {
            if (!r.involves(team)) continue;
            TeamResult tr = TeamResult.of(r, team);
            (tr.home() ? home : away).add(tr);
        }
        return new TeamHomeAwaySplit(team, home.toRecord(), away.toRecord());
    }

    /**
     * 5 derniers résultats, le plus récent en premier.
     */
    public List<MatchOutcome> teamForm(String team, List<MatchResult> results) {
        return standingsService.teamResults(team, results).stream()
                .limit(FORM_MATCHES)
                .map(TeamResult::outcome)
                .toList();
    }

    /**
     * Break-and-dish d'un joueur (player non null) ou de toute une équipe, limité à une division si fournie.
     */
    public BreakAndDishStats breakAndDishStats(String player, String team, LeagueSnapshot snapshot, String division) {
        int played = 0, bdFor = 0, bdAgainst = 0, forfeits = 0;

        Map<String, PlayerSeason> pool = new LinkedHashMap<>();
        if (player != null) {
            PlayerSeason season = snapshot.currentPlayers().get(player);
            if (season != null) pool.put(player, season);
        } else {
            pool.putAll(snapshot.currentPlayers());
        }

        for (PlayerSeason season : pool.values()) {
            for (PlayerSeasonStats c : season.contexts()) {
                if (player == null && !c.team().equals(team)) continue;
                if (division != null && !division.equals(c.division())) continue;
                played += c.played();
                bdFor += c.breakAndDishFor();
                bdAgainst += c.breakAndDishAgainst();
                forfeits += c.forfeits();
            }
        }
        return new BreakAndDishStats(player != null ? player : team, played, bdFor, bdAgainst, forfeits);
    }

    /**
     * Taux de présence par joueur (un match = un identifiant de feuille).
     */
    public List<PlayerAppearance> appearanceRates(String team, List<FrameRecord> frames) {
        Set<String> matches = new HashSet<>();
        Map<String, Set<String>> appearances = new LinkedHashMap<>();

        for (FrameRecord match : frames) {
            if (!match.involves(team)) continue;
            boolean home = team.equals(match.homeTeam());
            matches.add(match.matchId());
            for (Frame f : match.frames()) {
                String player = home ? f.homePlayer() : f.awayPlayer();
                appearances.computeIfAbsent(player, k -> new HashSet<>()).add(match.matchId());
            }
        }

        int total = matches.size();
        if (total == 0) return List.of();

        List<PlayerAppearance> result = new ArrayList<>();
        appearances.forEach((player, ids) -> {
            double rate = (double) ids.size() / total;
            AppearanceCategory category = rate >= CORE_RATE ? AppearanceCategory.CORE
                    : rate >= ROTATION_RATE ? AppearanceCategory.ROTATION
                    : AppearanceCategory.FRINGE;
            result.add(new PlayerAppearance(player, ids.size(), total, rate, category));
        });
        result.sort(Comparator.comparingDouble(PlayerAppearance::rate).reversed());
        return result;
    }

    /**
     * Composition probable : tous les joueurs alignés sur les N derniers matchs de l'équipe.
     */
    public PredictedLineup predictLineup(String team, List<FrameRecord> frames, int recentMatches) {
        List<FrameRecord> recent = PlayerAnalyticsService.byMostRecent(frames).stream()
                .filter(m -> m.involves(team))
                .limit(recentMatches)
                .toList();

        Set<String> players = new LinkedHashSet<>();
        for (FrameRecord match : recent) {
            boolean home = team.equals(match.homeTeam());
            match.frames().forEach(f -> players.add(home ? f.homePlayer() : f.awayPlayer()));
        }
        return new PredictedLineup(team, new ArrayList<>(players), recent.size());
    }

    public PredictedLineup predictLineup(String team, List<FrameRecord> frames) {
        return predictLineup(team, frames, lineupProperties.getOpponentRecentMatches());
    }

    /**
     * Rapport de scouting complet d'un adversaire.
     */
    public ScoutingReport scoutingReport(String team, String divisionCode, LeagueSnapshot snapshot) {
        List<FrameRecord> frames = snapshot.frames();
        List<TeamPlayer> players = playerStatsService.teamPlayers(team, snapshot);

        List<RatedPlayer> rated = players.stream()
                .filter(p -> p.current() != null && p.current().played() > 0)
                .map(p -> new RatedPlayer(p.name(), p.current().played(), p.current().winPct(), p.current().adjustedPct()))
                .sorted(Comparator.comparingDouble(RatedPlayer::adjustedPct).reversed())
                .toList();

        List<RatedPlayer> weakest = new ArrayList<>(rated.subList(Math.max(0, rated.size() - HIGHLIGHTED_PLAYERS), rated.size()));
        Collections.reverse(weakest);

        int games = 0;
        int forfeits = 0;
        for (TeamPlayer p : players) {
            if (p.current() == null) continue;
            games += p.current().played();
            forfeits += p.current().forfeits();
        }

        ScoutingReport report = ScoutingReport.builder()
                .team(team)
                .division(divisionCode)
                .form(teamForm(team, snapshot.results()))
                .homeAway(homeAwaySplit(team, snapshot.results()))
                .setPerformance(setPerformance(team, frames))
                .breakAndDish(breakAndDishStats(null, team, snapshot, divisionCode))
                .predictedLineup(predictLineup(team, frames))
                .appearances(appearanceRates(team, frames))
                .strongestPlayers(rated.stream().limit(HIGHLIGHTED_PLAYERS).toList())
                .weakestPlayers(weakest)
                .forfeitRate(games > 0 ? (double) forfeits / games : 0.0)
                .build();

        List<String> facts = insightService.scoutingFacts(report, frames);
        log.info("🔎 Scouting {} généré ({} faits clés)", team, facts.size());
        return report.toBuilder().keyFacts(facts).build();
    }

    private static final class VenueTally {
        int played, won, drawn, lost, framesFor, framesAgainst;

        void add(TeamResult r) {
            played++;
            framesFor += r.teamScore();
            framesAgainst += r.opponentScore();
            switch (r.outcome()) {
                case WIN -> won++;
                case DRAW -> drawn++;
                case LOSS -> lost++;
            }
        }

        TeamVenueRecord toRecord() {
            return new TeamVenueRecord(played, won, drawn, lost, framesFor, framesAgainst);
        }
    }
}
