package com.tony.leagueAnalytics.service;

import com.tony.leagueAnalytics.model.Division;
import com.tony.leagueAnalytics.model.Fixture;
import com.tony.leagueAnalytics.model.LeagueSnapshot;
import com.tony.leagueAnalytics.model.MatchResult;
import com.tony.leagueAnalytics.model.MatchScore;
import com.tony.leagueAnalytics.model.StandingEntry;
import com.tony.leagueAnalytics.model.TeamResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
@Slf4j
public class StandingsService {

    /** Points (Desc) -> Différence de frames (Desc). */
    public static final Comparator<StandingEntry> STANDINGS_ORDER = Comparator
            .comparingInt(StandingEntry::points).reversed()
            .thenComparing(Comparator.comparingInt(StandingEntry::difference).reversed());

    public String divisionOf(String team, LeagueSnapshot snapshot) {
        return snapshot.divisions().values().stream()
                .filter(d -> d.teams().contains(team))
                .map(Division::code)
                .findFirst()
                .orElse(null);
    }

    /**
     * Classement d'une division. Seuls comptent les résultats dont les deux équipes
     * appartiennent à la division. Division inconnue = liste vide.
     */
    public List<StandingEntry> calculateStandings(String divisionCode, LeagueSnapshot snapshot) {
        Division division = snapshot.divisions().get(divisionCode);
        if (division == null) return List.of();

        Map<String, Tally> table = new LinkedHashMap<>();
        division.teams().forEach(t -> table.put(t, new Tally()));

        for (MatchResult r : snapshot.results()) {
            Tally home = table.get(r.homeTeam());
            Tally away = table.get(r.awayTeam());
            if (home == null || away == null) continue;

            MatchScore score = r.score();
            home.add(r.homeScore(), r.awayScore(), score.homePoints());
            away.add(r.awayScore(), r.homeScore(), score.awayPoints());
        }

        List<StandingEntry> standings = new ArrayList<>();
        table.forEach((team, t) -> standings.add(t.toEntry(team)));
        standings.sort(STANDINGS_ORDER);

        log.debug("🏆 Classement {} calculé ({} équipes)", divisionCode, standings.size());
        return standings;
    }

    public LocalDate latestResultDate(List<MatchResult> results) {
        return results.stream().map(MatchResult::date).max(Comparator.naturalOrder()).orElse(null);
    }

    /**
     * Matchs restant à jouer : strictement après le dernier résultat connu DE LA DIVISION.
     */
    public List<Fixture> remainingFixtures(String divisionCode, LeagueSnapshot snapshot) {
        List<MatchResult> divisionResults = snapshot.results().stream()
                .filter(r -> divisionCode.equals(r.division()))
                .toList();
        LocalDate latest = latestResultDate(divisionResults);

        return snapshot.fixtures().stream()
                .filter(f -> divisionCode.equals(f.division()))
                .filter(f -> latest == null || f.date().isAfter(latest))
                .toList();
    }

    public List<Fixture> allRemainingFixtures(LeagueSnapshot snapshot) {
        List<Fixture> remaining = new ArrayList<>();
        for (String code : snapshot.divisions().keySet()) {
            remaining.addAll(remainingFixtures(code, snapshot));
        }
        return remaining;
    }

    /**
     * Tous les matchs d'une équipe, du plus récent au plus ancien.
     */
    public List<TeamResult> teamResults(String team, LeagueSnapshot snapshot) {
        return teamResults(team, snapshot.results());
    }

    public List<TeamResult> teamResults(String team, List<MatchResult> results) {
        return results.stream()
                .filter(r -> r.involves(team))
                .sorted(Comparator.comparing(MatchResult::date).reversed())
                .map(r -> TeamResult.of(r, team))
                .toList();
    }

    private static final class Tally {
        int played;
        int won;
        int drawn;
        int lost;
        int framesFor;
        int framesAgainst;
        int points;

        void add(int scored, int conceded, int pts) {
            played++;
            framesFor += scored;
            framesAgainst += conceded;
            points += pts;
            if (scored > conceded) won++;
            else if (scored == conceded) drawn++;
            else lost++;
        }

        StandingEntry toEntry(String team) {
            return new StandingEntry(team, played, won, drawn, lost, framesFor, framesAgainst, points);
        }
    }
}
