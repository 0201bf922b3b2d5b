package com.tony.leagueAnalytics.model;

import com.tony.leagueAnalytics.util.LeagueDates;

import java.time.LocalDate;
import java.util.Objects;

/**
 * Match terminé. Jamais modifié : une correction remplace l'enregistrement entier.
 */
public record MatchResult(String homeTeam, String awayTeam, int homeScore, int awayScore,
                          String division, LocalDate date) {

    public MatchResult {
        Objects.requireNonNull(homeTeam, "homeTeam");
        Objects.requireNonNull(awayTeam, "awayTeam");
        Objects.requireNonNull(date, "date");
    }

    public static MatchResult of(String homeTeam, String awayTeam, int homeScore, int awayScore,
                                 String division, String date) {
        return new MatchResult(homeTeam, awayTeam, homeScore, awayScore, division, LeagueDates.parse(date));
    }

    public boolean involves(String team) {
        return homeTeam.equals(team) || awayTeam.equals(team);
    }

    public MatchScore score() {
        return new MatchScore(homeScore, awayScore);
    }
}
