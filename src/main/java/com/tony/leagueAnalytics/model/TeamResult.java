package com.tony.leagueAnalytics.model;

public record TeamResult(MatchResult result, boolean home, String opponent,
                         int teamScore, int opponentScore, MatchOutcome outcome) {

    public static TeamResult of(MatchResult r, String team) {
        boolean home = r.homeTeam().equals(team);
        int scored = home ? r.homeScore() : r.awayScore();
        int conceded = home ? r.awayScore() : r.homeScore();
        return new TeamResult(r, home, home ? r.awayTeam() : r.homeTeam(), scored, conceded,
                MatchOutcome.of(scored, conceded));
    }
}
