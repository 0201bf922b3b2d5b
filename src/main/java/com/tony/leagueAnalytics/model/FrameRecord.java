package com.tony.leagueAnalytics.model;

import com.tony.leagueAnalytics.util.LeagueDates;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * Match décomposé frame par frame : seule source des analyses au niveau joueur.
 */
public record FrameRecord(String matchId, String homeTeam, String awayTeam, LocalDate date, List<Frame> frames) {

    public FrameRecord {
        Objects.requireNonNull(matchId, "matchId");
        Objects.requireNonNull(date, "date");
        frames = frames == null ? List.of() : List.copyOf(frames);
    }

    public static FrameRecord of(String matchId, String homeTeam, String awayTeam, String date, List<Frame> frames) {
        return new FrameRecord(matchId, homeTeam, awayTeam, LeagueDates.parse(date), frames);
    }

    public boolean involves(String team) {
        return team.equals(homeTeam) || team.equals(awayTeam);
    }
}
