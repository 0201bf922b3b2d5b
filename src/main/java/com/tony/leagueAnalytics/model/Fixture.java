package com.tony.leagueAnalytics.model;

import com.tony.leagueAnalytics.util.LeagueDates;

import java.time.LocalDate;
import java.util.Objects;

public record Fixture(String homeTeam, String awayTeam, String division, LocalDate date) {

    public Fixture {
        Objects.requireNonNull(homeTeam, "homeTeam");
        Objects.requireNonNull(awayTeam, "awayTeam");
        Objects.requireNonNull(date, "date");
    }

    public static Fixture of(String homeTeam, String awayTeam, String division, String date) {
        return new Fixture(homeTeam, awayTeam, division, LeagueDates.parse(date));
    }

    public String key() {
        return homeTeam + ":" + awayTeam;
    }
}
