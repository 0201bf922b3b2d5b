package com.tony.leagueAnalytics.model;

public record TeamHomeAwaySplit(String team, TeamVenueRecord home, TeamVenueRecord away) {
}
