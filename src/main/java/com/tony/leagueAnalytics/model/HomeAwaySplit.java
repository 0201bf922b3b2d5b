package com.tony.leagueAnalytics.model;

public record HomeAwaySplit(String player, VenueRecord home, VenueRecord away) {

    public VenueRecord at(boolean isHome) {
        return isHome ? home : away;
    }
}
