package com.tony.leagueAnalytics.model;

public record PlayerAvailability(String name, boolean available) {

    public static PlayerAvailability available(String name) {
        return new PlayerAvailability(name, true);
    }

    public static PlayerAvailability unavailable(String name) {
        return new PlayerAvailability(name, false);
    }
}
