package com.tony.leagueAnalytics.model;

public record Streak(StreakType type, int count) {

    public static final Streak NONE = new Streak(StreakType.NONE, 0);
}
