package com.tony.leagueAnalytics.model;

public enum StreakType {
    WIN, LOSS, NONE
}
