package com.tony.leagueAnalytics.model;

public enum Side {
    HOME, AWAY
}
