package com.tony.leagueAnalytics.model;

public enum AppearanceCategory {
    CORE, ROTATION, FRINGE
}
