package com.tony.leagueAnalytics.model;

public enum H2HAdvantage {
    STRONG, MODERATE, EVEN, DISADVANTAGE
}
