package com.tony.leagueAnalytics.model;

public enum FormTrend {
    HOT, COLD, STEADY
}
