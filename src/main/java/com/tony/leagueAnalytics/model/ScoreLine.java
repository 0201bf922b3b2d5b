package com.tony.leagueAnalytics.model;

public record ScoreLine(String score, double probability) {
}
