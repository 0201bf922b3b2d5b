package com.tony.leagueAnalytics.model;

public record ConfidenceBand(String label, int count, int correct, double accuracy) {
}
