package com.tony.leagueAnalytics.model;

/**
 * Set 1 = frames 1 à 5, set 2 = frames 6 à 10.
 * bias > 0 : l'équipe est plus forte en début de match.
 */
public record SetPerformance(String team, SetRecord set1, SetRecord set2, double bias) {
}
