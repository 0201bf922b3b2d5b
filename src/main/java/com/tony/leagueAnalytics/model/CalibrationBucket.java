package com.tony.leagueAnalytics.model;

/**
 * Tranche de 10% de probabilité prédite : fréquence observée vs probabilité moyenne annoncée.
 */
public record CalibrationBucket(double lower, double upper, int count, double meanPredicted, double observedFrequency) {
}
