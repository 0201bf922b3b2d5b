package com.tony.leagueAnalytics.model;

/**
 * Lien d'identité pré-calculé (hors de ce moteur) : nom brut vers nom canonique,
 * avec la similarité du rapprochement (0-1).
 */
public record PlayerIdentity(String canonicalName, double confidence) {
}
