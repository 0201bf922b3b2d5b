package com.tony.leagueAnalytics.model;

/**
 * Win% retenu pour un joueur (brut et bayésien, en %), avec son poids (frames jouées).
 */
public record EffectivePct(double pct, double adjustedPct, int weight, int wins, Source source) {

    public enum Source { CURRENT, PRIOR }
}
