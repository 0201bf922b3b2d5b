package com.tony.leagueAnalytics.model;

/**
 * Bilan sur les N dernières frames jouées (pct en %).
 */
public record FormWindow(int played, int won, double pct) {

    public static final FormWindow EMPTY = new FormWindow(0, 0, 0.0);

    public static FormWindow of(int played, int won) {
        return new FormWindow(played, won, played > 0 ? (double) won / played * 100.0 : 0.0);
    }
}
