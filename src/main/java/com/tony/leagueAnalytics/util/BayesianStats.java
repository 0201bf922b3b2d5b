package com.tony.leagueAnalytics.util;

/**
 * Pourcentage de victoire "bayésien" : tire les petits échantillons vers 50%.
 * Un 2-0 se lit 62.5%, pas 100%.
 */
public final class BayesianStats {

    public static final double PRIOR = 0.5;
    public static final int K = 6;

    private BayesianStats() {
    }

    /**
     * (wins + K * prior) / (games + K), exprimé en pourcentage (0-100).
     */
    public static double adjustedPct(int wins, int games) {
        if (games <= 0) return PRIOR * 100.0;
        return ((wins + K * PRIOR) / (games + K)) * 100.0;
    }

    public static double rawPct(int wins, int games) {
        return games > 0 ? (double) wins / games * 100.0 : 0.0;
    }
}
