package com.tony.leagueAnalytics.model;

/**
 * Score en frames d'un match, et barème de points de la ligue :
 * victoire à domicile = 2, victoire à l'extérieur = 3, nul = 1 chacun.
 */
public record MatchScore(int homeFrames, int awayFrames) {

    public static final int HOME_WIN_POINTS = 2;
    public static final int AWAY_WIN_POINTS = 3;
    public static final int DRAW_POINTS = 1;

    public int homePoints() {
        if (homeFrames > awayFrames) return HOME_WIN_POINTS;
        return homeFrames == awayFrames ? DRAW_POINTS : 0;
    }

    public int awayPoints() {
        if (awayFrames > homeFrames) return AWAY_WIN_POINTS;
        return homeFrames == awayFrames ? DRAW_POINTS : 0;
    }

    public String label() {
        return homeFrames + "-" + awayFrames;
    }
}
