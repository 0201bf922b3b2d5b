package com.tony.leagueAnalytics.model;

/**
 * Joueur imposé par le capitaine à une place précise (set 1-2, position 1-5).
 */
public record LockedPosition(String playerName, int set, int position) {

    public boolean isValid() {
        return playerName != null && (set == 1 || set == 2) && position >= 1 && position <= 5;
    }
}
