package com.tony.leagueAnalytics.model;

import java.time.LocalDate;

/**
 * Une frame vue du côté d'un joueur.
 */
public record FrameGame(String matchId, LocalDate date, int frameNumber, String opponent,
                        boolean home, boolean won, boolean breakAndDish) {
}
