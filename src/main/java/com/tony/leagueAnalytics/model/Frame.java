package com.tony.leagueAnalytics.model;

import java.util.Objects;

/**
 * Une frame d'un match : deux joueurs, un vainqueur, et un éventuel "break-and-dish"
 * (frame gagnée en une seule visite après la casse).
 */
public record Frame(int frameNumber, String homePlayer, String awayPlayer, Side winner, boolean breakAndDish) {

    public Frame {
        Objects.requireNonNull(homePlayer, "homePlayer");
        Objects.requireNonNull(awayPlayer, "awayPlayer");
        Objects.requireNonNull(winner, "winner");
    }

    public boolean homeWon() {
        return winner == Side.HOME;
    }
}
