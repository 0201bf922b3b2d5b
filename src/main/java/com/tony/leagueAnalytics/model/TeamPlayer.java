package com.tony.leagueAnalytics.model;

/**
 * Joueur rattaché à une équipe : effectif inscrit et/ou joueur ayant joué pour elle cette saison.
 * prior et current peuvent être absents.
 */
public record TeamPlayer(String name, PriorPlayerStats prior, PlayerSeasonStats current, boolean rostered) {
}
