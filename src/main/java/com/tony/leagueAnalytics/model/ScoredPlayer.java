package com.tony.leagueAnalytics.model;

/**
 * Score composite d'un joueur pour un match donné, avec ses composantes.
 */
public record ScoredPlayer(String name,
                           double score,
                           double adjustedPct,
                           Double formPct,
                           int headToHeadNet,
                           Double venuePct,
                           int gamesPlayed,
                           PlayerForm form) {
}
