package com.tony.leagueAnalytics.model;

import lombok.Builder;

/**
 * Note comparable entre divisions et ligues : win% bayésien + offset division + offset ligue.
 * La confiance est celle du calage le moins fiable des deux.
 */
@Builder
public record AdjustedRating(String subject,
                             String leagueId,
                             String division,
                             double rawPct,
                             double bayesianPct,
                             double adjustedPct,
                             double zScore,
                             double leaguePercentile,
                             double confidence,
                             AdjustmentBreakdown breakdown) {

    public String key() {
        return leagueId + ":" + division + ":" + subject;
    }
}
