package com.tony.leagueAnalytics.model;

public record HeadToHeadAnalysis(HeadToHeadRecord record, double winPct, H2HAdvantage advantage,
                                 double confidence) {
}
