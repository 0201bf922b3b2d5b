package com.tony.leagueAnalytics.model;

import java.util.List;

public record BacktestReport(String division, int predictions, double brierScore, double logLoss,
                             double accuracy, List<ConfidenceBand> bands, List<CalibrationBucket> buckets) {

    public BacktestReport {
        bands = bands == null ? List.of() : List.copyOf(bands);
        buckets = buckets == null ? List.of() : List.copyOf(buckets);
    }

    public static BacktestReport empty(String division) {
        return new BacktestReport(division, 0, 0.0, 0.0, 0.0, List.of(), List.of());
    }
}
