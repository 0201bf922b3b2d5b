package com.tony.leagueAnalytics.model;

public record AdjustmentBreakdown(double divisionOffset, double leagueOffset) {

    public double total() {
        return divisionOffset + leagueOffset;
    }
}
