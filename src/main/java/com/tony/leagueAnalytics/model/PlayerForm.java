package com.tony.leagueAnalytics.model;

import lombok.Builder;

@Builder
public record PlayerForm(String player,
                         FormWindow last5,
                         FormWindow last8,
                         FormWindow last10,
                         double seasonPct,
                         FormTrend trend,
                         Streak streak,
                         double momentum) {
}
