package com.tony.leagueAnalytics.model;

import java.util.List;

public record LeagueStrength(String leagueId, double offset, double confidence, int bridgePlayerCount,
                             List<DivisionStrength> divisions) {

    public LeagueStrength {
        divisions = divisions == null ? List.of() : List.copyOf(divisions);
    }

    public DivisionStrength division(String code) {
        return divisions.stream().filter(d -> d.division().equals(code)).findFirst().orElse(null);
    }
}
