package com.tony.leagueAnalytics.model;

import java.util.List;
import java.util.Map;

public record CalibrationResult(List<BridgePlayer> bridgePlayers, Map<String, LeagueStrength> leagues) {

    public CalibrationResult {
        bridgePlayers = bridgePlayers == null ? List.of() : List.copyOf(bridgePlayers);
        leagues = leagues == null ? Map.of() : Map.copyOf(leagues);
    }
}
