package com.tony.leagueAnalytics.model;

import java.util.List;

/**
 * Même humain observé dans plusieurs divisions (ou ligues).
 * matchConfidence = 1.0 pour un nom identique, similarité du lien d'identité sinon.
 */
public record BridgePlayer(String name, List<BridgeContext> contexts, double matchConfidence) {

    public BridgePlayer {
        contexts = contexts == null ? List.of() : List.copyOf(contexts);
    }

    public List<BridgeContext> contextsIn(String leagueId) {
        return contexts.stream().filter(c -> leagueId.equals(c.leagueId())).toList();
    }
}
