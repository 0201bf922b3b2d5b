package com.tony.leagueAnalytics.model;

import java.util.List;

/**
 * Changement d'effectif hypothétique (ajouts / retraits) pour une équipe.
 */
public record SquadOverride(List<String> added, List<String> removed) {

    public SquadOverride {
        added = added == null ? List.of() : List.copyOf(added);
        removed = removed == null ? List.of() : List.copyOf(removed);
    }
}
