package com.tony.leagueAnalytics.model;

import lombok.Builder;

import java.util.List;

/**
 * Demande de composition : mon équipe, l'adversaire, le lieu, les dispos et les places imposées.
 */
@Builder
public record LineupRequest(String team,
                            String opponent,
                            boolean home,
                            List<PlayerAvailability> availability,
                            List<LockedPosition> locks) {

    public LineupRequest {
        availability = availability == null ? List.of() : List.copyOf(availability);
        locks = locks == null ? List.of() : List.copyOf(locks);
    }

    public List<String> availablePlayers() {
        return availability.stream().filter(PlayerAvailability::available).map(PlayerAvailability::name).toList();
    }
}
