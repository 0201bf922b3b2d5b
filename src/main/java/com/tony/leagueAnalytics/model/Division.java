package com.tony.leagueAnalytics.model;

import java.util.List;
import java.util.Objects;

public record Division(String code, String name, List<String> teams) {

    public Division {
        Objects.requireNonNull(code, "code");
        teams = teams == null ? List.of() : List.copyOf(teams);
    }
}
