package com.tony.leagueAnalytics.model;

public enum MatchOutcome {
    WIN("W"), DRAW("D"), LOSS("L");

    private final String code;

    MatchOutcome(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public static MatchOutcome of(int scored, int conceded) {
        if (scored > conceded) return WIN;
        return scored == conceded ? DRAW : LOSS;
    }
}
