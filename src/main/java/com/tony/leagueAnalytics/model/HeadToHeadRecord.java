package com.tony.leagueAnalytics.model;

import java.util.List;

/**
 * Confrontations directes entre deux joueurs, les plus récentes en premier.
 */
public record HeadToHeadRecord(String player, String opponent, int wins, int losses,
                               List<HeadToHeadMeeting> meetings) {

    public HeadToHeadRecord {
        meetings = meetings == null ? List.of() : List.copyOf(meetings);
    }

    public int played() {
        return wins + losses;
    }

    public int net() {
        return wins - losses;
    }
}
