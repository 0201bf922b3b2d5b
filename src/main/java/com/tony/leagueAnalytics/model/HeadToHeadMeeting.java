package com.tony.leagueAnalytics.model;

import java.time.LocalDate;

public record HeadToHeadMeeting(String matchId, LocalDate date, String winner) {
}
