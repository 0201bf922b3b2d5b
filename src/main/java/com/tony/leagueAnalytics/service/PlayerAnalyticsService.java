package com.tony.leagueAnalytics.service;

import com.tony.leagueAnalytics.config.LineupProperties;
import com.tony.leagueAnalytics.model.FormTrend;
import com.tony.leagueAnalytics.model.FormWindow;
import com.tony.leagueAnalytics.model.Frame;
import com.tony.leagueAnalytics.model.FrameGame;
import com.tony.leagueAnalytics.model.FrameRecord;
import com.tony.leagueAnalytics.model.H2HAdvantage;
import com.tony.leagueAnalytics.model.HeadToHeadAnalysis;
import com.tony.leagueAnalytics.model.HeadToHeadMeeting;
import com.tony.leagueAnalytics.model.HeadToHeadRecord;
import com.tony.leagueAnalytics.model.HomeAwaySplit;
import com.tony.leagueAnalytics.model.PlayerForm;
import com.tony.leagueAnalytics.model.Side;
import com.tony.leagueAnalytics.model.Streak;
import com.tony.leagueAnalytics.model.StreakType;
import com.tony.leagueAnalytics.model.VenueRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Analyses individuelles à partir des feuilles de match frame par frame.
 * Les noms sont comparés à l'identique.
 */
@Service
@RequiredArgsConstructor
public class PlayerAnalyticsService {

    static final int FORM_WINDOW_SMALL = 5;
    static final int FORM_WINDOW_MEDIUM = 8;
    static final int FORM_WINDOW_LARGE = 10;

    private static final double HOT_THRESHOLD = 65.0;
    private static final double COLD_THRESHOLD = 40.0;
    private static final int MIN_GAMES_FOR_TREND = 5;
    private static final int H2H_FULL_CONFIDENCE_GAMES = 10;

    private final LineupProperties lineupProperties;

    /**
     * Toutes les frames jouées par un joueur, la plus récente en premier.
     */
    public List<FrameGame> frameHistory(String player, List<FrameRecord> frames) {
        List<FrameGame> games = new ArrayList<>();
        for (FrameRecord match : byMostRecent(frames)) {
            for (Frame f : match.frames()) {
                boolean home = player.equals(f.homePlayer());
                boolean away = player.equals(f.awayPlayer());
                if (!home && !away) continue;

                boolean won = home == f.homeWon();
                games.add(new FrameGame(match.matchId(), match.date(), f.frameNumber(),
                        home ? f.awayPlayer() : f.homePlayer(), home, won, won && f.breakAndDish()));
            }
        }
        return games;
    }

    /**
     * Forme récente sur 5/8/10 frames, tendance, série en cours et momentum (-1 à 1).
     * Null si le joueur n'apparaît dans aucune feuille.
     */
    public PlayerForm playerForm(String player, List<FrameRecord> frames, double seasonPct) {
        List<FrameGame> games = frameHistory(player, frames);
        if (games.isEmpty()) return null;

        FormWindow last5 = window(games, FORM_WINDOW_SMALL);

        FormTrend trend = FormTrend.STEADY;
        if (last5.played() >= MIN_GAMES_FOR_TREND) {
            if (last5.pct() >= HOT_THRESHOLD) trend = FormTrend.HOT;
            else if (last5.pct() < COLD_THRESHOLD) trend = FormTrend.COLD;
        }

        return PlayerForm.builder()
                .player(player)
                .last5(last5)
                .last8(window(games, FORM_WINDOW_MEDIUM))
                .last10(window(games, FORM_WINDOW_LARGE))
                .seasonPct(seasonPct)
                .trend(trend)
                .streak(streak(games))
                .momentum(momentum(games))
                .build();
    }

    /**
     * % de forme retenu : L8 si l'échantillon est suffisant, sinon L5.
     */
    public double recentFormPct(PlayerForm form) {
        FormWindow last8 = form.last8();
        if (last8 != null && last8.played() >= lineupProperties.getFormLast8MinGames()) {
            return last8.pct();
        }
        return form.last5().pct();
    }

    public String recentFormWindowLabel(PlayerForm form) {
        FormWindow last8 = form.last8();
        return last8 != null && last8.played() >= lineupProperties.getFormLast8MinGames() ? "L8" : "L5";
    }

    public HeadToHeadRecord headToHead(String player, String opponent, List<FrameRecord> frames) {
        int wins = 0;
        int losses = 0;
        List<HeadToHeadMeeting> meetings = new ArrayList<>();

        for (FrameRecord match : byMostRecent(frames)) {
            for (Frame f : match.frames()) {
                boolean playerHome = player.equals(f.homePlayer()) && opponent.equals(f.awayPlayer());
                boolean playerAway = player.equals(f.awayPlayer()) && opponent.equals(f.homePlayer());
                if (!playerHome && !playerAway) continue;

                boolean won = playerHome == f.homeWon();
                if (won) wins++;
                else losses++;
                meetings.add(new HeadToHeadMeeting(match.matchId(), match.date(), won ? player : opponent));
            }
        }
        return new HeadToHeadRecord(player, opponent, wins, losses, meetings);
    }

    /**
     * Null si les deux joueurs ne se sont jamais affrontés.
     */
    public HeadToHeadAnalysis analyzeHeadToHead(String player, String opponent, List<FrameRecord> frames) {
        HeadToHeadRecord record = headToHead(player, opponent, frames);
        if (record.played() == 0) return null;

        double winPct = (double) record.wins() / record.played() * 100.0;
        H2HAdvantage advantage;
        if (winPct >= 70) advantage = H2HAdvantage.STRONG;
        else if (winPct >= 60) advantage = H2HAdvantage.MODERATE;
        else if (winPct >= 40) advantage = H2HAdvantage.EVEN;
        else advantage = H2HAdvantage.DISADVANTAGE;

        double confidence = Math.min(1.0, (double) record.played() / H2H_FULL_CONFIDENCE_GAMES);
        return new HeadToHeadAnalysis(record, winPct, advantage, confidence);
    }

    public HomeAwaySplit homeAwaySplit(String player, List<FrameRecord> frames) {
        int homePlayed = 0, homeWon = 0, awayPlayed = 0, awayWon = 0;
        for (FrameGame g : frameHistory(player, frames)) {
            if (g.home()) {
                homePlayed++;
                if (g.won()) homeWon++;
            } else {
                awayPlayed++;
                if (g.won()) awayWon++;
            }
        }
        return new HomeAwaySplit(player, VenueRecord.of(homePlayed, homeWon), VenueRecord.of(awayPlayed, awayWon));
    }

    private FormWindow window(List<FrameGame> games, int size) {
        List<FrameGame> slice = games.subList(0, Math.min(size, games.size()));
        int won = (int) slice.stream().filter(FrameGame::won).count();
        return FormWindow.of(slice.size(), won);
    }

    private Streak streak(List<FrameGame> games) {
        if (games.isEmpty()) return Streak.NONE;
        boolean first = games.get(0).won();
        int count = 0;
        for (FrameGame g : games) {
            if (g.won() != first) break;
            count++;
        }
        return new Streak(first ? StreakType.WIN : StreakType.LOSS, count);
    }

    // Pondération 5,4,3,2,1 sur les 5 dernières frames, ramenée sur [-1, 1]
    private double momentum(List<FrameGame> games) {
        int n = Math.min(FORM_WINDOW_SMALL, games.size());
        if (n == 0) return 0.0;
        double weightedSum = 0;
        double weightTotal = 0;
        for (int i = 0; i < n; i++) {
            int weight = FORM_WINDOW_SMALL - i;
            weightedSum += games.get(i).won() ? weight : 0;
            weightTotal += weight;
        }
        return (weightedSum / weightTotal - 0.5) * 2;
    }

    static List<FrameRecord> byMostRecent(List<FrameRecord> frames) {
        return frames.stream().sorted(Comparator.comparing(FrameRecord::date).reversed()).toList();
    }

    static boolean teamWon(FrameRecord match, Frame frame, String team) {
        Side teamSide = team.equals(match.homeTeam()) ? Side.HOME : Side.AWAY;
        return frame.winner() == teamSide;
    }
}
