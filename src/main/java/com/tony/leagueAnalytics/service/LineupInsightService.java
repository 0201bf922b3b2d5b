package com.tony.leagueAnalytics.service;

import com.tony.leagueAnalytics.config.LineupProperties;
import com.tony.leagueAnalytics.model.FormTrend;
import com.tony.leagueAnalytics.model.FrameRecord;
import com.tony.leagueAnalytics.model.MatchOutcome;
import com.tony.leagueAnalytics.model.PlayerForm;
import com.tony.leagueAnalytics.model.ScoredPlayer;
import com.tony.leagueAnalytics.model.ScoutingReport;
import com.tony.leagueAnalytics.model.SetPerformance;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Faits marquants lisibles par un capitaine (composition et scouting).
 */
@Service
@RequiredArgsConstructor
public class LineupInsightService {

    private static final int MAX_NAMED_PLAYERS = 3;
    private static final int H2H_STAR_NET = 2;
    private static final int SIGNIFICANT_TEAM_STREAK = 3;

    private final PlayerAnalyticsService playerAnalytics;
    private final LineupProperties properties;

    /**
     * Conseils tactiques pour la composition retenue.
     */
    public List<String> lineupInsights(List<ScoredPlayer> scored, boolean opponentFrontLoaded, List<String> excluded) {
        List<String> insights = new ArrayList<>();

        insights.add(formInsight(scored, FormTrend.HOT, "🔥 En forme : "));
        insights.add(formInsight(scored, FormTrend.COLD, "🥶 En méforme : "));

        if (opponentFrontLoaded) {
            insights.add("⚠️ L'adversaire est plus fort en set 1 : garder les meilleurs pour le set 2");
        }

        String h2hStars = scored.stream()
                .filter(s -> s.headToHeadNet() >= H2H_STAR_NET)
                .limit(MAX_NAMED_PLAYERS)
                .map(s -> s.name() + " (+" + s.headToHeadNet() + ")")
                .collect(Collectors.joining(", "));
        if (!h2hStars.isEmpty()) {
            insights.add("🎯 Avantage H2H : " + h2hStars);
        }

        if (excluded != null && !excluded.isEmpty()) {
            insights.add("ℹ️ Écartés (<" + properties.getMinGames() + " frames) : " + String.join(", ", excluded));
        }

        return insights.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    /**
     * Faits clés d'un rapport de scouting : séries, biais de set, joueurs en feu.
     */
    public List<String> scoutingFacts(ScoutingReport report, List<FrameRecord> frames) {
        List<String> facts = new ArrayList<>();

        facts.add(analyzeTeamStreak(report.team(), report.form()));
        facts.add(analyzeSetBias(report.team(), report.setPerformance()));

        if (report.predictedLineup() != null) {
            String hot = report.predictedLineup().players().stream()
                    .map(p -> playerAnalytics.playerForm(p, frames, 0.0))
                    .filter(f -> f != null && f.trend() == FormTrend.HOT)
                    .limit(MAX_NAMED_PLAYERS)
                    .map(PlayerForm::player)
                    .collect(Collectors.joining(", "));
            if (!hot.isEmpty()) facts.add("🔥 Joueurs en forme : " + hot);
        }

        if (report.breakAndDish() != null && report.breakAndDish().net() > 0) {
            facts.add("🎱 " + report.team() + " : " + report.breakAndDish().net() + " break-and-dish d'avance cette saison");
        }

        return facts.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private String formInsight(List<ScoredPlayer> scored, FormTrend trend, String prefix) {
        String names = scored.stream()
                .filter(s -> s.form() != null && s.form().trend() == trend)
                .limit(MAX_NAMED_PLAYERS)
                .map(s -> formContext(s.name(), s.form()))
                .collect(Collectors.joining(", "));
        return names.isEmpty() ? null : prefix + names;
    }

    private String formContext(String name, PlayerForm form) {
        return name + " (" + playerAnalytics.recentFormWindowLabel(form) + " : "
                + Math.round(playerAnalytics.recentFormPct(form)) + "% vs " + Math.round(form.seasonPct()) + "% saison)";
    }

    /**
     * Série en cours (résultats du plus récent au plus ancien), remontée à partir de 3 matchs.
     */
    private String analyzeTeamStreak(String team, List<MatchOutcome> form) {
        if (form == null || form.isEmpty()) return null;

        int unbeaten = 0;
        int losing = 0;
        for (MatchOutcome o : form) {
            if (o != MatchOutcome.LOSS) {
                if (losing > 0) break;
                unbeaten++;
            } else {
                if (unbeaten > 0) break;
                losing++;
            }
        }

        if (unbeaten >= SIGNIFICANT_TEAM_STREAK) {
            return "🔥 " + team + " est invaincu depuis " + unbeaten + " matchs.";
        } else if (losing >= SIGNIFICANT_TEAM_STREAK) {
            return "⚠️ " + team + " reste sur " + losing + " défaites consécutives.";
        }
        return null;
    }

    private String analyzeSetBias(String team, SetPerformance perf) {
        if (perf == null) return null;
        if (perf.bias() > properties.getSetBiasThreshold()) {
            return "⏱️ " + team + " démarre fort : " + Math.round(perf.set1().pct()) + "% en set 1 contre "
                    + Math.round(perf.set2().pct()) + "% en set 2.";
        } else if (perf.bias() < -properties.getSetBiasThreshold()) {
            return "⏱️ " + team + " finit fort : " + Math.round(perf.set2().pct()) + "% en set 2 contre "
                    + Math.round(perf.set1().pct()) + "% en set 1.";
        }
        return null;
    }
}
