package com.tony.leagueAnalytics.service;

import com.tony.leagueAnalytics.config.LineupProperties;
import com.tony.leagueAnalytics.config.PredictionProperties;
import com.tony.leagueAnalytics.model.FrameRecord;
import com.tony.leagueAnalytics.model.HeadToHeadRecord;
import com.tony.leagueAnalytics.model.HomeAwaySplit;
import com.tony.leagueAnalytics.model.LeagueSnapshot;
import com.tony.leagueAnalytics.model.LineupAlternative;
import com.tony.leagueAnalytics.model.LineupRecommendation;
import com.tony.leagueAnalytics.model.LineupRequest;
import com.tony.leagueAnalytics.model.LineupWinProbability;
import com.tony.leagueAnalytics.model.LockedPosition;
import com.tony.leagueAnalytics.model.MatchPrediction;
import com.tony.leagueAnalytics.model.OptimizedLineup;
import com.tony.leagueAnalytics.model.PlayerForm;
import com.tony.leagueAnalytics.model.PlayerSeason;
import com.tony.leagueAnalytics.model.ScoredPlayer;
import com.tony.leagueAnalytics.model.SetPerformance;
import com.tony.leagueAnalytics.model.TeamPlayer;
import com.tony.leagueAnalytics.model.VenueRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.tony.leagueAnalytics.config.LineupProperties.LINEUP_SIZE;
import static com.tony.leagueAnalytics.config.LineupProperties.SET_SIZE;

/**
 * Composition d'équipe : score composite par joueur, places imposées, variantes.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LineupOptimizerService {

    private final PlayerStatsService playerStatsService;
    private final PlayerAnalyticsService playerAnalytics;
    private final TeamAnalyticsService teamAnalytics;
    private final StandingsService standingsService;
    private final StrengthEstimatorService strengthEstimator;
    private final MatchupService matchupService;
    private final MatchSimulationService matchSimulation;
    private final LineupInsightService insightService;
    private final LineupProperties properties;
    private final PredictionProperties predictionProperties;

    /**
     * Score composite des joueurs éligibles (au moins minGames frames cette saison), du meilleur au moins bon.
     * score = win% bayésien + 0.3 x (forme - win%) + 5 x net H2H + 0.2 x (win% lieu - win%).
     */
    public List<ScoredPlayer> scorePlayers(List<String> players, String opponent, boolean isHome, LeagueSnapshot snapshot) {
        List<FrameRecord> frames = snapshot.frames();
        List<String> likelyOpponents = teamAnalytics.predictLineup(opponent, frames).players();

        List<ScoredPlayer> scored = new ArrayList<>();
        for (String name : players) {
            PlayerSeason season = snapshot.currentPlayers().get(name);
            if (season == null) continue;
            PlayerSeason.PlayerTotals total = season.total();
            if (total.played() < properties.getMinGames()) continue;

            double adjPct = total.adjustedPct();
            double score = adjPct;

            PlayerForm form = playerAnalytics.playerForm(name, frames, total.winPct());
            Double formPct = form != null ? playerAnalytics.recentFormPct(form) : null;
            if (formPct != null) score += (formPct - adjPct) * properties.getFormWeight();

            int h2hNet = 0;
            for (String opp : likelyOpponents) {
                HeadToHeadRecord record = playerAnalytics.headToHead(name, opp, frames);
                h2hNet += record.net();
            }
            score += h2hNet * properties.getHeadToHeadWeight();

            Double venuePct = null;
            if (form != null) {
                HomeAwaySplit split = playerAnalytics.homeAwaySplit(name, frames);
                VenueRecord venue = split.at(isHome);
                venuePct = venue.pct();
                if (venue.played() >= properties.getVenueMinGames()) {
                    score += (venue.pct() - adjPct) * properties.getVenueWeight();
                }
            }

            scored.add(new ScoredPlayer(name, score, adjPct, formPct, h2hNet, venuePct, total.played(), form));
        }

        scored.sort(Comparator.comparingDouble(ScoredPlayer::score).reversed());
        log.debug("📋 {} joueurs notés contre {}", scored.size(), opponent);
        return scored;
    }

    /**
     * Meilleure composition. Null si moins de 10 joueurs disponibles ou si les 10 places
     * ne peuvent pas être remplies.
     */
    public OptimizedLineup optimize(LineupRequest request, LeagueSnapshot snapshot) {
        List<String> available = availablePlayers(request, snapshot);
        if (available.size() < LINEUP_SIZE) {
            log.warn("⚠️ {} : seulement {} joueurs disponibles, composition impossible", request.team(), available.size());
            return null;
        }
        return optimize(request, scorePlayers(available, request.opponent(), request.home(), snapshot), snapshot);
    }

    private OptimizedLineup optimize(LineupRequest request, List<ScoredPlayer> scored, LeagueSnapshot snapshot) {
        String[] set1 = new String[SET_SIZE];
        String[] set2 = new String[SET_SIZE];
        Set<String> locked = new HashSet<>();

        for (LockedPosition lock : appliedLocks(request.locks())) {
            (lock.set() == 1 ? set1 : set2)[lock.position() - 1] = lock.playerName();
            locked.add(lock.playerName());
        }

        // Adversaire plus fort en début de match : les meilleurs attendent le set 2
        SetPerformance oppSets = teamAnalytics.setPerformance(request.opponent(), snapshot.frames());
        boolean inverted = oppSets != null && oppSets.bias() > properties.getSetBiasThreshold();

        List<String> unlocked = scored.stream().map(ScoredPlayer::name).filter(n -> !locked.contains(n)).toList();
        int next = 0;
        for (String[] set : inverted ? List.of(set2, set1) : List.of(set1, set2)) {
            for (int i = 0; i < SET_SIZE; i++) {
                if (set[i] == null && next < unlocked.size()) {
                    set[i] = unlocked.get(next++);
                }
            }
        }

        if (Arrays.asList(set1).contains(null) || Arrays.asList(set2).contains(null)) {
            log.warn("⚠️ {} : composition incomplète ({} joueurs éligibles)", request.team(), scored.size());
            return null;
        }

        LineupWinProbability winProbability = lineupWinProbability(Arrays.asList(set1), Arrays.asList(set2),
                request.team(), request.opponent(), request.home(), snapshot);
        return new OptimizedLineup(Arrays.asList(set1), Arrays.asList(set2), winProbability, inverted);
    }

    /**
     * Probabilités vues de mon équipe. Moins de 5 joueurs avec des stats : on retombe sur la force d'équipe.
     */
    public LineupWinProbability lineupWinProbability(List<String> set1, List<String> set2, String myTeam,
                                                     String opponent, boolean isHome, LeagueSnapshot snapshot) {
        double totalAdjPct = 0;
        int valid = 0;
        List<String> all = new ArrayList<>(set1);
        all.addAll(set2);
        for (String name : all) {
            PlayerSeason season = snapshot.currentPlayers().get(name);
            if (season != null && season.total().played() > 0) {
                totalAdjPct += season.total().adjustedPct();
                valid++;
            }
        }

        double opponentStrength = teamStrength(opponent, snapshot);

        if (valid < properties.getMinRatedPlayers()) {
            String division = standingsService.divisionOf(myTeam, snapshot);
            if (division == null) {
                // Équipe introuvable : défaite certaine
                return new LineupWinProbability(0, 0, 1, 0, predictionProperties.getFramesPerMatch(), 1, true);
            }
            double myStrength = teamStrength(myTeam, snapshot);
            return fromMyPerspective(myStrength, opponentStrength, isHome, true);
        }

        double lineupStrength = matchupService.winPctToStrength(totalAdjPct / valid);
        return fromMyPerspective(lineupStrength, opponentStrength, isHome, false);
    }

    /**
     * Variantes à un échange banc/titulaire près (jamais sur une place imposée), classées par P(victoire).
     */
    public List<LineupAlternative> alternatives(OptimizedLineup optimal, LineupRequest request,
                                                LeagueSnapshot snapshot, int count) {
        List<ScoredPlayer> scored = scorePlayers(availablePlayers(request, snapshot), request.opponent(), request.home(), snapshot);
        return alternatives(optimal, request, scored, snapshot, count);
    }

    private List<LineupAlternative> alternatives(OptimizedLineup optimal, LineupRequest request, List<ScoredPlayer> scored,
                                                 LeagueSnapshot snapshot, int count) {
        List<LockedPosition> applied = appliedLocks(request.locks());
        Set<String> lockedNames = new HashSet<>();
        applied.forEach(l -> lockedNames.add(l.playerName()));
        Set<String> starters = new HashSet<>(optimal.players());

        List<String> bench = scored.stream().map(ScoredPlayer::name)
                .filter(n -> !starters.contains(n) && !lockedNames.contains(n)).toList();
        List<String> swappable = scored.stream().map(ScoredPlayer::name)
                .filter(n -> starters.contains(n) && !lockedNames.contains(n)).toList();

        List<Candidate> candidates = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        int maxAttempts = Math.min(count * 3, properties.getMaxSwapAttempts());

        for (int attempt = 1; attempt <= maxAttempts && candidates.size() < count; attempt++) {
            if (bench.isEmpty() || swappable.isEmpty()) break;

            String in = bench.get(attempt % bench.size());
            String out = swappable.get(attempt % swappable.size());

            List<String> altSet1 = new ArrayList<>(optimal.set1());
            List<String> altSet2 = new ArrayList<>(optimal.set2());
            if (!swap(altSet1, 1, out, in, applied) && !swap(altSet2, 2, out, in, applied)) continue;

            LineupWinProbability p = lineupWinProbability(altSet1, altSet2, request.team(), request.opponent(),
                    request.home(), snapshot);
            OptimizedLineup alt = new OptimizedLineup(altSet1, altSet2, p, optimal.setsInverted());
            if (seen.add(alt.key())) {
                candidates.add(new Candidate(alt, in, out));
            }
        }

        candidates.sort(Comparator.comparingDouble((Candidate c) -> c.lineup().winProbability().win()).reversed());

        List<LineupAlternative> result = new ArrayList<>();
        for (Candidate c : candidates) {
            double diff = optimal.winProbability().win() - c.lineup().winProbability().win();
            result.add(new LineupAlternative(result.size() + 1, c.lineup(), c.in(), c.out(), diff));
        }
        return result;
    }

    /**
     * Composition optimale + variantes + conseils. Null si aucune composition possible.
     */
    public LineupRecommendation recommend(LineupRequest request, LeagueSnapshot snapshot) {
        List<String> available = availablePlayers(request, snapshot);
        if (available.size() < LINEUP_SIZE) {
            log.warn("⚠️ {} : seulement {} joueurs disponibles, composition impossible", request.team(), available.size());
            return null;
        }

        List<ScoredPlayer> scored = scorePlayers(available, request.opponent(), request.home(), snapshot);
        OptimizedLineup optimal = optimize(request, scored, snapshot);
        if (optimal == null) return null;

        List<LineupAlternative> alternatives = alternatives(optimal, request, scored, snapshot,
                properties.getDefaultAlternatives());

        Set<String> eligible = new HashSet<>();
        scored.forEach(s -> eligible.add(s.name()));
        List<String> excluded = available.stream()
                .filter(n -> !eligible.contains(n))
                .filter(n -> {
                    PlayerSeason season = snapshot.currentPlayers().get(n);
                    return season != null && season.total().played() > 0;
                })
                .toList();

        List<String> insights = insightService.lineupInsights(scored, optimal.setsInverted(), excluded);

        log.info("✅ Composition {} vs {} : P(victoire) = {}", request.team(), request.opponent(),
                round(optimal.winProbability().win() * 100.0));
        return new LineupRecommendation(optimal, scored, alternatives, insights);
    }

    private List<String> availablePlayers(LineupRequest request, LeagueSnapshot snapshot) {
        Set<String> wanted = new HashSet<>(request.availablePlayers());
        return playerStatsService.teamPlayers(request.team(), snapshot).stream()
                .map(TeamPlayer::name)
                .filter(wanted::contains)
                .toList();
    }

    /**
     * Places réellement imposées : positions invalides ignorées, puis premier arrivé
     * pour un même joueur ou une même place.
     */
    static List<LockedPosition> appliedLocks(List<LockedPosition> locks) {
        List<LockedPosition> applied = new ArrayList<>();
        Set<String> players = new HashSet<>();
        Set<String> slots = new HashSet<>();
        for (LockedPosition lock : locks) {
            if (!lock.isValid() || players.contains(lock.playerName())) continue;
            if (!slots.add(lock.set() + ":" + lock.position())) continue;
            players.add(lock.playerName());
            applied.add(lock);
        }
        return applied;
    }

    private boolean swap(List<String> set, int setNumber, String out, String in, List<LockedPosition> locks) {
        for (int i = 0; i < set.size(); i++) {
            if (!set.get(i).equals(out)) continue;
            int position = i + 1;
            boolean lockedSlot = locks.stream().anyMatch(l -> l.set() == setNumber && l.position() == position);
            if (!lockedSlot) {
                set.set(i, in);
                return true;
            }
        }
        return false;
    }

    private double teamStrength(String team, LeagueSnapshot snapshot) {
        String division = standingsService.divisionOf(team, snapshot);
        if (division == null) return 0.0;
        Map<String, Double> strengths = strengthEstimator.calculateTeamStrengths(division, snapshot);
        return strengths.getOrDefault(team, 0.0);
    }

    private LineupWinProbability fromMyPerspective(double myStrength, double opponentStrength, boolean isHome,
                                                   boolean fallback) {
        double p = isHome
                ? matchupService.frameWinProbability(myStrength, opponentStrength)
                : matchupService.frameWinProbability(opponentStrength, myStrength);
        MatchPrediction prediction = matchSimulation.predictMatch(p);

        double win = isHome ? prediction.getHomeWinProbability() : prediction.getAwayWinProbability();
        double loss = isHome ? prediction.getAwayWinProbability() : prediction.getHomeWinProbability();
        double draw = prediction.getDrawProbability();
        double expectedFor = isHome ? prediction.getExpectedHomeFrames() : prediction.getExpectedAwayFrames();
        double expectedAgainst = isHome ? prediction.getExpectedAwayFrames() : prediction.getExpectedHomeFrames();

        return new LineupWinProbability(win, draw, loss, expectedFor, expectedAgainst,
                Math.max(win, Math.max(draw, loss)), fallback);
    }

    private double round(double value) {
        return Math.round(value * 10.0) / 10.0;
    }

    private record Candidate(OptimizedLineup lineup, String in, String out) {
    }
}
