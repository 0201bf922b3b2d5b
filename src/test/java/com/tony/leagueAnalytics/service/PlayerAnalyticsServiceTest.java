package com.tony.leagueAnalytics.service;

import com.tony.leagueAnalytics.TestFixtures;
import com.tony.leagueAnalytics.config.LineupProperties;
import com.tony.leagueAnalytics.model.FormTrend;
import com.tony.leagueAnalytics.model.Frame;
import com.tony.leagueAnalytics.model.FrameGame;
import com.tony.leagueAnalytics.model.FrameRecord;
import com.tony.leagueAnalytics.model.H2HAdvantage;
import com.tony.leagueAnalytics.model.HeadToHeadAnalysis;
import com.tony.leagueAnalytics.model.HeadToHeadRecord;
import com.tony.leagueAnalytics.model.HomeAwaySplit;
import com.tony.leagueAnalytics.model.PlayerForm;
import com.tony.leagueAnalytics.model.Side;
import com.tony.leagueAnalytics.model.StreakType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class PlayerAnalyticsServiceTest {

    private PlayerAnalyticsService playerAnalytics;
    private List<FrameRecord> frames;

    @BeforeEach
    void setUp() {
        playerAnalytics = new PlayerAnalyticsService(new LineupProperties());
        frames = TestFixtures.divisionFrames();
    }

    @Test
    @DisplayName("L'historique d'un joueur commence par le match le plus récent")
    void historyShouldStartWithMostRecentMatch() {
        List<FrameGame> games = playerAnalytics.frameHistory("A1", frames);

        assertThat(games).hasSize(2);
        assertThat(games.get(0).matchId()).isEqualTo("m4");
        assertThat(games.get(0).home()).isFalse();
        assertThat(games.get(0).opponent()).isEqualTo("D1");
        assertThat(games).allMatch(FrameGame::won);
    }

    @Test
    @DisplayName("Un joueur absent des feuilles de match n'a pas de forme")
    void unknownPlayerShouldHaveNoForm() {
        assertThat(playerAnalytics.playerForm("Personne", frames, 50.0)).isNull();
    }

    @Test
    @DisplayName("Moins de 5 frames : tendance stable, même à 100%")
    void shortHistoryShouldStaySteady() {
        PlayerForm form = playerAnalytics.playerForm("A1", frames, 100.0);

        assertThat(form.last5().played()).isEqualTo(2);
        assertThat(form.last5().pct()).isEqualTo(100.0);
        assertThat(form.trend()).isEqualTo(FormTrend.STEADY);
        assertThat(form.streak().type()).isEqualTo(StreakType.WIN);
        assertThat(form.streak().count()).isEqualTo(2);
        assertThat(form.momentum()).isCloseTo(1.0, within(1e-9));
        assertThat(playerAnalytics.recentFormWindowLabel(form)).isEqualTo("L5");
        assertThat(playerAnalytics.recentFormPct(form)).isEqualTo(100.0);
    }

    @Test
    @DisplayName("Au moins 65% sur les 5 dernières frames : joueur en forme")
    void highRecentPctShouldBeHot() {
        List<FrameRecord> history = List.of(soloMatch("x1", "01-10-2025", true, true, true, true, false));

        PlayerForm form = playerAnalytics.playerForm("Solo", history, 50.0);

        assertThat(form.last5().pct()).isEqualTo(80.0);
        assertThat(form.trend()).isEqualTo(FormTrend.HOT);
    }

    @Test
    @DisplayName("Moins de 40% sur les 5 dernières frames : joueur en méforme, série de défaites")
    void lowRecentPctShouldBeCold() {
        List<FrameRecord> history = List.of(soloMatch("x1", "01-10-2025", false, false, false, false, true));

        PlayerForm form = playerAnalytics.playerForm("Solo", history, 50.0);

        assertThat(form.trend()).isEqualTo(FormTrend.COLD);
        assertThat(form.streak().type()).isEqualTo(StreakType.LOSS);
        assertThat(form.streak().count()).isEqualTo(4);
        // Seule la 5e frame (poids 1 sur 15) est gagnée
        assertThat(form.momentum()).isCloseTo((1.0 / 15 - 0.5) * 2, within(1e-9));
    }

    @Test
    @DisplayName("À partir de 6 frames, la forme retenue est celle des 8 dernières")
    void longHistoryShouldUseLastEight() {
        List<FrameRecord> history = List.of(
                soloMatch("x2", "08-10-2025", true, true, true, true, true),
                soloMatch("x1", "01-10-2025", false, false, false, false, false));

        PlayerForm form = playerAnalytics.playerForm("Solo", history, 50.0);

        assertThat(form.last8().played()).isEqualTo(8);
        assertThat(playerAnalytics.recentFormWindowLabel(form)).isEqualTo("L8");
        assertThat(playerAnalytics.recentFormPct(form)).isCloseTo(62.5, within(1e-9));
        assertThat(form.last10().pct()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("Devrait compter les confrontations directes dans les deux sens")
    void shouldCountHeadToHeadBothWays() {
        HeadToHeadRecord record = playerAnalytics.headToHead("A1", "B1", frames);
        HeadToHeadRecord reverse = playerAnalytics.headToHead("B1", "A1", frames);

        assertThat(record.wins()).isEqualTo(1);
        assertThat(record.losses()).isZero();
        assertThat(record.meetings()).hasSize(1);
        assertThat(record.meetings().get(0).winner()).isEqualTo("A1");
        assertThat(reverse.net()).isEqualTo(-1);
    }

    @Test
    @DisplayName("Une seule défaite en H2H : désavantage, confiance faible")
    void singleLossShouldBeDisadvantage() {
        HeadToHeadAnalysis analysis = playerAnalytics.analyzeHeadToHead("A8", "B8", frames);

        assertThat(analysis.winPct()).isZero();
        assertThat(analysis.advantage()).isEqualTo(H2HAdvantage.DISADVANTAGE);
        assertThat(analysis.confidence()).isCloseTo(0.1, within(1e-9));
    }

    @Test
    @DisplayName("Deux joueurs qui ne se sont jamais affrontés n'ont pas d'analyse H2H")
    void neverMetShouldGiveNoAnalysis() {
        assertThat(playerAnalytics.analyzeHeadToHead("A1", "C1", frames)).isNull();
    }

    @Test
    @DisplayName("Devrait séparer les bilans à domicile et à l'extérieur")
    void shouldSplitHomeAndAway() {
        HomeAwaySplit split = playerAnalytics.homeAwaySplit("A9", frames);

        // A9 perd ses deux frames : contre Bravo à domicile, puis chez Delta
        assertThat(split.home().played()).isEqualTo(1);
        assertThat(split.home().won()).isZero();
        assertThat(split.away().won()).isZero();
        assertThat(split.at(false).played()).isEqualTo(1);
    }

    // Match où "Solo" joue chaque frame à domicile ; wins[i] = frame i+1 gagnée
    private FrameRecord soloMatch(String id, String date, boolean... wins) {
        List<Frame> list = new ArrayList<>();
        for (int i = 0; i < wins.length; i++) {
            list.add(new Frame(i + 1, "Solo", "Adversaire" + i, wins[i] ? Side.HOME : Side.AWAY, false));
        }
        return FrameRecord.of(id, "Maison", "Visiteurs", date, list);
    }
}
