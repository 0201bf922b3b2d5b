package com.tony.leagueAnalytics.service;

import com.tony.leagueAnalytics.config.CalibrationProperties;
import com.tony.leagueAnalytics.model.BridgeContext;
import com.tony.leagueAnalytics.model.BridgePlayer;
import com.tony.leagueAnalytics.model.LeagueSnapshot;
import com.tony.leagueAnalytics.model.PlayerIdentity;
import com.tony.leagueAnalytics.model.PlayerSeason;
import com.tony.leagueAnalytics.model.PlayerSeasonStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class BridgePlayerServiceTest {

    private BridgePlayerService bridgePlayerService;

    @BeforeEach
    void setUp() {
        bridgePlayerService = new BridgePlayerService(new CalibrationProperties());
    }

    @Test
    @DisplayName("Un joueur aligné dans deux divisions est un joueur-pont")
    void playerInTwoDivisionsShouldBeBridge() {
        LeagueSnapshot league = league(Map.of(
                "Pont", PlayerSeason.of("Pont", PlayerSeasonStats.of("T1", "D1", 10, 5), PlayerSeasonStats.of("T2", "D2", 8, 6)),
                "Fidèle", PlayerSeason.of("Fidèle", PlayerSeasonStats.of("T1", "D1", 10, 5))));

        List<BridgePlayer> bridges = bridgePlayerService.findIntraLeague("L1", league);

        assertThat(bridges).hasSize(1);
        assertThat(bridges.get(0).name()).isEqualTo("Pont");
        assertThat(bridges.get(0).matchConfidence()).isEqualTo(1.0);
        assertThat(bridges.get(0).contexts()).extracting(BridgeContext::division).containsExactly("D1", "D2");
        assertThat(bridges.get(0).contexts()).allMatch(c -> c.leagueId().equals("L1"));
    }

    @Test
    @DisplayName("Deux équipes de la même division ou une coupe ne font pas un pont")
    void sameDivisionOrCupShouldNotBridge() {
        PlayerSeasonStats cup = new PlayerSeasonStats("Coupe", "CUP", 4, 2, 50.0, 0, 0, 0, true);
        LeagueSnapshot league = league(Map.of(
                "Transféré", PlayerSeason.of("Transféré", PlayerSeasonStats.of("T1", "D1", 5, 2), PlayerSeasonStats.of("T3", "D1", 5, 3)),
                "Coupeur", PlayerSeason.of("Coupeur", PlayerSeasonStats.of("T1", "D1", 10, 5), cup)));

        assertThat(bridgePlayerService.findIntraLeague("L1", league)).isEmpty();
    }

    @Test
    @DisplayName("Même nom à la casse et aux espaces près dans deux ligues : pont certain")
    void normalizedNameShouldBridgeLeagues() {
        Map<String, LeagueSnapshot> leagues = leagues(
                Map.of("John Smith", PlayerSeason.of("John Smith", PlayerSeasonStats.of("T1", "D1", 10, 6))),
                Map.of(" john  SMITH", PlayerSeason.of(" john  SMITH", PlayerSeasonStats.of("U1", "P1", 10, 4))));

        List<BridgePlayer> bridges = bridgePlayerService.findCrossLeague(leagues, null);

        assertThat(bridges).hasSize(1);
        assertThat(bridges.get(0).matchConfidence()).isEqualTo(1.0);
        assertThat(bridges.get(0).contexts()).extracting(BridgeContext::leagueId).containsExactly("L1", "L2");
    }

    @Test
    @DisplayName("Un lien d'identité au-dessus du seuil rapproche deux noms différents")
    void identityLinkAboveThresholdShouldBridge() {
        Map<String, LeagueSnapshot> leagues = leagues(
                Map.of("John Smith", PlayerSeason.of("John Smith", PlayerSeasonStats.of("T1", "D1", 10, 6))),
                Map.of("J. Smith", PlayerSeason.of("J. Smith", PlayerSeasonStats.of("U1", "P1", 10, 4))));

        List<BridgePlayer> bridges = bridgePlayerService.findCrossLeague(leagues,
                Map.of("J. Smith", new PlayerIdentity("John Smith", 0.9)));

        assertThat(bridges).hasSize(1);
        assertThat(bridges.get(0).matchConfidence()).isEqualTo(0.9);
    }

    @Test
    @DisplayName("Un lien d'identité sous le seuil est ignoré")
    void identityLinkBelowThresholdShouldBeIgnored() {
        Map<String, LeagueSnapshot> leagues = leagues(
                Map.of("John Smith", PlayerSeason.of("John Smith", PlayerSeasonStats.of("T1", "D1", 10, 6))),
                Map.of("J. Smith", PlayerSeason.of("J. Smith", PlayerSeasonStats.of("U1", "P1", 10, 4))));

        assertThat(bridgePlayerService.findCrossLeague(leagues,
                Map.of("J. Smith", new PlayerIdentity("John Smith", 0.8)))).isEmpty();
    }

    @Test
    @DisplayName("Une seule ligue : aucun pont inter-ligues")
    void singleLeagueShouldHaveNoCrossLeagueBridge() {
        Map<String, LeagueSnapshot> leagues = Map.of("L1", league(Map.of(
                "Pont", PlayerSeason.of("Pont", PlayerSeasonStats.of("T1", "D1", 10, 5), PlayerSeasonStats.of("T2", "D2", 8, 6)))));

        assertThat(bridgePlayerService.findCrossLeague(leagues, Map.of())).isEmpty();
        assertThat(bridgePlayerService.findAll(leagues, Map.of())).hasSize(1);
    }

    @Test
    @DisplayName("La normalisation ignore la casse et les espaces superflus")
    void shouldNormalizeNames() {
        assertThat(BridgePlayerService.normalize("  Anne   MARIE ")).isEqualTo("anne marie");
    }

    private LeagueSnapshot league(Map<String, PlayerSeason> players) {
        return LeagueSnapshot.builder().currentPlayers(players).build();
    }

    private Map<String, LeagueSnapshot> leagues(Map<String, PlayerSeason> first, Map<String, PlayerSeason> second) {
        Map<String, LeagueSnapshot> leagues = new LinkedHashMap<>();
        leagues.put("L1", league(first));
        leagues.put("L2", league(second));
        return leagues;
    }
}
