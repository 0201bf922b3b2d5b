package com.tony.leagueAnalytics.service;

import com.tony.leagueAnalytics.config.CalibrationProperties;
import com.tony.leagueAnalytics.model.BridgeContext;
import com.tony.leagueAnalytics.model.BridgePlayer;
import com.tony.leagueAnalytics.model.LeagueSnapshot;
import com.tony.leagueAnalytics.model.PlayerIdentity;
import com.tony.leagueAnalytics.model.PlayerSeasonStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Détection des joueurs-ponts : même personne observée dans plusieurs divisions ou ligues.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BridgePlayerService {

    private final CalibrationProperties properties;

    /**
     * Joueurs ayant des stats de championnat (hors coupe) dans au moins 2 divisions de la ligue.
     */
    public List<BridgePlayer> findIntraLeague(String leagueId, LeagueSnapshot snapshot) {
        List<BridgePlayer> bridges = new ArrayList<>();
        snapshot.currentPlayers().forEach((name, season) -> {
            List<PlayerSeasonStats> contexts = season.leagueContexts();
            if (contexts.size() < 2) return;

            Set<String> divisions = new HashSet<>();
            contexts.forEach(c -> divisions.add(c.division()));
            if (divisions.size() < 2) return;

            bridges.add(new BridgePlayer(name, contexts.stream().map(c -> BridgeContext.of(leagueId, c)).toList(), 1.0));
        });
        log.debug("🌉 {} joueurs-ponts internes dans {}", bridges.size(), leagueId);
        return bridges;
    }

    /**
     * Joueurs présents dans au moins 2 ligues. Rapprochement par nom normalisé (confiance 1.0),
     * ou par le lien d'identité fourni s'il atteint la confiance minimale.
     * La confiance d'un pont est la plus faible de ses liens.
     *
     * @param identities nom brut vers identité canonique (calculée en amont)
     */
    public List<BridgePlayer> findCrossLeague(Map<String, LeagueSnapshot> leagues, Map<String, PlayerIdentity> identities) {
        if (leagues.size() < 2) return List.of();
        Map<String, PlayerIdentity> links = identities == null ? Map.of() : identities;

        Map<String, Group> groups = new LinkedHashMap<>();
        leagues.forEach((leagueId, snapshot) -> snapshot.currentPlayers().forEach((name, season) -> {
            List<PlayerSeasonStats> contexts = season.leagueContexts();
            if (contexts.isEmpty()) return;

            String key = normalize(name);
            double confidence = 1.0;
            PlayerIdentity identity = links.get(name);
            if (identity != null && identity.confidence() >= properties.getMinMatchConfidence()) {
                key = normalize(identity.canonicalName());
                if (!key.equals(normalize(name))) confidence = identity.confidence();
            }

            Group group = groups.computeIfAbsent(key, k -> new Group(name));
            group.leagues.add(leagueId);
            group.confidence = Math.min(group.confidence, confidence);
            contexts.forEach(c -> group.contexts.add(BridgeContext.of(leagueId, c)));
        }));

        List<BridgePlayer> bridges = new ArrayList<>();
        groups.values().stream()
                .filter(g -> g.leagues.size() >= 2)
                .forEach(g -> bridges.add(new BridgePlayer(g.name, g.contexts, g.confidence)));

        log.info("🌉 {} joueurs-ponts entre {} ligues", bridges.size(), leagues.size());
        return bridges;
    }

    public List<BridgePlayer> findAll(Map<String, LeagueSnapshot> leagues, Map<String, PlayerIdentity> identities) {
        List<BridgePlayer> all = new ArrayList<>();
        leagues.forEach((leagueId, snapshot) -> all.addAll(findIntraLeague(leagueId, snapshot)));
        all.addAll(findCrossLeague(leagues, identities));
        return all;
    }

    /** Minuscules, espaces superflus supprimés. */
    static String normalize(String name) {
        return name.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    private static final class Group {
        final String name;
        final Set<String> leagues = new HashSet<>();
        final List<BridgeContext> contexts = new ArrayList<>();
        double confidence = 1.0;

        Group(String name) {
            this.name = name;
        }
    }
}
