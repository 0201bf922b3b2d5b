package com.tony.leagueAnalytics.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Composition finale : deux sets ordonnés de 5 joueurs (index 0 = position 1).
 */
public record OptimizedLineup(List<String> set1, List<String> set2,
                              LineupWinProbability winProbability, boolean setsInverted) {

    public OptimizedLineup {
        set1 = List.copyOf(set1);
        set2 = List.copyOf(set2);
    }

    public List<String> players() {
        List<String> all = new ArrayList<>(set1);
        all.addAll(set2);
        return all;
    }

    public String playerAt(int set, int position) {
        return (set == 1 ? set1 : set2).get(position - 1);
    }

    /** Clé indépendante de l'ordre : deux compositions avec les mêmes 10 joueurs sont des doublons. */
    public String key() {
        return players().stream().sorted().reduce((a, b) -> a + "," + b).orElse("");
    }
}
