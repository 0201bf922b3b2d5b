package com.tony.leagueAnalytics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SimulationResult {
    private String team;
    private int currentPoints;
    private double averagePoints;

    // Probabilités (0-1)
    private double titleProbability;
    private double top2Probability;
    private double bottom2Probability;

    // Distribution complète : index 0 = 1er
    @Builder.Default
    private List<Double> positionProbabilities = new ArrayList<>();
}
