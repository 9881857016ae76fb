package org.jstats.pitwall_api.modules.strategy_engine.model;

import java.util.List;

public record PositionResponse(
        int currentPosition,
        int predictedFinalPosition,
        double overtakeProbability,
        PositionChangeProbabilities positionChangeProbabilities,
        AttackAnalysis attackAnalysis,
        DefenseAnalysis defenseAnalysis,
        String battleStatus,
        List<String> tacticalRecommendations
) {

    public record PositionChangeProbabilities(double lose, double maintain, double gain) {}

    /**
     * @param probability overtake probability in percent
     */
    public record AttackAnalysis(
            double gapToTarget,
            double probability,
            List<String> factors,
            String recommendedAction
    ) {}

    /**
     * @param loseProbability probability of losing the place, in percent
     */
    public record DefenseAnalysis(
            double gapToThreat,
            String threatLevel,
            String threatColor,
            double loseProbability,
            String recommendedAction
    ) {}
}
