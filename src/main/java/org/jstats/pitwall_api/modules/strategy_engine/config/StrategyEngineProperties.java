package org.jstats.pitwall_api.modules.strategy_engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for hybrid training, model persistence and prediction heuristics.
 */
@Configuration
@ConfigurationProperties(prefix = "pitwall.engine")
public class StrategyEngineProperties {

    private String modelsDir = "models";
    private long seed = 42L;
    private final Blend blend = new Blend();
    private final Trainer trainer = new Trainer();
    private final Heuristics heuristics = new Heuristics();

    public String getModelsDir() {
        return modelsDir;
    }

    public void setModelsDir(String modelsDir) {
        this.modelsDir = modelsDir;
    }

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }

    public Blend getBlend() {
        return blend;
    }

    public Trainer getTrainer() {
        return trainer;
    }

    public Heuristics getHeuristics() {
        return heuristics;
    }

    /**
     * Default real/synthetic split and synthetic pool sizing.
     */
    public static class Blend {
        private double realWeight = 0.7;
        private double syntheticWeight = 0.3;
        private double syntheticConfidence = 0.3;
        private int minRealSamples = 100;
        private int targetTotalSamples = 1000;
        private int maxSyntheticSamples = 2000;

        public double getRealWeight() {
            return realWeight;
        }

        public void setRealWeight(double realWeight) {
            this.realWeight = realWeight;
        }

        public double getSyntheticWeight() {
            return syntheticWeight;
        }

        public void setSyntheticWeight(double syntheticWeight) {
            this.syntheticWeight = syntheticWeight;
        }

        public double getSyntheticConfidence() {
            return syntheticConfidence;
        }

        public void setSyntheticConfidence(double syntheticConfidence) {
            this.syntheticConfidence = syntheticConfidence;
        }

        public int getMinRealSamples() {
            return minRealSamples;
        }

        public void setMinRealSamples(int minRealSamples) {
            this.minRealSamples = minRealSamples;
        }

        public int getTargetTotalSamples() {
            return targetTotalSamples;
        }

        public void setTargetTotalSamples(int targetTotalSamples) {
            this.targetTotalSamples = targetTotalSamples;
        }

        public int getMaxSyntheticSamples() {
            return maxSyntheticSamples;
        }

        public void setMaxSyntheticSamples(int maxSyntheticSamples) {
            this.maxSyntheticSamples = maxSyntheticSamples;
        }
    }

    /**
     * Ensemble hyper-parameters.
     */
    public static class Trainer {
        private double testFraction = 0.2;
        private int minExamples = 10;
        private int numTrees = 100;
        private int maxDepth = 10;
        private int boostingRounds = 100;
        private double learningRate = 0.1;
        private int boostingDepth = 4;

        public double getTestFraction() {
            return testFraction;
        }

        public void setTestFraction(double testFraction) {
            this.testFraction = testFraction;
        }

        public int getMinExamples() {
            return minExamples;
        }

        public void setMinExamples(int minExamples) {
            this.minExamples = minExamples;
        }

        public int getNumTrees() {
            return numTrees;
        }

        public void setNumTrees(int numTrees) {
            this.numTrees = numTrees;
        }

        public int getMaxDepth() {
            return maxDepth;
        }

        public void setMaxDepth(int maxDepth) {
            this.maxDepth = maxDepth;
        }

        public int getBoostingRounds() {
            return boostingRounds;
        }

        public void setBoostingRounds(int boostingRounds) {
            this.boostingRounds = boostingRounds;
        }

        public double getLearningRate() {
            return learningRate;
        }

        public void setLearningRate(double learningRate) {
            this.learningRate = learningRate;
        }

        public int getBoostingDepth() {
            return boostingDepth;
        }

        public void setBoostingDepth(int boostingDepth) {
            this.boostingDepth = boostingDepth;
        }
    }

    /**
     * Limits used by the post-processing rules and the real-data labeler.
     */
    public static class Heuristics {
        private double pitDelta = 22.0;
        private double undercutThreshold = 0.0;
        private int undercutTireMargin = 3;
        private int trendWindow = 3;
        private int lapHorizon = 5;
        private int maxTacticalRecommendations = 4;

        public double getPitDelta() {
            return pitDelta;
        }

        public void setPitDelta(double pitDelta) {
            this.pitDelta = pitDelta;
        }

        public double getUndercutThreshold() {
            return undercutThreshold;
        }

        public void setUndercutThreshold(double undercutThreshold) {
            this.undercutThreshold = undercutThreshold;
        }

        public int getUndercutTireMargin() {
            return undercutTireMargin;
        }

        public void setUndercutTireMargin(int undercutTireMargin) {
            this.undercutTireMargin = undercutTireMargin;
        }

        public int getTrendWindow() {
            return trendWindow;
        }

        public void setTrendWindow(int trendWindow) {
            this.trendWindow = trendWindow;
        }

        public int getLapHorizon() {
            return lapHorizon;
        }

        public void setLapHorizon(int lapHorizon) {
            this.lapHorizon = lapHorizon;
        }

        public int getMaxTacticalRecommendations() {
            return maxTacticalRecommendations;
        }

        public void setMaxTacticalRecommendations(int maxTacticalRecommendations) {
            this.maxTacticalRecommendations = maxTacticalRecommendations;
        }
    }
}
