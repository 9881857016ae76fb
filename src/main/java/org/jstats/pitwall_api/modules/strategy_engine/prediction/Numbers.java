package org.jstats.pitwall_api.modules.strategy_engine.prediction;

final class Numbers {

    private Numbers() {
    }

    static double round(double value, int places) {
        double scale = Math.pow(10, places);
        return Math.round(value * scale) / scale;
    }

    static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }
}
