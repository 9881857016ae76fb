package org.jstats.pitwall_api.modules.strategy_engine.training;

import org.jstats.pitwall_api.modules.strategy_engine.domain.DomainRules;

/**
 * Least-squares slope of lap time against tire age within one stint.
 */
final class DegradationEstimator {

    static final int MIN_LAPS = 3;

    private DegradationEstimator() {
    }

    static double slope(double[] tireAges, double[] lapTimes) {
        int n = tireAges.length;
        if (n < MIN_LAPS) {
            return DomainRules.BASE_DEGRADATION;
        }
        double meanX = 0;
        double meanY = 0;
        for (int i = 0; i < n; i++) {
            meanX += tireAges[i];
            meanY += lapTimes[i];
        }
        meanX /= n;
        meanY /= n;

        double cov = 0;
        double var = 0;
        for (int i = 0; i < n; i++) {
            double dx = tireAges[i] - meanX;
            cov += dx * (lapTimes[i] - meanY);
            var += dx * dx;
        }
        if (var == 0) {
            return DomainRules.BASE_DEGRADATION;
        }
        return DomainRules.clamp(cov / var, DomainRules.MIN_DEGRADATION, DomainRules.MAX_DEGRADATION);
    }
}
