package org.jstats.pitwall_api.modules.strategy_engine.training;

import org.jspecify.annotations.Nullable;
import org.jstats.pitwall_api.modules.strategy_engine.config.StrategyEngineProperties;
import org.jstats.pitwall_api.modules.strategy_engine.data.RawSessionRecord;
import org.jstats.pitwall_api.modules.strategy_engine.domain.Compound;
import org.jstats.pitwall_api.modules.strategy_engine.domain.LabelSet;
import org.jstats.pitwall_api.modules.strategy_engine.domain.StrategyDomain;
import org.jstats.pitwall_api.modules.strategy_engine.domain.TrainingExample;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

import static org.jstats.pitwall_api.modules.strategy_engine.domain.DomainRules.*;
import static org.jstats.pitwall_api.modules.strategy_engine.domain.Targets.*;

/**
 * Turns observed session laps into ground-truth examples. Malformed records are skipped, never fatal.
 */
@Component
public class RealSampleExtractor {

    private static final Logger log = LoggerFactory.getLogger(RealSampleExtractor.class);

    static final int NO_PIT_HORIZON = 20;
    static final double RAIN_OBSERVED_PROBABILITY = 50;
    static final double TRAFFIC_WINDOW_SECONDS = 2.0;
    static final double DRS_GAP_SECONDS = 1.0;

    // Circuit and car telemetry the timing feed does not carry; same values as the inference defaults.
    static final double TRACK_LENGTH_KM = 5.0;
    static final double CORNERS = 15;
    static final double HIGH_SPEED_CORNERS = 5;
    static final double LOW_SPEED_CORNERS = 10;
    static final double DEFAULT_POSITION = 10;
    static final double TRACK_POSITION_VALUE = 50;
    static final double PUSH_LEVEL = 80;
    static final double BATTERY_DEPLOYMENT = 50;
    static final double BATTERY_LEVEL = 80;
    static final double STRAIGHT_LENGTH = 1000;
    static final double OVERTAKING_DIFFICULTY = 50;
    static final double DRIVER_AGGRESSION = 50;

    private final StrategyEngineProperties properties;

    public RealSampleExtractor(StrategyEngineProperties properties) {
        this.properties = properties;
    }

    public List<TrainingExample> extract(StrategyDomain domain, List<RawSessionRecord> records) {
        SessionIndex index = new SessionIndex(records);
        List<TrainingExample> examples = new ArrayList<>();
        int skipped = 0;

        for (RawSessionRecord record : records) {
            if (!isUsable(domain, record)) {
                skipped++;
                continue;
            }
            Optional<TrainingExample> example = switch (domain) {
                case TIRE_STRATEGY -> Optional.of(tireExample(record, index));
                case PIT_STOP -> Optional.of(pitStopExample(record, index));
                case RACE_PACE -> Optional.of(paceExample(record, index));
                case POSITION -> positionExample(record, index);
            };
            if (example.isPresent()) {
                examples.add(example.get());
            } else {
                skipped++;
            }
        }

        if (log.isDebugEnabled()) {
            log.debug("Extracted {} real {} examples, skipped {} incomplete records",
                    examples.size(), domain.modelName(), skipped);
        }
        return examples;
    }

    static boolean isUsable(StrategyDomain domain, RawSessionRecord r) {
        if (r.lapNumber() == null || r.lapDuration() == null || !r.hasStint() || !r.hasWeather()) {
            return false;
        }
        if (Compound.parse(r.compound()).isEmpty()) {
            return false;
        }
        return switch (domain) {
            case POSITION -> r.position() != null;
            case RACE_PACE -> r.sector1Duration() != null && r.sector2Duration() != null;
            default -> true;
        };
    }

    // ---------- per-domain rows ----------
    private TrainingExample tireExample(RawSessionRecord r, SessionIndex index) {
        int lap = r.lapNumber();
        int totalLaps = index.totalLaps(r.sessionKey());
        RawSessionRecord behind = index.neighbour(r, 1);

        Map<String, Double> f = new LinkedHashMap<>();
        f.put("track_temperature", r.trackTemperature());
        f.put("air_temperature", r.airTemperature());
        f.put("humidity", r.humidity());
        f.put("track_length", TRACK_LENGTH_KM);
        f.put("number_of_corners", CORNERS);
        f.put("high_speed_corners", HIGH_SPEED_CORNERS);
        f.put("low_speed_corners", LOW_SPEED_CORNERS);
        f.put("current_lap", (double) lap);
        f.put("total_laps", (double) totalLaps);
        f.put("remaining_laps", (double) (totalLaps - lap));
        f.put("current_position", positionOf(r));
        f.put("gap_to_leader", orZero(r.gapToLeader()));
        f.put("gap_to_car_ahead", orZero(r.interval()));
        f.put("gap_to_car_behind", behind == null ? 0.0 : orZero(behind.interval()));
        f.put("fuel_load", fuelLoadAtLap(lap));
        f.put("tire_age", (double) tireAge(r));
        f.put("rain_probability", rainProbability(r));
        f.put("track_evolution", trackEvolutionAtLap(lap));
        f.put("safety_car", r.safetyCar() ? 1.0 : 0.0);
        f.put("vsc", r.virtualSafetyCar() ? 1.0 : 0.0);

        LabelSet labels = LabelSet.builder()
                .label(COMPOUND, compoundOf(r).name())
                .value(STINT_LENGTH, (double) (r.stintLapEnd() - r.stintLapStart() + 1))
                .value(DEGRADATION_RATE, index.degradation(r))
                .build();
        return TrainingExample.real(f, labels);
    }

    private TrainingExample pitStopExample(RawSessionRecord r, SessionIndex index) {
        StrategyEngineProperties.Heuristics limits = properties.getHeuristics();
        int lap = r.lapNumber();
        int totalLaps = index.totalLaps(r.sessionKey());
        int tireAge = tireAge(r);
        double degradation = index.degradation(r);
        double gapAhead = orZero(r.interval());
        RawSessionRecord ahead = index.neighbour(r, -1);
        RawSessionRecord behind = index.neighbour(r, 1);
        int competitorAge = ahead != null && ahead.hasStint() ? tireAge(ahead) : tireAge;
        Compound competitorCompound = ahead != null && ahead.hasStint() ? compoundOf(ahead) : compoundOf(r);
        double paceDelta = r.lapDuration() - index.bestLapUpTo(r);

        Map<String, Double> f = new LinkedHashMap<>();
        f.put("current_lap", (double) lap);
        f.put("total_laps", (double) totalLaps);
        f.put("remaining_laps", (double) (totalLaps - lap));
        f.put("tire_age", (double) tireAge);
        f.put("tire_compound_idx", (double) compoundOf(r).index());
        f.put("current_position", positionOf(r));
        f.put("gap_to_car_ahead", gapAhead);
        f.put("gap_to_car_behind", behind == null ? 0.0 : orZero(behind.interval()));
        f.put("pit_delta", limits.getPitDelta());
        f.put("track_position_value", TRACK_POSITION_VALUE);
        f.put("tire_degradation_rate", degradation);
        f.put("current_pace_delta", paceDelta);
        f.put("competitor_tire_age", (double) competitorAge);
        f.put("competitor_compound_idx", (double) competitorCompound.index());
        f.put("fuel_adjusted_pace", paceDelta - FUEL_EFFECT_PER_KG * fuelLoadAtLap(lap));
        f.put("traffic_density", (double) index.trafficAhead(r));
        f.put("safety_car_probability", r.safetyCar() || r.virtualSafetyCar() ? 100.0 : 0.0);
        f.put("drs_available", drs(r));
        f.put("track_temperature", r.trackTemperature());
        f.put("rain_probability", rainProbability(r));

        double undercutGain = degradation * tireAge * 3 - gapAhead;
        boolean inWindow = undercutGain > limits.getUndercutThreshold();
        boolean undercut = inWindow
                && gapAhead < UNDERCUT_GAP_FRACTION * limits.getPitDelta()
                && tireAge > competitorAge;

        LabelSet labels = LabelSet.builder()
                .label(IN_PIT_WINDOW, flag(inWindow))
                .label(UNDERCUT_OPPORTUNITY, flag(undercut))
                .value(OPTIMAL_PIT_LAP, (double) index.nextPitLap(r))
                .build();
        return TrainingExample.real(f, labels);
    }

    private TrainingExample paceExample(RawSessionRecord r, SessionIndex index) {
        int lap = r.lapNumber();
        Map<String, Double> f = new LinkedHashMap<>();
        f.put("lap_number", (double) lap);
        f.put("fuel_load", fuelLoadAtLap(lap));
        f.put("tire_age", (double) tireAge(r));
        f.put("tire_compound_idx", (double) compoundOf(r).index());
        f.put("track_temperature", r.trackTemperature());
        f.put("air_temperature", r.airTemperature());
        f.put("track_evolution", trackEvolutionAtLap(lap));
        f.put("traffic", (double) index.trafficAhead(r));
        f.put("drs_enabled", drs(r));
        f.put("sector1_time", r.sector1Duration());
        f.put("sector2_time", r.sector2Duration());
        f.put("previous_lap_time", index.previousLapTime(r));
        f.put("best_lap_time", index.bestLapUpTo(r));
        f.put("avg_lap_time", index.averageLapUpTo(r));
        f.put("position", positionOf(r));
        f.put("wind_speed", orZero(r.windSpeed()));
        f.put("humidity", r.humidity());
        f.put("safety_car_laps", (double) index.neutralisedLapsUpTo(r));
        f.put("push_level", PUSH_LEVEL);
        f.put("battery_deployment", BATTERY_DEPLOYMENT);

        LabelSet labels = LabelSet.builder()
                .value(LAP_TIME, r.lapDuration())
                .value(FUEL_EFFECT, FUEL_EFFECT_PER_KG)
                .value(PACE_TREND, index.degradation(r))
                .build();
        return TrainingExample.real(f, labels);
    }

    private Optional<TrainingExample> positionExample(RawSessionRecord r, SessionIndex index) {
        Integer nextPosition = index.nextLapPosition(r);
        if (nextPosition == null) {
            return Optional.empty();
        }
        int lap = r.lapNumber();
        int position = r.position();
        int totalLaps = index.totalLaps(r.sessionKey());
        RawSessionRecord ahead = index.neighbour(r, -1);
        RawSessionRecord behind = index.neighbour(r, 1);
        int tireAge = tireAge(r);
        int competitorAge = ahead != null && ahead.hasStint() ? tireAge(ahead) : tireAge;
        int compoundAdvantage = ahead != null && ahead.hasStint()
                ? compoundOf(ahead).hardness() - compoundOf(r).hardness()
                : 0;
        double relativePace = ahead != null && ahead.lapDuration() != null
                ? r.lapDuration() - ahead.lapDuration()
                : 0.0;

        Map<String, Double> f = new LinkedHashMap<>();
        f.put("current_position", (double) position);
        f.put("lap_number", (double) lap);
        f.put("remaining_laps", (double) (totalLaps - lap));
        f.put("gap_to_car_ahead", orZero(r.interval()));
        f.put("gap_to_car_behind", behind == null ? 0.0 : orZero(behind.interval()));
        f.put("relative_pace", relativePace);
        f.put("tire_advantage", (double) (competitorAge - tireAge));
        f.put("compound_advantage", (double) compoundAdvantage);
        f.put("drs_available", drs(r));
        f.put("battery_level", BATTERY_LEVEL);
        f.put("straight_length", STRAIGHT_LENGTH);
        f.put("overtaking_difficulty", OVERTAKING_DIFFICULTY);
        f.put("track_position_value", TRACK_POSITION_VALUE);
        f.put("driver_aggression", DRIVER_AGGRESSION);
        f.put("car_performance_delta", 0.0);
        f.put("weather_stability", Boolean.TRUE.equals(r.rainfall()) ? 50.0 : 100.0);
        f.put("safety_car_probability", r.safetyCar() || r.virtualSafetyCar() ? 100.0 : 0.0);
        f.put("laps_since_pit", (double) tireAge);
        f.put("competitor_laps_since_pit", (double) competitorAge);
        f.put("points_position", (double) position);

        String change = nextPosition < position ? GAIN : nextPosition > position ? LOSE : MAINTAIN;
        LabelSet labels = LabelSet.builder()
                .label(OVERTAKE_SUCCESS, flag(nextPosition < position))
                .label(POSITION_CHANGE, change)
                .value(POSITION_DELTA, (double) (index.finalPosition(r) - position))
                .build();
        return Optional.of(TrainingExample.real(f, labels));
    }

    // ---------- derived values ----------
    static int tireAge(RawSessionRecord r) {
        int atStart = r.tyreAgeAtStart() == null ? 0 : r.tyreAgeAtStart();
        return atStart + (r.lapNumber() - r.stintLapStart());
    }

    private static Compound compoundOf(RawSessionRecord r) {
        return Compound.parse(r.compound()).orElse(Compound.MEDIUM);
    }

    private static double positionOf(RawSessionRecord r) {
        return r.position() == null ? DEFAULT_POSITION : r.position();
    }

    private static double rainProbability(RawSessionRecord r) {
        return Boolean.TRUE.equals(r.rainfall()) ? RAIN_OBSERVED_PROBABILITY : 0.0;
    }

    private static double drs(RawSessionRecord r) {
        return r.interval() != null && r.interval() < DRS_GAP_SECONDS ? 1.0 : 0.0;
    }

    private static double orZero(@Nullable Double value) {
        return value == null ? 0.0 : value;
    }

    private record DriverKey(int sessionKey, int driverNumber) {
    }

    private record StintKey(int sessionKey, int driverNumber, int lapStart) {
    }

    /**
     * Lookups across one batch of records: per-driver lap history and per-lap running order.
     */
    private static final class SessionIndex {

        private final Map<Integer, Integer> totalLaps = new HashMap<>();
        private final Map<Integer, Map<Integer, List<RawSessionRecord>>> byLap = new HashMap<>();
        private final Map<DriverKey, NavigableMap<Integer, RawSessionRecord>> byDriver = new HashMap<>();
        private final Map<StintKey, Double> degradation = new HashMap<>();

        SessionIndex(List<RawSessionRecord> records) {
            for (RawSessionRecord r : records) {
                if (r.lapNumber() == null) {
                    continue;
                }
                totalLaps.merge(r.sessionKey(), r.lapNumber(), Math::max);
                byLap.computeIfAbsent(r.sessionKey(), k -> new HashMap<>())
                        .computeIfAbsent(r.lapNumber(), k -> new ArrayList<>())
                        .add(r);
                byDriver.computeIfAbsent(new DriverKey(r.sessionKey(), r.driverNumber()), k -> new TreeMap<>())
                        .put(r.lapNumber(), r);
            }
        }

        int totalLaps(int sessionKey) {
            return totalLaps.getOrDefault(sessionKey, 0);
        }

        /**
         * Car {@code offset} places behind (positive) or ahead (negative) on the same lap.
         */
        @Nullable RawSessionRecord neighbour(RawSessionRecord r, int offset) {
            if (r.position() == null) {
                return null;
            }
            int target = r.position() + offset;
            for (RawSessionRecord other : byLap.getOrDefault(r.sessionKey(), Map.of())
                    .getOrDefault(r.lapNumber(), List.of())) {
                if (other.position() != null && other.position() == target) {
                    return other;
                }
            }
            return null;
        }

        int trafficAhead(RawSessionRecord r) {
            if (r.gapToLeader() == null) {
                return 0;
            }
            int count = 0;
            for (RawSessionRecord other : byLap.getOrDefault(r.sessionKey(), Map.of())
                    .getOrDefault(r.lapNumber(), List.of())) {
                if (other.driverNumber() == r.driverNumber() || other.gapToLeader() == null) {
                    continue;
                }
                double gap = r.gapToLeader() - other.gapToLeader();
                if (gap > 0 && gap < TRAFFIC_WINDOW_SECONDS) {
                    count++;
                }
            }
            return count;
        }

        double degradation(RawSessionRecord r) {
            StintKey key = new StintKey(r.sessionKey(), r.driverNumber(), r.stintLapStart());
            return degradation.computeIfAbsent(key, k -> estimateDegradation(r));
        }

        private double estimateDegradation(RawSessionRecord r) {
            List<Double> ages = new ArrayList<>();
            List<Double> times = new ArrayList<>();
            for (RawSessionRecord lap : laps(r).subMap(r.stintLapStart(), true, r.stintLapEnd(), true).values()) {
                if (lap.lapDuration() == null || lap.pitInLap()) {
                    continue;
                }
                int atStart = r.tyreAgeAtStart() == null ? 0 : r.tyreAgeAtStart();
                ages.add((double) (atStart + lap.lapNumber() - r.stintLapStart()));
                times.add(lap.lapDuration());
            }
            return DegradationEstimator.slope(
                    ages.stream().mapToDouble(Double::doubleValue).toArray(),
                    times.stream().mapToDouble(Double::doubleValue).toArray());
        }

        int nextPitLap(RawSessionRecord r) {
            for (RawSessionRecord later : laps(r).tailMap(r.lapNumber(), false).values()) {
                if (later.pitInLap()) {
                    return later.lapNumber();
                }
            }
            return r.lapNumber() + NO_PIT_HORIZON;
        }

        double previousLapTime(RawSessionRecord r) {
            for (RawSessionRecord earlier : laps(r).headMap(r.lapNumber(), false).descendingMap().values()) {
                if (earlier.lapDuration() != null) {
                    return earlier.lapDuration();
                }
            }
            return r.lapDuration();
        }

        double bestLapUpTo(RawSessionRecord r) {
            double best = r.lapDuration();
            for (RawSessionRecord earlier : laps(r).headMap(r.lapNumber(), true).values()) {
                if (earlier.lapDuration() != null) {
                    best = Math.min(best, earlier.lapDuration());
                }
            }
            return best;
        }

        double averageLapUpTo(RawSessionRecord r) {
            double sum = 0;
            int n = 0;
            for (RawSessionRecord earlier : laps(r).headMap(r.lapNumber(), true).values()) {
                if (earlier.lapDuration() != null) {
                    sum += earlier.lapDuration();
                    n++;
                }
            }
            return n == 0 ? r.lapDuration() : sum / n;
        }

        int neutralisedLapsUpTo(RawSessionRecord r) {
            int count = 0;
            for (RawSessionRecord earlier : laps(r).headMap(r.lapNumber(), true).values()) {
                if (earlier.safetyCar() || earlier.virtualSafetyCar()) {
                    count++;
                }
            }
            return count;
        }

        @Nullable Integer nextLapPosition(RawSessionRecord r) {
            RawSessionRecord next = laps(r).get(r.lapNumber() + 1);
            return next == null ? null : next.position();
        }

        int finalPosition(RawSessionRecord r) {
            for (RawSessionRecord later : laps(r).descendingMap().values()) {
                if (later.position() != null) {
                    return later.position();
                }
            }
            return r.position();
        }

        private NavigableMap<Integer, RawSessionRecord> laps(RawSessionRecord r) {
            return byDriver.getOrDefault(new DriverKey(r.sessionKey(), r.driverNumber()), new TreeMap<>());
        }
    }
}
