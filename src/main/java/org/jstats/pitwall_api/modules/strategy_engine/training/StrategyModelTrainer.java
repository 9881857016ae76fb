package org.jstats.pitwall_api.modules.strategy_engine.training;

import org.jstats.pitwall_api.modules.strategy_engine.config.StrategyEngineProperties;
import org.jstats.pitwall_api.modules.strategy_engine.domain.SampleSource;
import org.jstats.pitwall_api.modules.strategy_engine.domain.StrategyDomain;
import org.jstats.pitwall_api.modules.strategy_engine.domain.TargetSpec;
import org.jstats.pitwall_api.modules.strategy_engine.domain.TrainingExample;
import org.jstats.pitwall_api.modules.strategy_engine.exception.TrainingFailureException;
import org.jstats.pitwall_api.modules.strategy_engine.registry.DataBreakdown;
import org.jstats.pitwall_api.modules.strategy_engine.registry.ModelArtifact;
import org.jstats.pitwall_api.modules.strategy_engine.registry.TrainingMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.tribuo.Example;
import org.tribuo.Model;
import org.tribuo.classification.Label;
import org.tribuo.classification.LabelFactory;
import org.tribuo.classification.dtree.CARTClassificationTrainer;
import org.tribuo.classification.ensemble.VotingCombiner;
import org.tribuo.common.tree.RandomForestTrainer;
import org.tribuo.regression.RegressionFactory;
import org.tribuo.regression.Regressor;
import org.tribuo.regression.ensemble.AveragingCombiner;
import org.tribuo.regression.rtree.CARTRegressionTrainer;
import org.tribuo.regression.rtree.impurity.MeanSquaredError;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeSet;
import java.util.function.Predicate;

/**
 * Fits every target of a domain on a blended dataset and scores it on a seeded held-out split.
 */
@Component
public class StrategyModelTrainer {

    private static final Logger log = LoggerFactory.getLogger(StrategyModelTrainer.class);

    static final float FOREST_FEATURE_FRACTION = 0.5f;
    static final float MIN_CHILD_WEIGHT = 5f;

    private final FeatureEncoder encoder;
    private final StrategyEngineProperties properties;
    private final Clock clock;

    public StrategyModelTrainer(FeatureEncoder encoder, StrategyEngineProperties properties, Clock clock) {
        this.encoder = encoder;
        this.properties = properties;
        this.clock = clock;
    }

    public ModelArtifact train(StrategyDomain domain, BlendedDataset dataset) {
        StrategyEngineProperties.Trainer cfg = properties.getTrainer();
        String name = domain.modelName();
        if (dataset.size() < cfg.getMinExamples()) {
            throw new TrainingFailureException(name,
                    "Need at least %d examples to train %s, got %d".formatted(cfg.getMinExamples(), name, dataset.size()));
        }

        List<TrainingExample> shuffled = new ArrayList<>(dataset.examples());
        Collections.shuffle(shuffled, new Random(properties.getSeed()));
        int testCount = heldOutCount(shuffled.size(), cfg.getTestFraction());
        List<TrainingExample> test = shuffled.subList(0, testCount);
        List<TrainingExample> train = shuffled.subList(testCount, shuffled.size());

        String[] featureNames = domain.schema().toArray();
        double[][] trainX = encodeAll(domain, train);
        double[][] testX = encodeAll(domain, test);
        float[] fitWeights = fitWeights(train);

        Map<String, TrainedClassifier> classifiers = new HashMap<>();
        Map<String, TrainedRegressor> regressors = new HashMap<>();
        Map<String, List<String>> classLabels = new HashMap<>();
        Map<String, Double> scores = new LinkedHashMap<>();

        for (TargetSpec target : domain.targets()) {
            if (target.isClassification()) {
                List<String> classes = distinctClasses(name, target.name(), train);
                TrainedClassifier classifier = fitClassifier(target.name(), featureNames, train, trainX, fitWeights);
                classifiers.put(target.name(), classifier);
                classLabels.put(target.name(), classes);
                scoreClassifier(target.name(), classifier, test, testX, scores);
            } else {
                TrainedRegressor regressor = target.estimator() == TargetSpec.Estimator.GRADIENT_BOOSTING
                        ? fitBoosted(target.name(), featureNames, train, trainX, fitWeights)
                        : fitForest(target.name(), featureNames, train, trainX, fitWeights);
                regressors.put(target.name(), regressor);
                scoreRegressor(target.name(), regressor, test, testX, scores);
            }
        }

        DataBreakdown breakdown = breakdown(dataset, train, fitWeights);
        log.info("Trained {} on {} examples ({} real, {} synthetic), held out {}",
                name, dataset.size(), breakdown.real(), breakdown.synthetic(), testCount);

        return new ModelArtifact(domain, domain.schema(), classifiers, regressors, classLabels,
                new TrainingMetrics(scores, breakdown), Instant.now(clock));
    }

    // ---------- split / weights ----------
    static int heldOutCount(int size, double testFraction) {
        if (testFraction <= 0) {
            return 0;
        }
        int count = (int) Math.round(size * testFraction);
        return Math.max(1, Math.min(count, size - 1));
    }

    /**
     * Per-row fit weights: a source's weight spread evenly over its rows and scaled so the mean row
     * weight is 1. Each source's share of the total equals its blend weight.
     */
    static float[] fitWeights(List<TrainingExample> train) {
        Map<SampleSource, Integer> counts = new EnumMap<>(SampleSource.class);
        Map<SampleSource, Double> weightBySource = new EnumMap<>(SampleSource.class);
        for (TrainingExample example : train) {
            counts.merge(example.source(), 1, Integer::sum);
            weightBySource.putIfAbsent(example.source(), example.weight());
        }
        double weightSum = weightBySource.values().stream().mapToDouble(Double::doubleValue).sum();
        float[] weights = new float[train.size()];
        for (int i = 0; i < weights.length; i++) {
            TrainingExample example = train.get(i);
            double share = weightSum > 0 ? example.weight() / weightSum : 1.0 / weightBySource.size();
            weights[i] = (float) (share / counts.get(example.source()) * train.size());
        }
        return weights;
    }

    private static DataBreakdown breakdown(BlendedDataset dataset, List<TrainingExample> train, float[] fitWeights) {
        double realMass = 0;
        double total = 0;
        for (int i = 0; i < fitWeights.length; i++) {
            total += fitWeights[i];
            if (train.get(i).isReal()) {
                realMass += fitWeights[i];
            }
        }
        double realInfluence = total > 0 ? round(realMass / total) : 0.0;
        return new DataBreakdown(dataset.realCount(), dataset.syntheticCount(), realInfluence, round(1.0 - realInfluence));
    }

    private double[][] encodeAll(StrategyDomain domain, List<TrainingExample> examples) {
        double[][] rows = new double[examples.size()][];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = encoder.encode(domain.schema(), examples.get(i).features());
        }
        return rows;
    }

    private static List<String> distinctClasses(String modelName, String target, List<TrainingExample> train) {
        TreeSet<String> classes = new TreeSet<>();
        for (TrainingExample example : train) {
            classes.add(example.labels().classOf(target));
        }
        if (classes.size() < 2) {
            throw new TrainingFailureException(modelName,
                    "Target '%s' has a single class %s; cannot fit a classifier".formatted(target, classes));
        }
        return List.copyOf(classes);
    }

    // ---------- fitting ----------
    private TrainedClassifier fitClassifier(String target, String[] names, List<TrainingExample> train,
                                            double[][] x, float[] w) {
        StrategyEngineProperties.Trainer cfg = properties.getTrainer();
        LabelFactory factory = new LabelFactory();
        List<Example<Label>> rows = new ArrayList<>(train.size());
        for (int i = 0; i < x.length; i++) {
            rows.add(TribuoRows.example(new Label(train.get(i).labels().classOf(target)), names, x[i], w[i]));
        }
        var trainer = new RandomForestTrainer<>(
                new CARTClassificationTrainer(cfg.getMaxDepth(), FOREST_FEATURE_FRACTION, properties.getSeed()),
                new VotingCombiner(),
                cfg.getNumTrees(),
                properties.getSeed());
        Model<Label> model = trainer.train(TribuoRows.dataset(target, factory, rows));
        return new ForestClassifier(target, names, model);
    }

    private TrainedRegressor fitForest(String target, String[] names, List<TrainingExample> train,
                                       double[][] x, float[] w) {
        StrategyEngineProperties.Trainer cfg = properties.getTrainer();
        var trainer = new RandomForestTrainer<>(
                new CARTRegressionTrainer(cfg.getMaxDepth(), MIN_CHILD_WEIGHT, 0f, FOREST_FEATURE_FRACTION,
                        false, new MeanSquaredError(), properties.getSeed()),
                new AveragingCombiner(),
                cfg.getNumTrees(),
                properties.getSeed());
        Model<Regressor> model = trainer.train(TribuoRows.dataset(target, new RegressionFactory(),
                regressionRows(target, names, x, targetValues(target, train), w)));
        return new ForestRegressor(target, names, model);
    }

    private TrainedRegressor fitBoosted(String target, String[] names, List<TrainingExample> train,
                                        double[][] x, float[] w) {
        StrategyEngineProperties.Trainer cfg = properties.getTrainer();
        double[] y = targetValues(target, train);

        double weightSum = 0;
        double base = 0;
        for (int i = 0; i < y.length; i++) {
            base += w[i] * y[i];
            weightSum += w[i];
        }
        base = weightSum > 0 ? base / weightSum : 0;

        double[] fitted = new double[y.length];
        Arrays.fill(fitted, base);
        double[] residuals = new double[y.length];
        CARTRegressionTrainer stageTrainer = new CARTRegressionTrainer(cfg.getBoostingDepth());
        RegressionFactory factory = new RegressionFactory();
        List<Model<Regressor>> stages = new ArrayList<>(cfg.getBoostingRounds());

        for (int round = 0; round < cfg.getBoostingRounds(); round++) {
            for (int i = 0; i < y.length; i++) {
                residuals[i] = y[i] - fitted[i];
            }
            List<Example<Regressor>> rows = regressionRows(target, names, x, residuals, w);
            Model<Regressor> stage = stageTrainer.train(TribuoRows.dataset(target + "-stage-" + round, factory, rows));
            stages.add(stage);
            for (int i = 0; i < rows.size(); i++) {
                fitted[i] += cfg.getLearningRate() * stage.predict(rows.get(i)).getOutput().getValues()[0];
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("Boosted {} with {} stages (lr={}, depth={})",
                    target, stages.size(), cfg.getLearningRate(), cfg.getBoostingDepth());
        }
        return new GradientBoostedRegressor(target, names, base, cfg.getLearningRate(), stages);
    }

    private static List<Example<Regressor>> regressionRows(String target, String[] names, double[][] x,
                                                           double[] y, float[] w) {
        List<Example<Regressor>> rows = new ArrayList<>(x.length);
        for (int i = 0; i < x.length; i++) {
            rows.add(TribuoRows.example(new Regressor(target, y[i]), names, x[i], w[i]));
        }
        return rows;
    }

    private static double[] targetValues(String target, List<TrainingExample> examples) {
        double[] y = new double[examples.size()];
        for (int i = 0; i < y.length; i++) {
            y[i] = examples.get(i).labels().valueOf(target);
        }
        return y;
    }

    // ---------- scoring ----------
    private static void scoreClassifier(String target, TrainedClassifier classifier, List<TrainingExample> test,
                                        double[][] x, Map<String, Double> scores) {
        if (test.isEmpty()) {
            return;
        }
        List<String> truth = new ArrayList<>(test.size());
        List<String> predicted = new ArrayList<>(test.size());
        for (int i = 0; i < x.length; i++) {
            truth.add(test.get(i).labels().classOf(target));
            predicted.add(classifier.predict(x[i]));
        }
        putClassificationScores(scores, target, "", truth, predicted, e -> true, test);
        putClassificationScores(scores, target, "_real", truth, predicted, TrainingExample::isReal, test);
        putClassificationScores(scores, target, "_synthetic", truth, predicted, e -> !e.isReal(), test);
    }

    private static void putClassificationScores(Map<String, Double> scores, String target, String suffix,
                                                List<String> truth, List<String> predicted,
                                                Predicate<TrainingExample> filter, List<TrainingExample> test) {
        List<String> t = new ArrayList<>();
        List<String> p = new ArrayList<>();
        for (int i = 0; i < test.size(); i++) {
            if (filter.test(test.get(i))) {
                t.add(truth.get(i));
                p.add(predicted.get(i));
            }
        }
        if (t.isEmpty()) {
            return;
        }
        scores.put(target + "_accuracy" + suffix, round(accuracy(t, p)));
        scores.put(target + "_macro_f1" + suffix, round(macroF1(t, p)));
    }

    private static void scoreRegressor(String target, TrainedRegressor regressor, List<TrainingExample> test,
                                       double[][] x, Map<String, Double> scores) {
        double sum = 0;
        double realSum = 0;
        double syntheticSum = 0;
        int real = 0;
        int synthetic = 0;
        for (int i = 0; i < x.length; i++) {
            double error = Math.abs(regressor.predict(x[i]) - test.get(i).labels().valueOf(target));
            sum += error;
            if (test.get(i).isReal()) {
                realSum += error;
                real++;
            } else {
                syntheticSum += error;
                synthetic++;
            }
        }
        if (x.length > 0) {
            scores.put(target + "_mae", round(sum / x.length));
        }
        if (real > 0) {
            scores.put(target + "_mae_real", round(realSum / real));
        }
        if (synthetic > 0) {
            scores.put(target + "_mae_synthetic", round(syntheticSum / synthetic));
        }
    }

    static double accuracy(List<String> truth, List<String> predicted) {
        int correct = 0;
        for (int i = 0; i < truth.size(); i++) {
            if (truth.get(i).equals(predicted.get(i))) {
                correct++;
            }
        }
        return (double) correct / truth.size();
    }

    /**
     * Unweighted mean of per-class F1 over every class that appears in either list.
     */
    static double macroF1(List<String> truth, List<String> predicted) {
        TreeSet<String> classes = new TreeSet<>(truth);
        classes.addAll(predicted);
        double total = 0;
        for (String cls : classes) {
            int tp = 0;
            int fp = 0;
            int fn = 0;
            for (int i = 0; i < truth.size(); i++) {
                boolean actual = truth.get(i).equals(cls);
                boolean guessed = predicted.get(i).equals(cls);
                if (actual && guessed) {
                    tp++;
                } else if (guessed) {
                    fp++;
                } else if (actual) {
                    fn++;
                }
            }
            int denominator = 2 * tp + fp + fn;
            total += denominator == 0 ? 0 : (2.0 * tp) / denominator;
        }
        return total / classes.size();
    }

    private static double round(double value) {
        return Math.round(value * 10_000d) / 10_000d;
    }
}
