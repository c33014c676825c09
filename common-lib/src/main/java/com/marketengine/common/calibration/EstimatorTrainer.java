package com.marketengine.common.calibration;

import com.marketengine.common.model.EstimatorInputs;
import com.marketengine.common.model.EstimatorModel;
import com.marketengine.common.model.MarketObservation;
import com.marketengine.common.model.ModelCoefficients;
import com.marketengine.common.model.ModelType;
import com.marketengine.common.model.ObservationOutputs;
import com.marketengine.common.model.TrainingDiagnostics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Turns a window of observations into a new model version for one
 * (marketplace, model type).
 *
 * <p>The target is the relative correction the baseline needed:
 * {@code y = reference / baseline(inputs) - 1}, which is exactly the delta the
 * read path applies. References:
 * <ul>
 *   <li>REVENUE: rank-curve revenue when the observation has it, else the midpoint of the revenue range</li>
 *   <li>SEARCH_VOLUME: midpoint of the search-volume range</li>
 * </ul>
 * Observations without inputs, a reference or a positive baseline are skipped.
 */
public final class EstimatorTrainer {

    private static final Logger log = LoggerFactory.getLogger(EstimatorTrainer.class);

    private final RetrainPolicy policy;

    public EstimatorTrainer(RetrainPolicy policy) {
        this.policy = policy;
    }

    public record TrainingSet(double[][] features, double[] targets) {
        public int size() {
            return targets.length;
        }
    }

    /**
     * @return the new, not yet persisted model; empty when fewer usable rows
     *         than the retrain minimum remain
     */
    public Optional<EstimatorModel> train(String marketplace, ModelType type,
                                          List<MarketObservation> observations, Instant trainedAt) {
        TrainingSet set = trainingSet(type, observations);
        if (set.size() < Math.max(policy.minRows(), LinearModelTrainer.MIN_SAMPLES)) {
            log.info("TRAINING_SKIPPED marketplace={} modelType={} usableRows={} required={}",
                marketplace, type.key(), set.size(), policy.minRows());
            return Optional.empty();
        }

        LinearModelTrainer.Fit fit = LinearModelTrainer.train(set.features(), set.targets());
        double[] c = fit.coefficients();
        ModelCoefficients coefficients = new ModelCoefficients(fit.intercept(), c[0], c[1], c[2], c[3], Map.of());

        EstimatorModel model = new EstimatorModel(null, marketplace, type,
            RetrainPolicy.modelVersion(trainedAt), coefficients, trainedAt, set.size(),
            new TrainingDiagnostics(fit.rSquared(), fit.meanAbsoluteError()));

        log.info("MODEL_TRAINED marketplace={} modelType={} version={} rows={} rSquared={} mae={}",
            marketplace, type.key(), model.modelVersion(), set.size(),
            String.format(Locale.ROOT, "%.4f", fit.rSquared()), String.format(Locale.ROOT, "%.4f", fit.meanAbsoluteError()));
        return Optional.of(model);
    }

    public static TrainingSet trainingSet(ModelType type, List<MarketObservation> observations) {
        List<double[]> rows = new ArrayList<>();
        List<Double> targets = new ArrayList<>();
        for (MarketObservation observation : observations) {
            EstimatorInputs inputs = observation.inputs();
            if (inputs == null || observation.outputs() == null) {
                continue;
            }
            Double reference = reference(type, observation.outputs());
            double baseline = SelfCalibratingEstimator.baseline(type, inputs);
            if (reference == null || !(baseline > 0)) {
                continue;
            }
            rows.add(inputs.features());
            targets.add(reference / baseline - 1.0);
        }
        double[] y = new double[targets.size()];
        for (int i = 0; i < y.length; i++) {
            y[i] = targets.get(i);
        }
        return new TrainingSet(rows.toArray(new double[0][]), y);
    }

    static Double reference(ModelType type, ObservationOutputs outputs) {
        if (type == ModelType.REVENUE) {
            if (outputs.rankDerivedRevenue() != null && outputs.rankDerivedRevenue() > 0) {
                return outputs.rankDerivedRevenue().doubleValue();
            }
            return midpoint(outputs.revenueLow(), outputs.revenueHigh());
        }
        return midpoint(outputs.searchVolumeLow(), outputs.searchVolumeHigh());
    }

    private static Double midpoint(Long low, Long high) {
        if (low == null || high == null || low + high <= 0) {
            return null;
        }
        return (low + high) / 2.0;
    }
}
