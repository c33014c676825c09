package com.marketengine.common.calibration;

import com.marketengine.common.model.CalibratedEstimate;
import com.marketengine.common.model.ConfidenceLevel;
import com.marketengine.common.model.EstimatorInputs;
import com.marketengine.common.model.EstimatorModel;
import com.marketengine.common.model.ModelType;
import com.marketengine.common.stats.PageStats;

/**
 * Heuristic baseline blended with the active linear correction model.
 *
 * <h3>Read path</h3>
 * <pre>
 *   baseline = heuristic(inputs)                       always computed first
 *   no model → baseline, source "heuristic_v1"
 *   model    → center = baseline x clamp(1 + delta, 0.5, 2.0) x category_multiplier
 *              delta = intercept + sum coef_i x feature_i
 * </pre>
 *
 * <p>Range widths are fixed: search volume +/-30%, revenue -20%/+20%.
 * Confidence follows the model's training-row count with the same thresholds
 * that gate retraining.
 *
 * <p>The active model is looked up by the caller; this class does no I/O.
 */
public final class SelfCalibratingEstimator {

    public static final String HEURISTIC_SOURCE = "heuristic_v1";
    public static final String HEURISTIC_VERSION = "v1.0";
    public static final String MODEL_SOURCE = "model_v2";

    public static final double SEARCH_VOLUME_LOW_FACTOR = 0.7;
    public static final double SEARCH_VOLUME_HIGH_FACTOR = 1.3;
    public static final double REVENUE_LOW_FACTOR = 0.8;
    public static final double REVENUE_HIGH_FACTOR = 1.2;

    static final double MIN_ADJUSTMENT_FACTOR = 0.5;
    static final double MAX_ADJUSTMENT_FACTOR = 2.0;

    public static final int MEDIUM_CONFIDENCE_ROWS = 200;
    public static final int HIGH_CONFIDENCE_ROWS = 500;

    private SelfCalibratingEstimator() {}

    /**
     * @param activeModel the active model for (marketplace, type), or {@code null}
     */
    public static CalibratedEstimate estimate(ModelType type, EstimatorInputs inputs, EstimatorModel activeModel) {
        double baseline = baseline(type, inputs);

        if (activeModel == null) {
            return range(type, baseline, baseline, HEURISTIC_SOURCE, ConfidenceLevel.LOW, HEURISTIC_VERSION);
        }

        double delta = activeModel.coefficients().adjustment(inputs.features());
        double factor = PageStats.clamp(1.0 + delta, MIN_ADJUSTMENT_FACTOR, MAX_ADJUSTMENT_FACTOR)
            * activeModel.coefficients().categoryMultiplier(inputs.category());
        double center = Math.max(0.0, baseline * factor);

        return range(type, center, baseline, MODEL_SOURCE,
            confidenceFor(activeModel.trainingRowCount()), activeModel.modelVersion());
    }

    /** Deterministic heuristic value the model corrects. */
    public static double baseline(ModelType type, EstimatorInputs inputs) {
        return type == ModelType.SEARCH_VOLUME
            ? SearchVolumeHeuristic.estimate(inputs)
            : MarketCalibrator.calibrate(inputs).revenue();
    }

    public static ConfidenceLevel confidenceFor(int trainingRows) {
        if (trainingRows >= HIGH_CONFIDENCE_ROWS) {
            return ConfidenceLevel.HIGH;
        }
        if (trainingRows >= MEDIUM_CONFIDENCE_ROWS) {
            return ConfidenceLevel.MEDIUM;
        }
        return ConfidenceLevel.LOW;
    }

    private static CalibratedEstimate range(ModelType type, double center, double baseline,
                                            String source, ConfidenceLevel confidence, String version) {
        double low = type == ModelType.SEARCH_VOLUME ? SEARCH_VOLUME_LOW_FACTOR : REVENUE_LOW_FACTOR;
        double high = type == ModelType.SEARCH_VOLUME ? SEARCH_VOLUME_HIGH_FACTOR : REVENUE_HIGH_FACTOR;
        return new CalibratedEstimate(type,
            Math.round(center * low), Math.round(center), Math.round(center * high),
            Math.round(baseline), source, confidence, version);
    }
}
