package com.marketengine.common.tier2;

import com.marketengine.common.calibration.EstimatorInputsBuilder;
import com.marketengine.common.calibration.MarketCalibrator;
import com.marketengine.common.calibration.SelfCalibratingEstimator;
import com.marketengine.common.curve.BsrRevenueCurveModel;
import com.marketengine.common.curve.UnitsEstimate;
import com.marketengine.common.model.AlgorithmBoost;
import com.marketengine.common.model.BrandDominance;
import com.marketengine.common.model.CalibratedEstimate;
import com.marketengine.common.model.EstimatorInputs;
import com.marketengine.common.model.EstimatorModel;
import com.marketengine.common.model.Listing;
import com.marketengine.common.model.ModelType;
import com.marketengine.common.model.Tier1Product;
import com.marketengine.common.model.Tier1Snapshot;
import com.marketengine.common.model.Tier2Refinement;
import com.marketengine.common.tier1.AsinValidator;
import com.marketengine.common.tier1.PageOneCanonicalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Refines a finished Tier-1 snapshot.
 *
 * <h3>Steps</h3>
 * <ol>
 *   <li>{@code calibration}     revenue through the self-calibrating estimator, units = revenue / avg price</li>
 *   <li>{@code search_volume}   search-volume range through the self-calibrating estimator</li>
 *   <li>{@code rank_curve}      curve units and revenue for listings carrying a category rank</li>
 *   <li>{@code confidence}      page-level confidence score</li>
 *   <li>{@code algorithm_boosts} ASINs seen more than once in the raw scan</li>
 *   <li>{@code brand_dominance} revenue share per brand</li>
 * </ol>
 *
 * <p>Steps are independent. A step that throws is logged, named in
 * {@code failedSteps} and its fields left null; the rest still run. The Tier-1
 * snapshot is only read.
 */
public final class Tier2RefinementPipeline {

    private static final Logger log = LoggerFactory.getLogger(Tier2RefinementPipeline.class);

    public static final String STEP_CALIBRATION = "calibration";
    public static final String STEP_SEARCH_VOLUME = "search_volume";
    public static final String STEP_RANK_CURVE = "rank_curve";
    public static final String STEP_CONFIDENCE = "confidence";
    public static final String STEP_ALGORITHM_BOOSTS = "algorithm_boosts";
    public static final String STEP_BRAND_DOMINANCE = "brand_dominance";

    private final BsrRevenueCurveModel curveModel;

    public Tier2RefinementPipeline(BsrRevenueCurveModel curveModel) {
        this.curveModel = curveModel;
    }

    record RankTotals(long units, long revenue, int coverage) {}

    /**
     * @param rawListings  the raw page scan before de-duplication, optionally rank-enriched
     * @param category     category hint for multipliers and curve lookup; may be null
     * @param activeModels active calibration models by type; absent types use the heuristic
     */
    public Tier2Refinement refine(String snapshotId,
                                  List<Listing> rawListings,
                                  Tier1Snapshot tier1,
                                  String category,
                                  Map<ModelType, EstimatorModel> activeModels,
                                  Instant completedAt) {
        List<String> failed = new ArrayList<>();
        List<Tier1Product> products = tier1.products();
        Map<ModelType, EstimatorModel> models = activeModels != null ? activeModels : Map.of();

        log.info("TIER2_REFINEMENT_START snapshotId={} products={} rawListings={}",
            snapshotId, products.size(), rawListings.size());

        EstimatorInputs inputs = runStep(snapshotId, STEP_CALIBRATION, failed,
            () -> EstimatorInputsBuilder.from(tier1, category));

        CalibratedEstimate revenue = inputs == null ? null : runStep(snapshotId, STEP_CALIBRATION, failed,
            () -> SelfCalibratingEstimator.estimate(ModelType.REVENUE, inputs, models.get(ModelType.REVENUE)));
        Long calibratedUnits = revenue == null ? null : calibratedUnits(revenue, inputs);

        CalibratedEstimate searchVolume = inputs == null ? null : runStep(snapshotId, STEP_SEARCH_VOLUME, failed,
            () -> SelfCalibratingEstimator.estimate(ModelType.SEARCH_VOLUME, inputs, models.get(ModelType.SEARCH_VOLUME)));

        RankTotals rank = runStep(snapshotId, STEP_RANK_CURVE, failed,
            () -> rankTotals(rawListings, products, category));

        ConfidenceScorer.Score confidence = runStep(snapshotId, STEP_CONFIDENCE, failed,
            () -> ConfidenceScorer.score(products));

        List<AlgorithmBoost> boosts = runStep(snapshotId, STEP_ALGORITHM_BOOSTS, failed,
            () -> AlgorithmBoostDetector.detect(rawListings));

        BrandDominance dominance = runStep(snapshotId, STEP_BRAND_DOMINANCE, failed,
            () -> BrandDominanceCalculator.calculate(products));

        boolean hasRank = rank != null && rank.coverage() > 0;
        Tier2Refinement refinement = new Tier2Refinement(
            snapshotId,
            calibratedUnits,
            revenue != null ? revenue.center() : null,
            revenue != null ? revenue.low() : null,
            revenue != null ? revenue.high() : null,
            revenue != null ? revenue.source() : null,
            revenue != null ? revenue.modelVersion() : null,
            searchVolume != null ? searchVolume.low() : null,
            searchVolume != null ? searchVolume.high() : null,
            hasRank ? rank.units() : null,
            hasRank ? rank.revenue() : null,
            rank != null ? rank.coverage() : 0,
            confidence != null ? confidence.score() : null,
            confidence != null ? confidence.level() : null,
            boosts != null ? boosts : List.of(),
            dominance,
            List.copyOf(failed),
            completedAt);

        log.info("TIER2_REFINEMENT_COMPLETE snapshotId={} source={} confidence={} rankCoverage={} failedSteps={}",
            snapshotId, refinement.calibrationSource(), refinement.confidenceScore(),
            refinement.rankCoverage(), refinement.failedSteps());
        return refinement;
    }

    // ── steps ──────────────────────────────────────────────────────────────

    private static long calibratedUnits(CalibratedEstimate revenue, EstimatorInputs inputs) {
        if (inputs.avgPrice() != null && inputs.avgPrice() > 0) {
            return Math.round(revenue.center() / inputs.avgPrice());
        }
        return MarketCalibrator.calibrate(inputs).units();
    }

    RankTotals rankTotals(List<Listing> rawListings, List<Tier1Product> products, String category) {
        Map<String, Listing> byAsin = new HashMap<>();
        for (Listing listing : PageOneCanonicalizer.canonicalize(rawListings)) {
            String asin = AsinValidator.canonical(listing.asin());
            if (asin != null) {
                byAsin.put(asin, listing);
            }
        }

        long units = 0;
        long revenue = 0;
        int coverage = 0;
        for (Tier1Product product : products) {
            Listing listing = byAsin.get(product.asin());
            if (listing == null) {
                continue;
            }
            String curveCategory = listing.category() != null ? listing.category() : category;
            UnitsEstimate estimate = curveModel.estimateUnits(listing.rankInCategory(), curveCategory);
            if (estimate == null) {
                continue;
            }
            coverage++;
            units += estimate.units();
            if (product.price() != null && product.price() > 0) {
                revenue += Math.round(estimate.units() * product.price());
            }
        }
        return new RankTotals(units, revenue, coverage);
    }

    private static <T> T runStep(String snapshotId, String step, List<String> failed, Supplier<T> body) {
        try {
            return body.get();
        } catch (RuntimeException e) {
            log.warn("TIER2_STEP_FAILED snapshotId={} step={} error={}", snapshotId, step, e.getMessage(), e);
            if (!failed.contains(step)) {
                failed.add(step);
            }
            return null;
        }
    }
}
