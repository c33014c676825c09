package com.marketengine.common.tier2;

import com.marketengine.common.config.EngineSettings;
import com.marketengine.common.curve.BsrRevenueCurveModel;
import com.marketengine.common.model.AlgorithmBoost;
import com.marketengine.common.model.BrandDominance;
import com.marketengine.common.model.ConfidenceLevel;
import com.marketengine.common.model.EstimatorModel;
import com.marketengine.common.model.Fulfillment;
import com.marketengine.common.model.Listing;
import com.marketengine.common.model.ModelCoefficients;
import com.marketengine.common.model.ModelType;
import com.marketengine.common.model.Tier1Product;
import com.marketengine.common.model.Tier1Snapshot;
import com.marketengine.common.model.Tier2Refinement;
import com.marketengine.common.model.TrainingDiagnostics;
import com.marketengine.common.tier1.Tier1FastEstimator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class Tier2RefinementPipelineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final EngineSettings settings = EngineSettings.defaults();
    private final Tier1FastEstimator tier1 = new Tier1FastEstimator(settings);
    private final Tier2RefinementPipeline pipeline =
        new Tier2RefinementPipeline(new BsrRevenueCurveModel(settings));

    static Listing listing(String asin, int position, boolean sponsored, Integer reviews, String brand, Integer bsr) {
        return new Listing(asin, "t", 25.0, 4.4, reviews, sponsored, position, sponsored ? null : position,
            brand, Fulfillment.FBA, null, false, bsr, null);
    }

    static List<Listing> rawPage(int count, Integer bsr) {
        List<Listing> listings = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            listings.add(listing(String.format("B%09d", i), i, false, 1000, "Brand" + (i % 3), bsr));
        }
        return listings;
    }

    private Tier2Refinement refine(List<Listing> raw, Map<ModelType, EstimatorModel> models) {
        Tier1Snapshot snapshot = tier1.buildSnapshot("snap", "k", "US", raw, null, NOW);
        return pipeline.refine("snap", raw, snapshot, null, models, NOW);
    }

    @Nested
    @DisplayName("confidence")
    class Confidence {

        @Test
        @DisplayName("15 organic listings with identical reviews → 50+20+15+15 = 100 HIGH")
        void maxScore() {
            Tier2Refinement refinement = refine(rawPage(15, null), Map.of());
            assertEquals(100, refinement.confidenceScore());
            assertEquals(ConfidenceLevel.HIGH, refinement.confidenceLevel());
        }

        @Test
        @DisplayName("3 listings, scattered reviews, all sponsored → 50 MEDIUM")
        void baseScore() {
            List<Tier1Product> products = List.of(
                product("B000000001", 10, true),
                product("B000000002", 5000, true),
                product("B000000003", 20, true));
            ConfidenceScorer.Score score = ConfidenceScorer.score(products);
            assertEquals(50, score.score());
            assertEquals(ConfidenceLevel.MEDIUM, score.level());
        }

        @Test
        void levelThresholds() {
            assertEquals(ConfidenceLevel.LOW, ConfidenceScorer.level(49));
            assertEquals(ConfidenceLevel.MEDIUM, ConfidenceScorer.level(79));
            assertEquals(ConfidenceLevel.HIGH, ConfidenceScorer.level(80));
        }

        private Tier1Product product(String asin, int reviews, boolean sponsored) {
            return new Tier1Product(asin, "t", null, 20.0, 4.0, reviews, Fulfillment.UNKNOWN,
                null, 1, sponsored, 10, 200);
        }
    }

    @Nested
    @DisplayName("algorithm boosts")
    class Boosts {

        @Test
        @DisplayName("ASINs appearing >= 2 times in the raw scan are flagged with their count")
        void repeatedAsins() {
            List<Listing> raw = new ArrayList<>(rawPage(5, null));
            raw.add(listing("B000000002", 6, true, 1000, "Brand2", null));
            raw.add(listing("B000000002", 7, true, 1000, "Brand2", null));
            raw.add(listing("B000000004", 8, true, 1000, "Brand1", null));

            List<AlgorithmBoost> boosts = refine(raw, Map.of()).algorithmBoosts();
            assertEquals(List.of(new AlgorithmBoost("B000000002", 3), new AlgorithmBoost("B000000004", 2)), boosts);
        }

        @Test
        void noRepeats() {
            assertTrue(refine(rawPage(5, null), Map.of()).algorithmBoosts().isEmpty());
        }
    }

    @Nested
    @DisplayName("brand dominance")
    class Dominance {

        @Test
        @DisplayName("missing brand is bucketed as Unknown")
        void unknownBucket() {
            List<Tier1Product> products = List.of(
                new Tier1Product("B000000001", "t", null, 20.0, 4.0, 10, Fulfillment.UNKNOWN, 1, 1, false, 10, 600),
                new Tier1Product("B000000002", "t", "Acme", 20.0, 4.0, 10, Fulfillment.UNKNOWN, 2, 2, false, 10, 400));
            BrandDominance dominance = BrandDominanceCalculator.calculate(products);
            assertEquals("Unknown", dominance.brands().get(0).brand());
            assertEquals(60.0, dominance.brands().get(0).revenueSharePct(), 1e-9);
            assertEquals(100.0, dominance.top5SharePct(), 1e-9);
        }

        @Test
        void zeroRevenueYieldsNothing() {
            assertNull(BrandDominanceCalculator.calculate(List.of()));
        }
    }

    @Nested
    @DisplayName("calibration and rank curve")
    class Calibration {

        @Test
        @DisplayName("no active model → heuristic source")
        void heuristicWithoutModel() {
            Tier2Refinement refinement = refine(rawPage(10, null), Map.of());
            assertEquals("heuristic_v1", refinement.calibrationSource());
            assertNotNull(refinement.calibratedRevenue());
            assertEquals(Math.round(refinement.calibratedRevenue() / 25.0), refinement.calibratedUnits());
            assertNotNull(refinement.searchVolumeLow());
            assertTrue(refinement.failedSteps().isEmpty());
        }

        @Test
        @DisplayName("active model → model source and version")
        void modelUsed() {
            EstimatorModel model = new EstimatorModel(1L, "US", ModelType.REVENUE, "v2.0.20260101.000000",
                new ModelCoefficients(0.1, 0, 0, 0, 0, Map.of()), NOW, 600, new TrainingDiagnostics(0.5, 0.1));
            Tier2Refinement refinement = refine(rawPage(10, null), Map.of(ModelType.REVENUE, model));
            assertEquals("model_v2", refinement.calibrationSource());
            assertEquals("v2.0.20260101.000000", refinement.modelVersion());
        }

        @Test
        @DisplayName("listings without rank leave rank-derived totals null")
        void noRankData() {
            Tier2Refinement refinement = refine(rawPage(10, null), Map.of());
            assertNull(refinement.rankDerivedUnits());
            assertEquals(0, refinement.rankCoverage());
        }

        @Test
        @DisplayName("rank-enriched listings feed the curve")
        void rankDerived() {
            Tier2Refinement refinement = refine(rawPage(4, 1), Map.of());
            // default curve at rank 1 → 13,960 units per listing
            assertEquals(4, refinement.rankCoverage());
            assertEquals(4 * 13_960L, refinement.rankDerivedUnits());
            assertEquals(4 * Math.round(13_960 * 25.0), refinement.rankDerivedRevenue());
        }
    }

    @Test
    @DisplayName("a failing step is recorded; the other steps still produce output")
    void failingStepIsIsolated() {
        Tier2RefinementPipeline broken = new Tier2RefinementPipeline(null);
        List<Listing> raw = rawPage(6, 500);
        Tier1Snapshot snapshot = tier1.buildSnapshot("snap", "k", "US", raw, null, NOW);

        Tier2Refinement refinement = broken.refine("snap", raw, snapshot, null, Map.of(), NOW);

        assertEquals(List.of(Tier2RefinementPipeline.STEP_RANK_CURVE), refinement.failedSteps());
        assertNull(refinement.rankDerivedUnits());
        assertNotNull(refinement.confidenceScore());
        assertNotNull(refinement.calibratedRevenue());
        assertNotNull(refinement.brandDominance());
    }
}
