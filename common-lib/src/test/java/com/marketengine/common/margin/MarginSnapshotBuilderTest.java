package com.marketengine.common.margin;

import com.marketengine.common.cogs.CogsAssumptionEngine;
import com.marketengine.common.config.EngineSettings;
import com.marketengine.common.exception.InvalidCostOverrideException;
import com.marketengine.common.model.CogsSource;
import com.marketengine.common.model.ConfidenceTier;
import com.marketengine.common.model.CostOverrides;
import com.marketengine.common.model.FeeQuote;
import com.marketengine.common.model.FeeSource;
import com.marketengine.common.model.MarginMode;
import com.marketengine.common.model.MarginRequest;
import com.marketengine.common.model.MarginSnapshot;
import com.marketengine.common.model.PriceSource;
import com.marketengine.common.model.SourcingModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MarginSnapshotBuilderTest {

    private final MarginSnapshotBuilder builder =
        new MarginSnapshotBuilder(new CogsAssumptionEngine(EngineSettings.defaults()));

    private static MarginRequest asin(Double price, SourcingModel model, String category) {
        return new MarginRequest(MarginMode.ASIN, model, category, price, null, null, null);
    }

    @Nested
    @DisplayName("build()")
    class Build {

        @Test
        @DisplayName("$20 dropshipping: COGS 14-17, standard fee 10, underwater")
        void dropshipping() {
            MarginSnapshot snapshot = builder.build(asin(20.0, SourcingModel.DROPSHIPPING, null));

            assertEquals(20.0, snapshot.assumedPrice());
            assertEquals(PriceSource.ASIN_PRICE, snapshot.priceSource());
            assertEquals(14.0, snapshot.cogsMin(), 1e-9);
            assertEquals(17.0, snapshot.cogsMax(), 1e-9);
            assertEquals(CogsSource.ASSUMPTION_ENGINE, snapshot.cogsSource());
            assertEquals(10.0, snapshot.fbaFee(), 1e-9);
            assertEquals(FeeSource.CATEGORY_ESTIMATE, snapshot.fbaFeeSource());
            assertEquals(0.0, snapshot.netMarginMinPct());
            assertEquals(0.0, snapshot.netMarginMaxPct());
            assertEquals(27.0, snapshot.breakevenPriceMax(), 1e-9);
            assertTrue(snapshot.belowBreakeven());
            assertEquals(ConfidenceTier.ESTIMATED, snapshot.confidenceTier());
            assertFalse(snapshot.assumptions().isEmpty());
        }

        @Test
        @DisplayName("assumption lines are plain ASCII")
        void assumptionsAreAscii() {
            MarginRequest request = new MarginRequest(MarginMode.KEYWORD, SourcingModel.UNKNOWN,
                "Electronics", null, 40.0, null, null);
            MarginSnapshot snapshot = builder.build(request);

            assertFalse(snapshot.assumptions().isEmpty());
            snapshot.assumptions().forEach(line ->
                assertTrue(line.chars().allMatch(c -> c >= 0x20 && c < 0x7f), line));
            assertTrue(snapshot.assumptions().stream().anyMatch(line -> line.startsWith("COGS: $16.00-$26.00")),
                String.valueOf(snapshot.assumptions()));
        }

        @Test
        @DisplayName("ASIN mode never reads the page-one average")
        void modeBinding() {
            MarginRequest request = new MarginRequest(MarginMode.ASIN, SourcingModel.PRIVATE_LABEL,
                null, null, 30.0, null, null);
            MarginSnapshot snapshot = builder.build(request);

            assertEquals(MarginSnapshotBuilder.FALLBACK_PRICE, snapshot.assumedPrice());
            assertEquals(PriceSource.FALLBACK, snapshot.priceSource());
            assertTrue(snapshot.assumptions().contains("Price unavailable, using fallback $25.00"));
        }

        @Test
        @DisplayName("KEYWORD mode uses the page-one average")
        void keywordMode() {
            MarginRequest request = new MarginRequest(MarginMode.KEYWORD, SourcingModel.PRIVATE_LABEL,
                null, 99.0, 30.0, null, null);
            MarginSnapshot snapshot = builder.build(request);

            assertEquals(30.0, snapshot.assumedPrice());
            assertEquals(PriceSource.PAGE1_AVG, snapshot.priceSource());
        }

        @Test
        @DisplayName("unknown sourcing in electronics widens the band twice")
        void widening() {
            MarginRequest request = new MarginRequest(MarginMode.KEYWORD, SourcingModel.UNKNOWN,
                "Electronics", null, 40.0, null, null);
            MarginSnapshot snapshot = builder.build(request);

            // unknown band 40-65% of $40 = 16-26, widened by 1.00 per condition
            assertEquals(14.0, snapshot.cogsMin(), 1e-9);
            assertEquals(28.0, snapshot.cogsMax(), 1e-9);
        }

        @Test
        void userFeeBeatsEstimatedQuote() {
            MarginRequest request = new MarginRequest(MarginMode.ASIN, SourcingModel.PRIVATE_LABEL, null,
                30.0, null, new FeeQuote(6.0, false), new CostOverrides(null, null, 4.0));
            MarginSnapshot snapshot = builder.build(request);

            assertEquals(4.0, snapshot.fbaFee());
            assertEquals(FeeSource.USER_PROVIDED, snapshot.fbaFeeSource());
        }

        @Test
        void exactQuoteBeatsUserFee() {
            MarginRequest request = new MarginRequest(MarginMode.ASIN, SourcingModel.PRIVATE_LABEL, null,
                30.0, null, FeeQuote.exactQuote(5.0), new CostOverrides(null, null, 4.0));
            MarginSnapshot snapshot = builder.build(request);

            assertEquals(5.0, snapshot.fbaFee());
            assertEquals(FeeSource.EXACT_QUOTE, snapshot.fbaFeeSource());
            assertEquals(ConfidenceTier.REFINED, snapshot.confidenceTier());
        }

        @Test
        @DisplayName("fallback price lowers EXACT to REFINED")
        void fallbackDowngrade() {
            MarginRequest request = new MarginRequest(MarginMode.ASIN, SourcingModel.PRIVATE_LABEL, null,
                null, null, FeeQuote.exactQuote(4.0), CostOverrides.cogs(8.0));
            MarginSnapshot snapshot = builder.build(request);

            assertEquals(PriceSource.FALLBACK, snapshot.priceSource());
            assertEquals(ConfidenceTier.REFINED, snapshot.confidenceTier());
        }
    }

    @Nested
    @DisplayName("refine()")
    class Refine {

        @Test
        @DisplayName("COGS override + exact quote → EXACT, 22.5% margin, breakeven 15.50")
        void exact() {
            MarginSnapshot first = builder.build(asin(20.0, SourcingModel.DROPSHIPPING, null));
            MarginSnapshot refined = builder.refine(first, CostOverrides.cogs(12.0), FeeQuote.exactQuote(3.5));

            assertEquals(ConfidenceTier.EXACT, refined.confidenceTier());
            assertEquals(12.0, refined.cogsMin());
            assertEquals(12.0, refined.cogsMax());
            assertEquals(22.5, refined.netMarginMinPct(), 1e-9);
            assertEquals(22.5, refined.netMarginMaxPct(), 1e-9);
            assertEquals(15.5, refined.breakevenPriceMin(), 1e-9);
            assertEquals(15.5, refined.breakevenPriceMax(), 1e-9);
            assertFalse(refined.belowBreakeven());
        }

        @Test
        @DisplayName("an estimated quote never replaces an exact one")
        void tierNeverDrops() {
            MarginSnapshot exact = builder.refine(builder.build(asin(20.0, SourcingModel.DROPSHIPPING, null)),
                CostOverrides.cogs(12.0), FeeQuote.exactQuote(3.5));
            MarginSnapshot again = builder.refine(exact, CostOverrides.none(), new FeeQuote(9.0, false));

            assertEquals(ConfidenceTier.EXACT, again.confidenceTier());
            assertEquals(3.5, again.fbaFee());
        }

        @Test
        void overridesMergeFieldWise() {
            MarginSnapshot first = builder.refine(builder.build(asin(20.0, SourcingModel.PRIVATE_LABEL, null)),
                CostOverrides.cogs(6.0), null);
            MarginSnapshot second = builder.refine(first, new CostOverrides(null, 24.0, null), null);

            assertEquals(24.0, second.assumedPrice());
            assertEquals(PriceSource.USER_OVERRIDE, second.priceSource());
            assertEquals(6.0, second.cogsMin());
            assertEquals(CogsSource.USER_OVERRIDE, second.cogsSource());
        }
    }

    @Nested
    @DisplayName("validation")
    class Validation {

        @Test
        void cogsAtOrAbovePrice() {
            MarginRequest request = asin(20.0, SourcingModel.PRIVATE_LABEL, null)
                .withOverrides(CostOverrides.cogs(20.0));
            InvalidCostOverrideException ex =
                assertThrows(InvalidCostOverrideException.class, () -> builder.build(request));
            assertTrue(ex.getReason().contains("below the selling price"));
        }

        @Test
        void nonPositivePrice() {
            MarginRequest request = asin(20.0, SourcingModel.PRIVATE_LABEL, null)
                .withOverrides(new CostOverrides(null, 0.0, null));
            assertThrows(InvalidCostOverrideException.class, () -> builder.build(request));
        }

        @Test
        void negativeFee() {
            MarginRequest request = asin(20.0, SourcingModel.PRIVATE_LABEL, null)
                .withOverrides(new CostOverrides(null, null, -1.0));
            assertThrows(InvalidCostOverrideException.class, () -> builder.build(request));
        }
    }
}
