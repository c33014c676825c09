package com.marketengine.common.cogs;

import com.marketengine.common.config.EngineSettings;
import com.marketengine.common.model.ConfidenceLevel;
import com.marketengine.common.model.SourcingModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CogsAssumptionEngineTest {

    private final CogsAssumptionEngine engine = new CogsAssumptionEngine(EngineSettings.defaults());

    @Nested
    @DisplayName("bands per sourcing model")
    class Bands {

        @Test
        @DisplayName("dropshipping at $20 → $14 - $17")
        void dropshipping() {
            CogsEstimate estimate = engine.estimateCogs(20.0, null, SourcingModel.DROPSHIPPING);
            assertEquals(14.0, estimate.low(), 1e-9);
            assertEquals(17.0, estimate.high(), 1e-9);
            assertEquals(ConfidenceLevel.MEDIUM, estimate.confidence());
        }

        @Test
        @DisplayName("private label branches on category")
        void privateLabelByCategory() {
            assertEquals("private_label.electronics",
                engine.estimateCogs(100.0, "Cell Phones & Accessories", SourcingModel.PRIVATE_LABEL).bandKey());
            assertEquals("private_label.home_goods",
                engine.estimateCogs(100.0, "Kitchen & Dining", SourcingModel.PRIVATE_LABEL).bandKey());
            assertEquals("private_label.beauty",
                engine.estimateCogs(100.0, "Beauty & Personal Care", SourcingModel.PRIVATE_LABEL).bandKey());
            assertEquals("private_label.default",
                engine.estimateCogs(100.0, "Pet Supplies", SourcingModel.PRIVATE_LABEL).bandKey());
        }

        @Test
        @DisplayName("unknown sourcing is wide and always LOW confidence")
        void unknownSourcing() {
            CogsEstimate estimate = engine.estimateCogs(100.0, "electronics", SourcingModel.UNKNOWN);
            assertEquals(40.0, estimate.low(), 1e-9);
            assertEquals(65.0, estimate.high(), 1e-9);
            assertEquals(ConfidenceLevel.LOW, estimate.confidence());
        }

        @Test
        @DisplayName("low <= high <= price for every sourcing model")
        void boundsHold() {
            for (SourcingModel model : SourcingModel.values()) {
                for (double price : new double[] {0.01, 9.99, 25, 149.5}) {
                    CogsEstimate e = engine.estimateCogs(price, "electronics", model);
                    assertTrue(e.low() >= 0);
                    assertTrue(e.low() <= e.high());
                    assertTrue(e.high() <= price);
                }
            }
        }
    }

    @Test
    @DisplayName("missing or non-positive price → null")
    void unusablePrice() {
        assertNull(engine.estimateCogs(null, null, SourcingModel.DROPSHIPPING));
        assertNull(engine.estimateCogs(0.0, null, SourcingModel.DROPSHIPPING));
        assertNull(engine.estimateCogs(Double.NaN, null, SourcingModel.DROPSHIPPING));
    }

    @Nested
    @DisplayName("category inference")
    class Inference {

        @Test
        void firstMatchWins() {
            // "phone" (electronics) is checked before "home"
            assertEquals(ProductCategory.ELECTRONICS, ProductCategory.infer("Home Phone Systems"));
        }

        @Test
        void caseInsensitive() {
            assertEquals(ProductCategory.HOME_GOODS, ProductCategory.infer("COOKWARE"));
        }

        @Test
        void noMatchIsDefault() {
            assertEquals(ProductCategory.DEFAULT, ProductCategory.infer("Automotive"));
            assertEquals(ProductCategory.DEFAULT, ProductCategory.infer(null));
        }
    }

    @Nested
    @DisplayName("fee estimate")
    class Fees {

        @Test
        void sizeClasses() {
            assertEquals(7.5, FeeEstimator.estimate("Jewelry").midpoint(), 1e-9);
            assertEquals(15.0, FeeEstimator.estimate("Furniture").midpoint(), 1e-9);
            assertEquals(10.0, FeeEstimator.estimate("Toys").midpoint(), 1e-9);
            assertEquals(10.0, FeeEstimator.estimate(null).midpoint(), 1e-9);
        }
    }
}
