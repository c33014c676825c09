package com.marketengine.common.cogs;

import com.marketengine.common.config.CogsBand;
import com.marketengine.common.config.EngineSettings;
import com.marketengine.common.exception.MarketEngineException;
import com.marketengine.common.model.ConfidenceLevel;
import com.marketengine.common.model.SourcingModel;

import java.util.Locale;
import java.util.Map;

/**
 * Percent-of-price COGS assumptions per sourcing model.
 *
 * <pre>
 *   PRIVATE_LABEL        → by category: electronics | home_goods | beauty | default
 *   WHOLESALE_ARBITRAGE  → wholesale_arbitrage
 *   RETAIL_ARBITRAGE     → retail_arbitrage
 *   DROPSHIPPING         → dropshipping
 *   UNKNOWN              → unknown   (wide band, always LOW confidence)
 * </pre>
 *
 * <p>Both bounds are {@code price x pct / 100} and always satisfy
 * {@code 0 &lt;= low &lt;= high &lt;= price}.
 */
public final class CogsAssumptionEngine {

    private final Map<String, CogsBand> bands;

    public CogsAssumptionEngine(EngineSettings settings) {
        this.bands = settings.cogsBands();
    }

    /**
     * @return the range, or {@code null} when {@code price} is missing, non-finite or not positive
     */
    public CogsEstimate estimateCogs(Double price, String category, SourcingModel sourcingModel) {
        if (price == null || !Double.isFinite(price) || price <= 0) {
            return null;
        }
        SourcingModel model = sourcingModel != null ? sourcingModel : SourcingModel.UNKNOWN;
        String bandKey = bandKey(model, ProductCategory.infer(category));
        CogsBand band = bands.get(bandKey);
        if (band == null) {
            throw new MarketEngineException("CogsAssumptionEngine", "no COGS band configured for '" + bandKey + "'");
        }

        double low = clamp(price * band.lowPct() / 100.0, price);
        double high = clamp(price * band.highPct() / 100.0, price);
        ConfidenceLevel confidence = model == SourcingModel.UNKNOWN ? ConfidenceLevel.LOW : ConfidenceLevel.MEDIUM;
        String rationale = String.format(Locale.ROOT, "%s: %.0f-%.0f%% of price", describe(model, bandKey), band.lowPct(), band.highPct());

        return new CogsEstimate(low, high, band.lowPct(), band.highPct(), confidence, bandKey, rationale);
    }

    static String bandKey(SourcingModel model, ProductCategory category) {
        switch (model) {
            case PRIVATE_LABEL:
                switch (category) {
                    case ELECTRONICS:
                    case HOME_GOODS:
                    case BEAUTY:
                        return "private_label." + category.key();
                    default:
                        return "private_label.default";
                }
            case WHOLESALE_ARBITRAGE:
                return "wholesale_arbitrage";
            case RETAIL_ARBITRAGE:
                return "retail_arbitrage";
            case DROPSHIPPING:
                return "dropshipping";
            default:
                return "unknown";
        }
    }

    private static String describe(SourcingModel model, String bandKey) {
        if (model == SourcingModel.UNKNOWN) {
            return "Sourcing model unknown, conservative band";
        }
        return "Typical " + bandKey.replace('.', ' ').replace('_', ' ');
    }

    private static double clamp(double value, double price) {
        return Math.max(0.0, Math.min(price, value));
    }
}
