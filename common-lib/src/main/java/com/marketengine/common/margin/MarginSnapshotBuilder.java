package com.marketengine.common.margin;

import com.marketengine.common.cogs.CogsAssumptionEngine;
import com.marketengine.common.cogs.CogsEstimate;
import com.marketengine.common.cogs.FeeEstimate;
import com.marketengine.common.cogs.FeeEstimator;
import com.marketengine.common.cogs.ProductCategory;
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

import java.util.ArrayList;
import java.util.List;

import static com.marketengine.common.margin.CostOverrideValidator.money;

/**
 * Builds margin snapshots. Every derived field is recomputed from the request
 * on each call; refinement merges overrides into the stored request and builds
 * again.
 *
 * <h3>Resolution</h3>
 * <pre>
 *   price  ASIN mode:    price override → listing price  → fallback $25
 *          KEYWORD mode: price override → page-one avg   → fallback $25
 *   COGS   override → assumption engine (+10% of range each for unknown sourcing, electronics)
 *   fee    exact quote → user fee → estimated quote → category midpoint
 *
 *   margin_max = (price - cogs_min - fee) / price     floored at 0
 *   margin_min = (price - cogs_max - fee) / price     floored at 0
 *   breakeven  = cogs + fee
 *
 *   tier   EXACT     COGS override AND exact quote
 *          REFINED   exactly one of the two
 *          ESTIMATED otherwise;  a fallback price lowers the tier one level
 * </pre>
 */
public final class MarginSnapshotBuilder {

    public static final double FALLBACK_PRICE = 25.0;
    static final double WIDENING_FRACTION = 0.10;

    private final CogsAssumptionEngine cogsEngine;

    public MarginSnapshotBuilder(CogsAssumptionEngine cogsEngine) {
        this.cogsEngine = cogsEngine;
    }

    public MarginSnapshot build(MarginRequest request) {
        CostOverrides overrides = request.overrides();
        CostOverrideValidator.validatePrice(overrides);
        List<String> assumptions = new ArrayList<>();

        // ── price ──────────────────────────────────────────────────────────
        double price;
        PriceSource priceSource;
        Double listedPrice = request.mode() == MarginMode.ASIN ? request.asinPrice() : request.marketAvgPrice();
        if (overrides.price() != null) {
            price = overrides.price();
            priceSource = PriceSource.USER_OVERRIDE;
            assumptions.add("Price: " + money(price) + " (user-provided)");
        } else if (listedPrice != null && listedPrice > 0 && Double.isFinite(listedPrice)) {
            price = listedPrice;
            priceSource = request.mode() == MarginMode.ASIN ? PriceSource.ASIN_PRICE : PriceSource.PAGE1_AVG;
            assumptions.add(request.mode() == MarginMode.ASIN
                ? "Price: " + money(price) + " (listing price)"
                : "Price: " + money(price) + " (page-one average)");
        } else {
            price = FALLBACK_PRICE;
            priceSource = PriceSource.FALLBACK;
            assumptions.add("Price unavailable, using fallback " + money(FALLBACK_PRICE));
        }
        CostOverrideValidator.validateCosts(overrides, price);

        // ── COGS ───────────────────────────────────────────────────────────
        double cogsMin;
        double cogsMax;
        CogsSource cogsSource;
        if (overrides.cogs() != null) {
            cogsMin = overrides.cogs();
            cogsMax = overrides.cogs();
            cogsSource = CogsSource.USER_OVERRIDE;
            assumptions.add("COGS: " + money(cogsMin) + " (user-provided)");
        } else {
            CogsEstimate estimate = cogsEngine.estimateCogs(price, request.category(), request.sourcingModel());
            cogsSource = CogsSource.ASSUMPTION_ENGINE;
            double widen = (estimate.high() - estimate.low()) * WIDENING_FRACTION;
            double low = estimate.low();
            double high = estimate.high();
            assumptions.add("COGS: " + money(low) + "-" + money(high) + " (" + estimate.rationale() + ")");
            if (request.sourcingModel() == SourcingModel.UNKNOWN) {
                low -= widen;
                high += widen;
                assumptions.add("Widened COGS range by 10% (sourcing model unknown)");
            }
            if (ProductCategory.infer(request.category()) == ProductCategory.ELECTRONICS) {
                low -= widen;
                high += widen;
                assumptions.add("Widened COGS range by 10% (electronics category)");
            }
            cogsMin = Math.max(0.0, low);
            cogsMax = Math.min(price, high);
        }

        // ── fee ────────────────────────────────────────────────────────────
        double fee;
        FeeSource feeSource;
        FeeQuote quote = usable(request.feeQuote());
        if (quote != null && quote.exact()) {
            fee = quote.amount();
            feeSource = FeeSource.EXACT_QUOTE;
            assumptions.add("FBA fee: " + money(fee) + " (live fee quote)");
            if (overrides.fbaFee() != null) {
                assumptions.add("User FBA fee " + money(overrides.fbaFee()) + " ignored in favor of the live quote");
            }
        } else if (overrides.fbaFee() != null) {
            fee = overrides.fbaFee();
            feeSource = FeeSource.USER_PROVIDED;
            assumptions.add("FBA fee: " + money(fee) + " (user-provided)");
        } else if (quote != null) {
            fee = quote.amount();
            feeSource = FeeSource.CATEGORY_ESTIMATE;
            assumptions.add("FBA fee: " + money(fee) + " (estimated)");
        } else {
            FeeEstimate estimate = FeeEstimator.estimate(request.category());
            fee = estimate.midpoint();
            feeSource = FeeSource.CATEGORY_ESTIMATE;
            assumptions.add("FBA fee: " + money(fee) + " (estimated: " + estimate.label() + ")");
        }

        // ── margins ────────────────────────────────────────────────────────
        double marginMin = Math.max(0.0, (price - cogsMax - fee) / price * 100.0);
        double marginMax = Math.max(0.0, (price - cogsMin - fee) / price * 100.0);
        double breakevenMin = cogsMin + fee;
        double breakevenMax = cogsMax + fee;

        // ── tier ───────────────────────────────────────────────────────────
        boolean exactCogs = cogsSource == CogsSource.USER_OVERRIDE;
        boolean exactFee = feeSource == FeeSource.EXACT_QUOTE;
        ConfidenceTier tier;
        String reason;
        if (exactCogs && exactFee) {
            tier = ConfidenceTier.EXACT;
            reason = "User-provided COGS and live fee quote";
        } else if (exactCogs) {
            tier = ConfidenceTier.REFINED;
            reason = "User-provided COGS with estimated fees";
        } else if (exactFee) {
            tier = ConfidenceTier.REFINED;
            reason = "Live fee quote with estimated COGS";
        } else {
            tier = ConfidenceTier.ESTIMATED;
            reason = "Estimated COGS and fees from sourcing model and category";
        }
        if (priceSource == PriceSource.FALLBACK && tier != ConfidenceTier.ESTIMATED) {
            tier = tier.downgrade();
            reason = reason + "; lowered one level for fallback price";
            assumptions.add("Confidence lowered one level: no price signal");
        }

        return new MarginSnapshot(
            request.mode(),
            price,
            priceSource,
            round2(cogsMin),
            round2(cogsMax),
            cogsSource,
            round2(fee),
            feeSource,
            round2(marginMin),
            round2(marginMax),
            round2(breakevenMin),
            round2(breakevenMax),
            price < breakevenMax,
            tier,
            reason,
            List.copyOf(assumptions),
            request);
    }

    /**
     * Rebuilds {@code previous} with {@code newOverrides} merged over the
     * overrides it was built with, and {@code newQuote} replacing its fee
     * quote when given. An estimated quote never replaces an exact one.
     */
    public MarginSnapshot refine(MarginSnapshot previous, CostOverrides newOverrides, FeeQuote newQuote) {
        MarginRequest request = previous.request().withOverrides(previous.request().overrides().mergedWith(newOverrides));
        FeeQuote current = request.feeQuote();
        if (newQuote != null && (newQuote.exact() || current == null || !current.exact())) {
            request = request.withFeeQuote(newQuote);
        }
        return build(request);
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static FeeQuote usable(FeeQuote quote) {
        if (quote == null || !(quote.amount() > 0) || !Double.isFinite(quote.amount())) {
            return null;
        }
        return quote;
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
