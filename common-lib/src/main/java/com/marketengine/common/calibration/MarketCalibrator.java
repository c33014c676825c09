package com.marketengine.common.calibration;

import com.marketengine.common.cogs.ProductCategory;
import com.marketengine.common.model.CompetitionLevel;
import com.marketengine.common.model.EstimatorInputs;
import com.marketengine.common.stats.PageStats;

/**
 * Heuristic revenue baseline: pulls the raw Tier-1 totals toward the band of
 * the page's competition level.
 *
 * <pre>
 *   competition   units            revenue
 *   LOW           2,000 -  6,000    50,000 - 150,000
 *   MEDIUM        6,000 - 15,000   150,000 - 375,000
 *   HIGH         15,000 - 35,000   375,000 - 875,000
 *
 *   factor  = clamp(mid(units band) / raw_units, 0.8, 1.2)
 *   units   = clamp(raw_units x factor x category, units band)
 *   revenue = clamp(max(units x mid(price band), raw_revenue x factor x category), revenue band)
 * </pre>
 */
public final class MarketCalibrator {

    static final double MIN_FACTOR = 0.8;
    static final double MAX_FACTOR = 1.2;

    private MarketCalibrator() {}

    public record CalibratedTotals(long units, long revenue, double factor, CompetitionLevel competitionLevel) {}

    public static CalibratedTotals calibrate(EstimatorInputs inputs) {
        CompetitionLevel level = competitionLevel(inputs.page1Count(), inputs.reviewDispersion(), inputs.sponsoredPct());
        double categoryMultiplier = categoryMultiplier(ProductCategory.infer(inputs.category()));

        double targetUnits = (unitsMin(level) + unitsMax(level)) / 2.0;
        double factor = inputs.rawUnits() > 0
            ? PageStats.clamp(targetUnits / inputs.rawUnits(), MIN_FACTOR, MAX_FACTOR)
            : MAX_FACTOR;

        double units = PageStats.clamp(
            Math.round(inputs.rawUnits() * factor * categoryMultiplier), unitsMin(level), unitsMax(level));

        double midPrice = (inputs.priceMin() + inputs.priceMax()) / 2.0;
        double revenue = PageStats.clamp(
            Math.max(units * midPrice, Math.round(inputs.rawRevenue() * factor * categoryMultiplier)),
            revenueMin(level), revenueMax(level));

        return new CalibratedTotals(Math.round(units), Math.round(revenue), factor * categoryMultiplier, level);
    }

    static CompetitionLevel competitionLevel(int listingCount, double reviewDispersion, double sponsoredPct) {
        if (listingCount < 8 || (reviewDispersion < 500 && sponsoredPct < 20)) {
            return CompetitionLevel.LOW;
        }
        if (listingCount >= 15 && (reviewDispersion > 2000 || sponsoredPct > 40)) {
            return CompetitionLevel.HIGH;
        }
        return CompetitionLevel.MEDIUM;
    }

    // ── bands ──────────────────────────────────────────────────────────────

    private static double categoryMultiplier(ProductCategory category) {
        switch (category) {
            case ELECTRONICS: return 1.15;
            case BEAUTY:      return 1.10;
            case HOME_GOODS:  return 1.05;
            default:          return 1.00;
        }
    }

    private static double unitsMin(CompetitionLevel level) {
        return level == CompetitionLevel.LOW ? 2_000 : level == CompetitionLevel.MEDIUM ? 6_000 : 15_000;
    }

    private static double unitsMax(CompetitionLevel level) {
        return level == CompetitionLevel.LOW ? 6_000 : level == CompetitionLevel.MEDIUM ? 15_000 : 35_000;
    }

    private static double revenueMin(CompetitionLevel level) {
        return level == CompetitionLevel.LOW ? 50_000 : level == CompetitionLevel.MEDIUM ? 150_000 : 375_000;
    }

    private static double revenueMax(CompetitionLevel level) {
        return level == CompetitionLevel.LOW ? 150_000 : level == CompetitionLevel.MEDIUM ? 375_000 : 875_000;
    }
}
