package com.marketengine.common.tier1;

import com.marketengine.common.cogs.ProductCategory;
import com.marketengine.common.model.CompetitionLevel;
import com.marketengine.common.model.PageOneDemand;
import com.marketengine.common.model.Tier1Product;
import com.marketengine.common.stats.PageStats;

import java.util.List;
import java.util.Objects;

/**
 * Estimates total page-one demand from aggregate signals, then clamps it into
 * the band of the detected competition level.
 *
 * <pre>
 *   units = organic_count x 400 x review_multiplier x category_multiplier
 *
 *   organic &lt; 8  OR median reviews &lt; 100          → LOW     2,000 -  6,000
 *   8 &lt;= organic &lt; 15 AND median reviews &lt; 1,500   → MEDIUM  6,000 - 15,000
 *   otherwise                                        → HIGH   15,000 - 35,000
 *
 *   revenue = units x median price
 * </pre>
 *
 * <p>The listing and review thresholds are empirical and have not been
 * re-derived from observation data; they are kept as named constants so a
 * recalibration can replace them in one place.
 */
public final class PageOneDemandEstimator {

    static final int    BASE_UNITS_PER_LISTING = 400;
    static final int    LOW_COMPETITION_MAX_LISTINGS = 8;
    static final int    MEDIUM_COMPETITION_MAX_LISTINGS = 15;
    static final double LOW_COMPETITION_MAX_REVIEWS = 100;
    static final double MEDIUM_COMPETITION_MAX_REVIEWS = 1500;
    static final double FALLBACK_PRICE = 25.0;

    private PageOneDemandEstimator() {}

    public static PageOneDemand estimate(List<Tier1Product> products, String category, Double avgPrice) {
        List<Tier1Product> organic = products.stream().filter(p -> !p.sponsored()).toList();
        int organicCount = organic.size();
        if (organicCount == 0) {
            return new PageOneDemand(CompetitionLevel.LOW, 0, 0.0, 0, 0, 0, 0);
        }

        List<Double> prices = organic.stream()
            .map(Tier1Product::price)
            .filter(Objects::nonNull)
            .filter(p -> p > 0)
            .toList();
        List<Integer> reviews = organic.stream()
            .map(Tier1Product::reviewCount)
            .filter(Objects::nonNull)
            .filter(r -> r > 0)
            .toList();

        double medianPrice = prices.isEmpty()
            ? (avgPrice != null && avgPrice > 0 ? avgPrice : FALLBACK_PRICE)
            : PageStats.median(prices);
        double medianReviews = PageStats.median(reviews);

        double units = organicCount * BASE_UNITS_PER_LISTING
            * reviewMultiplier(medianReviews)
            * categoryMultiplier(ProductCategory.infer(category));

        CompetitionLevel level = competitionLevel(organicCount, medianReviews);
        long min = unitsMin(level);
        long max = unitsMax(level);
        long totalUnits = Math.round(PageStats.clamp(units, min, max));

        return new PageOneDemand(level, organicCount, medianReviews, min, max,
            totalUnits, Math.round(totalUnits * medianPrice));
    }

    static CompetitionLevel competitionLevel(int organicCount, double medianReviews) {
        if (organicCount < LOW_COMPETITION_MAX_LISTINGS || medianReviews < LOW_COMPETITION_MAX_REVIEWS) {
            return CompetitionLevel.LOW;
        }
        if (organicCount < MEDIUM_COMPETITION_MAX_LISTINGS && medianReviews < MEDIUM_COMPETITION_MAX_REVIEWS) {
            return CompetitionLevel.MEDIUM;
        }
        return CompetitionLevel.HIGH;
    }

    // ── helpers ────────────────────────────────────────────────────────────

    private static double reviewMultiplier(double medianReviews) {
        if (medianReviews < 100)  return 0.7;
        if (medianReviews < 500)  return 1.0;
        if (medianReviews < 1500) return 1.3;
        return 1.6;
    }

    private static double categoryMultiplier(ProductCategory category) {
        switch (category) {
            case ELECTRONICS: return 1.3;
            case BEAUTY:      return 1.2;
            case HOME_GOODS:  return 1.1;
            default:          return 1.0;
        }
    }

    private static long unitsMin(CompetitionLevel level) {
        switch (level) {
            case LOW:    return 2_000;
            case MEDIUM: return 6_000;
            default:     return 15_000;
        }
    }

    private static long unitsMax(CompetitionLevel level) {
        switch (level) {
            case LOW:    return 6_000;
            case MEDIUM: return 15_000;
            default:     return 35_000;
        }
    }
}
