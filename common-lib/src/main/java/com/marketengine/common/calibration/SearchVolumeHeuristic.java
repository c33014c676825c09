package com.marketengine.common.calibration;

import com.marketengine.common.cogs.ProductCategory;
import com.marketengine.common.model.EstimatorInputs;
import com.marketengine.common.stats.PageStats;

/**
 * Monthly search-volume baseline from page-one density.
 *
 * <pre>
 *   volume = page1_count x 1500 x category x reviews x sponsored
 *   reviews   = clamp(1 + (log10(max(avg_reviews, 100)) - 2) x 0.15, 0.8, 1.5)
 *   sponsored = 0.9 + sponsored_ratio x 0.6     (1.0 when nothing is sponsored)
 * </pre>
 */
public final class SearchVolumeHeuristic {

    static final double SEARCHES_PER_LISTING = 1500;

    private SearchVolumeHeuristic() {}

    public static double estimate(EstimatorInputs inputs) {
        double base = inputs.page1Count() * SEARCHES_PER_LISTING;
        return base
            * categoryMultiplier(ProductCategory.infer(inputs.category()))
            * reviewMultiplier(inputs.avgReviews())
            * sponsoredMultiplier(inputs.sponsoredCount(), inputs.page1Count());
    }

    static double reviewMultiplier(double avgReviews) {
        if (avgReviews <= 0) {
            return 1.0;
        }
        double raw = 1.0 + (Math.log10(Math.max(avgReviews, 100)) - 2) * 0.15;
        return PageStats.clamp(raw, 0.8, 1.5);
    }

    static double sponsoredMultiplier(int sponsoredCount, int page1Count) {
        if (sponsoredCount <= 0 || page1Count <= 0) {
            return 1.0;
        }
        return 0.9 + ((double) sponsoredCount / page1Count) * 0.6;
    }

    private static double categoryMultiplier(ProductCategory category) {
        switch (category) {
            case ELECTRONICS: return 1.5;
            case BEAUTY:      return 1.3;
            case HEALTH:      return 0.9;
            default:          return 1.0;
        }
    }
}
