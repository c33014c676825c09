package com.marketengine.common.tier2;

import com.marketengine.common.model.ConfidenceLevel;
import com.marketengine.common.model.Tier1Product;
import com.marketengine.common.stats.PageStats;

import java.util.List;
import java.util.Objects;

/**
 * Page-level confidence in the Tier-1 estimate.
 *
 * <pre>
 *   base                                     50
 *   listings >= 15                           +20   (>= 5: +10)
 *   review stddev / mean &lt; 0.5              +15   (&lt; 1.0: +5)
 *   sponsored density &lt; 20%                 +15
 *   clamp [0, 100];  &lt;50 LOW, 50-79 MEDIUM, >=80 HIGH
 * </pre>
 */
public final class ConfidenceScorer {

    private ConfidenceScorer() {}

    public record Score(int score, ConfidenceLevel level) {}

    public static Score score(List<Tier1Product> products) {
        int score = 50;

        int count = products.size();
        if (count >= 15) {
            score += 20;
        } else if (count >= 5) {
            score += 10;
        }

        List<Integer> reviews = products.stream()
            .map(Tier1Product::reviewCount)
            .filter(Objects::nonNull)
            .filter(r -> r > 0)
            .toList();
        double mean = PageStats.mean(reviews);
        if (mean > 0) {
            double ratio = PageStats.stdDev(reviews) / mean;
            if (ratio < 0.5) {
                score += 15;
            } else if (ratio < 1.0) {
                score += 5;
            }
        }

        long sponsored = products.stream().filter(Tier1Product::sponsored).count();
        double sponsoredDensity = count > 0 ? sponsored * 100.0 / count : 0.0;
        if (sponsoredDensity < 20) {
            score += 15;
        }

        score = Math.max(0, Math.min(100, score));
        return new Score(score, level(score));
    }

    static ConfidenceLevel level(int score) {
        if (score >= 80) {
            return ConfidenceLevel.HIGH;
        }
        if (score >= 50) {
            return ConfidenceLevel.MEDIUM;
        }
        return ConfidenceLevel.LOW;
    }
}
