package com.marketengine.common.tier2;

import com.marketengine.common.model.BrandDominance;
import com.marketengine.common.model.BrandShare;
import com.marketengine.common.model.Tier1Product;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups Tier-1 revenue by brand. Listings without a brand share the
 * {@value #UNKNOWN_BRAND} bucket.
 */
public final class BrandDominanceCalculator {

    public static final String UNKNOWN_BRAND = "Unknown";
    static final int TOP_BRANDS = 5;
    static final int LISTED_BRANDS = 10;

    private BrandDominanceCalculator() {}

    /**
     * @return top-5 cumulative share and the ten largest brands, or {@code null}
     *         when there is no revenue to share
     */
    public static BrandDominance calculate(List<Tier1Product> products) {
        long total = products.stream().mapToLong(Tier1Product::estimatedMonthlyRevenue).sum();
        if (total <= 0) {
            return null;
        }

        Map<String, Long> byBrand = new LinkedHashMap<>();
        for (Tier1Product product : products) {
            byBrand.merge(bucket(product.brand()), product.estimatedMonthlyRevenue(), Long::sum);
        }

        List<BrandShare> ranked = byBrand.entrySet().stream()
            .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
            .map(e -> new BrandShare(e.getKey(), e.getValue(), round2(e.getValue() * 100.0 / total)))
            .toList();

        long top5 = ranked.stream().limit(TOP_BRANDS).mapToLong(BrandShare::revenue).sum();
        return new BrandDominance(round2(top5 * 100.0 / total),
            ranked.subList(0, Math.min(LISTED_BRANDS, ranked.size())));
    }

    static String bucket(String brand) {
        return brand == null || brand.isBlank() ? UNKNOWN_BRAND : brand.trim();
    }

    private static double round2(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
