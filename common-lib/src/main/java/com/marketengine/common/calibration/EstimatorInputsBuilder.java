package com.marketengine.common.calibration;

import com.marketengine.common.model.EstimatorInputs;
import com.marketengine.common.model.Tier1Product;
import com.marketengine.common.model.Tier1Snapshot;
import com.marketengine.common.stats.PageStats;

import java.util.List;
import java.util.Objects;

/** Derives calibration inputs from a Tier-1 snapshot. */
public final class EstimatorInputsBuilder {

    private EstimatorInputsBuilder() {}

    public static EstimatorInputs from(Tier1Snapshot snapshot, String category) {
        List<Tier1Product> products = snapshot.products();

        List<Integer> reviews = products.stream()
            .map(Tier1Product::reviewCount)
            .filter(Objects::nonNull)
            .filter(r -> r > 0)
            .toList();
        List<Double> prices = products.stream()
            .map(Tier1Product::price)
            .filter(Objects::nonNull)
            .filter(p -> p > 0)
            .toList();

        int sponsored = (int) products.stream().filter(Tier1Product::sponsored).count();
        Double avgPrice = prices.isEmpty() ? null : PageStats.mean(prices);
        double priceMin = prices.stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
        double priceMax = prices.stream().mapToDouble(Double::doubleValue).max().orElse(0.0);

        return new EstimatorInputs(
            products.size(),
            PageStats.mean(reviews),
            PageStats.stdDev(reviews),
            sponsored,
            avgPrice,
            priceMin,
            priceMax,
            category,
            snapshot.aggregates().totalUnits(),
            snapshot.aggregates().totalRevenue());
    }
}
