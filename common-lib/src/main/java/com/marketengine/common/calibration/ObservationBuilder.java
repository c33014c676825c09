package com.marketengine.common.calibration;

import com.marketengine.common.model.DataQuality;
import com.marketengine.common.model.EstimatorInputs;
import com.marketengine.common.model.Listing;
import com.marketengine.common.model.ListingSummary;
import com.marketengine.common.model.MarketObservation;
import com.marketengine.common.model.ObservationOutputs;
import com.marketengine.common.model.Tier1Aggregates;
import com.marketengine.common.model.Tier1Product;
import com.marketengine.common.model.Tier1Snapshot;
import com.marketengine.common.model.Tier2Refinement;
import com.marketengine.common.tier1.AsinValidator;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Assembles the training observation for one finished analysis.
 *
 * <p>{@code fallbackUsed} is set when no refinement is available or any of its
 * steps failed, i.e. when the outputs are partly heuristic-only.
 */
public final class ObservationBuilder {

    private ObservationBuilder() {}

    public static MarketObservation build(Tier1Snapshot tier1,
                                          List<Listing> rawListings,
                                          Tier2Refinement refinement,
                                          String category,
                                          int page,
                                          Instant createdAt) {
        List<Tier1Product> products = tier1.products();
        Tier1Aggregates aggregates = tier1.aggregates();
        int n = products.size();

        ListingSummary summary = new ListingSummary(
            aggregates.avgPrice(),
            aggregates.avgReviews() != null ? aggregates.avgReviews() : 0.0,
            aggregates.avgRating(),
            n > 0 ? aggregates.sponsoredCount() * 100.0 / n : 0.0,
            n,
            aggregates.fulfillmentMix());

        EstimatorInputs inputs = EstimatorInputsBuilder.from(tier1, category);

        ObservationOutputs outputs = new ObservationOutputs(
            aggregates.totalUnits(),
            aggregates.totalRevenue(),
            refinement != null ? refinement.searchVolumeLow() : null,
            refinement != null ? refinement.searchVolumeHigh() : null,
            refinement != null ? refinement.calibratedRevenueLow() : null,
            refinement != null ? refinement.calibratedRevenueHigh() : null,
            refinement != null ? refinement.calibratedUnits() : null,
            refinement != null ? refinement.rankDerivedRevenue() : null,
            refinement != null ? refinement.confidenceScore() : null);

        int invalidAsins = (int) rawListings.stream()
            .filter(listing -> listing != null && !AsinValidator.isValid(listing.asin()))
            .count();
        DataQuality quality = new DataQuality(
            n > 0,
            n,
            invalidAsins,
            missingFields(products),
            refinement == null || !refinement.failedSteps().isEmpty());

        return new MarketObservation(
            null,
            tier1.marketplace(),
            tier1.keyword(),
            MarketObservation.normalizeKeyword(tier1.keyword()),
            page,
            tier1.snapshotId(),
            summary,
            inputs,
            outputs,
            quality,
            createdAt);
    }

    /** Names of listing fields absent on at least one Tier-1 product. */
    static List<String> missingFields(List<Tier1Product> products) {
        List<String> missing = new ArrayList<>();
        if (products.stream().anyMatch(p -> p.price() == null)) {
            missing.add("price");
        }
        if (products.stream().anyMatch(p -> p.rating() == null)) {
            missing.add("rating");
        }
        if (products.stream().anyMatch(p -> p.reviewCount() == null)) {
            missing.add("reviewCount");
        }
        if (products.stream().anyMatch(p -> p.brand() == null || p.brand().isBlank())) {
            missing.add("brand");
        }
        return List.copyOf(missing);
    }
}
