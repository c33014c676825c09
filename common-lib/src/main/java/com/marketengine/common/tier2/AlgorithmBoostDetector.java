package com.marketengine.common.tier2;

import com.marketengine.common.model.AlgorithmBoost;
import com.marketengine.common.model.Listing;
import com.marketengine.common.tier1.PageOneCanonicalizer;

import java.util.Comparator;
import java.util.List;

/**
 * Flags ASINs the marketplace surfaced more than once in the raw page scan.
 * Runs on the pre-canonicalization listing list.
 */
public final class AlgorithmBoostDetector {

    static final int MIN_APPEARANCES = 2;

    private AlgorithmBoostDetector() {}

    /** Boosted ASINs, most appearances first; first-appearance order breaks ties. */
    public static List<AlgorithmBoost> detect(List<Listing> rawListings) {
        return PageOneCanonicalizer.appearanceCounts(rawListings).entrySet().stream()
            .filter(e -> e.getValue() >= MIN_APPEARANCES)
            .map(e -> new AlgorithmBoost(e.getKey(), e.getValue()))
            .sorted(Comparator.comparingInt(AlgorithmBoost::appearances).reversed())
            .toList();
    }
}
