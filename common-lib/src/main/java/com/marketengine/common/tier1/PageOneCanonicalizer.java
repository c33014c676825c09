package com.marketengine.common.tier1;

import com.marketengine.common.model.Fulfillment;
import com.marketengine.common.model.Listing;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Collapses repeated appearances of one ASIN into a single listing.
 *
 * <p>Rules for a merged listing:
 * <ul>
 *   <li>position and descriptive fields come from the first appearance</li>
 *   <li>{@code sponsored} is true when any appearance was sponsored</li>
 *   <li>{@code organicRank} is the best (lowest) organic rank seen</li>
 *   <li>missing price/rating/reviews/brand are filled from later appearances</li>
 * </ul>
 *
 * <p>Listings without an ASIN are passed through untouched so that the
 * validator downstream can drop them.
 */
public final class PageOneCanonicalizer {

    private PageOneCanonicalizer() {}

    public static List<Listing> canonicalize(List<Listing> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        Map<String, Listing> byAsin = new LinkedHashMap<>();
        List<Listing> result = new ArrayList<>();
        List<Object> order = new ArrayList<>();

        for (Listing listing : raw) {
            if (listing == null) {
                continue;
            }
            if (listing.asin() == null || listing.asin().isBlank()) {
                order.add(listing);
                continue;
            }
            String key = listing.asin().trim().toUpperCase(Locale.ROOT);
            Listing existing = byAsin.get(key);
            if (existing == null) {
                byAsin.put(key, listing);
                order.add(key);
            } else {
                byAsin.put(key, merge(existing, listing));
            }
        }

        for (Object entry : order) {
            result.add(entry instanceof String ? byAsin.get(entry) : (Listing) entry);
        }
        return result;
    }

    /** Raw appearance count per canonical ASIN, in first-appearance order. */
    public static Map<String, Integer> appearanceCounts(List<Listing> raw) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        if (raw == null) {
            return counts;
        }
        for (Listing listing : raw) {
            if (listing == null || listing.asin() == null || listing.asin().isBlank()) {
                continue;
            }
            counts.merge(listing.asin().trim().toUpperCase(Locale.ROOT), 1, Integer::sum);
        }
        return counts;
    }

    private static Listing merge(Listing first, Listing later) {
        return new Listing(
            first.asin(),
            first.title() != null ? first.title() : later.title(),
            first.price() != null ? first.price() : later.price(),
            first.rating() != null ? first.rating() : later.rating(),
            first.reviewCount() != null ? first.reviewCount() : later.reviewCount(),
            first.sponsored() || later.sponsored(),
            first.pagePosition(),
            bestRank(first.organicRank(), later.organicRank()),
            first.brand() != null ? first.brand() : later.brand(),
            first.fulfillment() != null && first.fulfillment() != Fulfillment.UNKNOWN
                ? first.fulfillment() : later.fulfillment(),
            first.seller() != null ? first.seller() : later.seller(),
            first.prime() || later.prime(),
            bestRank(first.rankInCategory(), later.rankInCategory()),
            first.category() != null ? first.category() : later.category());
    }

    private static Integer bestRank(Integer a, Integer b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return Math.min(a, b);
    }
}
