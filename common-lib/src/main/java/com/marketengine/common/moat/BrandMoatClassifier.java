package com.marketengine.common.moat;

import com.marketengine.common.model.BrandMoatVerdict;
import com.marketengine.common.model.MoatLevel;
import com.marketengine.common.model.MoatSignals;
import com.marketengine.common.model.PageOneListing;
import com.marketengine.common.stats.PageStats;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Deterministic brand moat classification over one page-one listing set.
 *
 * <p>The dominant brand is the named brand with the highest revenue share
 * (ties: more page-one slots, then brand name). Listings without a brand count
 * toward totals and medians but never dominate.
 *
 * <h3>Rules (first match wins)</h3>
 * <pre>
 *   HARD  share >= 60%
 *         OR (slots >= 3 AND share >= 40%)
 *         OR (slots >= 5 AND top-10 slots >= 3)
 *   SOFT  40% &lt;= share &lt; 60%
 *         OR (slots >= 2 AND brand median reviews >= 2 x page median reviews)
 *         OR review ladder: >= 3 brand listings, max reviews >= 3 x brand median
 *   NONE  otherwise
 * </pre>
 *
 * <p>Price immunity (brand median price >= 1.15 x page median while holding
 * >= 2 top-10 slots) is reported as a signal only. No logging, no side-effects,
 * never throws for well-formed input.
 */
public final class BrandMoatClassifier {

    static final double HARD_SHARE_PCT = 60.0;
    static final double SOFT_SHARE_PCT = 40.0;
    static final int    SLOT_CONTROL_SLOTS = 3;
    static final int    HARD_SLOTS = 5;
    static final int    HARD_TOP10_SLOTS = 3;
    static final int    REVIEW_EDGE_SLOTS = 2;
    static final double REVIEW_EDGE_MULTIPLE = 2.0;
    static final int    LADDER_MIN_LISTINGS = 3;
    static final double LADDER_MULTIPLE = 3.0;
    static final double PRICE_PREMIUM = 1.15;
    static final int    PRICE_IMMUNITY_TOP10_SLOTS = 2;
    static final int    TOP_SLOTS = 10;

    private BrandMoatClassifier() {}

    private record BrandStats(String brand, double revenue, int slots, int top10Slots,
                              List<Integer> reviews, List<Double> prices) {}

    public static BrandMoatVerdict classify(List<PageOneListing> listings) {
        if (listings == null || listings.isEmpty()) {
            return BrandMoatVerdict.none();
        }

        // ── per-brand aggregation ──────────────────────────────────────────
        Map<String, BrandStats> byBrand = new LinkedHashMap<>();
        double totalRevenue = 0;
        for (int i = 0; i < listings.size(); i++) {
            PageOneListing listing = listings.get(i);
            if (listing == null) {
                continue;
            }
            double revenue = Math.max(0.0, listing.estimatedMonthlyRevenue());
            totalRevenue += revenue;
            if (listing.brand() == null || listing.brand().isBlank()) {
                continue;
            }
            int position = listing.position() != null && listing.position() > 0 ? listing.position() : i + 1;
            String brand = listing.brand().trim();
            BrandStats stats = byBrand.computeIfAbsent(brand,
                b -> new BrandStats(b, 0, 0, 0, new ArrayList<>(), new ArrayList<>()));
            if (listing.reviewCount() != null) {
                stats.reviews().add(listing.reviewCount());
            }
            if (listing.price() != null && listing.price() > 0) {
                stats.prices().add(listing.price());
            }
            byBrand.put(brand, new BrandStats(brand, stats.revenue() + revenue, stats.slots() + 1,
                stats.top10Slots() + (position <= TOP_SLOTS ? 1 : 0), stats.reviews(), stats.prices()));
        }
        if (byBrand.isEmpty()) {
            return BrandMoatVerdict.none();
        }

        final double total = totalRevenue;
        BrandStats top = byBrand.values().stream()
            .min(Comparator.comparingDouble((BrandStats s) -> -s.revenue())
                .thenComparingInt(s -> -s.slots())
                .thenComparing(BrandStats::brand))
            .orElseThrow();

        // ── signals ────────────────────────────────────────────────────────
        double sharePct = total > 0 ? top.revenue() * 100.0 / total : 0.0;
        double pageMedianReviews = PageStats.median(listings.stream()
            .filter(Objects::nonNull).map(PageOneListing::reviewCount).toList());
        double pageMedianPrice = PageStats.median(listings.stream()
            .filter(Objects::nonNull).map(PageOneListing::price).filter(p -> p != null && p > 0).toList());
        double brandMedianReviews = PageStats.median(top.reviews());
        double brandMedianPrice = PageStats.median(top.prices());

        boolean reviewLadder = top.reviews().size() >= LADDER_MIN_LISTINGS
            && brandMedianReviews > 0
            && top.reviews().stream().mapToInt(Integer::intValue).max().orElse(0)
                >= LADDER_MULTIPLE * brandMedianReviews;
        boolean reviewEdge = top.slots() >= REVIEW_EDGE_SLOTS
            && pageMedianReviews > 0
            && brandMedianReviews >= REVIEW_EDGE_MULTIPLE * pageMedianReviews;
        boolean priceImmunity = pageMedianPrice > 0
            && brandMedianPrice >= PRICE_PREMIUM * pageMedianPrice
            && top.top10Slots() >= PRICE_IMMUNITY_TOP10_SLOTS;

        MoatSignals signals = new MoatSignals(
            sharePct >= SOFT_SHARE_PCT,
            top.slots() >= SLOT_CONTROL_SLOTS,
            reviewLadder,
            priceImmunity);

        // ── classification ─────────────────────────────────────────────────
        MoatLevel level;
        if (sharePct >= HARD_SHARE_PCT
                || (top.slots() >= SLOT_CONTROL_SLOTS && sharePct >= SOFT_SHARE_PCT)
                || (top.slots() >= HARD_SLOTS && top.top10Slots() >= HARD_TOP10_SLOTS)) {
            level = MoatLevel.HARD;
        } else if (sharePct >= SOFT_SHARE_PCT || reviewEdge || reviewLadder) {
            level = MoatLevel.SOFT;
        } else {
            level = MoatLevel.NONE;
        }

        return new BrandMoatVerdict(level,
            level == MoatLevel.NONE ? null : top.brand(),
            signals,
            Math.round(sharePct * 100.0) / 100.0,
            top.slots(),
            top.top10Slots());
    }
}
