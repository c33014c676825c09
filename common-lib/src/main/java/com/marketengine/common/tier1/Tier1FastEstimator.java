package com.marketengine.common.tier1;

import com.marketengine.common.config.EngineSettings;
import com.marketengine.common.model.Fulfillment;
import com.marketengine.common.model.Listing;
import com.marketengine.common.model.PageOneDemand;
import com.marketengine.common.model.Tier1Aggregates;
import com.marketengine.common.model.Tier1Product;
import com.marketengine.common.model.Tier1Snapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Synchronous page-one estimator. Uses only organic rank (or page position)
 * and price; never rank-in-category, never any I/O.
 *
 * <h3>Pipeline</h3>
 * <ol>
 *   <li>canonicalize repeated ASIN appearances</li>
 *   <li>cap at {@code maxProducts}</li>
 *   <li>drop listings whose ASIN fails format validation</li>
 *   <li>total market revenue = N x (avg price x 1000, or 50,000 without prices) x price-band multiplier</li>
 *   <li>per listing: revenue = total x (1 / rank^0.7) / N, units = revenue / price</li>
 * </ol>
 *
 * <p>Each weight is at most 1, so allocated revenue never exceeds the market
 * total beyond rounding.
 */
public final class Tier1FastEstimator {

    static final double RANK_DECAY_EXPONENT = 0.7;
    static final double REVENUE_PER_PRICE_UNIT = 1000;
    static final double REVENUE_WITHOUT_PRICE = 50_000;
    static final double HIGH_PRICE_THRESHOLD = 100;
    static final double LOW_PRICE_THRESHOLD = 20;
    static final double HIGH_PRICE_MULTIPLIER = 0.6;
    static final double LOW_PRICE_MULTIPLIER = 1.5;

    private final int maxProducts;

    public Tier1FastEstimator(EngineSettings settings) {
        this.maxProducts = settings.maxProducts();
    }

    public List<Tier1Product> buildProducts(List<Listing> listings) {
        List<Listing> eligible = eligible(listings);
        return allocate(eligible, totalMarketRevenue(eligible));
    }

    /**
     * Builds the full Tier-1 snapshot: products, aggregates and the page-one
     * demand band.
     */
    public Tier1Snapshot buildSnapshot(String snapshotId, String keyword, String marketplace,
                                       List<Listing> listings, String category, Instant createdAt) {
        List<Listing> eligible = eligible(listings);
        long totalMarketRevenue = totalMarketRevenue(eligible);
        List<Tier1Product> products = allocate(eligible, totalMarketRevenue);
        Tier1Aggregates aggregates = aggregate(products, totalMarketRevenue, category);
        return new Tier1Snapshot(snapshotId, keyword, marketplace, products, aggregates, createdAt);
    }

    /** Canonicalized, capped and ASIN-validated listings in page order. */
    public List<Listing> eligible(List<Listing> listings) {
        List<Listing> canonical = PageOneCanonicalizer.canonicalize(listings);
        List<Listing> capped = canonical.subList(0, Math.min(maxProducts, canonical.size()));
        List<Listing> valid = new ArrayList<>(capped.size());
        for (Listing listing : capped) {
            String asin = AsinValidator.canonical(listing.asin());
            if (asin == null) {
                continue;
            }
            valid.add(asin.equals(listing.asin()) ? listing : withAsin(listing, asin));
        }
        return valid;
    }

    public static long totalMarketRevenue(List<Listing> listings) {
        if (listings.isEmpty()) {
            return 0;
        }
        double avgPrice = listings.stream()
            .filter(Listing::hasPrice)
            .mapToDouble(Listing::price)
            .average()
            .orElse(0.0);
        double perProduct = avgPrice > 0 ? avgPrice * REVENUE_PER_PRICE_UNIT : REVENUE_WITHOUT_PRICE;
        return Math.round(listings.size() * perProduct * priceBandMultiplier(avgPrice));
    }

    static double priceBandMultiplier(double avgPrice) {
        if (avgPrice > HIGH_PRICE_THRESHOLD) {
            return HIGH_PRICE_MULTIPLIER;
        }
        if (avgPrice > 0 && avgPrice < LOW_PRICE_THRESHOLD) {
            return LOW_PRICE_MULTIPLIER;
        }
        return 1.0;
    }

    // ── allocation ─────────────────────────────────────────────────────────

    private static List<Tier1Product> allocate(List<Listing> listings, long totalMarketRevenue) {
        int n = listings.size();
        List<Tier1Product> products = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            Listing listing = listings.get(i);
            int rank = allocationRank(listing, i);
            double weight = 1.0 / Math.pow(rank, RANK_DECAY_EXPONENT);
            long revenue = Math.max(0, Math.round(totalMarketRevenue * weight / n));
            long units = listing.hasPrice() ? Math.max(0, Math.round(revenue / listing.price())) : 0;

            products.add(new Tier1Product(
                listing.asin(),
                listing.title() != null && !listing.title().isBlank() ? listing.title().trim() : "Unknown product",
                listing.brand(),
                listing.price(),
                listing.rating(),
                listing.reviewCount(),
                FulfillmentResolver.resolve(listing),
                listing.organicRank(),
                listing.pagePosition() > 0 ? listing.pagePosition() : i + 1,
                listing.sponsored(),
                units,
                revenue));
        }
        return products;
    }

    private static int allocationRank(Listing listing, int index) {
        if (listing.organicRank() != null && listing.organicRank() > 0) {
            return listing.organicRank();
        }
        if (listing.pagePosition() > 0) {
            return listing.pagePosition();
        }
        return index + 1;
    }

    // ── aggregates ─────────────────────────────────────────────────────────

    static Tier1Aggregates aggregate(List<Tier1Product> products, long totalMarketRevenue, String category) {
        long totalUnits = products.stream().mapToLong(Tier1Product::estimatedMonthlyUnits).sum();
        long totalRevenue = products.stream().mapToLong(Tier1Product::estimatedMonthlyRevenue).sum();

        Double avgPrice = average(products.stream()
            .map(Tier1Product::price).filter(Objects::nonNull).filter(p -> p > 0).toList());
        Double avgReviews = average(products.stream()
            .map(Tier1Product::reviewCount).filter(Objects::nonNull).toList());
        Double avgRating = average(products.stream()
            .map(Tier1Product::rating).filter(Objects::nonNull).filter(r -> r > 0).toList());
        int sponsoredCount = (int) products.stream().filter(Tier1Product::sponsored).count();

        Map<Fulfillment, Integer> mix = new EnumMap<>(Fulfillment.class);
        for (Fulfillment f : Fulfillment.values()) {
            mix.put(f, 0);
        }
        products.forEach(p -> mix.merge(p.fulfillment(), 1, Integer::sum));

        PageOneDemand demand = PageOneDemandEstimator.estimate(products, category, avgPrice);

        return new Tier1Aggregates(totalUnits, totalRevenue, totalMarketRevenue,
            avgPrice, avgReviews, avgRating, sponsoredCount, mix, demand);
    }

    private static Double average(List<? extends Number> values) {
        if (values.isEmpty()) {
            return null;
        }
        return values.stream().mapToDouble(Number::doubleValue).average().orElse(0.0);
    }

    private static Listing withAsin(Listing l, String asin) {
        return new Listing(asin, l.title(), l.price(), l.rating(), l.reviewCount(), l.sponsored(),
            l.pagePosition(), l.organicRank(), l.brand(), l.fulfillment(), l.seller(), l.prime(),
            l.rankInCategory(), l.category());
    }
}
