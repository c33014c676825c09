package com.marketengine.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One marketplace search-result or product entry as delivered by the listing source.
 *
 * <p>Nullable fields carry "not supplied" rather than zero: {@code price},
 * {@code rating}, {@code reviewCount}, {@code organicRank}, {@code brand},
 * {@code rankInCategory} and {@code category}. {@code prime} is carried for
 * display only and never used to infer {@link Fulfillment#FBA}.
 */
public record Listing(
    @JsonProperty("asin") String asin,
    @JsonProperty("title") String title,
    @JsonProperty("price") Double price,
    @JsonProperty("rating") Double rating,
    @JsonProperty("reviewCount") Integer reviewCount,
    @JsonProperty("sponsored") boolean sponsored,
    @JsonProperty("pagePosition") int pagePosition,
    @JsonProperty("organicRank") Integer organicRank,
    @JsonProperty("brand") String brand,
    @JsonProperty("fulfillment") Fulfillment fulfillment,
    @JsonProperty("seller") String seller,
    @JsonProperty("prime") boolean prime,
    @JsonProperty("rankInCategory") Integer rankInCategory,
    @JsonProperty("category") String category
) {
    public Listing {
        if (fulfillment == null) {
            fulfillment = Fulfillment.UNKNOWN;
        }
    }

    /** Copy with rank/category enrichment applied. */
    public Listing withEnrichment(Integer rank, String enrichedCategory) {
        return new Listing(asin, title, price, rating, reviewCount, sponsored, pagePosition,
            organicRank, brand, fulfillment, seller, prime,
            rank != null ? rank : rankInCategory,
            enrichedCategory != null ? enrichedCategory : category);
    }

    public boolean hasPrice() {
        return price != null && price > 0;
    }
}
