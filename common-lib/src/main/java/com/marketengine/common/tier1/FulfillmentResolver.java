package com.marketengine.common.tier1;

import com.marketengine.common.model.Fulfillment;
import com.marketengine.common.model.Listing;

/**
 * Resolves fulfillment from explicit evidence only.
 *
 * <ol>
 *   <li>explicit fulfillment field → that value</li>
 *   <li>seller is Amazon          → {@link Fulfillment#AMAZON}</li>
 *   <li>otherwise                 → {@link Fulfillment#UNKNOWN}</li>
 * </ol>
 *
 * <p>The Prime badge is never consulted.
 */
public final class FulfillmentResolver {

    private FulfillmentResolver() {}

    public static Fulfillment resolve(Listing listing) {
        if (listing.fulfillment() != null && listing.fulfillment() != Fulfillment.UNKNOWN) {
            return listing.fulfillment();
        }
        String seller = listing.seller();
        if (seller != null && (seller.trim().equalsIgnoreCase("amazon")
                || seller.trim().equalsIgnoreCase("amazon.com"))) {
            return Fulfillment.AMAZON;
        }
        return Fulfillment.UNKNOWN;
    }
}
