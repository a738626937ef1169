package com.pricelens.engine.model;

import java.util.Objects;

/**
 * Identity of a competitor listing: the competitor store id plus the product id within that store.
 */
public record ListingRef(String competitorStoreId, String competitorProductId) {
    public ListingRef {
        Objects.requireNonNull(competitorStoreId, "competitorStoreId");
        Objects.requireNonNull(competitorProductId, "competitorProductId");
    }

    /** Stable key used for slot history, e.g. {@code shop-a:sku-991}. */
    public String key() {
        return competitorStoreId + ":" + competitorProductId;
    }
}
