package com.pricelens.engine.repository;

import com.pricelens.engine.model.RawListing;
import com.pricelens.engine.model.UrlCompetitor;

import java.util.List;

/**
 * Latest scraper output per merchant store: listings of tracked competitor stores and
 * competitor URLs attached to single products.
 */
public interface ListingRepository {
    void replaceListings(String storeId, List<RawListing> listings);

    List<RawListing> findListings(String storeId);

    /** Adds or replaces (same product and url) a URL competitor. */
    void saveUrlCompetitor(String storeId, UrlCompetitor competitor);

    List<UrlCompetitor> findUrlCompetitors(String storeId);
}
