package com.pricelens.engine.repository;

import com.pricelens.engine.model.PriceUpdateRequest;
import com.pricelens.engine.model.Product;

import java.util.List;
import java.util.Optional;

/**
 * Catalog collaborator. The engine reads products through it and writes only through
 * {@link #updatePrice(PriceUpdateRequest)} when a recommendation is applied.
 */
public interface CatalogRepository {
    List<Product> findByStore(String storeId);

    Optional<Product> findById(String productId);

    /** Inserts or replaces products by id. */
    void saveAll(String storeId, List<Product> products);

    /**
     * Applies a price change. Implementations throw when the write does not happen;
     * the caller reports that failure instead of marking the recommendation applied.
     */
    Product updatePrice(PriceUpdateRequest request);
}
