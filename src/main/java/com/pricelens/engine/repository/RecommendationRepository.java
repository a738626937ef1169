package com.pricelens.engine.repository;

import com.pricelens.engine.model.ProductRecommendation;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

public interface RecommendationRepository {
    /** Latest recommendation per product of a store, ordered by product id. */
    List<ProductRecommendation> findByStore(String storeId);

    Optional<ProductRecommendation> findById(String id);

    /**
     * Stores the output of one run: each product's latest recommendation is replaced. Products
     * absent from {@code recommendations} keep nothing from earlier runs.
     */
    void replaceForStore(String storeId, List<ProductRecommendation> recommendations);

    ProductRecommendation update(String id, UnaryOperator<ProductRecommendation> update);
}
