package com.pricelens.engine.recommendation;

import com.pricelens.engine.error.Warn;
import com.pricelens.engine.model.ProductRecommendation;

import java.util.List;
import java.util.Optional;

/**
 * What pricing one product produced. Only {@link Status#RECOMMENDED} carries a recommendation.
 */
public record ProductOutcome(String productId, Status status, ProductRecommendation recommendation, List<Warn> warnings) {

    public enum Status { RECOMMENDED, NO_COMPETITORS, INVALID_PRICE, FAILED }

    public static ProductOutcome recommended(ProductRecommendation r, List<Warn> warnings) {
        return new ProductOutcome(r.getProductId(), Status.RECOMMENDED, r, List.copyOf(warnings));
    }

    public static ProductOutcome skipped(String productId, Status status, List<Warn> warnings) {
        return new ProductOutcome(productId, status, null, List.copyOf(warnings));
    }

    public Optional<ProductRecommendation> asOptional() {
        return Optional.ofNullable(recommendation);
    }
}
