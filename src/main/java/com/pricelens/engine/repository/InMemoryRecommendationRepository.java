package com.pricelens.engine.repository;

import com.pricelens.engine.error.NotFoundException;
import com.pricelens.engine.model.ProductRecommendation;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

@Repository
public class InMemoryRecommendationRepository implements RecommendationRepository {
    private final Map<String, ProductRecommendation> byId = new ConcurrentHashMap<>();

    @Override
    public List<ProductRecommendation> findByStore(String storeId) {
        return byId.values().stream()
                .filter(r -> storeId.equals(r.getStoreId()))
                .map(ProductRecommendation::copy)
                .sorted(Comparator.comparing(ProductRecommendation::getProductId))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<ProductRecommendation> findById(String id) {
        return Optional.ofNullable(byId.get(id)).map(ProductRecommendation::copy);
    }

    @Override
    public synchronized void replaceForStore(String storeId, List<ProductRecommendation> recommendations) {
        byId.values().removeIf(r -> storeId.equals(r.getStoreId()));
        for (ProductRecommendation r : recommendations) {
            r.setStoreId(storeId);
            byId.put(r.getId(), r.copy());
        }
    }

    @Override
    public ProductRecommendation update(String id, UnaryOperator<ProductRecommendation> update) {
        ProductRecommendation updated = byId.computeIfPresent(id, (k, current) -> update.apply(current.copy()));
        if (updated == null) {
            throw new NotFoundException("recommendation", id);
        }
        return updated.copy();
    }
}
