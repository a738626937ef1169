package com.pricelens.engine.repository;

import com.pricelens.engine.error.NotFoundException;
import com.pricelens.engine.model.PriceUpdateRequest;
import com.pricelens.engine.model.Product;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

@Repository
public class InMemoryCatalogRepository implements CatalogRepository {
    private static final Logger log = LoggerFactory.getLogger(InMemoryCatalogRepository.class);

    private final Map<String, Product> products = new ConcurrentHashMap<>();

    @Override
    public List<Product> findByStore(String storeId) {
        return products.values().stream()
                .filter(p -> storeId.equals(p.getStoreId()))
                .map(Product::copy)
                .sorted(Comparator.comparing(Product::getId))
                .collect(Collectors.toList());
    }

    @Override
    public Optional<Product> findById(String productId) {
        return Optional.ofNullable(products.get(productId)).map(Product::copy);
    }

    @Override
    public void saveAll(String storeId, List<Product> toSave) {
        for (Product p : toSave) {
            Product stored = p.copy();
            stored.setStoreId(storeId);
            products.put(stored.getId(), stored);
        }
    }

    @Override
    public Product updatePrice(PriceUpdateRequest request) {
        Product updated = products.computeIfPresent(request.productId(), (id, p) -> p.withPrice(request.newPrice()));
        if (updated == null) {
            throw new NotFoundException("product", request.productId());
        }
        log.info("Catalog price updated: product={} price={} margin={}",
                updated.getId(), updated.getCurrentPrice(), updated.getMarginPercent());
        return updated.copy();
    }
}
