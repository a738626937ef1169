package com.pricelens.engine.recommendation;

import com.pricelens.engine.model.CompetitorSlot;
import com.pricelens.engine.model.ProductRecommendation;
import com.pricelens.engine.model.UrlCompetitor;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Run-scoped inputs of the recommendation engine besides products, matches and listings.
 */
public class PricingContext {
    private final String storeId;
    private final String runId;
    private final List<UrlCompetitor> urlCompetitors;
    /** productId -> (competitorKey -> price recorded by the previous run) */
    private final Map<String, Map<String, Double>> previousPrices = new HashMap<>();

    /**
     * @param previous recommendations of the last run, source of each slot's {@code oldPrice}
     * @param urlCompetitors competitor pages attached directly to products
     */
    public PricingContext(String storeId, String runId, List<ProductRecommendation> previous,
                          List<UrlCompetitor> urlCompetitors) {
        this.storeId = storeId;
        this.runId = runId;
        this.urlCompetitors = List.copyOf(urlCompetitors);
        for (ProductRecommendation r : previous) {
            Map<String, Double> prices = previousPrices.computeIfAbsent(r.getProductId(), k -> new HashMap<>());
            for (CompetitorSlot s : r.getCompetitors()) {
                if (s.getCompetitorKey() != null && s.getNewPrice() != null) {
                    prices.put(s.getCompetitorKey(), s.getNewPrice());
                }
            }
        }
    }

    public String getStoreId() { return storeId; }
    public String getRunId() { return runId; }
    public List<UrlCompetitor> getUrlCompetitors() { return urlCompetitors; }

    public Optional<Double> previousPrice(String productId, String competitorKey) {
        Map<String, Double> prices = previousPrices.get(productId);
        return prices == null ? Optional.empty() : Optional.ofNullable(prices.get(competitorKey));
    }
}
