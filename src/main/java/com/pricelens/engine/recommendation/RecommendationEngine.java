package com.pricelens.engine.recommendation;

import com.pricelens.engine.config.AppProperties;
import com.pricelens.engine.error.Warn;
import com.pricelens.engine.model.CompetitorSlot;
import com.pricelens.engine.model.Match;
import com.pricelens.engine.model.Product;
import com.pricelens.engine.model.ProductRecommendation;
import com.pricelens.engine.model.RawListing;
import com.pricelens.engine.model.RecommendationStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Aggregates matched competitor prices into one recommendation per product.
 *
 * <p>Usable prices are those of AUTO_MATCHED/CONFIRMED store listings and of URL competitors that
 * are positive and quoted in the product's currency (a quote without currency is assumed to be in
 * the product's). Other-currency quotes are dropped with a {@code CURRENCY_MISMATCH} warning. Every
 * usable price becomes one competitor slot, so {@code competitorCount} always equals the number
 * of slots with a price; {@code app.pricing.max-competitor-slots} caps both together.
 *
 * <p>Products are priced independently. A product without usable prices, or with a non-positive
 * price, gets no recommendation; an unexpected error while pricing one product is logged, reported
 * as {@code PRODUCT_FAILED}, and does not affect the others.
 */
@Component
public class RecommendationEngine {
    private static final Logger log = LoggerFactory.getLogger(RecommendationEngine.class);

    private final PricingPolicy pricingPolicy;
    private final ExplanationBuilder explanationBuilder;
    private final AppProperties appProperties;

    public RecommendationEngine(PricingPolicy pricingPolicy, ExplanationBuilder explanationBuilder, AppProperties appProperties) {
        this.pricingPolicy = pricingPolicy;
        this.explanationBuilder = explanationBuilder;
        this.appProperties = appProperties;
    }

    public RecommendationResult computeRecommendations(List<Product> products, List<Match> matches,
                                                       List<RawListing> listings, PricingContext context) {
        CompetitorIndex index = CompetitorIndex.build(matches, listings, context.getUrlCompetitors());
        List<ProductOutcome> outcomes = new ArrayList<>(products.size());
        for (Product p : products) {
            outcomes.add(recommend(p, index, context));
        }
        return RecommendationResult.merge(outcomes);
    }

    /**
     * Prices a single product. Never throws: failures come back as a {@link ProductOutcome.Status#FAILED} outcome.
     */
    public ProductOutcome recommend(Product product, CompetitorIndex index, PricingContext context) {
        try {
            return price(product, index.quotesFor(product.getId()), context);
        } catch (RuntimeException e) {
            log.error("Pricing failed for product {} in store {}", product.getId(), context.getStoreId(), e);
            return ProductOutcome.skipped(product.getId(), ProductOutcome.Status.FAILED,
                    List.of(Warn.productFailed(product.getId(), e)));
        }
    }

    private ProductOutcome price(Product product, List<CompetitorQuote> quotes, PricingContext context) {
        String productId = product.getId();
        String currency = product.getCurrency() != null ? product.getCurrency() : appProperties.getCatalog().getDefaultCurrency();
        List<Warn> warnings = new ArrayList<>();

        List<CompetitorQuote> usable = new ArrayList<>();
        for (CompetitorQuote q : quotes) {
            Double p = q.price();
            if (p == null || !(p > 0) || p.isInfinite()) continue;
            if (q.currency() != null && !q.currency().trim().equalsIgnoreCase(currency.trim())) {
                warnings.add(Warn.currencyMismatch(productId, q.key(), currency, q.currency()));
                continue;
            }
            usable.add(q);
        }
        int cap = appProperties.getPricing().getMaxCompetitorSlots();
        if (cap > 0 && usable.size() > cap) {
            usable = usable.subList(0, cap);
        }
        if (usable.isEmpty()) {
            return ProductOutcome.skipped(productId, ProductOutcome.Status.NO_COMPETITORS, warnings);
        }

        Double productPrice = product.getCurrentPrice();
        if (productPrice == null || !(productPrice > 0)) {
            warnings.add(Warn.invalidPrice(productId, productPrice));
            return ProductOutcome.skipped(productId, ProductOutcome.Status.INVALID_PRICE, warnings);
        }

        List<Double> prices = usable.stream().map(CompetitorQuote::price).toList();
        PriceDecision decision = pricingPolicy.decide(productPrice, product.getCost(), prices);

        List<CompetitorSlot> slots = new ArrayList<>(usable.size());
        for (int i = 0; i < usable.size(); i++) {
            CompetitorQuote q = usable.get(i);
            CompetitorSlot slot = new CompetitorSlot();
            slot.setLabel("Competitor " + (i + 1));
            slot.setName(q.name());
            slot.setUrl(q.url());
            slot.setNewPrice(q.price());
            slot.setOldPrice(context.previousPrice(productId, q.key()).orElse(null));
            slot.setChangePercent(percentChange(productPrice, q.price()));
            slot.setSource(q.source());
            slot.setCompetitorKey(q.key());
            slots.add(slot);
        }

        ProductRecommendation r = new ProductRecommendation();
        r.setId(recommendationId(context.getRunId(), productId));
        r.setStoreId(context.getStoreId());
        r.setProductId(productId);
        r.setProductName(product.getName());
        r.setProductSku(product.getSku());
        r.setProductPrice(productPrice);
        r.setRecommendedPrice(decision.recommendedPrice());
        r.setChangePercent(decision.changePercent());
        r.setDirection(decision.direction());
        r.setCompetitorAvg(decision.competitorAvg());
        r.setCompetitorCount(slots.size());
        r.setMarginFloor(decision.marginFloor());
        r.setMarginFloorApplied(decision.marginFloorApplied());
        r.setExplanation(explanationBuilder.build(decision, slots.size()));
        r.setCompetitors(slots);
        r.setStatus(RecommendationStatus.PENDING);

        log.debug("Recommendation: product={} price={} recommended={} change={}% competitors={} floorApplied={}",
                productId, productPrice, decision.recommendedPrice(), decision.changePercent(),
                slots.size(), decision.marginFloorApplied());
        return ProductOutcome.recommended(r, warnings);
    }

    /** Competitor price relative to the product price, in percent with two decimals. */
    static double percentChange(double productPrice, double competitorPrice) {
        BigDecimal base = BigDecimal.valueOf(productPrice);
        return BigDecimal.valueOf(competitorPrice).subtract(base)
                .multiply(BigDecimal.valueOf(100))
                .divide(base, 2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    public static String recommendationId(String runId, String productId) {
        return UUID.nameUUIDFromBytes((runId + ":" + productId).getBytes(StandardCharsets.UTF_8)).toString();
    }
}
