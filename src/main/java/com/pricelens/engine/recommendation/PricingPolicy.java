package com.pricelens.engine.recommendation;

import com.pricelens.engine.config.AppProperties;
import com.pricelens.engine.model.Direction;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Margin-aware pricing: follow the competitor average, but never below
 * {@code cost / (1 - minMarginFraction)}.
 *
 * <p>Arithmetic is done in {@link BigDecimal}. The average is rounded half-up to cents and the
 * margin floor is rounded up to cents, so a recommendation never undercuts the exact floor.
 * Direction is taken from the unrounded change with the configured dead band.
 */
@Component
public class PricingPolicy {
    private static final int MONEY_SCALE = 2;
    private static final int WORK_SCALE = 10;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final AppProperties appProperties;

    public PricingPolicy(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    /**
     * @param productPrice current price, must be positive
     * @param cost unit cost, or null when unknown (no floor)
     * @param competitorPrices usable competitor prices, at least one, all positive
     */
    public PriceDecision decide(double productPrice, Double cost, List<Double> competitorPrices) {
        if (!(productPrice > 0)) {
            throw new IllegalArgumentException("productPrice must be positive: " + productPrice);
        }
        if (competitorPrices == null || competitorPrices.isEmpty()) {
            throw new IllegalArgumentException("at least one competitor price is required");
        }
        AppProperties.Pricing cfg = appProperties.getPricing();

        BigDecimal sum = BigDecimal.ZERO;
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        for (Double p : competitorPrices) {
            sum = sum.add(BigDecimal.valueOf(p));
            min = Math.min(min, p);
            max = Math.max(max, p);
        }
        BigDecimal avg = sum.divide(BigDecimal.valueOf(competitorPrices.size()), MONEY_SCALE, RoundingMode.HALF_UP);

        BigDecimal floor = marginFloor(cost, cfg.getMinMarginFraction());
        boolean floorApplied = floor != null && floor.compareTo(avg) > 0;
        BigDecimal recommended = floorApplied ? floor : avg;

        BigDecimal price = BigDecimal.valueOf(productPrice);
        BigDecimal change = recommended.subtract(price)
                .divide(price, WORK_SCALE, RoundingMode.HALF_UP)
                .multiply(HUNDRED);
        Direction direction = Direction.of(change.doubleValue(), cfg.getSameDeadBandPercent());

        return new PriceDecision(
                avg.doubleValue(),
                min,
                max,
                floor != null ? floor.doubleValue() : null,
                floorApplied,
                recommended.doubleValue(),
                change.setScale(2, RoundingMode.HALF_UP).doubleValue(),
                direction);
    }

    /**
     * Lowest price that keeps {@code minMarginFraction} of the price as margin, rounded up to cents.
     * Returns null when cost is unknown.
     */
    public static BigDecimal marginFloor(Double cost, double minMarginFraction) {
        if (cost == null) return null;
        if (minMarginFraction < 0 || minMarginFraction >= 1) {
            throw new IllegalStateException("app.pricing.min-margin-fraction must be in [0, 1): " + minMarginFraction);
        }
        return BigDecimal.valueOf(cost)
                .divide(BigDecimal.ONE.subtract(BigDecimal.valueOf(minMarginFraction)), MONEY_SCALE, RoundingMode.CEILING);
    }
}
