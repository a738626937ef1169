package com.pricelens.engine.recommendation;

import com.pricelens.engine.model.Direction;

/**
 * Outcome of the pricing policy for one product. Money values are rounded to cents,
 * {@code changePercent} to two decimals.
 *
 * @param marginFloor lowest price keeping the minimum margin; null when cost is unknown
 * @param marginFloorApplied whether the floor replaced the competitor average
 */
public record PriceDecision(double competitorAvg,
                            double minCompetitorPrice,
                            double maxCompetitorPrice,
                            Double marginFloor,
                            boolean marginFloorApplied,
                            double recommendedPrice,
                            double changePercent,
                            Direction direction) {

    /** (max - min) / avg of the competitor prices, 0 for a single price. */
    public double spread() {
        if (competitorAvg <= 0) return 0.0;
        return (maxCompetitorPrice - minCompetitorPrice) / competitorAvg;
    }
}
