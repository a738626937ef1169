package com.pricelens.engine.recommendation;

import com.pricelens.engine.error.Warn;
import com.pricelens.engine.model.ProductRecommendation;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Merged outcome of one aggregation pass. Recommendations and warnings are ordered by
 * product id, whatever order the per-product work finished in.
 */
public record RecommendationResult(List<ProductRecommendation> recommendations,
                                   List<Warn> warnings,
                                   int withoutCompetitors,
                                   int invalidPrice,
                                   int failed) {

    public static RecommendationResult merge(List<ProductOutcome> outcomes) {
        List<ProductOutcome> sorted = new ArrayList<>(outcomes);
        sorted.sort(Comparator.comparing(ProductOutcome::productId, Comparator.nullsFirst(Comparator.naturalOrder())));

        List<ProductRecommendation> recs = new ArrayList<>();
        List<Warn> warnings = new ArrayList<>();
        int without = 0;
        int invalid = 0;
        int failed = 0;
        for (ProductOutcome o : sorted) {
            warnings.addAll(o.warnings());
            switch (o.status()) {
                case RECOMMENDED -> recs.add(o.recommendation());
                case NO_COMPETITORS -> without++;
                case INVALID_PRICE -> invalid++;
                case FAILED -> failed++;
            }
        }
        return new RecommendationResult(List.copyOf(recs), List.copyOf(warnings), without, invalid, failed);
    }
}
