package com.pricelens.engine.recommendation;

import com.pricelens.engine.model.CompetitorSource;
import com.pricelens.engine.model.Match;
import com.pricelens.engine.model.RawListing;
import com.pricelens.engine.model.UrlCompetitor;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Competitor quotes grouped by product, built once per run from the match and listing snapshot.
 *
 * <p>Per product, store competitors come first in match sequence order, followed by URL
 * competitors in the order they were attached. Only matches usable for pricing (AUTO_MATCHED,
 * CONFIRMED) whose listing is present in the snapshot contribute.
 */
public class CompetitorIndex {
    private final Map<String, List<CompetitorQuote>> byProduct;

    private CompetitorIndex(Map<String, List<CompetitorQuote>> byProduct) {
        this.byProduct = byProduct;
    }

    public static CompetitorIndex build(List<Match> matches, List<RawListing> listings, List<UrlCompetitor> urlCompetitors) {
        Map<String, RawListing> listingsByKey = new HashMap<>();
        for (RawListing l : listings) {
            listingsByKey.putIfAbsent(l.getRef().key(), l);
        }

        Map<String, List<CompetitorQuote>> byProduct = new LinkedHashMap<>();
        matches.stream()
                .filter(m -> m.getStatus() != null && m.getStatus().isUsableForPricing())
                .sorted(Comparator.comparingLong(Match::getSequence))
                .forEach(m -> {
                    RawListing l = listingsByKey.get(m.getListingRef().key());
                    if (l == null) return;
                    byProduct.computeIfAbsent(m.getProductId(), k -> new ArrayList<>())
                            .add(new CompetitorQuote(m.getListingRef().key(), l.getName(), l.getUrl(),
                                    l.getPrice(), l.getCurrency(), CompetitorSource.STORE));
                });

        for (UrlCompetitor uc : urlCompetitors) {
            byProduct.computeIfAbsent(uc.getProductId(), k -> new ArrayList<>())
                    .add(new CompetitorQuote(uc.key(), uc.getCompetitorName(), uc.getUrl(),
                            uc.getLastPrice(), uc.getCurrency(), CompetitorSource.URL));
        }
        return new CompetitorIndex(byProduct);
    }

    public List<CompetitorQuote> quotesFor(String productId) {
        return byProduct.getOrDefault(productId, List.of());
    }
}
