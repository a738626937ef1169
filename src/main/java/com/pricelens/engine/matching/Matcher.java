package com.pricelens.engine.matching;

import com.pricelens.engine.config.AppProperties;
import com.pricelens.engine.model.ListingRef;
import com.pricelens.engine.model.Match;
import com.pricelens.engine.model.MatchStatus;
import com.pricelens.engine.model.Product;
import com.pricelens.engine.model.RawListing;
import com.pricelens.engine.util.TitleNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Pairs competitor listings with catalog products.
 *
 * <p>For each listing the best-scoring product wins, ties going to the lowest product id. The
 * score is {@link TitleSimilarity} on canonical names, raised to {@code app.matching.sku-match-score}
 * when both sides carry the same SKU. Scores at or above {@code auto-match-threshold} become
 * AUTO_MATCHED, scores in {@code [review-threshold, auto-match-threshold)} become PENDING, anything
 * lower creates no match.
 *
 * <p>A listing that already has a match never gets a second one. Reviewed matches (CONFIRMED,
 * REJECTED) are passed through as they are; AUTO_MATCHED and PENDING matches get their confidence
 * recomputed against their own product while keeping their status.
 *
 * <p>The result depends only on the inputs: ids are name-based UUIDs and new sequences continue
 * from the highest existing one in listing order.
 */
@Component
public class Matcher {
    private static final Logger log = LoggerFactory.getLogger(Matcher.class);

    private final AppProperties appProperties;

    public Matcher(AppProperties appProperties) {
        this.appProperties = appProperties;
    }

    public MatchResult match(String storeId, List<Product> products, List<RawListing> listings, List<Match> existing) {
        AppProperties.Matching cfg = appProperties.getMatching();

        List<CatalogEntry> catalog = new ArrayList<>();
        Map<String, CatalogEntry> catalogById = new HashMap<>();
        products.stream()
                .filter(p -> p.getId() != null)
                .sorted(Comparator.comparing(Product::getId))
                .forEach(p -> {
                    CatalogEntry e = new CatalogEntry(p);
                    if (catalogById.putIfAbsent(p.getId(), e) == null) catalog.add(e);
                });

        // first occurrence wins when the feed repeats a listing
        Map<String, RawListing> listingsByKey = new LinkedHashMap<>();
        for (RawListing l : listings) {
            listingsByKey.putIfAbsent(l.getRef().key(), l);
        }

        List<Match> out = new ArrayList<>();
        Set<String> matchedListings = new HashSet<>();
        long nextSequence = 1;
        List<Match> rescored = new ArrayList<>();
        int preserved = 0;

        for (Match m : existing) {
            nextSequence = Math.max(nextSequence, m.getSequence() + 1);
            matchedListings.add(m.getListingRef().key());
            CatalogEntry product = catalogById.get(m.getProductId());
            RawListing listing = listingsByKey.get(m.getListingRef().key());
            if (m.getStatus().isTerminal() || product == null || listing == null) {
                out.add(m);
                preserved++;
                continue;
            }
            double score = score(product, new ListingEntry(listing), cfg);
            if (Double.compare(score, m.getConfidence()) != 0) {
                Match r = m.copy();
                r.setConfidence(score);
                out.add(r);
                rescored.add(r);
            } else {
                out.add(m);
                preserved++;
            }
        }

        List<Match> created = new ArrayList<>();
        for (Map.Entry<String, RawListing> e : listingsByKey.entrySet()) {
            if (matchedListings.contains(e.getKey())) continue;
            ListingEntry listing = new ListingEntry(e.getValue());

            CatalogEntry best = null;
            double bestScore = 0.0;
            for (CatalogEntry candidate : catalog) {
                double s = score(candidate, listing, cfg);
                // catalog is sorted by id, so strict > keeps the lowest id on ties
                if (best == null || s > bestScore) {
                    best = candidate;
                    bestScore = s;
                }
            }
            if (best == null || bestScore < cfg.getReviewThreshold()) continue;

            MatchStatus status = bestScore >= cfg.getAutoMatchThreshold() ? MatchStatus.AUTO_MATCHED : MatchStatus.PENDING;
            ListingRef ref = e.getValue().getRef();
            Match m = new Match(matchId(storeId, ref, best.product.getId()), storeId, best.product.getId(),
                    ref, bestScore, status, nextSequence++);
            out.add(m);
            created.add(m);
            log.debug("New match: listing={} product={} confidence={} status={}",
                    ref.key(), best.product.getId(), bestScore, status);
        }

        out.sort(Comparator.comparingLong(Match::getSequence));
        log.info("Matching finished: store={} products={} listings={} created={} updated={} preserved={}",
                storeId, catalog.size(), listingsByKey.size(), created.size(), rescored.size(), preserved);
        return new MatchResult(out, created, rescored, preserved);
    }

    private static double score(CatalogEntry product, ListingEntry listing, AppProperties.Matching cfg) {
        double s = TitleSimilarity.ofCanonical(product.canonicalName, listing.canonicalName);
        if (product.sku != null && product.sku.equals(listing.sku)) {
            s = Math.max(s, cfg.getSkuMatchScore());
        }
        return Math.max(0.0, Math.min(1.0, s));
    }

    /** Name-based id, stable for one store/listing/product triple. */
    public static String matchId(String storeId, ListingRef ref, String productId) {
        String seed = storeId + "|" + ref.key() + "|" + productId;
        return UUID.nameUUIDFromBytes(seed.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static String skuKey(String sku) {
        if (sku == null || sku.isBlank()) return null;
        return sku.trim().toLowerCase(Locale.ROOT);
    }

    private static final class CatalogEntry {
        final Product product;
        final String canonicalName;
        final String sku;

        CatalogEntry(Product product) {
            this.product = Objects.requireNonNull(product);
            this.canonicalName = TitleNormalizer.normalize(product.getName());
            this.sku = skuKey(product.getSku());
        }
    }

    private static final class ListingEntry {
        final String canonicalName;
        final String sku;

        ListingEntry(RawListing listing) {
            this.canonicalName = TitleNormalizer.normalize(listing.getName());
            this.sku = skuKey(listing.getSku());
        }
    }
}
