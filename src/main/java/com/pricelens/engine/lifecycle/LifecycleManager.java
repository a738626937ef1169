package com.pricelens.engine.lifecycle;

import com.pricelens.engine.error.CatalogUpdateException;
import com.pricelens.engine.error.InvalidTransitionException;
import com.pricelens.engine.error.NotFoundException;
import com.pricelens.engine.matching.Matcher;
import com.pricelens.engine.model.ListingRef;
import com.pricelens.engine.model.Match;
import com.pricelens.engine.model.MatchStatus;
import com.pricelens.engine.model.PriceUpdateRequest;
import com.pricelens.engine.model.Product;
import com.pricelens.engine.model.ProductRecommendation;
import com.pricelens.engine.model.RecommendationStatus;
import com.pricelens.engine.repository.CatalogRepository;
import com.pricelens.engine.repository.ListingRepository;
import com.pricelens.engine.repository.MatchRepository;
import com.pricelens.engine.repository.RecommendationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Owns every status change of matches and recommendations.
 *
 * <p>Normal transitions only leave the initial states:
 * <ul>
 *   <li>match: AUTO_MATCHED/PENDING -> CONFIRMED (confirm) or REJECTED (reject)</li>
 *   <li>recommendation: PENDING -> APPLIED (apply) or DISMISSED (dismiss)</li>
 * </ul>
 * Any of them on a terminal record throws {@link InvalidTransitionException} and leaves the record
 * as it was. {@code reset} is the only way back to PENDING and is recorded in the {@link AuditTrail}.
 *
 * <p>The status check runs inside the repository's atomic update, so two concurrent actions on
 * the same record cannot both succeed.
 */
@Service
public class LifecycleManager {
    private static final Logger log = LoggerFactory.getLogger(LifecycleManager.class);

    private static final String MATCH = "match";
    private static final String RECOMMENDATION = "recommendation";

    private final MatchRepository matchRepository;
    private final RecommendationRepository recommendationRepository;
    private final CatalogRepository catalogRepository;
    private final ListingRepository listingRepository;
    private final AuditTrail auditTrail;

    public LifecycleManager(MatchRepository matchRepository, RecommendationRepository recommendationRepository,
                            CatalogRepository catalogRepository, ListingRepository listingRepository,
                            AuditTrail auditTrail) {
        this.matchRepository = matchRepository;
        this.recommendationRepository = recommendationRepository;
        this.catalogRepository = catalogRepository;
        this.listingRepository = listingRepository;
        this.auditTrail = auditTrail;
    }

    // ---- matches ----

    public List<Match> findMatches(String storeId, Optional<MatchStatus> status) {
        return matchRepository.findByStore(storeId).stream()
                .filter(m -> status.map(s -> s == m.getStatus()).orElse(true))
                .collect(Collectors.toList());
    }

    public Match confirmMatch(String matchId) {
        return transitionMatch(matchId, "confirm", MatchStatus.CONFIRMED);
    }

    public Match rejectMatch(String matchId) {
        return transitionMatch(matchId, "reject", MatchStatus.REJECTED);
    }

    private Match transitionMatch(String matchId, String action, MatchStatus target) {
        Match updated = matchRepository.update(matchId, current -> {
            if (current.getStatus().isTerminal()) {
                throw new InvalidTransitionException(MATCH, matchId, current.getStatus().name(), action);
            }
            return current.withStatus(target);
        });
        log.info("Match {} {}: product={} listing={}", matchId, target, updated.getProductId(), updated.getListingRef().key());
        return updated;
    }

    /** Returns a CONFIRMED or REJECTED match to PENDING. */
    public Match resetMatch(String matchId, String actor) {
        MatchStatus[] previous = new MatchStatus[1];
        Match updated = matchRepository.update(matchId, current -> {
            if (!current.getStatus().isTerminal()) {
                throw new InvalidTransitionException(MATCH, matchId, current.getStatus().name(), "reset");
            }
            previous[0] = current.getStatus();
            return current.withStatus(MatchStatus.PENDING);
        });
        auditTrail.record(updated.getStoreId(), MATCH, matchId, "reset", previous[0].name(), MatchStatus.PENDING.name(), actor);
        return updated;
    }

    /**
     * Records a reviewer's pairing of a listing with a product as a CONFIRMED match with confidence 1.0.
     *
     * <p>If the listing already has an unreviewed match it is re-pointed to {@code productId} and
     * confirmed in place; a reviewed one must be reset first.
     *
     * @throws NotFoundException when the product or the listing is unknown to the store
     * @throws InvalidTransitionException when the listing's match is already CONFIRMED or REJECTED
     */
    public Match manualMatch(String storeId, String productId, ListingRef listingRef, String actor) {
        Product product = catalogRepository.findById(productId)
                .filter(p -> storeId.equals(p.getStoreId()))
                .orElseThrow(() -> new NotFoundException("product", productId));
        boolean listingKnown = listingRepository.findListings(storeId).stream()
                .anyMatch(l -> l.getRef().equals(listingRef));
        if (!listingKnown) {
            throw new NotFoundException("listing", listingRef.key());
        }

        List<Match> existing = matchRepository.findByStore(storeId);
        Optional<Match> forListing = existing.stream()
                .filter(m -> m.getListingRef().equals(listingRef))
                .findFirst();

        Match result;
        String fromStatus;
        if (forListing.isPresent()) {
            Match m = forListing.get();
            String[] before = new String[1];
            result = matchRepository.update(m.getId(), current -> {
                if (current.getStatus().isTerminal()) {
                    throw new InvalidTransitionException(MATCH, current.getId(), current.getStatus().name(), "manually match");
                }
                before[0] = current.getStatus().name();
                Match next = current.withStatus(MatchStatus.CONFIRMED);
                next.setProductId(product.getId());
                next.setConfidence(1.0);
                return next;
            });
            fromStatus = before[0];
        } else {
            long sequence = existing.stream().mapToLong(Match::getSequence).max().orElse(0) + 1;
            result = new Match(Matcher.matchId(storeId, listingRef, product.getId()), storeId, product.getId(),
                    listingRef, 1.0, MatchStatus.CONFIRMED, sequence);
            matchRepository.saveAll(List.of(result));
            fromStatus = null;
        }
        auditTrail.record(storeId, MATCH, result.getId(), "manual_match", fromStatus, MatchStatus.CONFIRMED.name(), actor);
        return result;
    }

    // ---- recommendations ----

    public List<ProductRecommendation> findRecommendations(String storeId, Optional<RecommendationStatus> status) {
        return recommendationRepository.findByStore(storeId).stream()
                .filter(r -> status.map(s -> s == r.getStatus()).orElse(true))
                .collect(Collectors.toList());
    }

    /**
     * Sends the recommended price to the catalog and marks the recommendation APPLIED.
     *
     * <p>The catalog write happens first. If it fails the recommendation stays PENDING and the
     * failure is rethrown as {@link CatalogUpdateException}. A successful write is recorded in the
     * {@link AuditTrail} with the catalog price it replaced.
     */
    public ProductRecommendation applyRecommendation(String recommendationId, String actor) {
        ProductRecommendation current = recommendationRepository.findById(recommendationId)
                .orElseThrow(() -> new NotFoundException(RECOMMENDATION, recommendationId));
        if (current.getStatus().isTerminal()) {
            throw new InvalidTransitionException(RECOMMENDATION, recommendationId, current.getStatus().name(), "apply");
        }

        PriceUpdateRequest request = new PriceUpdateRequest(current.getProductId(), current.getRecommendedPrice());
        Double oldPrice = catalogRepository.findById(request.productId())
                .map(Product::getCurrentPrice)
                .orElse(current.getProductPrice());
        try {
            catalogRepository.updatePrice(request);
        } catch (RuntimeException e) {
            log.warn("Apply failed for recommendation {}: catalog rejected price {} for product {}",
                    recommendationId, request.newPrice(), request.productId(), e);
            throw new CatalogUpdateException(request.productId(), e);
        }
        auditTrail.recordPriceUpdate(current.getStoreId(), recommendationId, request.productId(),
                oldPrice, request.newPrice(), actor);

        ProductRecommendation applied = recommendationRepository.update(recommendationId, r -> {
            if (r.getStatus().isTerminal()) {
                throw new InvalidTransitionException(RECOMMENDATION, recommendationId, r.getStatus().name(), "apply");
            }
            return r.withStatus(RecommendationStatus.APPLIED);
        });
        log.info("Recommendation {} APPLIED: product={} price {} -> {}",
                recommendationId, applied.getProductId(), applied.getProductPrice(), applied.getRecommendedPrice());
        return applied;
    }

    public ProductRecommendation dismissRecommendation(String recommendationId) {
        ProductRecommendation dismissed = recommendationRepository.update(recommendationId, r -> {
            if (r.getStatus().isTerminal()) {
                throw new InvalidTransitionException(RECOMMENDATION, recommendationId, r.getStatus().name(), "dismiss");
            }
            return r.withStatus(RecommendationStatus.DISMISSED);
        });
        log.info("Recommendation {} DISMISSED: product={}", recommendationId, dismissed.getProductId());
        return dismissed;
    }

    /**
     * Returns an APPLIED or DISMISSED recommendation to PENDING. A price already sent to the
     * catalog is not reverted.
     */
    public ProductRecommendation resetRecommendation(String recommendationId, String actor) {
        RecommendationStatus[] previous = new RecommendationStatus[1];
        ProductRecommendation updated = recommendationRepository.update(recommendationId, r -> {
            if (!r.getStatus().isTerminal()) {
                throw new InvalidTransitionException(RECOMMENDATION, recommendationId, r.getStatus().name(), "reset");
            }
            previous[0] = r.getStatus();
            return r.withStatus(RecommendationStatus.PENDING);
        });
        auditTrail.record(updated.getStoreId(), RECOMMENDATION, recommendationId, "reset",
                previous[0].name(), RecommendationStatus.PENDING.name(), actor);
        return updated;
    }
}
