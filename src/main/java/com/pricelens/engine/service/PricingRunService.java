package com.pricelens.engine.service;

import com.pricelens.engine.config.AppProperties;
import com.pricelens.engine.dto.RunDtos;
import com.pricelens.engine.matching.MatchResult;
import com.pricelens.engine.matching.Matcher;
import com.pricelens.engine.model.Match;
import com.pricelens.engine.model.Product;
import com.pricelens.engine.model.ProductRecommendation;
import com.pricelens.engine.model.RawListing;
import com.pricelens.engine.model.UrlCompetitor;
import com.pricelens.engine.recommendation.CompetitorIndex;
import com.pricelens.engine.recommendation.PricingContext;
import com.pricelens.engine.recommendation.RecommendationEngine;
import com.pricelens.engine.recommendation.RecommendationResult;
import com.pricelens.engine.repository.CatalogRepository;
import com.pricelens.engine.repository.ListingRepository;
import com.pricelens.engine.repository.MatchRepository;
import com.pricelens.engine.repository.RecommendationRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs matching and aggregation for one store.
 *
 * <p>The run works on a snapshot taken at the start (catalog, listings, URL competitors, matches,
 * previous recommendations). Products are priced in parallel on {@code boundedElastic} with
 * {@code app.run.parallelism} workers; outcomes are merged and ordered by product id. Nothing is
 * written until every product is done, and then matches and recommendations are stored together.
 *
 * <p>The service takes no locks: callers serialize runs of the same store. Writes of rescored
 * matches still go through the repository's atomic update and skip matches a reviewer decided on
 * while the run was in flight.
 */
@Service
public class PricingRunService {
    private static final Logger log = LoggerFactory.getLogger(PricingRunService.class);

    private final CatalogRepository catalogRepository;
    private final ListingRepository listingRepository;
    private final MatchRepository matchRepository;
    private final RecommendationRepository recommendationRepository;
    private final Matcher matcher;
    private final RecommendationEngine recommendationEngine;
    private final AppProperties appProperties;

    public PricingRunService(CatalogRepository catalogRepository, ListingRepository listingRepository,
                             MatchRepository matchRepository, RecommendationRepository recommendationRepository,
                             Matcher matcher, RecommendationEngine recommendationEngine, AppProperties appProperties) {
        this.catalogRepository = catalogRepository;
        this.listingRepository = listingRepository;
        this.matchRepository = matchRepository;
        this.recommendationRepository = recommendationRepository;
        this.matcher = matcher;
        this.recommendationEngine = recommendationEngine;
        this.appProperties = appProperties;
    }

    private static class Snapshot {
        final List<Product> products;
        final List<RawListing> listings;
        final List<UrlCompetitor> urlCompetitors;
        final List<Match> matches;
        final List<ProductRecommendation> previous;

        Snapshot(List<Product> products, List<RawListing> listings, List<UrlCompetitor> urlCompetitors,
                 List<Match> matches, List<ProductRecommendation> previous) {
            this.products = products;
            this.listings = listings;
            this.urlCompetitors = urlCompetitors;
            this.matches = matches;
            this.previous = previous;
        }
    }

    public Mono<RunDtos.RunReport> run(String storeId) {
        String runId = UUID.randomUUID().toString();
        long started = System.currentTimeMillis();
        int parallelism = Math.max(1, appProperties.getRun().getParallelism());

        return Mono.fromCallable(() -> new Snapshot(
                        catalogRepository.findByStore(storeId),
                        listingRepository.findListings(storeId),
                        listingRepository.findUrlCompetitors(storeId),
                        matchRepository.findByStore(storeId),
                        recommendationRepository.findByStore(storeId)))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(snap -> {
                    log.info("Pricing run {} started: store={} products={} listings={} urlCompetitors={}",
                            runId, storeId, snap.products.size(), snap.listings.size(), snap.urlCompetitors.size());
                    MatchResult matchResult = matcher.match(storeId, snap.products, snap.listings, snap.matches);
                    CompetitorIndex index = CompetitorIndex.build(matchResult.matches(), snap.listings, snap.urlCompetitors);
                    PricingContext context = new PricingContext(storeId, runId, snap.previous, snap.urlCompetitors);
                    AtomicInteger counter = new AtomicInteger(0);

                    return Flux.fromIterable(snap.products)
                            .flatMap(product -> Mono.fromCallable(() -> recommendationEngine.recommend(product, index, context))
                                            .map(outcome -> {
                                                int current = counter.incrementAndGet();
                                                int competitors = outcome.recommendation() != null
                                                        ? outcome.recommendation().getCompetitorCount() : 0;
                                                log.info("Pricing run progress: {} products processed so far; id={} status={} competitors={}",
                                                        current, outcome.productId(), outcome.status(), competitors);
                                                return outcome;
                                            })
                                            .subscribeOn(Schedulers.boundedElastic()),
                                    parallelism)
                            .collectList()
                            .map(outcomes -> {
                                RecommendationResult result = RecommendationResult.merge(outcomes);
                                persistMatches(matchResult);
                                recommendationRepository.replaceForStore(storeId, result.recommendations());
                                return buildReport(storeId, runId, snap, matchResult, result,
                                        System.currentTimeMillis() - started);
                            });
                })
                .doOnNext(r -> log.info("Pricing run {} finished: store={} recommendations={} withoutCompetitors={} failed={} warnings={} in {} ms",
                        runId, storeId, r.getRecommendations(), r.getProducts_without_competitors(),
                        r.getProducts_failed(), r.getWarnings_total(), r.getDuration_ms()))
                .doOnError(e -> log.error("Pricing run {} for store {} failed", runId, storeId, e));
    }

    private void persistMatches(MatchResult matchResult) {
        matchRepository.saveAll(matchResult.created());
        for (Match rescored : matchResult.rescored()) {
            matchRepository.update(rescored.getId(), current -> {
                if (current.getStatus().isTerminal()) return current;
                Match next = current.copy();
                next.setConfidence(rescored.getConfidence());
                return next;
            });
        }
    }

    private RunDtos.RunReport buildReport(String storeId, String runId, Snapshot snap, MatchResult matchResult,
                                          RecommendationResult result, long durationMs) {
        RunDtos.RunReport report = new RunDtos.RunReport();
        report.setStore_id(storeId);
        report.setRun_id(runId);
        report.setProducts(snap.products.size());
        report.setListings(snap.listings.size());
        report.setMatches_created(matchResult.createdCount());
        report.setMatches_updated(matchResult.updatedCount());
        report.setMatches_preserved(matchResult.preserved());
        report.setRecommendations(result.recommendations().size());
        report.setProducts_without_competitors(result.withoutCompetitors());
        report.setProducts_invalid_price(result.invalidPrice());
        report.setProducts_failed(result.failed());
        report.setWarnings_total(result.warnings().size());
        int sample = Math.max(0, appProperties.getRun().getWarningSampleSize());
        report.setWarnings(new ArrayList<>(result.warnings().subList(0, Math.min(sample, result.warnings().size()))));
        report.setDuration_ms(durationMs);
        return report;
    }
}
