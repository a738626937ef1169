package com.pricelens.engine.service;

import com.pricelens.engine.config.AppProperties;
import com.pricelens.engine.matching.Matcher;
import com.pricelens.engine.model.CompetitorSlot;
import com.pricelens.engine.model.Match;
import com.pricelens.engine.model.MatchStatus;
import com.pricelens.engine.model.Product;
import com.pricelens.engine.model.ProductRecommendation;
import com.pricelens.engine.model.RawListing;
import com.pricelens.engine.model.RecommendationStatus;
import com.pricelens.engine.recommendation.ExplanationBuilder;
import com.pricelens.engine.recommendation.PricingPolicy;
import com.pricelens.engine.recommendation.RecommendationEngine;
import com.pricelens.engine.repository.InMemoryCatalogRepository;
import com.pricelens.engine.repository.InMemoryListingRepository;
import com.pricelens.engine.repository.InMemoryMatchRepository;
import com.pricelens.engine.repository.InMemoryRecommendationRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PricingRunServiceTest {

    private InMemoryCatalogRepository catalog;
    private InMemoryListingRepository listings;
    private InMemoryMatchRepository matches;
    private InMemoryRecommendationRepository recommendations;
    private PricingRunService service;

    @BeforeEach
    public void setUp() {
        AppProperties props = new AppProperties();
        props.getRun().setParallelism(3);
        catalog = new InMemoryCatalogRepository();
        listings = new InMemoryListingRepository();
        matches = new InMemoryMatchRepository();
        recommendations = new InMemoryRecommendationRepository();
        RecommendationEngine engine = new RecommendationEngine(new PricingPolicy(props), new ExplanationBuilder(props), props);
        service = new PricingRunService(catalog, listings, matches, recommendations, new Matcher(props), engine, props);

        catalog.saveAll("s1", List.of(
                new Product("p1", "Desk Lamp", "L-1", 100.0, "USD", 60.0),
                new Product("p2", "Garden Hose", "H-1", 30.0, "USD", null)));
        listings.replaceListings("s1", List.of(
                new RawListing("shop-a", "a1", "https://shop-a.example/a1", "Desk Lamp", 90.0, "USD"),
                new RawListing("shop-a", "a2", "https://shop-a.example/a2", "Garden Hose Reel", 35.0, "USD"),
                new RawListing("shop-a", "a3", "https://shop-a.example/a3", "Bicycle Helmet", 50.0, "USD")));
    }

    @Test
    public void firstRunMatchesAndRecommends() {
        StepVerifier.create(service.run("s1"))
                .assertNext(report -> {
                    assertEquals("s1", report.getStore_id());
                    assertNotNull(report.getRun_id());
                    assertEquals(2, report.getProducts());
                    assertEquals(3, report.getListings());
                    assertEquals(2, report.getMatches_created());
                    assertEquals(0, report.getMatches_updated());
                    assertEquals(1, report.getRecommendations());
                    assertEquals(1, report.getProducts_without_competitors());
                    assertEquals(0, report.getProducts_failed());
                    assertEquals(0, report.getWarnings_total());
                })
                .verifyComplete();

        List<Match> stored = matches.findByStore("s1");
        assertEquals(2, stored.size());
        assertEquals(MatchStatus.AUTO_MATCHED, stored.get(0).getStatus());
        assertEquals(MatchStatus.PENDING, stored.get(1).getStatus());

        List<ProductRecommendation> recs = recommendations.findByStore("s1");
        assertEquals(1, recs.size());
        assertEquals("p1", recs.get(0).getProductId());
        assertEquals(90.0, recs.get(0).getRecommendedPrice());
        assertEquals(RecommendationStatus.PENDING, recs.get(0).getStatus());
        assertEquals("s1", recs.get(0).getStoreId());
    }

    @Test
    public void secondRunKeepsReviewsAndCarriesPreviousPrices() {
        service.run("s1").block();
        Match pending = matches.findByStore("s1").get(1);
        matches.update(pending.getId(), m -> m.withStatus(MatchStatus.CONFIRMED));
        String firstRecId = recommendations.findByStore("s1").get(0).getId();

        listings.replaceListings("s1", List.of(
                new RawListing("shop-a", "a1", "https://shop-a.example/a1", "Desk Lamp", 80.0, "USD"),
                new RawListing("shop-a", "a2", "https://shop-a.example/a2", "Garden Hose Reel", 35.0, "USD"),
                new RawListing("shop-a", "a3", "https://shop-a.example/a3", "Bicycle Helmet", 50.0, "USD")));

        StepVerifier.create(service.run("s1"))
                .assertNext(report -> {
                    assertEquals(0, report.getMatches_created());
                    assertEquals(2, report.getMatches_preserved());
                    assertEquals(2, report.getRecommendations());
                    assertEquals(0, report.getProducts_without_competitors());
                })
                .verifyComplete();

        List<ProductRecommendation> recs = recommendations.findByStore("s1");
        assertEquals(2, recs.size());
        ProductRecommendation lamp = recs.get(0);
        assertNotEquals(firstRecId, lamp.getId());
        assertEquals(80.0, lamp.getRecommendedPrice());
        CompetitorSlot slot = lamp.getCompetitors().get(0);
        assertEquals(90.0, slot.getOldPrice());
        assertEquals(80.0, slot.getNewPrice());

        ProductRecommendation hose = recs.get(1);
        assertEquals("p2", hose.getProductId());
        assertEquals(35.0, hose.getRecommendedPrice());
        assertEquals(MatchStatus.CONFIRMED, matches.findById(pending.getId()).orElseThrow().getStatus());
    }

    @Test
    public void emptyStoreProducesEmptyReport() {
        StepVerifier.create(service.run("nobody"))
                .assertNext(report -> {
                    assertEquals(0, report.getProducts());
                    assertEquals(0, report.getRecommendations());
                    assertTrue(report.getWarnings().isEmpty());
                })
                .verifyComplete();
    }
}
