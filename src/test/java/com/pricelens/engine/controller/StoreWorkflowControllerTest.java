package com.pricelens.engine.controller;

import com.pricelens.engine.config.AppProperties;
import com.pricelens.engine.ingest.CatalogImportService;
import com.pricelens.engine.ingest.ColumnMapper;
import com.pricelens.engine.ingest.CsvParser;
import com.pricelens.engine.matching.Matcher;
import com.pricelens.engine.recommendation.ExplanationBuilder;
import com.pricelens.engine.recommendation.PricingPolicy;
import com.pricelens.engine.recommendation.RecommendationEngine;
import com.pricelens.engine.repository.InMemoryCatalogRepository;
import com.pricelens.engine.repository.InMemoryListingRepository;
import com.pricelens.engine.repository.InMemoryMatchRepository;
import com.pricelens.engine.repository.InMemoryRecommendationRepository;
import com.pricelens.engine.service.ListingIntakeService;
import com.pricelens.engine.service.PricingRunService;
import com.pricelens.engine.lifecycle.AuditTrail;
import com.pricelens.engine.lifecycle.LifecycleManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

/**
 * Import, listing snapshot, URL competitor and run through the HTTP layer.
 */
public class StoreWorkflowControllerTest {
    private static final String KEY = "test-key";

    private WebTestClient client;

    @BeforeEach
    public void setUp() {
        AppProperties props = new AppProperties();
        props.setAdminKey(KEY);
        InMemoryCatalogRepository catalog = new InMemoryCatalogRepository();
        InMemoryListingRepository listings = new InMemoryListingRepository();
        InMemoryMatchRepository matches = new InMemoryMatchRepository();
        InMemoryRecommendationRepository recommendations = new InMemoryRecommendationRepository();
        ColumnMapper mapper = new ColumnMapper();
        RecommendationEngine engine = new RecommendationEngine(new PricingPolicy(props), new ExplanationBuilder(props), props);
        PricingRunService runs = new PricingRunService(catalog, listings, matches, recommendations, new Matcher(props), engine, props);
        LifecycleManager lifecycle = new LifecycleManager(matches, recommendations, catalog, listings, new AuditTrail());

        client = WebTestClient.bindToController(
                        new CatalogController(new CatalogImportService(new CsvParser(), mapper, catalog, props), mapper, props),
                        new ListingController(new ListingIntakeService(listings, catalog), props),
                        new RunController(runs, props),
                        new RecommendationController(lifecycle, props))
                .controllerAdvice(new GlobalErrorHandler())
                .build();
    }

    @Test
    public void importListRunAndRead() {
        client.post().uri("/stores/s1/catalog/import").header("x-admin-key", KEY)
                .contentType(MediaType.parseMediaType("text/csv"))
                .bodyValue("name,sku,price,cost\nDesk Lamp,L-1,100,60\n")
                .exchange()
                .expectStatus().isOk();

        client.post().uri("/stores/s1/listings").header("x-admin-key", KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"listings\":[" +
                        "{\"competitorStoreId\":\"shop-a\",\"competitorProductId\":\"a1\",\"name\":\"Desk Lamp\",\"price\":90,\"currency\":\"USD\"}," +
                        "{\"competitorStoreId\":\"shop-a\",\"competitorProductId\":\"a2\",\"name\":\"\",\"price\":10}]}")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.accepted").isEqualTo(1)
                .jsonPath("$.dropped").isEqualTo(1);

        client.post().uri("/stores/s1/url-competitors").header("x-admin-key", KEY)
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"product_id\":\"s1:L-1\",\"competitor_name\":\"Corner Shop\"," +
                        "\"url\":\"https://corner.example/lamp\",\"last_price\":80}")
                .exchange()
                .expectStatus().isOk();

        client.post().uri("/stores/s1/runs").header("x-admin-key", KEY)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.store_id").isEqualTo("s1")
                .jsonPath("$.matches_created").isEqualTo(1)
                .jsonPath("$.recommendations").isEqualTo(1);

        client.get().uri("/stores/s1/recommendations")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$[0].productId").isEqualTo("s1:L-1")
                .jsonPath("$[0].competitorCount").isEqualTo(2)
                .jsonPath("$[0].recommendedPrice").isEqualTo(85.0)
                .jsonPath("$[0].direction").isEqualTo("DOWN")
                .jsonPath("$[0].competitors[1].source").isEqualTo("URL");
    }

    @Test
    public void runRequiresAdminKey() {
        client.post().uri("/stores/s1/runs").exchange().expectStatus().isUnauthorized();
    }
}
