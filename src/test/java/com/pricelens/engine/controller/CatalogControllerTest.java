package com.pricelens.engine.controller;

import com.pricelens.engine.config.AppProperties;
import com.pricelens.engine.ingest.CatalogImportService;
import com.pricelens.engine.ingest.ColumnMapper;
import com.pricelens.engine.ingest.CsvParser;
import com.pricelens.engine.repository.InMemoryCatalogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class CatalogControllerTest {
    private static final String KEY = "test-key";
    private static final MediaType CSV = MediaType.parseMediaType("text/csv");

    private InMemoryCatalogRepository catalog;
    private WebTestClient client;

    @BeforeEach
    public void setUp() {
        AppProperties props = new AppProperties();
        props.setAdminKey(KEY);
        catalog = new InMemoryCatalogRepository();
        ColumnMapper mapper = new ColumnMapper();
        CatalogImportService service = new CatalogImportService(new CsvParser(), mapper, catalog, props);
        client = WebTestClient.bindToController(new CatalogController(service, mapper, props))
                .controllerAdvice(new GlobalErrorHandler())
                .build();
    }

    @Test
    public void importsCsvCatalog() {
        String csv = "Product Name,SKU,Price,Cost\nDesk Lamp,L-1,100,60\nFloor Lamp,L-2,150,\n";
        client.post().uri("/stores/s1/catalog/import").header("x-admin-key", KEY)
                .contentType(CSV).bodyValue(csv)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.imported").isEqualTo(2)
                .jsonPath("$.skipped").isEqualTo(0)
                .jsonPath("$.mapping.sku").isEqualTo("SKU");
        assertEquals(2, catalog.findByStore("s1").size());
    }

    @Test
    public void overrideQueryParameterPicksColumn() {
        String csv = "Title,Code,Amount\nDesk Lamp,L-1,100\n";
        client.post().uri("/stores/s1/catalog/import?name=Title&sku=Code&price=Amount").header("x-admin-key", KEY)
                .contentType(CSV).bodyValue(csv)
                .exchange()
                .expectStatus().isOk()
                .expectBody().jsonPath("$.imported").isEqualTo(1);
    }

    @Test
    public void missingColumnsAreRejected() {
        client.post().uri("/stores/s1/catalog/import").header("x-admin-key", KEY)
                .contentType(CSV).bodyValue("Description,Weight\nlamp,2\n")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("missing_required_fields")
                .jsonPath("$.missing.length()").isEqualTo(3);
    }

    @Test
    public void blankBodyIsRejected() {
        client.post().uri("/stores/s1/catalog/import").header("x-admin-key", KEY)
                .contentType(CSV).bodyValue("\n\n")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody().jsonPath("$.error").isEqualTo("empty_input");
    }

    @Test
    public void importRequiresAdminKey() {
        client.post().uri("/stores/s1/catalog/import")
                .contentType(CSV).bodyValue("name,sku,price\na,b,1\n")
                .exchange()
                .expectStatus().isUnauthorized();
    }

    @Test
    public void autoMapReportsMissingFields() {
        client.get().uri("/stores/s1/catalog/columns/auto-map?headers=product_name,unit_price")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.valid").isEqualTo(false)
                .jsonPath("$.missing[0]").isEqualTo("sku");
    }
}
