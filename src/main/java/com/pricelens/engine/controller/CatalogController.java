package com.pricelens.engine.controller;

import com.pricelens.engine.config.AppProperties;
import com.pricelens.engine.dto.ImportDtos;
import com.pricelens.engine.ingest.CatalogField;
import com.pricelens.engine.ingest.CatalogImportService;
import com.pricelens.engine.ingest.ColumnMapper;
import com.pricelens.engine.ingest.ColumnMapping;
import com.pricelens.engine.ingest.MappingValidation;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/stores/{storeId}/catalog")
public class CatalogController {
    private final CatalogImportService catalogImportService;
    private final ColumnMapper columnMapper;
    private final AppProperties appProperties;

    public CatalogController(CatalogImportService catalogImportService, ColumnMapper columnMapper, AppProperties appProperties) {
        this.catalogImportService = catalogImportService;
        this.columnMapper = columnMapper;
        this.appProperties = appProperties;
    }

    /**
     * Imports a CSV catalog. Query parameters named after a catalog field ({@code name}, {@code sku},
     * {@code price}, {@code cost}, {@code inventory}, {@code currency}) override the auto-mapped column.
     */
    @PostMapping(value = "/import", consumes = {"text/csv", MediaType.TEXT_PLAIN_VALUE}, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ImportDtos.ImportReport>> importCsv(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @PathVariable("storeId") String storeId,
            @RequestParam Map<String, String> params,
            @RequestBody(required = false) String body) {
        if (adminKey == null || !adminKey.equals(appProperties.getAdminKey())) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        Map<CatalogField, String> overrides = overrides(params);
        return Mono.fromCallable(() -> catalogImportService.importCsv(storeId, body, overrides))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @GetMapping(value = "/columns/auto-map", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ImportDtos.AutoMapResponse>> autoMap(
            @PathVariable("storeId") String storeId,
            @RequestParam("headers") List<String> headers) {
        ColumnMapping mapping = columnMapper.autoMap(headers);
        MappingValidation validation = columnMapper.validate(mapping);
        ImportDtos.AutoMapResponse resp = new ImportDtos.AutoMapResponse();
        resp.setMapping(mapping.asMap());
        resp.setValid(validation.valid());
        resp.setMissing(validation.missing());
        return Mono.just(ResponseEntity.ok(resp));
    }

    private static Map<CatalogField, String> overrides(Map<String, String> params) {
        Map<CatalogField, String> out = new EnumMap<>(CatalogField.class);
        for (CatalogField f : CatalogField.values()) {
            String header = params.get(f.key());
            if (header != null) out.put(f, header);
        }
        return out;
    }
}
