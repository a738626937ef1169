package com.pricelens.engine.controller;

import com.pricelens.engine.config.AppProperties;
import com.pricelens.engine.dto.ListingDtos;
import com.pricelens.engine.model.UrlCompetitor;
import com.pricelens.engine.service.ListingIntakeService;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/stores/{storeId}")
public class ListingController {
    private final ListingIntakeService listingIntakeService;
    private final AppProperties appProperties;

    public ListingController(ListingIntakeService listingIntakeService, AppProperties appProperties) {
        this.listingIntakeService = listingIntakeService;
        this.appProperties = appProperties;
    }

    @PostMapping(value = "/listings", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ListingDtos.ListingSnapshotResponse>> replaceListings(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @PathVariable("storeId") String storeId,
            @Valid @RequestBody ListingDtos.ListingSnapshotRequest body) {
        if (adminKey == null || !adminKey.equals(appProperties.getAdminKey())) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        return Mono.fromCallable(() -> listingIntakeService.replaceListings(storeId, body.getListings()))
                .map(ResponseEntity::ok);
    }

    @PostMapping(value = "/url-competitors", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<UrlCompetitor>> attachUrlCompetitor(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @PathVariable("storeId") String storeId,
            @Valid @RequestBody ListingDtos.UrlCompetitorRequest body) {
        if (adminKey == null || !adminKey.equals(appProperties.getAdminKey())) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        return Mono.fromCallable(() -> listingIntakeService.attachUrlCompetitor(storeId, body))
                .map(ResponseEntity::ok);
    }
}
