package com.pricelens.engine.controller;

import com.pricelens.engine.config.AppProperties;
import com.pricelens.engine.lifecycle.LifecycleManager;
import com.pricelens.engine.model.ProductRecommendation;
import com.pricelens.engine.model.RecommendationStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

@RestController
public class RecommendationController {
    private final LifecycleManager lifecycleManager;
    private final AppProperties appProperties;

    public RecommendationController(LifecycleManager lifecycleManager, AppProperties appProperties) {
        this.lifecycleManager = lifecycleManager;
        this.appProperties = appProperties;
    }

    @GetMapping(value = "/stores/{storeId}/recommendations", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<List<ProductRecommendation>>> list(
            @PathVariable("storeId") String storeId,
            @RequestParam(value = "status", required = false) String status) {
        Optional<RecommendationStatus> filter = Optional.ofNullable(status)
                .filter(s -> !s.isBlank())
                .map(s -> RecommendationStatus.valueOf(s.trim().toUpperCase(Locale.ROOT)));
        return Mono.fromCallable(() -> lifecycleManager.findRecommendations(storeId, filter))
                .map(ResponseEntity::ok);
    }

    /** Sends the recommended price to the catalog; 502 when the catalog write fails. */
    @PostMapping(value = "/recommendations/{id}/apply", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ProductRecommendation>> apply(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @RequestHeader(value = "x-actor", required = false) String actor,
            @PathVariable("id") String id) {
        if (adminKey == null || !adminKey.equals(appProperties.getAdminKey())) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        return Mono.fromCallable(() -> lifecycleManager.applyRecommendation(id, MatchController.actorOrDefault(actor)))
                .map(ResponseEntity::ok);
    }

    @PostMapping(value = "/recommendations/{id}/dismiss", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ProductRecommendation>> dismiss(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @PathVariable("id") String id) {
        if (adminKey == null || !adminKey.equals(appProperties.getAdminKey())) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        return Mono.fromCallable(() -> lifecycleManager.dismissRecommendation(id)).map(ResponseEntity::ok);
    }

    @PostMapping(value = "/recommendations/{id}/reset", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<ProductRecommendation>> reset(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @RequestHeader(value = "x-actor", required = false) String actor,
            @PathVariable("id") String id) {
        if (adminKey == null || !adminKey.equals(appProperties.getAdminKey())) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        return Mono.fromCallable(() -> lifecycleManager.resetRecommendation(id, MatchController.actorOrDefault(actor)))
                .map(ResponseEntity::ok);
    }
}
