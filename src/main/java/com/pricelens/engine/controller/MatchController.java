package com.pricelens.engine.controller;

import com.pricelens.engine.config.AppProperties;
import com.pricelens.engine.dto.LifecycleDtos;
import com.pricelens.engine.lifecycle.LifecycleManager;
import com.pricelens.engine.model.ListingRef;
import com.pricelens.engine.model.Match;
import com.pricelens.engine.model.MatchStatus;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

@RestController
public class MatchController {
    private final LifecycleManager lifecycleManager;
    private final AppProperties appProperties;

    public MatchController(LifecycleManager lifecycleManager, AppProperties appProperties) {
        this.lifecycleManager = lifecycleManager;
        this.appProperties = appProperties;
    }

    @GetMapping(value = "/stores/{storeId}/matches", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<List<Match>>> list(
            @PathVariable("storeId") String storeId,
            @RequestParam(value = "status", required = false) String status) {
        Optional<MatchStatus> filter = Optional.ofNullable(status)
                .filter(s -> !s.isBlank())
                .map(s -> MatchStatus.valueOf(s.trim().toUpperCase(Locale.ROOT)));
        return Mono.fromCallable(() -> lifecycleManager.findMatches(storeId, filter))
                .map(ResponseEntity::ok);
    }

    @PostMapping(value = "/stores/{storeId}/matches", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Match>> manualMatch(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @RequestHeader(value = "x-actor", required = false) String actor,
            @PathVariable("storeId") String storeId,
            @Valid @RequestBody LifecycleDtos.ManualMatchRequest body) {
        if (adminKey == null || !adminKey.equals(appProperties.getAdminKey())) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        ListingRef ref = new ListingRef(body.getCompetitor_store_id(), body.getCompetitor_product_id());
        return Mono.fromCallable(() -> lifecycleManager.manualMatch(storeId, body.getProduct_id(), ref, actorOrDefault(actor)))
                .map(ResponseEntity::ok);
    }

    @PostMapping(value = "/matches/{id}/confirm", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Match>> confirm(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @PathVariable("id") String id) {
        if (adminKey == null || !adminKey.equals(appProperties.getAdminKey())) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        return Mono.fromCallable(() -> lifecycleManager.confirmMatch(id)).map(ResponseEntity::ok);
    }

    @PostMapping(value = "/matches/{id}/reject", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Match>> reject(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @PathVariable("id") String id) {
        if (adminKey == null || !adminKey.equals(appProperties.getAdminKey())) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        return Mono.fromCallable(() -> lifecycleManager.rejectMatch(id)).map(ResponseEntity::ok);
    }

    @PostMapping(value = "/matches/{id}/reset", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<Match>> reset(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @RequestHeader(value = "x-actor", required = false) String actor,
            @PathVariable("id") String id) {
        if (adminKey == null || !adminKey.equals(appProperties.getAdminKey())) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        return Mono.fromCallable(() -> lifecycleManager.resetMatch(id, actorOrDefault(actor))).map(ResponseEntity::ok);
    }

    static String actorOrDefault(String actor) {
        return actor == null || actor.isBlank() ? "admin" : actor.trim();
    }
}
