package com.pricelens.engine.controller;

import com.pricelens.engine.config.AppProperties;
import com.pricelens.engine.lifecycle.AuditTrail;
import com.pricelens.engine.model.AuditEntry;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
public class AuditController {
    private final AuditTrail auditTrail;
    private final AppProperties appProperties;

    public AuditController(AuditTrail auditTrail, AppProperties appProperties) {
        this.auditTrail = auditTrail;
        this.appProperties = appProperties;
    }

    @GetMapping(value = "/stores/{storeId}/audit", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<List<AuditEntry>>> audit(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @PathVariable("storeId") String storeId) {
        if (adminKey == null || !adminKey.equals(appProperties.getAdminKey())) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        return Mono.just(ResponseEntity.ok(auditTrail.forStore(storeId)));
    }
}
