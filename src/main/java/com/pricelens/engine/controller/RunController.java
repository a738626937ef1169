package com.pricelens.engine.controller;

import com.pricelens.engine.config.AppProperties;
import com.pricelens.engine.dto.RunDtos;
import com.pricelens.engine.service.PricingRunService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
public class RunController {
    private final PricingRunService pricingRunService;
    private final AppProperties appProperties;

    public RunController(PricingRunService pricingRunService, AppProperties appProperties) {
        this.pricingRunService = pricingRunService;
        this.appProperties = appProperties;
    }

    @PostMapping(value = "/stores/{storeId}/runs", produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<ResponseEntity<RunDtos.RunReport>> run(
            @RequestHeader(value = "x-admin-key", required = false) String adminKey,
            @PathVariable("storeId") String storeId) {
        if (adminKey == null || !adminKey.equals(appProperties.getAdminKey())) {
            return Mono.just(ResponseEntity.status(401).build());
        }
        return pricingRunService.run(storeId).map(ResponseEntity::ok);
    }
}
