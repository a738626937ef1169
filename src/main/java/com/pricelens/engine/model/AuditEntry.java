package com.pricelens.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/**
 * One audited lifecycle action: a reset, a manual match, or a price sent to the catalog.
 *
 * @param recordType "match" or "recommendation"
 * @param fromStatus status before the action, null for records created by the action
 * @param productId set on price updates only, like {@code oldPrice} and {@code newPrice}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuditEntry(Instant at, String storeId, String recordType, String recordId,
                         String action, String fromStatus, String toStatus, String actor,
                         String productId, Double oldPrice, Double newPrice) {}
