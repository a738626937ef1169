package com.pricelens.engine.model;

/**
 * Price change sent to the catalog collaborator when a recommendation is applied.
 */
public record PriceUpdateRequest(String productId, double newPrice) {}
