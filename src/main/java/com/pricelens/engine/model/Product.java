package com.pricelens.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A merchant catalog product as read from the catalog collaborator or produced by CSV import.
 *
 * <p>{@code marginPercent} is derived from {@code currentPrice} and {@code cost} and is
 * recomputed whenever either of them changes. It is absent when cost is unknown or the
 * price is not positive.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Product {
    /** Catalog id, unique within a store (CSV imports use {@code <storeId>:<sku>}) */
    private String id;
    private String storeId;
    private String name;
    private String sku;
    private Double currentPrice;
    private String currency;
    private Double cost;
    private Double marginPercent;
    private Integer inventory;

    public Product() {}

    public Product(String id, String name, String sku, Double currentPrice, String currency, Double cost) {
        this.id = id;
        this.name = name;
        this.sku = sku;
        this.currentPrice = currentPrice;
        this.currency = currency;
        this.cost = cost;
        recomputeMargin();
    }

    /**
     * Returns a copy of this product carrying {@code newPrice} with the margin recomputed.
     */
    public Product withPrice(double newPrice) {
        Product p = new Product(id, name, sku, newPrice, currency, cost);
        p.setStoreId(storeId);
        p.setInventory(inventory);
        return p;
    }

    public Product copy() {
        Product p = new Product(id, name, sku, currentPrice, currency, cost);
        p.setStoreId(storeId);
        p.setInventory(inventory);
        return p;
    }

    private void recomputeMargin() {
        if (currentPrice == null || cost == null || currentPrice <= 0) {
            marginPercent = null;
            return;
        }
        double m = (currentPrice - cost) / currentPrice * 100.0;
        marginPercent = Math.round(m * 100.0) / 100.0;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getStoreId() { return storeId; }
    public void setStoreId(String storeId) { this.storeId = storeId; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getSku() { return sku; }
    public void setSku(String sku) { this.sku = sku; }
    public Double getCurrentPrice() { return currentPrice; }
    public void setCurrentPrice(Double currentPrice) {
        this.currentPrice = currentPrice;
        recomputeMargin();
    }
    public String getCurrency() { return currency; }
    public void setCurrency(String currency) { this.currency = currency; }
    public Double getCost() { return cost; }
    public void setCost(Double cost) {
        this.cost = cost;
        recomputeMargin();
    }
    public Double getMarginPercent() { return marginPercent; }
    public Integer getInventory() { return inventory; }
    public void setInventory(Integer inventory) { this.inventory = inventory; }
}
