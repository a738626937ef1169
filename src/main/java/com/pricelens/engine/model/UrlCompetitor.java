package com.pricelens.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * A competitor page attached directly to one catalog product by URL, outside of store matching.
 * {@code lastPrice} is whatever the scraper last extracted from that page.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class UrlCompetitor {
    private String productId;
    private String competitorName;
    private String url;
    private Double lastPrice;
    private String currency;

    public UrlCompetitor() {}

    public UrlCompetitor(String productId, String competitorName, String url, Double lastPrice, String currency) {
        this.productId = productId;
        this.competitorName = competitorName;
        this.url = url;
        this.lastPrice = lastPrice;
        this.currency = currency;
    }

    public String key() {
        return "url:" + url;
    }

    public String getProductId() { return productId; }
    public void setProductId(String productId) { this.productId = productId; }
    public String getCompetitorName() { return competitorName; }
    public void setCompetitorName(String competitorName) { this.competitorName = competitorName; }
    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public Double getLastPrice() { return lastPrice; }
    public void setLastPrice(Double lastPrice) { this.lastPrice = lastPrice; }
    public String getCurrency() { return currency; }
    public void setCurrency(String currency) { this.currency = currency; }
}
