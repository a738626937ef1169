package com.pricelens.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A competitor listing as handed over by the scraper.
 *
 * <p>Listings are snapshot input: the engine never mutates them and never looks inside
 * {@code raw}, which is carried along for the persistence collaborator.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RawListing {
    /** Competitor store the listing was scraped from */
    private String competitorStoreId;
    /** Product id within the competitor store; falls back to the url when absent */
    private String competitorProductId;
    private String url;
    private String name;
    private String sku;
    private Double price;
    private String currency;
    /** Opaque scraper payload */
    private JsonNode raw;

    public RawListing() {}

    public RawListing(String competitorStoreId, String competitorProductId, String url, String name, Double price, String currency) {
        this.competitorStoreId = competitorStoreId;
        this.competitorProductId = competitorProductId;
        this.url = url;
        this.name = name;
        this.price = price;
        this.currency = currency;
    }

    @JsonIgnore
    public ListingRef getRef() {
        String cpid = competitorProductId != null && !competitorProductId.isBlank() ? competitorProductId : url;
        return new ListingRef(competitorStoreId != null ? competitorStoreId : "", cpid != null ? cpid : "");
    }

    public String getCompetitorStoreId() { return competitorStoreId; }
    public void setCompetitorStoreId(String competitorStoreId) { this.competitorStoreId = competitorStoreId; }
    public String getCompetitorProductId() { return competitorProductId; }
    public void setCompetitorProductId(String competitorProductId) { this.competitorProductId = competitorProductId; }
    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getSku() { return sku; }
    public void setSku(String sku) { this.sku = sku; }
    public Double getPrice() { return price; }
    public void setPrice(Double price) { this.price = price; }
    public String getCurrency() { return currency; }
    public void setCurrency(String currency) { this.currency = currency; }
    public JsonNode getRaw() { return raw; }
    public void setRaw(JsonNode raw) { this.raw = raw; }
}
