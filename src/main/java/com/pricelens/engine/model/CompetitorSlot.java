package com.pricelens.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One competitor price entry attached to a recommendation for display.
 *
 * <p>{@code changePercent} is the competitor's price relative to the product's current price.
 * {@code oldPrice} is the price the previous aggregation run recorded for the same competitor.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CompetitorSlot {
    private String label;               // "Competitor 1", ...
    private String name;
    private String url;
    private Double oldPrice;
    private Double newPrice;
    private Double changePercent;
    private CompetitorSource source;
    /** Listing key for store competitors, {@code url:<url>} for URL competitors */
    private String competitorKey;

    public String getLabel() { return label; }
    public void setLabel(String label) { this.label = label; }
    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public Double getOldPrice() { return oldPrice; }
    public void setOldPrice(Double oldPrice) { this.oldPrice = oldPrice; }
    public Double getNewPrice() { return newPrice; }
    public void setNewPrice(Double newPrice) { this.newPrice = newPrice; }
    public Double getChangePercent() { return changePercent; }
    public void setChangePercent(Double changePercent) { this.changePercent = changePercent; }
    public CompetitorSource getSource() { return source; }
    public void setSource(CompetitorSource source) { this.source = source; }
    public String getCompetitorKey() { return competitorKey; }
    public void setCompetitorKey(String competitorKey) { this.competitorKey = competitorKey; }
}
