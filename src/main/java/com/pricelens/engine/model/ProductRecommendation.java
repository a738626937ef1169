package com.pricelens.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.ArrayList;
import java.util.List;

/**
 * Price recommendation for one catalog product, produced by an aggregation run.
 *
 * <p>Invariants: {@code competitorCount} equals the number of slots with a {@code newPrice};
 * {@code changePercent} is relative to {@code productPrice}; when the product cost is known,
 * {@code recommendedPrice} is never below {@code marginFloor}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProductRecommendation {
    private String id;
    private String storeId;
    private String productId;
    private String productName;
    private String productSku;
    private double productPrice;
    private double recommendedPrice;
    private double changePercent;
    private Direction direction;
    private double competitorAvg;
    private int competitorCount;
    private Double marginFloor;
    private boolean marginFloorApplied;
    private String explanation;
    private List<CompetitorSlot> competitors = new ArrayList<>();
    private RecommendationStatus status = RecommendationStatus.PENDING;

    public ProductRecommendation copy() {
        ProductRecommendation r = new ProductRecommendation();
        r.id = id;
        r.storeId = storeId;
        r.productId = productId;
        r.productName = productName;
        r.productSku = productSku;
        r.productPrice = productPrice;
        r.recommendedPrice = recommendedPrice;
        r.changePercent = changePercent;
        r.direction = direction;
        r.competitorAvg = competitorAvg;
        r.competitorCount = competitorCount;
        r.marginFloor = marginFloor;
        r.marginFloorApplied = marginFloorApplied;
        r.explanation = explanation;
        r.competitors = new ArrayList<>(competitors);
        r.status = status;
        return r;
    }

    public ProductRecommendation withStatus(RecommendationStatus newStatus) {
        ProductRecommendation r = copy();
        r.status = newStatus;
        return r;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getStoreId() { return storeId; }
    public void setStoreId(String storeId) { this.storeId = storeId; }
    public String getProductId() { return productId; }
    public void setProductId(String productId) { this.productId = productId; }
    public String getProductName() { return productName; }
    public void setProductName(String productName) { this.productName = productName; }
    public String getProductSku() { return productSku; }
    public void setProductSku(String productSku) { this.productSku = productSku; }
    public double getProductPrice() { return productPrice; }
    public void setProductPrice(double productPrice) { this.productPrice = productPrice; }
    public double getRecommendedPrice() { return recommendedPrice; }
    public void setRecommendedPrice(double recommendedPrice) { this.recommendedPrice = recommendedPrice; }
    public double getChangePercent() { return changePercent; }
    public void setChangePercent(double changePercent) { this.changePercent = changePercent; }
    public Direction getDirection() { return direction; }
    public void setDirection(Direction direction) { this.direction = direction; }
    public double getCompetitorAvg() { return competitorAvg; }
    public void setCompetitorAvg(double competitorAvg) { this.competitorAvg = competitorAvg; }
    public int getCompetitorCount() { return competitorCount; }
    public void setCompetitorCount(int competitorCount) { this.competitorCount = competitorCount; }
    public Double getMarginFloor() { return marginFloor; }
    public void setMarginFloor(Double marginFloor) { this.marginFloor = marginFloor; }
    public boolean isMarginFloorApplied() { return marginFloorApplied; }
    public void setMarginFloorApplied(boolean marginFloorApplied) { this.marginFloorApplied = marginFloorApplied; }
    public String getExplanation() { return explanation; }
    public void setExplanation(String explanation) { this.explanation = explanation; }
    public List<CompetitorSlot> getCompetitors() { return competitors; }
    public void setCompetitors(List<CompetitorSlot> competitors) { this.competitors = competitors; }
    public RecommendationStatus getStatus() { return status; }
    public void setStatus(RecommendationStatus status) { this.status = status; }
}
