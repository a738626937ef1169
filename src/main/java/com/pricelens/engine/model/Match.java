package com.pricelens.engine.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Pairing of a catalog product with a competitor listing.
 *
 * <p>{@code confidence} is the title similarity the matcher computed, always in [0, 1].
 * {@code sequence} records creation order within a store and orders competitor slots.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Match {
    private String id;
    /** Merchant store (tenant) that owns the catalog product */
    private String storeId;
    private String productId;
    private ListingRef listingRef;
    private double confidence;
    private MatchStatus status;
    private long sequence;

    public Match() {}

    public Match(String id, String storeId, String productId, ListingRef listingRef,
                 double confidence, MatchStatus status, long sequence) {
        this.id = id;
        this.storeId = storeId;
        this.productId = productId;
        this.listingRef = listingRef;
        setConfidence(confidence);
        this.status = status;
        this.sequence = sequence;
    }

    public Match copy() {
        return new Match(id, storeId, productId, listingRef, confidence, status, sequence);
    }

    public Match withStatus(MatchStatus newStatus) {
        Match m = copy();
        m.setStatus(newStatus);
        return m;
    }

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getStoreId() { return storeId; }
    public void setStoreId(String storeId) { this.storeId = storeId; }
    public String getProductId() { return productId; }
    public void setProductId(String productId) { this.productId = productId; }
    public ListingRef getListingRef() { return listingRef; }
    public void setListingRef(ListingRef listingRef) { this.listingRef = listingRef; }
    public double getConfidence() { return confidence; }
    public void setConfidence(double confidence) {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1]: " + confidence);
        }
        this.confidence = confidence;
    }
    public MatchStatus getStatus() { return status; }
    public void setStatus(MatchStatus status) { this.status = status; }
    public long getSequence() { return sequence; }
    public void setSequence(long sequence) { this.sequence = sequence; }
}
