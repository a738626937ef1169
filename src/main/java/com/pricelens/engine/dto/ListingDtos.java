package com.pricelens.engine.dto;

import com.pricelens.engine.model.RawListing;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;

public class ListingDtos {

    /** Full scrape of tracked competitor stores; replaces the previous snapshot */
    public static class ListingSnapshotRequest {
        @NotNull
        private List<RawListing> listings;

        public List<RawListing> getListings() { return listings; }
        public void setListings(List<RawListing> listings) { this.listings = listings; }
    }

    public static class ListingSnapshotResponse {
        private String store_id;
        private int accepted; // listings stored
        private int dropped; // listings without name or identity

        public String getStore_id() { return store_id; }
        public void setStore_id(String store_id) { this.store_id = store_id; }
        public int getAccepted() { return accepted; }
        public void setAccepted(int accepted) { this.accepted = accepted; }
        public int getDropped() { return dropped; }
        public void setDropped(int dropped) { this.dropped = dropped; }
    }

    /** Competitor page attached to one product by hand */
    public static class UrlCompetitorRequest {
        @NotBlank
        private String product_id;
        private String competitor_name;
        @NotBlank
        private String url;
        @NotNull
        @Positive
        private Double last_price; // latest scraped price of the page
        private String currency;

        public String getProduct_id() { return product_id; }
        public void setProduct_id(String product_id) { this.product_id = product_id; }
        public String getCompetitor_name() { return competitor_name; }
        public void setCompetitor_name(String competitor_name) { this.competitor_name = competitor_name; }
        public String getUrl() { return url; }
        public void setUrl(String url) { this.url = url; }
        public Double getLast_price() { return last_price; }
        public void setLast_price(Double last_price) { this.last_price = last_price; }
        public String getCurrency() { return currency; }
        public void setCurrency(String currency) { this.currency = currency; }
    }
}
