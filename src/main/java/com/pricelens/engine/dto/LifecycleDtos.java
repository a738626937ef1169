package com.pricelens.engine.dto;

import jakarta.validation.constraints.NotBlank;

public class LifecycleDtos {

    /** Reviewer pairing of a competitor listing with a catalog product */
    public static class ManualMatchRequest {
        @NotBlank
        private String product_id;
        @NotBlank
        private String competitor_store_id;
        @NotBlank
        private String competitor_product_id;

        public String getProduct_id() { return product_id; }
        public void setProduct_id(String product_id) { this.product_id = product_id; }
        public String getCompetitor_store_id() { return competitor_store_id; }
        public void setCompetitor_store_id(String competitor_store_id) { this.competitor_store_id = competitor_store_id; }
        public String getCompetitor_product_id() { return competitor_product_id; }
        public void setCompetitor_product_id(String competitor_product_id) { this.competitor_product_id = competitor_product_id; }
    }
}
