package com.pricelens.engine.dto;

import com.pricelens.engine.error.Warn;

import java.util.List;

public class RunDtos {

    /** Summary of one match + aggregate run for a store */
    public static class RunReport {
        private String store_id;
        private String run_id;
        private int products; // catalog products considered
        private int listings; // competitor listings in the snapshot
        private int matches_created;
        private int matches_updated; // confidence recomputed
        private int matches_preserved;
        private int recommendations;
        private int products_without_competitors;
        private int products_invalid_price;
        private int products_failed;
        private int warnings_total;
        private List<Warn> warnings; // first N warnings, N = app.run.warning-sample-size
        private long duration_ms;

        public String getStore_id() { return store_id; }
        public void setStore_id(String store_id) { this.store_id = store_id; }
        public String getRun_id() { return run_id; }
        public void setRun_id(String run_id) { this.run_id = run_id; }
        public int getProducts() { return products; }
        public void setProducts(int products) { this.products = products; }
        public int getListings() { return listings; }
        public void setListings(int listings) { this.listings = listings; }
        public int getMatches_created() { return matches_created; }
        public void setMatches_created(int matches_created) { this.matches_created = matches_created; }
        public int getMatches_updated() { return matches_updated; }
        public void setMatches_updated(int matches_updated) { this.matches_updated = matches_updated; }
        public int getMatches_preserved() { return matches_preserved; }
        public void setMatches_preserved(int matches_preserved) { this.matches_preserved = matches_preserved; }
        public int getRecommendations() { return recommendations; }
        public void setRecommendations(int recommendations) { this.recommendations = recommendations; }
        public int getProducts_without_competitors() { return products_without_competitors; }
        public void setProducts_without_competitors(int products_without_competitors) { this.products_without_competitors = products_without_competitors; }
        public int getProducts_invalid_price() { return products_invalid_price; }
        public void setProducts_invalid_price(int products_invalid_price) { this.products_invalid_price = products_invalid_price; }
        public int getProducts_failed() { return products_failed; }
        public void setProducts_failed(int products_failed) { this.products_failed = products_failed; }
        public int getWarnings_total() { return warnings_total; }
        public void setWarnings_total(int warnings_total) { this.warnings_total = warnings_total; }
        public List<Warn> getWarnings() { return warnings; }
        public void setWarnings(List<Warn> warnings) { this.warnings = warnings; }
        public long getDuration_ms() { return duration_ms; }
        public void setDuration_ms(long duration_ms) { this.duration_ms = duration_ms; }
    }
}
