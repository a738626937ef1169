package com.pricelens.engine.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "app")
public class AppProperties {
    /**
     * Shared secret expected in the {@code x-admin-key} header on mutating endpoints.
     */
    private String adminKey;

    private Pricing pricing = new Pricing();
    private Matching matching = new Matching();
    private Catalog catalog = new Catalog();
    private Run run = new Run();

    public static class Pricing {
        /**
         * Minimum margin over cost a recommendation must keep, as a fraction of price.
         * 0.15 means the price never drops below cost / 0.85.
         */
        private double minMarginFraction = 0.15;
        /** |changePercent| below this is reported as SAME. */
        private double sameDeadBandPercent = 0.01;
        /** (max - min) / avg above which competitor prices are described as widely spread. */
        private double wideSpreadFraction = 0.25;
        /** Upper bound on competitor slots per recommendation; 0 = no limit. */
        private int maxCompetitorSlots;

        public double getMinMarginFraction() { return minMarginFraction; }
        public void setMinMarginFraction(double minMarginFraction) { this.minMarginFraction = minMarginFraction; }
        public double getSameDeadBandPercent() { return sameDeadBandPercent; }
        public void setSameDeadBandPercent(double sameDeadBandPercent) { this.sameDeadBandPercent = sameDeadBandPercent; }
        public double getWideSpreadFraction() { return wideSpreadFraction; }
        public void setWideSpreadFraction(double wideSpreadFraction) { this.wideSpreadFraction = wideSpreadFraction; }
        public int getMaxCompetitorSlots() { return maxCompetitorSlots; }
        public void setMaxCompetitorSlots(int maxCompetitorSlots) { this.maxCompetitorSlots = maxCompetitorSlots; }
    }

    public static class Matching {
        private double autoMatchThreshold = 0.85;
        private double reviewThreshold = 0.4;
        /**
         * Similarity granted when catalog and listing carry the same SKU (case-insensitive).
         * A value below the auto-match threshold sends SKU-only matches to review.
         */
        private double skuMatchScore = 0.9;

        public double getAutoMatchThreshold() { return autoMatchThreshold; }
        public void setAutoMatchThreshold(double autoMatchThreshold) { this.autoMatchThreshold = autoMatchThreshold; }
        public double getReviewThreshold() { return reviewThreshold; }
        public void setReviewThreshold(double reviewThreshold) { this.reviewThreshold = reviewThreshold; }
        public double getSkuMatchScore() { return skuMatchScore; }
        public void setSkuMatchScore(double skuMatchScore) { this.skuMatchScore = skuMatchScore; }
    }

    public static class Catalog {
        /** Currency for imported products when the file has no currency column. */
        private String defaultCurrency = "USD";

        public String getDefaultCurrency() { return defaultCurrency; }
        public void setDefaultCurrency(String defaultCurrency) { this.defaultCurrency = defaultCurrency; }
    }

    public static class Run {
        /** Worker units for per-product aggregation within one store run. */
        private int parallelism = 4;
        /** Number of warnings copied verbatim into a report; the rest are only counted. */
        private int warningSampleSize = 20;

        public int getParallelism() { return parallelism; }
        public void setParallelism(int parallelism) { this.parallelism = parallelism; }
        public int getWarningSampleSize() { return warningSampleSize; }
        public void setWarningSampleSize(int warningSampleSize) { this.warningSampleSize = warningSampleSize; }
    }

    public String getAdminKey() { return adminKey; }
    public void setAdminKey(String adminKey) { this.adminKey = adminKey; }
    public Pricing getPricing() { return pricing; }
    public void setPricing(Pricing pricing) { this.pricing = pricing; }
    public Matching getMatching() { return matching; }
    public void setMatching(Matching matching) { this.matching = matching; }
    public Catalog getCatalog() { return catalog; }
    public void setCatalog(Catalog catalog) { this.catalog = catalog; }
    public Run getRun() { return run; }
    public void setRun(Run run) { this.run = run; }
}
