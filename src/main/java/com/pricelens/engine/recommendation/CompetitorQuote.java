package com.pricelens.engine.recommendation;

import com.pricelens.engine.model.CompetitorSource;

/**
 * A competitor price candidate for one product, before currency and positivity filtering.
 *
 * @param key stable competitor key, used to look up the previous run's price
 */
public record CompetitorQuote(String key, String name, String url, Double price, String currency,
                              CompetitorSource source) {}
