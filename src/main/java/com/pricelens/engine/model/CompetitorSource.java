package com.pricelens.engine.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Where a competitor price came from: a matched listing of a tracked competitor store,
 * or a competitor URL attached to the product by hand.
 */
public enum CompetitorSource {
    STORE("Store"),
    URL("URL");

    private final String label;

    CompetitorSource(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
