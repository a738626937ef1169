package com.pricelens.engine.model;

public enum RecommendationStatus {
    PENDING,
    APPLIED,
    DISMISSED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
