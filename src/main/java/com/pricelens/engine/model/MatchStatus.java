package com.pricelens.engine.model;

/**
 * Review status of a product match.
 */
public enum MatchStatus {
    /** Similarity at or above the auto-match threshold */
    AUTO_MATCHED,
    /** Plausible pairing waiting for a reviewer */
    PENDING,
    /** Accepted by a reviewer */
    CONFIRMED,
    /** Refused by a reviewer */
    REJECTED;

    public boolean isTerminal() {
        return this == CONFIRMED || this == REJECTED;
    }

    /** Whether a listing under this status may feed pricing. */
    public boolean isUsableForPricing() {
        return this == AUTO_MATCHED || this == CONFIRMED;
    }
}
