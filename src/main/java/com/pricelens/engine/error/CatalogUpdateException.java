package com.pricelens.engine.error;

/**
 * The catalog collaborator refused or failed a price update requested by {@code apply}.
 */
public class CatalogUpdateException extends PricingException {
    public CatalogUpdateException(String productId, Throwable cause) {
        super("Catalog price update failed for product " + productId + ": " + cause.getMessage(), cause);
    }
}
