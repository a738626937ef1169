package com.pricelens.engine.error;

import java.util.List;

/**
 * After auto-mapping and overrides, at least one of name/sku/price has no column.
 */
public class MissingRequiredFieldException extends PricingException {
    private final List<String> missing;

    public MissingRequiredFieldException(List<String> missing) {
        super("Required columns are not mapped: " + String.join(", ", missing));
        this.missing = List.copyOf(missing);
    }

    public List<String> getMissing() {
        return missing;
    }
}
