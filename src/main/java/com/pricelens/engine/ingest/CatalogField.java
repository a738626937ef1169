package com.pricelens.engine.ingest;

import java.util.List;

/**
 * Canonical catalog fields a CSV column can be mapped to, in claiming order.
 * Each field lists its header aliases from most to least preferred.
 */
public enum CatalogField {
    NAME("name", true, List.of("name", "product_name", "title")),
    SKU("sku", true, List.of("sku", "id", "product_id", "code")),
    PRICE("price", true, List.of("price", "currentprice", "current_price", "our_price", "cena", "price_with_vat")),
    COST("cost", false, List.of("cost", "buy_price", "purchase_price")),
    INVENTORY("inventory", false, List.of("inventory", "stock", "qty", "quantity")),
    CURRENCY("currency", false, List.of("currency", "currency_code"));

    private final String key;
    private final boolean required;
    private final List<String> aliases;

    CatalogField(String key, boolean required, List<String> aliases) {
        this.key = key;
        this.required = required;
        this.aliases = aliases;
    }

    public String key() { return key; }
    public boolean isRequired() { return required; }
    public List<String> aliases() { return aliases; }
}
