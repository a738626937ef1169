package com.pricelens.engine.error;

public class NotFoundException extends PricingException {
    public NotFoundException(String recordType, String id) {
        super(recordType + " not found: " + id);
    }
}
