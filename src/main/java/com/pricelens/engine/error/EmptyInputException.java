package com.pricelens.engine.error;

/**
 * CSV text contained no non-blank line. Fatal to the import call only.
 */
public class EmptyInputException extends PricingException {
    public EmptyInputException() {
        super("CSV file is empty");
    }
}
